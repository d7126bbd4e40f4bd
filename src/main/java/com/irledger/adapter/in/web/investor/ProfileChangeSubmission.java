package com.irledger.adapter.in.web.investor;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Profile edit submitted by an investor for admin review
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProfileChangeSubmission {
    private Map<String, Object> requestedChanges;
}
