package com.irledger.adapter.in.web.investor;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Account closure request raised by an admin
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClosureRequest {
    private String reason;
    private String adminId;
}
