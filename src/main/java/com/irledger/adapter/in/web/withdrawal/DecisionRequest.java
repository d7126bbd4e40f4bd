package com.irledger.adapter.in.web.withdrawal;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Admin decision on a pending withdrawal
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DecisionRequest {
    private String decision;
    private String processedBy;
    private String reason;
}
