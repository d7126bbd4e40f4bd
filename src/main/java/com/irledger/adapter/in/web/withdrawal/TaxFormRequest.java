package com.irledger.adapter.in.web.withdrawal;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * W-8BEN review outcome
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaxFormRequest {
    private String status;
    private String processedBy;
    private String reason;
}
