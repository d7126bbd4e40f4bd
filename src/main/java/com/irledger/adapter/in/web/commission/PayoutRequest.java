package com.irledger.adapter.in.web.commission;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Commission payout request of an affiliate
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PayoutRequest {
    private String affiliateId;
    private String affiliateName;
    private BigDecimal amount;
}
