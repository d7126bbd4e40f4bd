package com.irledger.adapter.in.web.withdrawal;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * New withdrawal request
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubmitWithdrawalRequest {
    private String id;
    private String investorId;
    private String investorName;
    private BigDecimal amount;
    private String w8benStatus;
}
