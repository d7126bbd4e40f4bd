package com.irledger.adapter.in.web.investor;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Ledger entry posted through the API
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransactionRequest {
    private String investorId;
    private String type;
    private BigDecimal amount;
    private String date;
    private String status;
    private String description;
}
