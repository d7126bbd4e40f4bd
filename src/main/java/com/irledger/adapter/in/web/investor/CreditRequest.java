package com.irledger.adapter.in.web.investor;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Admin credit to an investor balance
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreditRequest {
    private BigDecimal amount;
    private String actorId;
}
