package com.irledger.adapter.in.web.investor;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Onboarding request for a new investor profile
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateInvestorRequest {
    private String id;
    private String name;
    private String email;
    private String phone;
    private String country;
    private BigDecimal initialBalance;
    private String accountType;
}
