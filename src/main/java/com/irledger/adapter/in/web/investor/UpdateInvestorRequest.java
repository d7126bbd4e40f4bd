package com.irledger.adapter.in.web.investor;

import com.irledger.domain.model.Investor;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Admin edit of an investor profile; absent fields are left unchanged
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateInvestorRequest {
    private String name;
    private String email;
    private String phone;
    private String country;
    private String accountType;
    private String accountStatus;
    private Boolean active;
    private Investor.AccountFlags accountFlags;
    private Investor.TradingData tradingData;
}
