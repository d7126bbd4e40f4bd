package com.irledger.application.port.in;

import com.irledger.application.service.Subscription;
import com.irledger.domain.model.Commission;
import com.irledger.domain.model.WithdrawalRequest;
import io.vertx.core.Future;
import io.vertx.core.Handler;

import java.math.BigDecimal;
import java.util.List;

/**
 * Inbound port - commissions derived from approved withdrawals
 */
public interface CommissionUseCase {

    /**
     * Record the commission for an approved withdrawal. At most one record
     * ever exists per withdrawal; repeated calls return the existing one.
     */
    Future<Commission> recordForApproval(WithdrawalRequest approved);

    Future<List<Commission>> list();

    Subscription subscribe(Handler<List<Commission>> callback);

    Future<BigDecimal> totalEarned();

    /**
     * File a payout request against earned commissions
     * @return the payout request id
     */
    Future<String> requestPayout(String affiliateId, String affiliateName, BigDecimal amount);
}
