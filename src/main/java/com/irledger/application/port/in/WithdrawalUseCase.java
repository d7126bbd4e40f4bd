package com.irledger.application.port.in;

import com.irledger.application.service.Subscription;
import com.irledger.domain.model.TaxFormStatus;
import com.irledger.domain.model.WithdrawalRequest;
import com.irledger.domain.model.WithdrawalStatus;
import io.vertx.core.Future;
import io.vertx.core.Handler;

import java.math.BigDecimal;
import java.util.List;

/**
 * Inbound port - withdrawal request lifecycle
 * Pending moves once to Approved or Rejected; the W-8BEN status evolves independently.
 */
public interface WithdrawalUseCase {

    /**
     * Submit a new request in Pending
     * @return the request id
     */
    Future<String> submit(SubmitWithdrawalCommand command);

    /**
     * Decide a pending request. Approval stamps the approval date and records
     * exactly one commission. Rejection records nothing else and does not
     * reverse any balance.
     */
    Future<WithdrawalRequest> process(ProcessWithdrawalCommand command);

    /**
     * Record the W-8BEN review outcome, in any primary state
     */
    Future<Void> setTaxFormStatus(String requestId, TaxFormStatus status, String processedBy, String reason);

    Future<WithdrawalRequest> get(String requestId);

    /**
     * @param investorId null for all requests
     */
    Future<List<WithdrawalRequest>> list(String investorId);

    Subscription subscribe(String investorId, Handler<List<WithdrawalRequest>> callback);

    /**
     * @param requestId optional caller-chosen id
     * @param w8benStatus not_required when null
     */
    record SubmitWithdrawalCommand(
            String requestId,
            String investorId,
            String investorName,
            BigDecimal amount,
            TaxFormStatus w8benStatus
    ) {}

    record ProcessWithdrawalCommand(
            String requestId,
            WithdrawalStatus decision,
            String processedBy,
            String reason
    ) {}
}
