package com.irledger.application.service;

import com.irledger.application.port.in.CommissionUseCase;
import com.irledger.application.port.in.WithdrawalUseCase;
import com.irledger.application.port.out.DocumentQuery;
import com.irledger.application.port.out.DocumentStore;
import com.irledger.application.port.out.FieldValues;
import com.irledger.application.port.out.SortOrder;
import com.irledger.application.port.out.StoreCollections;
import com.irledger.domain.exception.InvalidTransitionException;
import com.irledger.domain.exception.NotFoundException;
import com.irledger.domain.model.TaxFormStatus;
import com.irledger.domain.model.WithdrawalRequest;
import com.irledger.domain.model.WithdrawalStatus;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.json.JsonObject;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Withdrawal request state machine
 *
 * <p>Flow:
 * 1. submit - create the request in Pending
 * 2. process - compare-and-set Pending to Approved or Rejected
 * 3. on approval, record the commission
 *
 * <p>Deciding an already approved request records its commission again before
 * the terminal policy applies; the commission is keyed by the withdrawal id,
 * so this only fills in a record a failed earlier approval left missing.
 *
 * <p>The W-8BEN sub-status is updated independently and never touches the primary status.
 */
@Slf4j
public class WithdrawalWorkflowService implements WithdrawalUseCase {

    static final String DEFAULT_TAX_FORM_REJECTION = "Form rejected by compliance team";

    private static final JsonObject EXPECT_PENDING =
            new JsonObject().put("status", WithdrawalStatus.PENDING.getValue());

    private final DocumentStore store;
    private final ChangeFeed changeFeed;
    private final LedgerValidator validator;
    private final CommissionUseCase commissions;
    private final TerminalTransitionPolicy terminalPolicy;
    private final Clock clock;

    public WithdrawalWorkflowService(DocumentStore store, ChangeFeed changeFeed, LedgerValidator validator,
                                     CommissionUseCase commissions, TerminalTransitionPolicy terminalPolicy,
                                     Clock clock) {
        this.store = store;
        this.changeFeed = changeFeed;
        this.validator = validator;
        this.commissions = commissions;
        this.terminalPolicy = terminalPolicy;
        this.clock = clock;
    }

    @Override
    public Future<String> submit(SubmitWithdrawalCommand command) {
        log.info("Submitting withdrawal request for investor {}: {}", command.investorId(), command.amount());

        ValidationResult validation = validator.validate(command);
        if (!validation.isValid()) {
            log.warn("Withdrawal request rejected: {}", validation.errors());
            return validation.toFailure();
        }

        WithdrawalRequest request = WithdrawalRequest.builder()
                .investorId(command.investorId())
                .investorName(command.investorName())
                .amount(command.amount())
                .status(WithdrawalStatus.PENDING)
                .date(LocalDate.now(clock).toString())
                .w8benStatus(command.w8benStatus() != null ? command.w8benStatus() : TaxFormStatus.NOT_REQUIRED)
                .build();

        JsonObject doc = request.toDocument().put("createdAt", FieldValues.SERVER_TIMESTAMP);

        Future<String> stored;
        if (command.requestId() == null) {
            stored = store.add(StoreCollections.WITHDRAWAL_REQUESTS, doc);
        } else {
            stored = store.createIfAbsent(StoreCollections.WITHDRAWAL_REQUESTS, command.requestId(), doc)
                    .compose(created -> {
                        if (!created) {
                            return Future.<String>failedFuture(new IllegalArgumentException(
                                    "Withdrawal request already exists: " + command.requestId()));
                        }
                        return Future.succeededFuture(command.requestId());
                    });
        }

        return stored
                .onSuccess(id -> log.info("Withdrawal request {} submitted", id))
                .recover(StoreErrors.wrap("Failed to create withdrawal request"));
    }

    @Override
    public Future<WithdrawalRequest> process(ProcessWithdrawalCommand command) {
        log.info("Processing withdrawal {}: {} by {}",
                command.requestId(), command.decision(), command.processedBy());

        if (command.decision() == null || !command.decision().isTerminal()) {
            return Future.failedFuture(new IllegalArgumentException(
                    "Decision must be Approved or Rejected, got " + command.decision()));
        }

        return get(command.requestId())
                .compose(current -> {
                    if (!current.isPending()) {
                        return onTerminal(current, command);
                    }
                    return transition(command);
                })
                .recover(StoreErrors.wrap("Failed to update withdrawal status"));
    }

    @Override
    public Future<Void> setTaxFormStatus(String requestId, TaxFormStatus status, String processedBy, String reason) {
        if (status != TaxFormStatus.APPROVED && status != TaxFormStatus.REJECTED) {
            return Future.failedFuture(new IllegalArgumentException(
                    "W-8BEN status must be approved or rejected, got " + status));
        }

        log.info("Setting W-8BEN status of {} to {} by {}", requestId, status.getValue(), processedBy);

        JsonObject fields = new JsonObject()
                .put("w8benStatus", status.getValue())
                .put("updatedAt", FieldValues.SERVER_TIMESTAMP);
        if (status == TaxFormStatus.APPROVED) {
            fields.put("w8benApprovedAt", FieldValues.SERVER_TIMESTAMP);
        } else {
            fields.put("w8benRejectionReason", reason != null ? reason : DEFAULT_TAX_FORM_REJECTION);
        }

        return store.update(StoreCollections.WITHDRAWAL_REQUESTS, requestId, fields)
                .recover(StoreErrors.wrap("Failed to update W-8BEN status"));
    }

    @Override
    public Future<WithdrawalRequest> get(String requestId) {
        return store.get(StoreCollections.WITHDRAWAL_REQUESTS, requestId)
                .compose(found -> {
                    if (found.isEmpty()) {
                        return Future.<WithdrawalRequest>failedFuture(
                                NotFoundException.of("Withdrawal request", requestId));
                    }
                    return Future.succeededFuture(WithdrawalRequest.fromDocument(found.get()));
                })
                .recover(StoreErrors.wrap("Failed to load withdrawal request"));
    }

    @Override
    public Future<List<WithdrawalRequest>> list(String investorId) {
        return changeFeed.fetch(requestsQuery(investorId))
                .map(WithdrawalWorkflowService::toRequests)
                .recover(StoreErrors.wrap("Failed to load withdrawal requests"));
    }

    @Override
    public Subscription subscribe(String investorId, Handler<List<WithdrawalRequest>> callback) {
        return changeFeed.subscribe(requestsQuery(investorId), rows -> callback.handle(toRequests(rows)));
    }

    private Future<WithdrawalRequest> transition(ProcessWithdrawalCommand command) {
        JsonObject fields = new JsonObject()
                .put("status", command.decision().getValue())
                .put("processedBy", command.processedBy())
                .put("processedAt", FieldValues.SERVER_TIMESTAMP)
                .put("reason", command.reason())
                .put("updatedAt", FieldValues.SERVER_TIMESTAMP);
        if (command.decision() == WithdrawalStatus.APPROVED) {
            fields.put("approvalDate", FieldValues.SERVER_TIMESTAMP);
        }

        return store.updateIf(StoreCollections.WITHDRAWAL_REQUESTS, command.requestId(), EXPECT_PENDING, fields)
                .compose(applied -> get(command.requestId())
                        .compose(updated -> {
                            if (!applied) {
                                // Another admin decided the request between our read and write
                                return onTerminal(updated, command);
                            }
                            log.info("Withdrawal {} moved to {}", updated.getId(), updated.getStatus().getValue());
                            if (updated.isApproved()) {
                                return commissions.recordForApproval(updated).map(updated);
                            }
                            return Future.succeededFuture(updated);
                        }));
    }

    private Future<WithdrawalRequest> onTerminal(WithdrawalRequest current, ProcessWithdrawalCommand command) {
        if (current.isApproved()) {
            // An earlier approval may have committed without its commission
            return commissions.recordForApproval(current)
                    .compose(commission -> applyTerminalPolicy(current, command));
        }
        return applyTerminalPolicy(current, command);
    }

    private Future<WithdrawalRequest> applyTerminalPolicy(WithdrawalRequest current, ProcessWithdrawalCommand command) {
        String message = "Withdrawal request " + current.getId() + " is already "
                + current.getStatus().getValue() + "; cannot move it to " + command.decision().getValue();
        if (terminalPolicy == TerminalTransitionPolicy.IGNORE) {
            log.warn("{} (ignored)", message);
            return Future.succeededFuture(current);
        }
        log.warn(message);
        return Future.failedFuture(new InvalidTransitionException(message));
    }

    private static DocumentQuery requestsQuery(String investorId) {
        DocumentQuery query = DocumentQuery.of(StoreCollections.WITHDRAWAL_REQUESTS)
                .orderBy(SortOrder.descending("date"));
        return investorId != null ? query.where("investorId", investorId) : query;
    }

    private static List<WithdrawalRequest> toRequests(List<JsonObject> rows) {
        return rows.stream().map(WithdrawalRequest::fromDocument).collect(Collectors.toList());
    }
}
