package com.irledger.application.service;

import com.irledger.application.port.in.CommissionUseCase;
import com.irledger.application.port.out.DocumentQuery;
import com.irledger.application.port.out.DocumentStore;
import com.irledger.application.port.out.FieldValues;
import com.irledger.application.port.out.SortOrder;
import com.irledger.application.port.out.StoreCollections;
import com.irledger.domain.model.Amounts;
import com.irledger.domain.model.Commission;
import com.irledger.domain.model.WithdrawalRequest;
import com.irledger.domain.model.WithdrawalStatus;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.json.JsonObject;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Commission records derived from approved withdrawals
 *
 * <p>Each commission is stored under the id of the withdrawal it derives
 * from, so a second approval attempt finds the existing record instead of
 * writing another one.
 */
@Slf4j
public class CommissionBook implements CommissionUseCase {

    /** Percent of the withdrawal amount */
    public static final int COMMISSION_RATE = 15;

    private final DocumentStore store;
    private final ChangeFeed changeFeed;
    private final Clock clock;

    public CommissionBook(DocumentStore store, ChangeFeed changeFeed, Clock clock) {
        this.store = store;
        this.changeFeed = changeFeed;
        this.clock = clock;
    }

    /**
     * Commission for an approved withdrawal at the current rate
     */
    public static Commission derive(WithdrawalRequest request, String date) {
        BigDecimal rate = BigDecimal.valueOf(COMMISSION_RATE);
        // Exact: two-decimal amounts give at most four decimals here
        BigDecimal commissionAmount = request.getAmount().multiply(rate).movePointLeft(2);

        return Commission.builder()
                .id(request.getId())
                .investorId(request.getInvestorId())
                .investorName(request.getInvestorName())
                .withdrawalId(request.getId())
                .withdrawalAmount(request.getAmount())
                .commissionRate(rate)
                .commissionAmount(commissionAmount)
                .date(date)
                .status(Commission.STATUS_EARNED)
                .build();
    }

    @Override
    public Future<Commission> recordForApproval(WithdrawalRequest approved) {
        if (!approved.isApproved()) {
            return Future.failedFuture(new IllegalArgumentException(
                    "Commission requires an approved withdrawal, got " + approved.getStatus().getValue()));
        }

        Commission commission = derive(approved, LocalDate.now(clock).toString());
        JsonObject doc = commission.toDocument().put("createdAt", FieldValues.SERVER_TIMESTAMP);

        return store.createIfAbsent(StoreCollections.COMMISSIONS, approved.getId(), doc)
                .compose(created -> {
                    if (created) {
                        log.info("Recorded commission {} on withdrawal {} ({}% of {})",
                                commission.getCommissionAmount(), approved.getId(),
                                COMMISSION_RATE, approved.getAmount());
                    } else {
                        log.info("Commission for withdrawal {} already recorded", approved.getId());
                    }
                    return store.get(StoreCollections.COMMISSIONS, approved.getId());
                })
                .map(stored -> stored.map(Commission::fromDocument).orElse(commission))
                .recover(StoreErrors.wrap("Failed to create commission record"));
    }

    @Override
    public Future<List<Commission>> list() {
        return changeFeed.fetch(commissionsQuery())
                .map(CommissionBook::toCommissions)
                .recover(StoreErrors.wrap("Failed to load commissions"));
    }

    @Override
    public Subscription subscribe(Handler<List<Commission>> callback) {
        return changeFeed.subscribe(commissionsQuery(), rows -> callback.handle(toCommissions(rows)));
    }

    @Override
    public Future<BigDecimal> totalEarned() {
        return list()
                .map(commissions -> commissions.stream()
                        .map(Commission::getCommissionAmount)
                        .reduce(BigDecimal.ZERO, BigDecimal::add));
    }

    @Override
    public Future<String> requestPayout(String affiliateId, String affiliateName, BigDecimal amount) {
        if (affiliateId == null || affiliateId.isBlank()) {
            return Future.failedFuture(new IllegalArgumentException("affiliateId is required"));
        }
        if (amount == null || amount.signum() <= 0) {
            return Future.failedFuture(new IllegalArgumentException("amount must be positive"));
        }

        log.info("Commission payout of {} requested by {}", amount, affiliateId);

        JsonObject doc = new JsonObject()
                .put("affiliateId", affiliateId)
                .put("affiliateName", affiliateName)
                .put("amount", Amounts.toDocument(amount))
                .put("status", WithdrawalStatus.PENDING.getValue())
                .put("date", LocalDate.now(clock).toString())
                .put("createdAt", FieldValues.SERVER_TIMESTAMP);

        return store.add(StoreCollections.COMMISSION_WITHDRAWALS, doc)
                .recover(StoreErrors.wrap("Failed to create withdrawal request"));
    }

    private static DocumentQuery commissionsQuery() {
        return DocumentQuery.of(StoreCollections.COMMISSIONS).orderBy(SortOrder.descending("date"));
    }

    private static List<Commission> toCommissions(List<JsonObject> rows) {
        return rows.stream().map(Commission::fromDocument).collect(Collectors.toList());
    }
}
