package com.irledger.application.service;

import com.irledger.application.port.in.AccountLedgerUseCase;
import com.irledger.application.port.out.DocumentQuery;
import com.irledger.application.port.out.DocumentStore;
import com.irledger.application.port.out.FieldValues;
import com.irledger.application.port.out.SortOrder;
import com.irledger.application.port.out.StoreCollections;
import com.irledger.domain.exception.NotFoundException;
import com.irledger.domain.exception.WriteConflictException;
import com.irledger.domain.model.Amounts;
import com.irledger.domain.model.Investor;
import com.irledger.domain.model.ProfileChangeRequest;
import com.irledger.domain.model.Transaction;
import com.irledger.domain.model.TransactionType;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.json.JsonObject;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Use case implementation for investor balances and the transaction log
 *
 * <p>Balance changes are read-modify-write sequences guarded by a
 * compare-and-set on the stored balance: a writer that loses the race re-reads
 * and retries, up to {@code maxAttempts} times, instead of overwriting the
 * other writer's update.
 */
@Slf4j
public class AccountLedgerService implements AccountLedgerUseCase {

    private static final SortOrder BY_DATE_DESC = SortOrder.descending("date");

    private final DocumentStore store;
    private final ChangeFeed changeFeed;
    private final LedgerValidator validator;
    private final Clock clock;
    private final int maxAttempts;

    public AccountLedgerService(DocumentStore store, ChangeFeed changeFeed, LedgerValidator validator,
                                Clock clock, int maxAttempts) {
        this.store = store;
        this.changeFeed = changeFeed;
        this.validator = validator;
        this.clock = clock;
        this.maxAttempts = maxAttempts;
    }

    @Override
    public Future<Investor> createInvestor(String investorId, InvestorProfile profile) {
        log.info("Creating investor profile {} ({})", investorId, profile.name());

        Investor investor = Investor.builder()
                .id(investorId)
                .name(profile.name())
                .email(profile.email() != null ? profile.email() : "")
                .phone(profile.phone() != null ? profile.phone() : "")
                .country(profile.country() != null ? profile.country() : "Unknown")
                .currentBalance(profile.initialBalance() != null ? profile.initialBalance() : BigDecimal.ZERO)
                .accountType(profile.accountType() != null ? profile.accountType() : "Standard")
                .accountStatus(Investor.STATUS_ACTIVE)
                .active(true)
                .accountFlags(new Investor.AccountFlags())
                .tradingData(Investor.TradingData.defaults())
                .build();

        JsonObject doc = investor.toDocument()
                .put("createdAt", FieldValues.SERVER_TIMESTAMP)
                .put("updatedAt", FieldValues.SERVER_TIMESTAMP);

        return store.set(StoreCollections.USERS, investorId, doc)
                .compose(v -> getInvestor(investorId))
                .onSuccess(created -> log.info("Created investor profile {}", investorId))
                .recover(StoreErrors.wrap("Failed to create investor profile"));
    }

    @Override
    public Future<Investor> getInvestor(String investorId) {
        return loadInvestorDocument(investorId)
                .map(Investor::fromDocument)
                .recover(StoreErrors.wrap("Failed to retrieve investor profile"));
    }

    @Override
    public Future<List<Investor>> listInvestors() {
        return changeFeed.fetch(investorsQuery())
                .map(AccountLedgerService::toInvestors)
                .onSuccess(investors -> log.info("Found {} investors", investors.size()))
                .recover(StoreErrors.wrap("Database connection failed"));
    }

    @Override
    public Future<List<Investor>> investorsByStatus(String accountStatus) {
        return changeFeed.fetch(investorsQuery().where("accountStatus", accountStatus))
                .map(AccountLedgerService::toInvestors)
                .recover(StoreErrors.wrap("Failed to filter by status"));
    }

    @Override
    public Future<List<Investor>> searchInvestors(String term) {
        String needle = term == null ? "" : term.toLowerCase(Locale.ROOT);
        return listInvestors()
                .map(investors -> investors.stream()
                        .filter(investor -> contains(investor.getName(), needle)
                                || contains(investor.getEmail(), needle)
                                || contains(investor.getCountry(), needle))
                        .collect(Collectors.toList()))
                .recover(StoreErrors.wrap("Search failed"));
    }

    @Override
    public Future<BigDecimal> totalAssetsUnderManagement() {
        return listInvestors()
                .map(investors -> investors.stream()
                        .map(Investor::getCurrentBalance)
                        .reduce(BigDecimal.ZERO, BigDecimal::add))
                .onSuccess(total -> log.info("Total AUM: {}", total))
                .recover(StoreErrors.wrap("Failed to calculate total balance"));
    }

    @Override
    public Future<Investor> updateInvestor(String investorId, InvestorUpdate update) {
        JsonObject fields = toFields(update);
        if (fields.isEmpty()) {
            return Future.failedFuture(new IllegalArgumentException("No investor fields to update"));
        }

        log.info("Updating investor {}: {}", investorId, fields.fieldNames());
        fields.put("updatedAt", FieldValues.SERVER_TIMESTAMP);

        return loadInvestorDocument(investorId)
                .compose(doc -> store.update(StoreCollections.USERS, investorId, fields))
                .compose(v -> getInvestor(investorId))
                .onSuccess(investor -> log.info("Updated investor {}", investorId))
                .recover(StoreErrors.wrap("Failed to update investor profile"));
    }

    @Override
    public Future<String> submitProfileChange(String investorId, Map<String, Object> requestedChanges) {
        if (requestedChanges == null || requestedChanges.isEmpty()) {
            return Future.failedFuture(new IllegalArgumentException("requestedChanges must not be empty"));
        }
        if (requestedChanges.containsKey("currentBalance")) {
            return Future.failedFuture(new IllegalArgumentException("currentBalance cannot be changed by request"));
        }

        return getInvestor(investorId)
                .compose(investor -> {
                    log.info("Adding profile change request for investor {}: {}",
                            investor.getName(), requestedChanges.keySet());
                    ProfileChangeRequest request = ProfileChangeRequest.builder()
                            .investorId(investorId)
                            .investorName(investor.getName())
                            .requestedChanges(requestedChanges)
                            .status(ProfileChangeRequest.STATUS_PENDING)
                            .date(LocalDate.now(clock).toString())
                            .build();
                    return store.add(StoreCollections.PROFILE_CHANGE_REQUESTS,
                            request.toDocument().put("createdAt", FieldValues.SERVER_TIMESTAMP));
                })
                .recover(StoreErrors.wrap("Failed to submit profile changes"));
    }

    @Override
    public Future<List<ProfileChangeRequest>> profileChangeRequests(String investorId) {
        DocumentQuery query = DocumentQuery.of(StoreCollections.PROFILE_CHANGE_REQUESTS).orderBy(BY_DATE_DESC);
        return changeFeed.fetch(investorId != null ? query.where("investorId", investorId) : query)
                .map(rows -> rows.stream().map(ProfileChangeRequest::fromDocument).collect(Collectors.toList()))
                .recover(StoreErrors.wrap("Failed to load profile change requests"));
    }

    @Override
    public Future<Void> requestAccountClosure(String investorId, String reason, String adminId) {
        log.info("Account closure requested for investor {} by {}: {}", investorId, adminId, reason);

        JsonObject fields = new JsonObject()
                .put("accountStatus", Investor.STATUS_CLOSURE_REQUESTED)
                .put("isActive", false)
                .put("updatedAt", FieldValues.SERVER_TIMESTAMP);

        return loadInvestorDocument(investorId)
                .compose(doc -> store.update(StoreCollections.USERS, investorId, fields))
                .recover(StoreErrors.wrap("Failed to create closure request"));
    }

    @Override
    public Future<BigDecimal> getBalance(String investorId) {
        return getInvestor(investorId).map(Investor::getCurrentBalance);
    }

    @Override
    public Future<BigDecimal> credit(String investorId, BigDecimal amount, String actorId) {
        log.info("Adding credit of {} to investor {} by {}", amount, investorId, actorId);

        TransactionEntry entry = new TransactionEntry(
                investorId,
                TransactionType.CREDIT,
                amount,
                null,
                Transaction.STATUS_COMPLETED,
                "Credit added by admin " + actorId
        );

        return applyTransaction(entry)
                .onSuccess(balance -> log.info("AUM impact: +{} (new balance of {}: {})", amount, investorId, balance))
                .recover(StoreErrors.wrap("Failed to add credit"));
    }

    @Override
    public Future<BigDecimal> applyTransaction(TransactionEntry entry) {
        ValidationResult validation = validator.validate(entry);
        if (!validation.isValid()) {
            log.warn("Rejected transaction for {}: {}", entry.investorId(), validation.errors());
            return validation.toFailure();
        }

        BigDecimal delta = entry.type().balanceDelta(entry.amount());
        return adjustBalance(entry.investorId(), delta, 1)
                .compose(newBalance -> recordTransaction(entry).map(newBalance))
                .recover(StoreErrors.wrap("Failed to apply " + entry.type().getValue() + " transaction"));
    }

    @Override
    public Future<String> recordTransaction(TransactionEntry entry) {
        ValidationResult validation = validator.validate(entry);
        if (!validation.isValid()) {
            return validation.toFailure();
        }

        Transaction transaction = Transaction.builder()
                .investorId(entry.investorId())
                .type(entry.type())
                .amount(entry.amount().abs())
                .date(entry.date() != null ? entry.date() : LocalDate.now(clock).toString())
                .status(entry.status() != null ? entry.status() : Transaction.STATUS_COMPLETED)
                .description(entry.description())
                .build();

        return store.add(StoreCollections.TRANSACTIONS,
                        transaction.toDocument().put("createdAt", FieldValues.SERVER_TIMESTAMP))
                .onSuccess(id -> log.info("Recorded {} transaction {} of {} for investor {}",
                        entry.type().getValue(), id, transaction.getAmount(), entry.investorId()))
                .recover(StoreErrors.wrap("Failed to record transaction"));
    }

    @Override
    public Future<Void> updateTransaction(String transactionId, TransactionUpdate update) {
        ValidationResult validation = validator.validate(update);
        if (!validation.isValid()) {
            return validation.toFailure();
        }

        log.info("Updating transaction {}", transactionId);

        JsonObject fields = new JsonObject().put("updatedAt", FieldValues.SERVER_TIMESTAMP);
        putIfPresent(fields, "status", update.status());
        putIfPresent(fields, "description", update.description());
        putIfPresent(fields, "date", update.date());

        return store.update(StoreCollections.TRANSACTIONS, transactionId, fields)
                .onSuccess(v -> log.info("Updated transaction {}", transactionId))
                .recover(StoreErrors.wrap("Failed to update transaction"));
    }

    @Override
    public Future<List<Transaction>> getTransactions(String investorId) {
        return changeFeed.fetch(transactionsQuery(investorId))
                .map(AccountLedgerService::toTransactions)
                .onSuccess(rows -> log.debug("Retrieved {} transactions", rows.size()))
                .recover(StoreErrors.wrap("Failed to load transaction history"));
    }

    @Override
    public Future<List<Transaction>> recentTransactions(int limit) {
        return changeFeed.fetch(transactionsQuery(null).limit(limit))
                .map(AccountLedgerService::toTransactions)
                .recover(StoreErrors.wrap("Failed to load recent transactions"));
    }

    @Override
    public Subscription subscribeTransactions(String investorId, Handler<List<Transaction>> callback) {
        return changeFeed.subscribe(transactionsQuery(investorId), rows -> callback.handle(toTransactions(rows)));
    }

    @Override
    public Subscription subscribeInvestors(Handler<List<Investor>> callback) {
        return changeFeed.subscribe(investorsQuery(), rows -> callback.handle(toInvestors(rows)));
    }

    @Override
    public Subscription subscribeInvestor(String investorId, Handler<List<Investor>> callback) {
        DocumentQuery query = investorsQuery().where("id", investorId);
        return changeFeed.subscribe(query, rows -> callback.handle(toInvestors(rows)));
    }

    private Future<BigDecimal> adjustBalance(String investorId, BigDecimal delta, int attempt) {
        return loadInvestorDocument(investorId).compose(doc -> {
            Object storedBalance = doc.getValue("currentBalance");
            BigDecimal newBalance = Amounts.fromDocument(storedBalance).add(delta);

            JsonObject expected = new JsonObject().put("currentBalance", storedBalance);
            JsonObject fields = new JsonObject()
                    .put("currentBalance", Amounts.toDocument(newBalance))
                    .put("updatedAt", FieldValues.SERVER_TIMESTAMP);

            return store.updateIf(StoreCollections.USERS, investorId, expected, fields)
                    .compose(applied -> {
                        if (applied) {
                            log.debug("Balance of {} moved by {} to {}", investorId, delta, newBalance);
                            return Future.succeededFuture(newBalance);
                        }
                        if (attempt >= maxAttempts) {
                            return Future.failedFuture(new WriteConflictException(
                                    "Balance of investor " + investorId + " kept changing; gave up after "
                                            + attempt + " attempts"));
                        }
                        log.warn("Balance of investor {} changed concurrently, retrying ({}/{})",
                                investorId, attempt, maxAttempts);
                        return adjustBalance(investorId, delta, attempt + 1);
                    });
        });
    }

    private Future<JsonObject> loadInvestorDocument(String investorId) {
        return store.get(StoreCollections.USERS, investorId)
                .compose(found -> {
                    if (found.isEmpty() || !Investor.ROLE.equals(found.get().getString("role"))) {
                        return Future.failedFuture(NotFoundException.of("Investor", investorId));
                    }
                    return Future.succeededFuture(found.get());
                });
    }

    private static DocumentQuery investorsQuery() {
        return DocumentQuery.of(StoreCollections.USERS).where("role", Investor.ROLE);
    }

    private static DocumentQuery transactionsQuery(String investorId) {
        DocumentQuery query = DocumentQuery.of(StoreCollections.TRANSACTIONS).orderBy(BY_DATE_DESC);
        return investorId != null ? query.where("investorId", investorId) : query;
    }

    private static List<Investor> toInvestors(List<JsonObject> rows) {
        return rows.stream().map(Investor::fromDocument).collect(Collectors.toList());
    }

    private static List<Transaction> toTransactions(List<JsonObject> rows) {
        return rows.stream().map(Transaction::fromDocument).collect(Collectors.toList());
    }

    private static JsonObject toFields(InvestorUpdate update) {
        JsonObject fields = new JsonObject();
        putIfPresent(fields, "name", update.name());
        putIfPresent(fields, "email", update.email());
        putIfPresent(fields, "phone", update.phone());
        putIfPresent(fields, "country", update.country());
        putIfPresent(fields, "accountType", update.accountType());
        putIfPresent(fields, "accountStatus", update.accountStatus());
        putIfPresent(fields, "isActive", update.active());
        if (update.accountFlags() != null) {
            fields.put("accountFlags", update.accountFlags().toDocument());
        }
        if (update.tradingData() != null) {
            fields.put("tradingData", update.tradingData().toDocument());
        }
        return fields;
    }

    private static void putIfPresent(JsonObject fields, String key, Object value) {
        if (value != null) {
            fields.put(key, value);
        }
    }

    private static boolean contains(String value, String needle) {
        return value != null && value.toLowerCase(Locale.ROOT).contains(needle);
    }
}
