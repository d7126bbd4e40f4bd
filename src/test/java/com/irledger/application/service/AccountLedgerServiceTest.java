package com.irledger.application.service;

import com.irledger.adapter.out.persistence.InMemoryDocumentStore;
import com.irledger.application.port.in.AccountLedgerUseCase.InvestorProfile;
import com.irledger.application.port.in.AccountLedgerUseCase.InvestorUpdate;
import com.irledger.application.port.in.AccountLedgerUseCase.TransactionEntry;
import com.irledger.application.port.in.AccountLedgerUseCase.TransactionUpdate;
import com.irledger.application.port.out.DocumentStore;
import com.irledger.application.port.out.StoreCollections;
import com.irledger.domain.exception.NotFoundException;
import com.irledger.domain.exception.StoreUnavailableException;
import com.irledger.domain.exception.WriteConflictException;
import com.irledger.domain.model.Investor;
import com.irledger.domain.model.ProfileChangeRequest;
import com.irledger.domain.model.Transaction;
import com.irledger.domain.model.TransactionType;
import io.vertx.core.Future;
import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for AccountLedgerService
 */
class AccountLedgerServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-15T09:30:00Z"), ZoneOffset.UTC);

    private InMemoryDocumentStore store;
    private AccountLedgerService ledger;

    @BeforeEach
    void setUp() {
        store = new InMemoryDocumentStore(CLOCK);
        ledger = newLedger(store);
        createInvestor("inv-1", "Ada Lovelace", "1000");
    }

    @Test
    void createInvestor_appliesOnboardingDefaults() {
        Future<Investor> result = ledger.createInvestor("inv-2",
                new InvestorProfile("Grace Hopper", "grace@example.com", null, "US", null, null));

        assertTrue(result.succeeded());
        Investor investor = result.result();
        assertEquals("inv-2", investor.getId());
        assertEquals(Investor.STATUS_ACTIVE, investor.getAccountStatus());
        assertEquals("Standard", investor.getAccountType());
        assertTrue(investor.isActive());
        assertEquals(0, BigDecimal.ZERO.compareTo(investor.getCurrentBalance()));
        assertEquals("IBKR", investor.getTradingData().getPlatform());
        assertNotNull(investor.getCreatedAt());
    }

    @Test
    void credit_thenGetBalance_addsAmount() {
        Future<BigDecimal> credited = ledger.credit("inv-1", new BigDecimal("250.50"), "admin-1");
        Future<BigDecimal> balance = ledger.getBalance("inv-1");

        assertTrue(credited.succeeded());
        assertEquals(0, new BigDecimal("1250.50").compareTo(credited.result()));
        assertEquals(0, new BigDecimal("1250.50").compareTo(balance.result()));
    }

    @Test
    void credit_appendsCreditTransaction() {
        ledger.credit("inv-1", new BigDecimal("100"), "admin-1");

        List<Transaction> transactions = ledger.getTransactions("inv-1").result();

        assertEquals(1, transactions.size());
        Transaction credit = transactions.get(0);
        assertEquals(TransactionType.CREDIT, credit.getType());
        assertEquals(0, new BigDecimal("100").compareTo(credit.getAmount()));
        assertEquals("2024-03-15", credit.getDate());
        assertEquals(Transaction.STATUS_COMPLETED, credit.getStatus());
        assertEquals("Credit added by admin admin-1", credit.getDescription());
    }

    @Test
    void credit_unknownInvestor_failsWithNotFound() {
        Future<BigDecimal> result = ledger.credit("nobody", new BigDecimal("10"), "admin-1");

        assertTrue(result.failed());
        assertInstanceOf(NotFoundException.class, result.cause());
        assertEquals(0, store.count(StoreCollections.TRANSACTIONS));
    }

    @Test
    void credit_nonPositiveAmount_failsValidation() {
        Future<BigDecimal> result = ledger.credit("inv-1", new BigDecimal("-5"), "admin-1");

        assertTrue(result.failed());
        assertInstanceOf(IllegalArgumentException.class, result.cause());
        assertEquals(0, new BigDecimal("1000").compareTo(ledger.getBalance("inv-1").result()));
    }

    @Test
    void applyTransaction_withdrawalDebitsBalanceButRecordsMagnitude() {
        TransactionEntry entry = new TransactionEntry(
                "inv-1", TransactionType.WITHDRAWAL, new BigDecimal("300"), "2024-03-01", null, "Monthly payout");

        Future<BigDecimal> result = ledger.applyTransaction(entry);

        assertEquals(0, new BigDecimal("700").compareTo(result.result()));
        Transaction recorded = ledger.getTransactions("inv-1").result().get(0);
        assertEquals(0, new BigDecimal("300").compareTo(recorded.getAmount()));
        assertEquals(0, new BigDecimal("-300").compareTo(recorded.getBalanceDelta()));
    }

    @Test
    void recordTransaction_doesNotTouchBalance() {
        TransactionEntry entry = new TransactionEntry(
                "inv-1", TransactionType.EARNINGS, new BigDecimal("42"), "2024-02-01", null, null);

        Future<String> result = ledger.recordTransaction(entry);

        assertTrue(result.succeeded());
        assertNotNull(result.result());
        assertEquals(0, new BigDecimal("1000").compareTo(ledger.getBalance("inv-1").result()));
        assertEquals(1, store.count(StoreCollections.TRANSACTIONS));
    }

    @Test
    void getTransactions_ordersMostRecentFirst() {
        record("inv-1", "2024-01-01");
        record("inv-1", "2024-03-01");
        record("inv-1", "2024-02-01");
        record("inv-2", "2024-04-01");

        List<Transaction> own = ledger.getTransactions("inv-1").result();
        List<Transaction> all = ledger.getTransactions(null).result();
        List<Transaction> recent = ledger.recentTransactions(2).result();

        assertEquals(List.of("2024-03-01", "2024-02-01", "2024-01-01"), own.stream().map(Transaction::getDate).toList());
        assertEquals(4, all.size());
        assertEquals(List.of("2024-04-01", "2024-03-01"), recent.stream().map(Transaction::getDate).toList());
    }

    @Test
    void getInvestor_nonInvestorUser_failsWithNotFound() {
        store.set(StoreCollections.USERS, "admin-1", new JsonObject().put("role", "admin").put("name", "Admin"));

        Future<Investor> result = ledger.getInvestor("admin-1");

        assertTrue(result.failed());
        assertInstanceOf(NotFoundException.class, result.cause());
    }

    @Test
    void listAndSearchInvestors() {
        createInvestor("inv-2", "Grace Hopper", "500");
        store.set(StoreCollections.USERS, "admin-1", new JsonObject().put("role", "admin").put("name", "Ada Admin"));

        assertEquals(2, ledger.listInvestors().result().size());
        assertEquals(List.of("inv-2"), ledger.searchInvestors("GRACE").result().stream().map(Investor::getId).toList());
        assertEquals(2, ledger.searchInvestors("example.com").result().size());
        assertEquals(0, new BigDecimal("1500").compareTo(ledger.totalAssetsUnderManagement().result()));
    }

    @Test
    void requestAccountClosure_flagsWithoutDeleting() {
        Future<Void> result = ledger.requestAccountClosure("inv-1", "Moving abroad", "admin-1");

        assertTrue(result.succeeded());
        Investor investor = ledger.getInvestor("inv-1").result();
        assertEquals(Investor.STATUS_CLOSURE_REQUESTED, investor.getAccountStatus());
        assertFalse(investor.isActive());
        assertEquals(1, ledger.investorsByStatus(Investor.STATUS_CLOSURE_REQUESTED).result().size());
        assertEquals(0, ledger.investorsByStatus(Investor.STATUS_ACTIVE).result().size());
    }

    @Test
    void updateInvestor_setsFlagsAndStatusButNotBalance() {
        Investor.AccountFlags flags = new Investor.AccountFlags(
                false, "", true, "Upload proof of address", true, "Withdrawals paused pending KYC");

        Future<Investor> result = ledger.updateInvestor("inv-1", new InvestorUpdate(
                null, null, "+44 20 7946 0000", null, null, "Restricted", null, flags, null));

        assertTrue(result.succeeded());
        Investor investor = result.result();
        assertEquals("Restricted", investor.getAccountStatus());
        assertTrue(investor.isWithdrawalDisabled());
        assertTrue(investor.getAccountFlags().isPendingKyc());
        assertEquals("Upload proof of address", investor.getAccountFlags().getKycMessage());
        assertEquals("+44 20 7946 0000", investor.getPhone());
        assertEquals("Ada Lovelace", investor.getName());
        assertEquals(0, new BigDecimal("1000").compareTo(investor.getCurrentBalance()));
        assertEquals("IBKR", investor.getTradingData().getPlatform());
    }

    @Test
    void updateInvestor_rejectsEmptyUpdateAndUnknownInvestor() {
        InvestorUpdate empty = new InvestorUpdate(null, null, null, null, null, null, null, null, null);
        InvestorUpdate rename = new InvestorUpdate("Someone", null, null, null, null, null, null, null, null);

        assertInstanceOf(IllegalArgumentException.class, ledger.updateInvestor("inv-1", empty).cause());
        assertInstanceOf(NotFoundException.class, ledger.updateInvestor("nobody", rename).cause());
        assertEquals(1, store.count(StoreCollections.USERS));
    }

    @Test
    void updateTransaction_correctsStatusKeepingAmount() {
        String id = ledger.recordTransaction(new TransactionEntry(
                "inv-1", TransactionType.DEPOSIT, new BigDecimal("75"), "2024-02-01", "Pending", null)).result();

        Future<Void> result = ledger.updateTransaction(id, new TransactionUpdate("Completed", "Wire received", null));

        assertTrue(result.succeeded());
        Transaction updated = ledger.getTransactions("inv-1").result().get(0);
        assertEquals("Completed", updated.getStatus());
        assertEquals("Wire received", updated.getDescription());
        assertEquals("2024-02-01", updated.getDate());
        assertEquals(0, new BigDecimal("75").compareTo(updated.getAmount()));
        assertEquals(0, new BigDecimal("1000").compareTo(ledger.getBalance("inv-1").result()));
    }

    @Test
    void updateTransaction_validatesAndRequiresExistingEntry() {
        Future<Void> badDate = ledger.updateTransaction("t-1", new TransactionUpdate(null, null, "03/01/2024"));
        Future<Void> nothing = ledger.updateTransaction("t-1", new TransactionUpdate(null, null, null));
        Future<Void> missing = ledger.updateTransaction("t-1", new TransactionUpdate("Completed", null, null));

        assertInstanceOf(IllegalArgumentException.class, badDate.cause());
        assertInstanceOf(IllegalArgumentException.class, nothing.cause());
        assertInstanceOf(NotFoundException.class, missing.cause());
    }

    @Test
    void submitProfileChange_queuesRequestWithoutTouchingProfile() {
        Future<String> result = ledger.submitProfileChange("inv-1", Map.of("phone", "+44 20 7946 0001"));

        assertTrue(result.succeeded());
        List<ProfileChangeRequest> requests = ledger.profileChangeRequests("inv-1").result();
        assertEquals(1, requests.size());
        ProfileChangeRequest request = requests.get(0);
        assertEquals(result.result(), request.getId());
        assertEquals("Ada Lovelace", request.getInvestorName());
        assertEquals(ProfileChangeRequest.STATUS_PENDING, request.getStatus());
        assertEquals("2024-03-15", request.getDate());
        assertEquals("+44 20 7946 0001", request.getRequestedChanges().get("phone"));
        assertEquals("", ledger.getInvestor("inv-1").result().getPhone());
    }

    @Test
    void submitProfileChange_rejectsBalanceEditsAndUnknownInvestor() {
        assertInstanceOf(IllegalArgumentException.class,
                ledger.submitProfileChange("inv-1", Map.of("currentBalance", 1000000)).cause());
        assertInstanceOf(IllegalArgumentException.class,
                ledger.submitProfileChange("inv-1", Map.of()).cause());
        assertInstanceOf(NotFoundException.class,
                ledger.submitProfileChange("nobody", Map.of("phone", "1")).cause());
        assertEquals(0, store.count(StoreCollections.PROFILE_CHANGE_REQUESTS));
    }

    @Test
    void credit_retriesWhenBalanceChangedConcurrently() {
        DocumentStore racingStore = mock(DocumentStore.class);
        when(racingStore.get(StoreCollections.USERS, "inv-1"))
                .thenReturn(Future.succeededFuture(Optional.of(investorDoc(1000.0))))
                .thenReturn(Future.succeededFuture(Optional.of(investorDoc(1100.0))));
        when(racingStore.updateIf(eq(StoreCollections.USERS), eq("inv-1"), any(), any()))
                .thenReturn(Future.succeededFuture(false))
                .thenReturn(Future.succeededFuture(true));
        when(racingStore.add(eq(StoreCollections.TRANSACTIONS), any())).thenReturn(Future.succeededFuture("t-1"));

        Future<BigDecimal> result = newLedger(racingStore).credit("inv-1", new BigDecimal("50"), "admin-1");

        // The second attempt builds on the concurrent writer's balance
        assertTrue(result.succeeded());
        assertEquals(0, new BigDecimal("1150").compareTo(result.result()));
        verify(racingStore, times(2)).updateIf(eq(StoreCollections.USERS), eq("inv-1"), any(), any());
        verify(racingStore, times(1)).add(eq(StoreCollections.TRANSACTIONS), any());
    }

    @Test
    void credit_givesUpAfterMaxAttempts() {
        DocumentStore racingStore = mock(DocumentStore.class);
        when(racingStore.get(StoreCollections.USERS, "inv-1"))
                .thenReturn(Future.succeededFuture(Optional.of(investorDoc(1000.0))));
        when(racingStore.updateIf(anyString(), anyString(), any(), any())).thenReturn(Future.succeededFuture(false));

        Future<BigDecimal> result = newLedger(racingStore).credit("inv-1", new BigDecimal("50"), "admin-1");

        assertTrue(result.failed());
        assertInstanceOf(WriteConflictException.class, result.cause());
        verify(racingStore, times(3)).updateIf(anyString(), anyString(), any(), any());
        verify(racingStore, never()).add(any(), any());
    }

    @Test
    void credit_storeFailure_isWrappedWithOperationMessage() {
        DocumentStore brokenStore = mock(DocumentStore.class);
        when(brokenStore.get(any(), any())).thenReturn(Future.failedFuture(new RuntimeException("socket closed")));

        Future<BigDecimal> result = newLedger(brokenStore).credit("inv-1", new BigDecimal("50"), "admin-1");

        assertTrue(result.failed());
        assertInstanceOf(StoreUnavailableException.class, result.cause());
        assertEquals("Failed to add credit: socket closed", result.cause().getMessage());
    }

    @Test
    void subscribeInvestor_deliversUpdatesAndEmptyForUnknown() {
        List<List<Investor>> deliveries = new ArrayList<>();
        List<List<Investor>> unknown = new ArrayList<>();

        Subscription subscription = ledger.subscribeInvestor("inv-1", deliveries::add);
        ledger.subscribeInvestor("nobody", unknown::add);
        ledger.credit("inv-1", new BigDecimal("1"), "admin-1");

        assertEquals(1, deliveries.get(0).size());
        assertEquals(0, new BigDecimal("1001").compareTo(deliveries.get(deliveries.size() - 1).get(0).getCurrentBalance()));
        assertTrue(unknown.get(0).isEmpty());

        subscription.cancel();
        int delivered = deliveries.size();
        ledger.credit("inv-1", new BigDecimal("1"), "admin-1");
        assertEquals(delivered, deliveries.size());
    }

    @Test
    void subscribeTransactions_failsSoft() {
        List<List<Transaction>> deliveries = new ArrayList<>();
        ledger.subscribeTransactions("inv-1", deliveries::add);

        store.setUnavailable(true);

        assertTrue(deliveries.get(deliveries.size() - 1).isEmpty());
    }

    private AccountLedgerService newLedger(DocumentStore documentStore) {
        return new AccountLedgerService(documentStore, new ChangeFeed(documentStore), new LedgerValidator(), CLOCK, 3);
    }

    private void createInvestor(String id, String name, String balance) {
        String email = name.toLowerCase().replace(' ', '.') + "@example.com";
        assertTrue(ledger.createInvestor(id,
                new InvestorProfile(name, email, null, "UK", new BigDecimal(balance), null)).succeeded());
    }

    private void record(String investorId, String date) {
        ledger.recordTransaction(new TransactionEntry(
                investorId, TransactionType.DEPOSIT, BigDecimal.TEN, date, null, null));
    }

    private static JsonObject investorDoc(double balance) {
        return new JsonObject()
                .put("id", "inv-1")
                .put("role", "investor")
                .put("currentBalance", balance);
    }
}
