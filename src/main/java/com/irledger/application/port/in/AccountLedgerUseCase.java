package com.irledger.application.port.in;

import com.irledger.application.service.Subscription;
import com.irledger.domain.model.Investor;
import com.irledger.domain.model.ProfileChangeRequest;
import com.irledger.domain.model.Transaction;
import com.irledger.domain.model.TransactionType;
import io.vertx.core.Future;
import io.vertx.core.Handler;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Inbound port - investor balances and the append-only transaction log
 */
public interface AccountLedgerUseCase {

    /**
     * Onboard an investor profile under the identity provider's user id
     */
    Future<Investor> createInvestor(String investorId, InvestorProfile profile);

    /**
     * @return the investor, failing with NotFoundException if absent or not an investor
     */
    Future<Investor> getInvestor(String investorId);

    Future<List<Investor>> listInvestors();

    Future<List<Investor>> investorsByStatus(String accountStatus);

    /**
     * Case-insensitive match on name, email or country
     */
    Future<List<Investor>> searchInvestors(String term);

    /**
     * Assets under management: sum of all investor balances
     */
    Future<BigDecimal> totalAssetsUnderManagement();

    /**
     * Admin edit of profile fields, status and account flags. Null fields are left unchanged;
     * the balance is not editable here and only moves through transactions.
     */
    Future<Investor> updateInvestor(String investorId, InvestorUpdate update);

    /**
     * Investor-submitted profile edit, queued for admin review
     * @return the change request id
     */
    Future<String> submitProfileChange(String investorId, Map<String, Object> requestedChanges);

    /**
     * @param investorId null for the requests of all investors
     */
    Future<List<ProfileChangeRequest>> profileChangeRequests(String investorId);

    /**
     * Flag the account as under closure review. Investors are never hard-deleted.
     */
    Future<Void> requestAccountClosure(String investorId, String reason, String adminId);

    Future<BigDecimal> getBalance(String investorId);

    /**
     * Add credit to an investor and record a Credit transaction
     * @param actorId admin granting the credit
     * @return the new balance
     */
    Future<BigDecimal> credit(String investorId, BigDecimal amount, String actorId);

    /**
     * Move the balance by the delta the entry's type implies, then append the entry
     * @return the new balance
     */
    Future<BigDecimal> applyTransaction(TransactionEntry entry);

    /**
     * Append a transaction without touching the balance.
     * Callers are responsible for keeping balance and log consistent.
     * @return the transaction id
     */
    Future<String> recordTransaction(TransactionEntry entry);

    /**
     * Correct the status, description or date of a logged transaction.
     * Type and amount are fixed once logged, since the balance already reflects them.
     */
    Future<Void> updateTransaction(String transactionId, TransactionUpdate update);

    /**
     * @param investorId null for the transactions of all investors
     */
    Future<List<Transaction>> getTransactions(String investorId);

    Future<List<Transaction>> recentTransactions(int limit);

    Subscription subscribeTransactions(String investorId, Handler<List<Transaction>> callback);

    Subscription subscribeInvestors(Handler<List<Investor>> callback);

    /**
     * Live view of one investor. An empty list means absent, not an investor, or feed failure.
     */
    Subscription subscribeInvestor(String investorId, Handler<List<Investor>> callback);

    /**
     * Ledger entry to append
     * @param date YYYY-MM-DD, today when null
     * @param status Completed when null
     */
    record TransactionEntry(
            String investorId,
            TransactionType type,
            BigDecimal amount,
            String date,
            String status,
            String description
    ) {}

    /**
     * Onboarding data for a new investor
     */
    record InvestorProfile(
            String name,
            String email,
            String phone,
            String country,
            BigDecimal initialBalance,
            String accountType
    ) {}

    /**
     * Admin edit of an investor. A null field keeps its stored value;
     * {@code accountFlags} and {@code tradingData} replace the stored objects whole.
     */
    record InvestorUpdate(
            String name,
            String email,
            String phone,
            String country,
            String accountType,
            String accountStatus,
            Boolean active,
            Investor.AccountFlags accountFlags,
            Investor.TradingData tradingData
    ) {}

    /**
     * Correction to a logged transaction; null fields are left unchanged
     */
    record TransactionUpdate(
            String status,
            String description,
            String date
    ) {}
}
