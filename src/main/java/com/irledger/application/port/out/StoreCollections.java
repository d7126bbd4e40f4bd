package com.irledger.application.port.out;

/**
 * Collection names of the document store schema
 */
public final class StoreCollections {

    public static final String USERS = "users";
    public static final String TRANSACTIONS = "transactions";
    public static final String WITHDRAWAL_REQUESTS = "withdrawalRequests";
    public static final String COMMISSIONS = "commissions";
    public static final String COMMISSION_WITHDRAWALS = "commissionWithdrawals";
    public static final String CONVERSATIONS = "conversations";
    public static final String AFFILIATE_MESSAGES = "affiliateMessages";
    public static final String PROFILE_CHANGE_REQUESTS = "profileChangeRequests";

    private StoreCollections() {
    }
}
