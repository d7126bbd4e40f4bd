package com.irledger.domain.model;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Investor profile, stored in the {@code users} collection with role {@code investor}.
 * The id is shared with the identity provider.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Investor {

    public static final String ROLE = "investor";
    public static final String STATUS_ACTIVE = "Active";
    public static final String STATUS_CLOSURE_REQUESTED = "Deletion Request Under Review";

    private String id;
    private String name;
    private String email;
    private String phone;
    private String country;
    private BigDecimal currentBalance;
    private String accountType;
    private String accountStatus;
    private boolean active;
    private AccountFlags accountFlags;
    private TradingData tradingData;
    private Instant createdAt;
    private Instant updatedAt;

    public boolean isWithdrawalDisabled() {
        return accountFlags != null && accountFlags.isWithdrawalDisabled();
    }

    /**
     * Read an investor from a {@code users} document, applying the same defaults
     * the back office shows for missing fields.
     */
    public static Investor fromDocument(JsonObject doc) {
        return Investor.builder()
                .id(doc.getString("id"))
                .name(doc.getString("name", "Unknown Investor"))
                .email(doc.getString("email", ""))
                .phone(doc.getString("phone", ""))
                .country(doc.getString("country", "Unknown"))
                .currentBalance(Amounts.fromDocument(doc.getValue("currentBalance")))
                .accountType(doc.getString("accountType", "Standard"))
                .accountStatus(doc.getString("accountStatus", STATUS_ACTIVE))
                .active(!Boolean.FALSE.equals(doc.getBoolean("isActive")))
                .accountFlags(AccountFlags.fromDocument(doc.getJsonObject("accountFlags", new JsonObject())))
                .tradingData(TradingData.fromDocument(doc.getJsonObject("tradingData", new JsonObject())))
                .createdAt(toInstant(doc.getLong("createdAt")))
                .updatedAt(toInstant(doc.getLong("updatedAt")))
                .build();
    }

    public JsonObject toDocument() {
        return new JsonObject()
                .put("name", name)
                .put("email", email)
                .put("phone", phone)
                .put("country", country)
                .put("role", ROLE)
                .put("currentBalance", Amounts.toDocument(currentBalance))
                .put("accountType", accountType)
                .put("accountStatus", accountStatus)
                .put("isActive", active)
                .put("accountFlags", (accountFlags != null ? accountFlags : new AccountFlags()).toDocument())
                .put("tradingData", (tradingData != null ? tradingData : TradingData.defaults()).toDocument());
    }

    static Instant toInstant(Long epochMillis) {
        return epochMillis == null ? null : Instant.ofEpochMilli(epochMillis);
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AccountFlags {
        private boolean policyViolation;
        private String policyViolationMessage;
        private boolean pendingKyc;
        private String kycMessage;
        private boolean withdrawalDisabled;
        private String withdrawalMessage;

        static AccountFlags fromDocument(JsonObject doc) {
            return new AccountFlags(
                    doc.getBoolean("policyViolation", false),
                    doc.getString("policyViolationMessage", ""),
                    doc.getBoolean("pendingKyc", false),
                    doc.getString("kycMessage", ""),
                    doc.getBoolean("withdrawalDisabled", false),
                    doc.getString("withdrawalMessage", "")
            );
        }

        public JsonObject toDocument() {
            return new JsonObject()
                    .put("policyViolation", policyViolation)
                    .put("policyViolationMessage", policyViolationMessage != null ? policyViolationMessage : "")
                    .put("pendingKyc", pendingKyc)
                    .put("kycMessage", kycMessage != null ? kycMessage : "")
                    .put("withdrawalDisabled", withdrawalDisabled)
                    .put("withdrawalMessage", withdrawalMessage != null ? withdrawalMessage : "");
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TradingData {
        private int positionsPerDay;
        private List<String> pairs;
        private String platform;
        private int leverage;
        private String currency;

        public static TradingData defaults() {
            return new TradingData(0, new ArrayList<>(), "IBKR", 100, "USD");
        }

        static TradingData fromDocument(JsonObject doc) {
            List<String> pairs = new ArrayList<>();
            doc.getJsonArray("pairs", new JsonArray()).forEach(pair -> pairs.add(String.valueOf(pair)));
            return new TradingData(
                    doc.getInteger("positionsPerDay", 0),
                    pairs,
                    doc.getString("platform", "IBKR"),
                    doc.getInteger("leverage", 100),
                    doc.getString("currency", "USD")
            );
        }

        public JsonObject toDocument() {
            return new JsonObject()
                    .put("positionsPerDay", positionsPerDay)
                    .put("pairs", new JsonArray(pairs != null ? new ArrayList<>(pairs) : new ArrayList<>()))
                    .put("platform", platform)
                    .put("leverage", leverage)
                    .put("currency", currency);
        }
    }
}
