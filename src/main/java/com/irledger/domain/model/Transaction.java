package com.irledger.domain.model;

import io.vertx.core.json.JsonObject;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Immutable ledger entry in the {@code transactions} collection
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Transaction {

    public static final String STATUS_COMPLETED = "Completed";

    private String id;
    private String investorId;
    private TransactionType type;
    private BigDecimal amount;      // Positive magnitude, direction comes from type
    private String date;            // YYYY-MM-DD
    private String status;
    private String description;
    private Instant createdAt;

    public BigDecimal getBalanceDelta() {
        return type.balanceDelta(amount);
    }

    public static Transaction fromDocument(JsonObject doc) {
        return Transaction.builder()
                .id(doc.getString("id"))
                .investorId(doc.getString("investorId"))
                .type(TransactionType.fromValue(doc.getString("type", TransactionType.DEPOSIT.getValue())))
                .amount(Amounts.fromDocument(doc.getValue("amount")))
                .date(doc.getString("date"))
                .status(doc.getString("status", STATUS_COMPLETED))
                .description(doc.getString("description", ""))
                .createdAt(Investor.toInstant(doc.getLong("createdAt")))
                .build();
    }

    public JsonObject toDocument() {
        return new JsonObject()
                .put("investorId", investorId)
                .put("type", type.getValue())
                .put("amount", Amounts.toDocument(amount))
                .put("date", date)
                .put("status", status)
                .put("description", description != null ? description : "");
    }
}
