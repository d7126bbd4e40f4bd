package com.irledger.domain.model;

import io.vertx.core.json.JsonObject;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Commission earned on an approved withdrawal. The rate is stored with the
 * record so later rate changes leave history untouched.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Commission {

    public static final String STATUS_EARNED = "Earned";

    private String id;
    private String investorId;
    private String investorName;
    private String withdrawalId;
    private BigDecimal withdrawalAmount;
    private BigDecimal commissionRate;      // Percent
    private BigDecimal commissionAmount;
    private String date;
    private String status;
    private Instant createdAt;

    public static Commission fromDocument(JsonObject doc) {
        return Commission.builder()
                .id(doc.getString("id"))
                .investorId(doc.getString("investorId"))
                .investorName(doc.getString("investorName", "Unknown Investor"))
                .withdrawalId(doc.getString("withdrawalId"))
                .withdrawalAmount(Amounts.fromDocument(doc.getValue("withdrawalAmount")))
                .commissionRate(Amounts.fromDocument(doc.getValue("commissionRate", 15)))
                .commissionAmount(Amounts.fromDocument(doc.getValue("commissionAmount")))
                .date(doc.getString("date"))
                .status(doc.getString("status", STATUS_EARNED))
                .createdAt(Investor.toInstant(doc.getLong("createdAt")))
                .build();
    }

    public JsonObject toDocument() {
        return new JsonObject()
                .put("investorId", investorId)
                .put("investorName", investorName)
                .put("withdrawalId", withdrawalId)
                .put("withdrawalAmount", Amounts.toDocument(withdrawalAmount))
                .put("commissionRate", Amounts.toDocument(commissionRate))
                .put("commissionAmount", Amounts.toDocument(commissionAmount))
                .put("date", date)
                .put("status", status);
    }
}
