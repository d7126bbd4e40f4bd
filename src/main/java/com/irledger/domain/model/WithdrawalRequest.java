package com.irledger.domain.model;

import io.vertx.core.json.JsonObject;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Withdrawal request with its orthogonal W-8BEN sub-status.
 * Only the withdrawal workflow mutates it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WithdrawalRequest {
    private String id;
    private String investorId;
    private String investorName;
    private BigDecimal amount;
    private WithdrawalStatus status;
    private String date;                    // Submission date, YYYY-MM-DD
    private Instant approvalDate;
    private String processedBy;
    private Instant processedAt;
    private String reason;
    private TaxFormStatus w8benStatus;
    private Instant w8benApprovedAt;
    private String w8benRejectionReason;
    private Instant createdAt;

    public boolean isPending() {
        return WithdrawalStatus.PENDING.equals(status);
    }

    public boolean isApproved() {
        return WithdrawalStatus.APPROVED.equals(status);
    }

    public static WithdrawalRequest fromDocument(JsonObject doc) {
        return WithdrawalRequest.builder()
                .id(doc.getString("id"))
                .investorId(doc.getString("investorId"))
                .investorName(doc.getString("investorName", "Unknown Investor"))
                .amount(Amounts.fromDocument(doc.getValue("amount")))
                .status(WithdrawalStatus.fromValue(doc.getString("status", WithdrawalStatus.PENDING.getValue())))
                .date(doc.getString("date"))
                .approvalDate(Investor.toInstant(doc.getLong("approvalDate")))
                .processedBy(doc.getString("processedBy"))
                .processedAt(Investor.toInstant(doc.getLong("processedAt")))
                .reason(doc.getString("reason"))
                .w8benStatus(TaxFormStatus.fromValue(doc.getString("w8benStatus", TaxFormStatus.NOT_REQUIRED.getValue())))
                .w8benApprovedAt(Investor.toInstant(doc.getLong("w8benApprovedAt")))
                .w8benRejectionReason(doc.getString("w8benRejectionReason"))
                .createdAt(Investor.toInstant(doc.getLong("createdAt")))
                .build();
    }

    public JsonObject toDocument() {
        return new JsonObject()
                .put("investorId", investorId)
                .put("investorName", investorName)
                .put("amount", Amounts.toDocument(amount))
                .put("status", status.getValue())
                .put("date", date)
                .putNull("approvalDate")
                .put("w8benStatus", w8benStatus.getValue());
    }
}
