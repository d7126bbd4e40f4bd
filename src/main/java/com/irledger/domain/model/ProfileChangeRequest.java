package com.irledger.domain.model;

import io.vertx.core.json.JsonObject;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Investor-submitted profile edit awaiting admin review, stored in {@code profileChangeRequests}.
 * The investor record itself is only changed once an admin applies the edit.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProfileChangeRequest {

    public static final String STATUS_PENDING = "Pending";

    private String id;
    private String investorId;
    private String investorName;
    private Map<String, Object> requestedChanges;
    private String status;
    private String date;            // YYYY-MM-DD
    private Instant createdAt;

    public static ProfileChangeRequest fromDocument(JsonObject doc) {
        return ProfileChangeRequest.builder()
                .id(doc.getString("id"))
                .investorId(doc.getString("investorId"))
                .investorName(doc.getString("investorName", "Unknown Investor"))
                .requestedChanges(new LinkedHashMap<>(doc.getJsonObject("requestedChanges", new JsonObject()).getMap()))
                .status(doc.getString("status", STATUS_PENDING))
                .date(doc.getString("date"))
                .createdAt(Investor.toInstant(doc.getLong("createdAt")))
                .build();
    }

    public JsonObject toDocument() {
        return new JsonObject()
                .put("investorId", investorId)
                .put("investorName", investorName)
                .put("requestedChanges", new JsonObject(requestedChanges != null ? new LinkedHashMap<>(requestedChanges) : new LinkedHashMap<>()))
                .put("status", status)
                .put("date", date);
    }
}
