package com.irledger.domain.model;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Two-party conversation between an admin and an affiliate.
 * Participants are kept in canonical order: admin first, affiliate second.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Conversation {
    private String id;
    private List<String> participants;
    private List<String> participantNames;
    private String lastMessage;
    private Instant lastMessageTime;
    private Instant createdAt;
    private Instant updatedAt;

    /**
     * Document id for the conversation between an admin and an affiliate.
     * Both parties derive the same id, so concurrent first contacts collapse
     * onto a single document.
     */
    public static String pairId(String adminId, String affiliateId) {
        return adminId + "__" + affiliateId;
    }

    public static JsonObject newDocument(Participant admin, Participant affiliate) {
        return new JsonObject()
                .put("participants", new JsonArray().add(admin.id()).add(affiliate.id()))
                .put("participantNames", new JsonArray().add(admin.name()).add(affiliate.name()))
                .put("participantRoles", new JsonArray()
                        .add(SenderRole.ADMIN.getValue())
                        .add(SenderRole.AFFILIATE.getValue()))
                .put("adminId", admin.id())
                .put("affiliateId", affiliate.id())
                .put("lastMessage", "");
    }

    public boolean hasParticipant(String userId) {
        return participants != null && participants.contains(userId);
    }

    public static Conversation fromDocument(JsonObject doc) {
        return Conversation.builder()
                .id(doc.getString("id"))
                .participants(strings(doc.getJsonArray("participants")))
                .participantNames(strings(doc.getJsonArray("participantNames")))
                .lastMessage(doc.getString("lastMessage", ""))
                .lastMessageTime(Investor.toInstant(doc.getLong("lastMessageTime")))
                .createdAt(Investor.toInstant(doc.getLong("createdAt")))
                .updatedAt(Investor.toInstant(doc.getLong("updatedAt")))
                .build();
    }

    private static List<String> strings(JsonArray array) {
        List<String> values = new ArrayList<>();
        if (array != null) {
            array.forEach(value -> values.add(String.valueOf(value)));
        }
        return values;
    }
}
