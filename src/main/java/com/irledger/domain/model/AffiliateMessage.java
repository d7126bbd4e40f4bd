package com.irledger.domain.model;

import io.vertx.core.json.JsonObject;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Message row in the {@code affiliateMessages} collection. Immutable once written.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AffiliateMessage {
    private String id;
    private String senderId;
    private String senderName;
    private SenderRole senderRole;
    private String content;
    private String conversationId;
    private String replyTo;
    private MessagePriority priority;
    private MessageStatus status;
    private Instant timestamp;
    private Instant createdAt;

    public static AffiliateMessage fromDocument(JsonObject doc) {
        return AffiliateMessage.builder()
                .id(doc.getString("id"))
                .senderId(doc.getString("senderId"))
                .senderName(doc.getString("senderName"))
                .senderRole(SenderRole.fromValue(doc.getString("senderRole", SenderRole.AFFILIATE.getValue())))
                .content(doc.getString("content", ""))
                .conversationId(doc.getString("conversationId"))
                .replyTo(doc.getString("replyTo"))
                .priority(MessagePriority.fromValue(doc.getString("priority", MessagePriority.MEDIUM.getValue())))
                .status(MessageStatus.fromValue(doc.getString("status", MessageStatus.SENT.getValue())))
                .timestamp(Investor.toInstant(doc.getLong("timestamp")))
                .createdAt(Investor.toInstant(doc.getLong("createdAt")))
                .build();
    }

    public JsonObject toDocument() {
        return new JsonObject()
                .put("senderId", senderId)
                .put("senderName", senderName)
                .put("senderRole", senderRole.getValue())
                .put("content", content)
                .put("conversationId", conversationId)
                .put("replyTo", replyTo)
                .put("priority", priority.getValue())
                .put("status", status.getValue());
    }
}
