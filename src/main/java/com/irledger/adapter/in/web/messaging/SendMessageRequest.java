package com.irledger.adapter.in.web.messaging;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Message posted by an admin or affiliate
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SendMessageRequest {
    private String senderId;
    private String senderName;
    private String senderRole;
    private String content;
    private String conversationId;
    private String replyTo;
    private String priority;
}
