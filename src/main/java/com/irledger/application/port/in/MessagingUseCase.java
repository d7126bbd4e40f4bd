package com.irledger.application.port.in;

import com.irledger.application.service.Subscription;
import com.irledger.domain.model.AffiliateMessage;
import com.irledger.domain.model.MessagePriority;
import com.irledger.domain.model.SenderRole;
import io.vertx.core.Future;
import io.vertx.core.Handler;

import java.util.List;

/**
 * Inbound port - per-conversation message log
 */
public interface MessagingUseCase {

    /**
     * Send a message, resolving the sender's conversation first when the
     * command names none
     * @return the message id
     */
    Future<String> send(SendMessageCommand command);

    /**
     * Append a message to an existing conversation and refresh its last-message preview
     * @return the message id
     */
    Future<String> append(String conversationId, SendMessageCommand command);

    /**
     * Messages of a conversation, oldest first
     */
    Future<List<AffiliateMessage>> list(String conversationId);

    Subscription subscribe(String conversationId, Handler<List<AffiliateMessage>> callback);

    /**
     * @param conversationId optional, resolved from the sender when null
     * @param priority medium when null
     */
    record SendMessageCommand(
            String senderId,
            String senderName,
            SenderRole senderRole,
            String content,
            String conversationId,
            String replyTo,
            MessagePriority priority
    ) {}
}
