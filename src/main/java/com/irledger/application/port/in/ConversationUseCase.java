package com.irledger.application.port.in;

import com.irledger.application.service.Subscription;
import com.irledger.domain.model.Conversation;
import com.irledger.domain.model.Participant;
import com.irledger.domain.model.SenderRole;
import io.vertx.core.Future;
import io.vertx.core.Handler;

import java.util.List;

/**
 * Inbound port - directory of two-party admin/affiliate conversations
 */
public interface ConversationUseCase {

    /**
     * Find the user's conversation, creating it with the designated admin when
     * none exists. Repeated and concurrent calls for the same pair return the same id.
     */
    Future<String> resolve(String userId, String userName, SenderRole userRole);

    /**
     * Admin-initiated start of a conversation with a chosen affiliate
     */
    Future<String> startConversation(Participant admin, Participant affiliate);

    Future<Conversation> get(String conversationId);

    /**
     * Conversations the user takes part in, most recently active first
     */
    Future<List<Conversation>> conversationsFor(String userId);

    Subscription subscribeConversations(String userId, Handler<List<Conversation>> callback);
}
