package com.irledger.adapter.in.web.messaging;

import com.irledger.adapter.in.web.HttpResponses;
import com.irledger.application.port.in.ConversationUseCase;
import com.irledger.application.port.in.MessagingUseCase;
import com.irledger.application.port.in.MessagingUseCase.SendMessageCommand;
import com.irledger.domain.model.AffiliateMessage;
import com.irledger.domain.model.Conversation;
import com.irledger.domain.model.MessagePriority;
import com.irledger.domain.model.Participant;
import com.irledger.domain.model.SenderRole;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

import static com.irledger.adapter.in.web.HttpResponses.requireBody;
import static com.irledger.adapter.in.web.HttpResponses.sendError;
import static com.irledger.adapter.in.web.HttpResponses.sendJson;

/**
 * HTTP handlers for conversations and their messages
 */
@Slf4j
@RequiredArgsConstructor
public class MessagingHandler {

    private final ConversationUseCase conversations;
    private final MessagingUseCase messages;

    public void resolve(RoutingContext context) {
        JsonObject body = requireBody(context);
        if (body == null) {
            return;
        }

        ResolveConversationRequest request;
        SenderRole role;
        try {
            request = body.mapTo(ResolveConversationRequest.class);
            role = SenderRole.fromValue(request.getUserRole());
        } catch (Exception e) {
            sendError(context, 400, "Invalid request format: " + e.getMessage());
            return;
        }

        conversations.resolve(request.getUserId(), request.getUserName(), role)
                .onSuccess(id -> sendJson(context, 200, Map.of("conversationId", id)))
                .onFailure(error -> sendError(context, error));
    }

    public void start(RoutingContext context) {
        JsonObject body = requireBody(context);
        if (body == null) {
            return;
        }

        StartConversationRequest request;
        try {
            request = body.mapTo(StartConversationRequest.class);
        } catch (Exception e) {
            sendError(context, 400, "Invalid request format: " + e.getMessage());
            return;
        }
        if (request.getAdminId() == null || request.getAffiliateId() == null) {
            sendError(context, 400, "adminId and affiliateId are required");
            return;
        }

        conversations.startConversation(
                        new Participant(request.getAdminId(), request.getAdminName()),
                        new Participant(request.getAffiliateId(), request.getAffiliateName()))
                .onSuccess(id -> sendJson(context, 201, Map.of("conversationId", id)))
                .onFailure(error -> sendError(context, error));
    }

    public void list(RoutingContext context) {
        String userId = context.queryParams().get("userId");
        if (userId == null) {
            sendError(context, 400, "userId query parameter is required");
            return;
        }
        conversations.conversationsFor(userId)
                .onSuccess(rows -> sendJson(context, 200, rows))
                .onFailure(error -> sendError(context, error));
    }

    public void get(RoutingContext context) {
        conversations.get(context.pathParam("id"))
                .onSuccess(conversation -> sendJson(context, 200, conversation))
                .onFailure(error -> sendError(context, error));
    }

    public void streamConversations(RoutingContext context) {
        String userId = context.queryParams().get("userId");
        if (userId == null) {
            sendError(context, 400, "userId query parameter is required");
            return;
        }
        HttpResponses.<Conversation>stream(context, callback -> conversations.subscribeConversations(userId, callback));
    }

    /**
     * POST /api/messages: the conversation is resolved from the sender when the body names none
     */
    public void send(RoutingContext context) {
        SendMessageCommand command = readMessage(context, null);
        if (command == null) {
            return;
        }
        messages.send(command)
                .onSuccess(id -> sendJson(context, 201, Map.of("messageId", id)))
                .onFailure(error -> sendError(context, error));
    }

    public void append(RoutingContext context) {
        String conversationId = context.pathParam("id");
        SendMessageCommand command = readMessage(context, conversationId);
        if (command == null) {
            return;
        }
        messages.append(conversationId, command)
                .onSuccess(id -> sendJson(context, 201, Map.of("messageId", id)))
                .onFailure(error -> sendError(context, error));
    }

    public void messages(RoutingContext context) {
        messages.list(context.pathParam("id"))
                .onSuccess(rows -> sendJson(context, 200, rows))
                .onFailure(error -> sendError(context, error));
    }

    public void streamMessages(RoutingContext context) {
        String conversationId = context.pathParam("id");
        HttpResponses.<AffiliateMessage>stream(context, callback -> messages.subscribe(conversationId, callback));
    }

    private SendMessageCommand readMessage(RoutingContext context, String conversationId) {
        JsonObject body = requireBody(context);
        if (body == null) {
            return null;
        }
        try {
            SendMessageRequest request = body.mapTo(SendMessageRequest.class);
            return new SendMessageCommand(
                    request.getSenderId(),
                    request.getSenderName(),
                    request.getSenderRole() != null ? SenderRole.fromValue(request.getSenderRole()) : null,
                    request.getContent(),
                    conversationId != null ? conversationId : request.getConversationId(),
                    request.getReplyTo(),
                    request.getPriority() != null ? MessagePriority.fromValue(request.getPriority()) : null
            );
        } catch (Exception e) {
            log.warn("Invalid message request: {}", e.getMessage());
            sendError(context, 400, "Invalid request format: " + e.getMessage());
            return null;
        }
    }
}
