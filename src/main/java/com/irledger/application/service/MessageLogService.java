package com.irledger.application.service;

import com.irledger.application.port.in.ConversationUseCase;
import com.irledger.application.port.in.MessagingUseCase;
import com.irledger.application.port.out.DocumentQuery;
import com.irledger.application.port.out.DocumentStore;
import com.irledger.application.port.out.FieldValues;
import com.irledger.application.port.out.SortOrder;
import com.irledger.application.port.out.StoreCollections;
import com.irledger.domain.model.AffiliateMessage;
import com.irledger.domain.model.MessagePriority;
import com.irledger.domain.model.MessageStatus;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.json.JsonObject;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Append-only message log of a conversation.
 * Each append also refreshes the conversation's last-message preview.
 */
@Slf4j
public class MessageLogService implements MessagingUseCase {

    private final DocumentStore store;
    private final ChangeFeed changeFeed;
    private final LedgerValidator validator;
    private final ConversationUseCase conversations;
    private final int previewLength;

    public MessageLogService(DocumentStore store, ChangeFeed changeFeed, LedgerValidator validator,
                             ConversationUseCase conversations, int previewLength) {
        this.store = store;
        this.changeFeed = changeFeed;
        this.validator = validator;
        this.conversations = conversations;
        this.previewLength = previewLength;
    }

    @Override
    public Future<String> send(SendMessageCommand command) {
        ValidationResult validation = validator.validate(command);
        if (!validation.isValid()) {
            return validation.toFailure();
        }

        Future<String> conversationId = command.conversationId() != null
                ? Future.succeededFuture(command.conversationId())
                : conversations.resolve(command.senderId(), command.senderName(), command.senderRole());

        return conversationId.compose(id -> append(id, command));
    }

    @Override
    public Future<String> append(String conversationId, SendMessageCommand command) {
        ValidationResult validation = validator.validate(command);
        if (!validation.isValid()) {
            return validation.toFailure();
        }

        AffiliateMessage message = AffiliateMessage.builder()
                .senderId(command.senderId())
                .senderName(command.senderName())
                .senderRole(command.senderRole())
                .content(command.content())
                .conversationId(conversationId)
                .replyTo(command.replyTo())
                .priority(command.priority() != null ? command.priority() : MessagePriority.MEDIUM)
                .status(MessageStatus.SENT)
                .build();

        JsonObject doc = message.toDocument()
                .put("timestamp", FieldValues.SERVER_TIMESTAMP)
                .put("createdAt", FieldValues.SERVER_TIMESTAMP);

        return conversations.get(conversationId)
                .compose(conversation -> store.add(StoreCollections.AFFILIATE_MESSAGES, doc))
                .compose(messageId -> updatePreview(conversationId, command.content()).map(messageId))
                .onSuccess(messageId -> log.info("Message {} from {} appended to conversation {}",
                        messageId, command.senderId(), conversationId))
                .recover(StoreErrors.wrap("Failed to send message"));
    }

    @Override
    public Future<List<AffiliateMessage>> list(String conversationId) {
        return changeFeed.fetch(messagesQuery(conversationId))
                .map(MessageLogService::toMessages)
                .recover(StoreErrors.wrap("Failed to load messages"));
    }

    @Override
    public Subscription subscribe(String conversationId, Handler<List<AffiliateMessage>> callback) {
        return changeFeed.subscribe(messagesQuery(conversationId), rows -> callback.handle(toMessages(rows)));
    }

    String preview(String content) {
        if (content.length() <= previewLength) {
            return content;
        }
        return content.substring(0, previewLength);
    }

    /**
     * The message is already stored when this runs, so a failed preview
     * refresh is logged and the send still succeeds
     */
    private Future<Void> updatePreview(String conversationId, String content) {
        JsonObject fields = new JsonObject()
                .put("lastMessage", preview(content))
                .put("lastMessageTime", FieldValues.SERVER_TIMESTAMP)
                .put("updatedAt", FieldValues.SERVER_TIMESTAMP);

        return store.update(StoreCollections.CONVERSATIONS, conversationId, fields)
                .recover(error -> {
                    log.error("Failed to update last message of conversation {}: {}",
                            conversationId, error.getMessage());
                    return Future.succeededFuture();
                });
    }

    private static DocumentQuery messagesQuery(String conversationId) {
        return DocumentQuery.of(StoreCollections.AFFILIATE_MESSAGES)
                .where("conversationId", conversationId)
                .orderBy(SortOrder.ascending("timestamp"));
    }

    private static List<AffiliateMessage> toMessages(List<JsonObject> rows) {
        return rows.stream().map(AffiliateMessage::fromDocument).collect(Collectors.toList());
    }
}
