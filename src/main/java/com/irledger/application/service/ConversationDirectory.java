package com.irledger.application.service;

import com.irledger.application.port.in.ConversationUseCase;
import com.irledger.application.port.out.DocumentQuery;
import com.irledger.application.port.out.DocumentStore;
import com.irledger.application.port.out.FieldValues;
import com.irledger.application.port.out.SortOrder;
import com.irledger.application.port.out.StoreCollections;
import com.irledger.domain.exception.NotFoundException;
import com.irledger.domain.model.Conversation;
import com.irledger.domain.model.Participant;
import com.irledger.domain.model.SenderRole;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.json.JsonObject;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Directory of admin/affiliate conversations
 *
 * <p>A conversation is keyed by its (admin, affiliate) pair, so two parties
 * resolving at the same time create at most one document between them.
 */
@Slf4j
public class ConversationDirectory implements ConversationUseCase {

    private static final String ADMIN_ROLE = "admin";

    private final DocumentStore store;
    private final ChangeFeed changeFeed;
    private final String adminEmail;
    private final Participant fallbackAdmin;

    public ConversationDirectory(DocumentStore store, ChangeFeed changeFeed,
                                 String adminEmail, Participant fallbackAdmin) {
        this.store = store;
        this.changeFeed = changeFeed;
        this.adminEmail = adminEmail;
        this.fallbackAdmin = fallbackAdmin;
    }

    @Override
    public Future<String> resolve(String userId, String userName, SenderRole userRole) {
        if (userId == null || userId.isBlank()) {
            return Future.failedFuture(new IllegalArgumentException("userId is required"));
        }

        DocumentQuery existing = DocumentQuery.of(StoreCollections.CONVERSATIONS)
                .whereArrayContains("participants", userId);

        return store.query(existing)
                .compose(rows -> {
                    if (!rows.isEmpty()) {
                        String id = rows.get(0).getString("id");
                        log.debug("Found conversation {} for {}", id, userId);
                        return Future.succeededFuture(id);
                    }
                    if (userRole == SenderRole.ADMIN) {
                        return Future.<String>failedFuture(new IllegalArgumentException(
                                "Admin " + userId + " has no conversation yet; start one with a named affiliate"));
                    }
                    return designatedAdmin()
                            .compose(admin -> startConversation(admin, new Participant(userId, userName)));
                })
                .recover(StoreErrors.wrap("Failed to get or create conversation"));
    }

    @Override
    public Future<String> startConversation(Participant admin, Participant affiliate) {
        String id = Conversation.pairId(admin.id(), affiliate.id());
        JsonObject doc = Conversation.newDocument(admin, affiliate)
                .put("lastMessageTime", FieldValues.SERVER_TIMESTAMP)
                .put("createdAt", FieldValues.SERVER_TIMESTAMP)
                .put("updatedAt", FieldValues.SERVER_TIMESTAMP);

        return store.createIfAbsent(StoreCollections.CONVERSATIONS, id, doc)
                .map(created -> {
                    if (created) {
                        log.info("Created conversation {} between {} and {}", id, admin.id(), affiliate.id());
                    }
                    return id;
                })
                .recover(StoreErrors.wrap("Failed to create conversation"));
    }

    @Override
    public Future<Conversation> get(String conversationId) {
        return store.get(StoreCollections.CONVERSATIONS, conversationId)
                .compose(found -> {
                    if (found.isEmpty()) {
                        return Future.<Conversation>failedFuture(NotFoundException.of("Conversation", conversationId));
                    }
                    return Future.succeededFuture(Conversation.fromDocument(found.get()));
                })
                .recover(StoreErrors.wrap("Failed to load conversation"));
    }

    @Override
    public Future<List<Conversation>> conversationsFor(String userId) {
        return changeFeed.fetch(conversationsQuery(userId))
                .map(ConversationDirectory::toConversations)
                .recover(StoreErrors.wrap("Failed to load conversations"));
    }

    @Override
    public Subscription subscribeConversations(String userId, Handler<List<Conversation>> callback) {
        return changeFeed.subscribe(conversationsQuery(userId), rows -> callback.handle(toConversations(rows)));
    }

    /**
     * The admin account new affiliate conversations are opened with.
     * Lookup failures fall back to the configured identity so first contact never blocks.
     */
    private Future<Participant> designatedAdmin() {
        DocumentQuery query = DocumentQuery.of(StoreCollections.USERS)
                .where("role", ADMIN_ROLE)
                .where("email", adminEmail);

        return store.query(query)
                .map(rows -> {
                    if (rows.isEmpty()) {
                        log.warn("No admin account with email {}, using fallback admin {}", adminEmail, fallbackAdmin.id());
                        return fallbackAdmin;
                    }
                    JsonObject admin = rows.get(0);
                    return new Participant(admin.getString("id"), admin.getString("name", fallbackAdmin.name()));
                })
                .recover(error -> {
                    log.warn("Admin lookup failed, using fallback admin {}: {}", fallbackAdmin.id(), error.getMessage());
                    return Future.succeededFuture(fallbackAdmin);
                });
    }

    private static DocumentQuery conversationsQuery(String userId) {
        return DocumentQuery.of(StoreCollections.CONVERSATIONS)
                .whereArrayContains("participants", userId)
                .orderBy(SortOrder.descending("lastMessageTime"));
    }

    private static List<Conversation> toConversations(List<JsonObject> rows) {
        return rows.stream().map(Conversation::fromDocument).collect(Collectors.toList());
    }
}
