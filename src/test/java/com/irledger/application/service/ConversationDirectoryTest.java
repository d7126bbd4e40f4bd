package com.irledger.application.service;

import com.irledger.adapter.out.persistence.InMemoryDocumentStore;
import com.irledger.application.port.out.DocumentQuery;
import com.irledger.application.port.out.StoreCollections;
import com.irledger.domain.exception.NotFoundException;
import com.irledger.domain.exception.StoreUnavailableException;
import com.irledger.domain.model.Conversation;
import com.irledger.domain.model.Participant;
import com.irledger.domain.model.SenderRole;
import io.vertx.core.Future;
import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ConversationDirectory
 */
class ConversationDirectoryTest {

    private static final String ADMIN_EMAIL = "admin@example.com";
    private static final Participant FALLBACK_ADMIN = new Participant("fallback-admin", "Investment Director");

    private InMemoryDocumentStore store;
    private ConversationDirectory directory;

    @BeforeEach
    void setUp() {
        store = new InMemoryDocumentStore();
        store.set(StoreCollections.USERS, "admin-1", new JsonObject()
                .put("role", "admin")
                .put("email", ADMIN_EMAIL)
                .put("name", "Head of IR"));
        directory = new ConversationDirectory(store, new ChangeFeed(store), ADMIN_EMAIL, FALLBACK_ADMIN);
    }

    @Test
    void resolve_createsConversationWithDesignatedAdmin() {
        Future<String> result = directory.resolve("aff-1", "Affiliate One", SenderRole.AFFILIATE);

        assertTrue(result.succeeded());
        assertEquals("admin-1__aff-1", result.result());

        Conversation conversation = directory.get(result.result()).result();
        assertEquals(List.of("admin-1", "aff-1"), conversation.getParticipants());
        assertEquals(List.of("Head of IR", "Affiliate One"), conversation.getParticipantNames());
        assertEquals("", conversation.getLastMessage());
        assertNotNull(conversation.getLastMessageTime());
    }

    @Test
    void resolve_repeatedCalls_returnSameConversation() {
        String first = directory.resolve("aff-1", "Affiliate One", SenderRole.AFFILIATE).result();
        String second = directory.resolve("aff-1", "Affiliate One", SenderRole.AFFILIATE).result();

        assertEquals(first, second);
        assertEquals(1, store.count(StoreCollections.CONVERSATIONS));
    }

    @Test
    void resolve_adminAndAffiliate_shareOneConversation() {
        String fromAffiliate = directory.resolve("aff-1", "Affiliate One", SenderRole.AFFILIATE).result();
        String fromAdmin = directory.resolve("admin-1", "Head of IR", SenderRole.ADMIN).result();

        assertEquals(fromAffiliate, fromAdmin);
    }

    @Test
    void startConversation_concurrentWithResolve_collapsesOntoOneDocument() {
        String started = directory.startConversation(
                new Participant("admin-1", "Head of IR"), new Participant("aff-1", "Affiliate One")).result();
        String resolved = directory.resolve("aff-1", "Affiliate One", SenderRole.AFFILIATE).result();
        String startedAgain = directory.startConversation(
                new Participant("admin-1", "Head of IR"), new Participant("aff-1", "Affiliate One")).result();

        assertEquals(started, resolved);
        assertEquals(started, startedAgain);
        assertEquals(1, store.count(StoreCollections.CONVERSATIONS));
    }

    @Test
    void resolve_adminWithoutConversation_fails() {
        Future<String> result = directory.resolve("admin-1", "Head of IR", SenderRole.ADMIN);

        assertTrue(result.failed());
        assertInstanceOf(IllegalArgumentException.class, result.cause());
        assertEquals(0, store.count(StoreCollections.CONVERSATIONS));
    }

    @Test
    void resolve_blankUser_fails() {
        assertInstanceOf(IllegalArgumentException.class,
                directory.resolve(" ", "Nobody", SenderRole.AFFILIATE).cause());
    }

    @Test
    void resolve_noAdminAccount_usesFallbackAdmin() {
        InMemoryDocumentStore empty = new InMemoryDocumentStore();
        ConversationDirectory withoutAdmin =
                new ConversationDirectory(empty, new ChangeFeed(empty), ADMIN_EMAIL, FALLBACK_ADMIN);

        String id = withoutAdmin.resolve("aff-1", "Affiliate One", SenderRole.AFFILIATE).result();

        assertEquals("fallback-admin__aff-1", id);
        assertEquals("Investment Director", withoutAdmin.get(id).result().getParticipantNames().get(0));
    }

    @Test
    void resolve_adminLookupFails_usesFallbackAdmin() {
        InMemoryDocumentStore brokenUsers = new InMemoryDocumentStore() {
            @Override
            public synchronized Future<List<JsonObject>> query(DocumentQuery query) {
                if (StoreCollections.USERS.equals(query.collection())) {
                    return Future.failedFuture(new StoreUnavailableException("users unavailable"));
                }
                return super.query(query);
            }
        };
        ConversationDirectory fallback =
                new ConversationDirectory(brokenUsers, new ChangeFeed(brokenUsers), ADMIN_EMAIL, FALLBACK_ADMIN);

        Future<String> result = fallback.resolve("aff-1", "Affiliate One", SenderRole.AFFILIATE);

        assertTrue(result.succeeded());
        assertEquals("fallback-admin__aff-1", result.result());
    }

    @Test
    void resolve_storeDown_failsWithStoreUnavailable() {
        store.setUnavailable(true);

        Future<String> result = directory.resolve("aff-1", "Affiliate One", SenderRole.AFFILIATE);

        assertInstanceOf(StoreUnavailableException.class, result.cause());
        assertTrue(result.cause().getMessage().startsWith("Failed to get or create conversation"));
    }

    @Test
    void get_unknownConversation_failsWithNotFound() {
        assertInstanceOf(NotFoundException.class, directory.get("nope").cause());
    }

    @Test
    void conversationsFor_ordersByLastActivity() {
        store.set(StoreCollections.CONVERSATIONS, "admin-1__aff-1", conversation("aff-1", 1_000L));
        store.set(StoreCollections.CONVERSATIONS, "admin-1__aff-2", conversation("aff-2", 3_000L));
        store.set(StoreCollections.CONVERSATIONS, "admin-1__aff-3", conversation("aff-3", 2_000L));

        List<Conversation> forAdmin = directory.conversationsFor("admin-1").result();
        List<Conversation> forAffiliate = directory.conversationsFor("aff-2").result();

        assertEquals(List.of("admin-1__aff-2", "admin-1__aff-3", "admin-1__aff-1"),
                forAdmin.stream().map(Conversation::getId).toList());
        assertEquals(1, forAffiliate.size());
    }

    private static JsonObject conversation(String affiliateId, long lastMessageTime) {
        return Conversation.newDocument(new Participant("admin-1", "Head of IR"), new Participant(affiliateId, affiliateId))
                .put("lastMessageTime", lastMessageTime);
    }
}
