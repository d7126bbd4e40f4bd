package com.irledger.adapter.in.web;

import io.vertx.core.DeploymentOptions;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpClient;
import io.vertx.core.http.HttpClientResponse;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests of the HTTP API against the in-memory document store
 */
class HttpServerVerticleTest {

    private static final int PORT = 18931;

    private Vertx vertx;
    private HttpClient client;

    @BeforeEach
    void setUp() throws Exception {
        vertx = Vertx.vertx();
        JsonObject config = new JsonObject()
                .put("http", new JsonObject().put("port", PORT))
                .put("store", new JsonObject().put("type", "memory"))
                .put("messaging", new JsonObject().put("admin_email", "admin@example.com"));

        await(vertx.deployVerticle(new HttpServerVerticle(), new DeploymentOptions().setConfig(config)));
        client = vertx.createHttpClient();
    }

    @AfterEach
    void tearDown() throws Exception {
        await(vertx.close());
    }

    @Test
    void health_reportsUp() throws Exception {
        Reply reply = call(HttpMethod.GET, "/health", null);

        assertEquals(200, reply.status());
        assertEquals("UP", reply.body().getString("status"));
    }

    @Test
    void creditFlow_updatesBalanceAndLog() throws Exception {
        Reply created = call(HttpMethod.POST, "/api/investors", new JsonObject()
                .put("id", "inv-1")
                .put("name", "Ada Lovelace")
                .put("email", "ada@example.com")
                .put("initialBalance", 1000));
        assertEquals(201, created.status());
        assertEquals("success", created.body().getString("status"));

        Reply credited = call(HttpMethod.POST, "/api/investors/inv-1/credit", new JsonObject()
                .put("amount", 250)
                .put("actorId", "admin-1"));
        assertEquals(200, credited.status());
        assertEquals(1250.0, credited.body().getJsonObject("data").getDouble("currentBalance"));

        Reply transactions = call(HttpMethod.GET, "/api/transactions?investorId=inv-1", null);
        JsonArray rows = transactions.body().getJsonArray("data");
        assertEquals(1, rows.size());
        assertEquals("Credit", rows.getJsonObject(0).getString("type"));
    }

    @Test
    void investorUpdate_setsAccountFlags() throws Exception {
        call(HttpMethod.POST, "/api/investors", new JsonObject()
                .put("id", "inv-1")
                .put("name", "Ada Lovelace")
                .put("initialBalance", 1000));

        Reply updated = call(HttpMethod.PATCH, "/api/investors/inv-1", new JsonObject()
                .put("accountStatus", "Restricted")
                .put("accountFlags", new JsonObject()
                        .put("withdrawalDisabled", true)
                        .put("withdrawalMessage", "Withdrawals paused")));
        Reply balanceEdit = call(HttpMethod.PATCH, "/api/investors/inv-1", new JsonObject().put("currentBalance", 5));

        assertEquals(200, updated.status());
        JsonObject investor = updated.body().getJsonObject("data");
        assertEquals("Restricted", investor.getString("accountStatus"));
        assertTrue(investor.getJsonObject("accountFlags").getBoolean("withdrawalDisabled"));
        assertEquals(1000.0, investor.getDouble("currentBalance"));
        assertEquals(400, balanceEdit.status());
    }

    @Test
    void withdrawalApproval_recordsCommissionOnce() throws Exception {
        Reply submitted = call(HttpMethod.POST, "/api/withdrawals", new JsonObject()
                .put("id", "wr-1")
                .put("investorId", "inv-1")
                .put("investorName", "Ada Lovelace")
                .put("amount", 1000));
        assertEquals(201, submitted.status());

        JsonObject decision = new JsonObject().put("decision", "Approved").put("processedBy", "admin-1");
        Reply approved = call(HttpMethod.POST, "/api/withdrawals/wr-1/decision", decision);
        Reply again = call(HttpMethod.POST, "/api/withdrawals/wr-1/decision", decision);

        assertEquals(200, approved.status());
        assertEquals("Approved", approved.body().getJsonObject("data").getString("status"));
        assertEquals(409, again.status());
        assertEquals("error", again.body().getString("status"));

        Reply total = call(HttpMethod.GET, "/api/commissions/total", null);
        assertEquals(150.0, total.body().getJsonObject("data").getDouble("totalEarned"));
    }

    @Test
    void conversationFlow_resolvesAndAppends() throws Exception {
        Reply resolved = call(HttpMethod.POST, "/api/conversations/resolve", new JsonObject()
                .put("userId", "aff-1")
                .put("userName", "Affiliate One")
                .put("userRole", "affiliate"));
        String conversationId = resolved.body().getJsonObject("data").getString("conversationId");
        assertEquals("admin_fallback__aff-1", conversationId);

        Reply sent = call(HttpMethod.POST, "/api/conversations/" + conversationId + "/messages", new JsonObject()
                .put("senderId", "aff-1")
                .put("senderName", "Affiliate One")
                .put("senderRole", "affiliate")
                .put("content", "When is the next payout?"));
        assertEquals(201, sent.status());

        Reply conversation = call(HttpMethod.GET, "/api/conversations/" + conversationId, null);
        assertEquals("When is the next payout?",
                conversation.body().getJsonObject("data").getString("lastMessage"));
    }

    @Test
    void errors_mapToStatusCodes() throws Exception {
        assertEquals(404, call(HttpMethod.GET, "/api/investors/nobody", null).status());
        assertEquals(404, call(HttpMethod.GET, "/api/unknown", null).status());
        assertEquals(400, call(HttpMethod.POST, "/api/investors", null).status());
        assertEquals(400, call(HttpMethod.POST, "/api/investors/inv-1/credit", new JsonObject().put("amount", "lots")).status());
    }

    private Reply call(HttpMethod method, String path, JsonObject body) throws Exception {
        Future<Reply> reply = client.request(method, PORT, "localhost", path)
                .compose(request -> {
                    if (body == null) {
                        return request.send();
                    }
                    return request.putHeader("Content-Type", "application/json").send(body.encode());
                })
                .compose(response -> response.body().map(buffer -> toReply(response, buffer.toString())));
        return await(reply);
    }

    private static Reply toReply(HttpClientResponse response, String body) {
        return new Reply(response.statusCode(), body.isEmpty() ? new JsonObject() : new JsonObject(body));
    }

    private static <T> T await(Future<T> future) throws Exception {
        return future.toCompletionStage().toCompletableFuture().get(10, TimeUnit.SECONDS);
    }

    private record Reply(int status, JsonObject body) {}
}
