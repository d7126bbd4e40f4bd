package com.irledger.adapter.in.web;

import com.irledger.adapter.in.web.commission.CommissionHandler;
import com.irledger.adapter.in.web.investor.InvestorHandler;
import com.irledger.adapter.in.web.messaging.MessagingHandler;
import com.irledger.adapter.in.web.withdrawal.WithdrawalHandler;
import com.irledger.adapter.out.persistence.InMemoryDocumentStore;
import com.irledger.adapter.out.persistence.MongoDocumentStore;
import com.irledger.application.port.in.AccountLedgerUseCase;
import com.irledger.application.port.in.CommissionUseCase;
import com.irledger.application.port.in.ConversationUseCase;
import com.irledger.application.port.in.MessagingUseCase;
import com.irledger.application.port.in.WithdrawalUseCase;
import com.irledger.application.port.out.DocumentStore;
import com.irledger.application.service.AccountLedgerService;
import com.irledger.application.service.ChangeFeed;
import com.irledger.application.service.CommissionBook;
import com.irledger.application.service.ConversationDirectory;
import com.irledger.application.service.LedgerValidator;
import com.irledger.application.service.MessageLogService;
import com.irledger.application.service.WithdrawalWorkflowService;
import com.irledger.infrastructure.config.AppConfig;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.mongo.MongoClient;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.handler.BodyHandler;
import io.vertx.ext.web.handler.LoggerHandler;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;

/**
 * HTTP Server Verticle - handles all HTTP requests
 * Infrastructure component that wires up the hexagonal architecture
 */
@Slf4j
public class HttpServerVerticle extends AbstractVerticle {

    private AppConfig appConfig;
    private MongoClient mongoClient;
    private DocumentStore documentStore;
    private ChangeFeed changeFeed;
    private WebRouter webRouter;
    private Router router;

    @Override
    public void start(Promise<Void> startPromise) {
        log.info("Starting HTTP Server Verticle...");
        appConfig = new AppConfig(config());

        initializeStore()
                .compose(v -> {
                    log.info("Document store initialized successfully ({})", appConfig.storeType());
                    return initializeServices();
                })
                .compose(v -> {
                    log.info("All services initialized successfully");
                    return startHttpServer();
                })
                .onSuccess(v -> {
                    log.info("HTTP Server Verticle started successfully on port {}", appConfig.httpPort());
                    startPromise.complete();
                })
                .onFailure(error -> {
                    log.error("Failed to start HTTP Server Verticle", error);
                    startPromise.fail(error);
                });
    }

    @Override
    public void stop() {
        if (changeFeed != null) {
            changeFeed.close();
        }
        if (mongoClient != null) {
            mongoClient.close();
        }
        log.info("HTTP Server Verticle stopped");
    }

    private Future<Void> initializeStore() {
        String storeType = appConfig.storeType();
        if ("memory".equals(storeType)) {
            log.warn("Using the in-memory document store; data is lost on shutdown");
            documentStore = new InMemoryDocumentStore();
            return Future.succeededFuture();
        }
        if (!"mongo".equals(storeType)) {
            return Future.failedFuture(new IllegalStateException("Unknown store.type: " + storeType));
        }

        JsonObject mongoConfig = appConfig.mongoConfig();
        log.info("Connecting to MongoDB database {}", mongoConfig.getString("db_name"));

        mongoClient = MongoClient.createShared(vertx, mongoConfig);
        documentStore = new MongoDocumentStore(mongoClient);

        return mongoClient.runCommand("ping", new JsonObject().put("ping", 1))
                .onSuccess(result -> log.info("MongoDB connection test successful"))
                .onFailure(error -> log.error("MongoDB connection failed", error))
                .mapEmpty();
    }

    private Future<Void> initializeServices() {
        Clock clock = Clock.systemUTC();
        changeFeed = new ChangeFeed(documentStore);

        // Application services (use cases)
        LedgerValidator validator = new LedgerValidator();
        AccountLedgerUseCase ledger = new AccountLedgerService(
                documentStore, changeFeed, validator, clock, appConfig.creditMaxAttempts());
        CommissionUseCase commissions = new CommissionBook(documentStore, changeFeed, clock);
        WithdrawalUseCase withdrawals = new WithdrawalWorkflowService(
                documentStore, changeFeed, validator, commissions, appConfig.terminalTransitionPolicy(), clock);
        ConversationUseCase conversations = new ConversationDirectory(
                documentStore, changeFeed, appConfig.adminEmail(), appConfig.fallbackAdmin());
        MessagingUseCase messages = new MessageLogService(
                documentStore, changeFeed, validator, conversations, appConfig.previewLength());

        router = Router.router(vertx);
        webRouter = new WebRouter(
                router,
                new InvestorHandler(ledger),
                new WithdrawalHandler(withdrawals),
                new CommissionHandler(commissions),
                new MessagingHandler(conversations, messages)
        );

        log.info("Services wired up (terminal transition policy: {})", appConfig.terminalTransitionPolicy().getValue());
        return Future.succeededFuture();
    }

    private Future<Void> startHttpServer() {
        // Global handlers
        router.route().handler(LoggerHandler.create());
        router.route().handler(BodyHandler.create());

        webRouter.setupRoutes();

        // Default route - 404
        router.route().handler(ctx -> HttpResponses.sendError(ctx, 404, "Endpoint not found"));

        int port = appConfig.httpPort();

        return vertx.createHttpServer()
                .requestHandler(router)
                .listen(port)
                .onSuccess(server -> log.info("HTTP server listening on port {}", port))
                .mapEmpty();
    }
}
