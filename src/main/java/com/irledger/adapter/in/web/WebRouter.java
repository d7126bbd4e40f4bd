package com.irledger.adapter.in.web;

import com.irledger.adapter.in.web.commission.CommissionHandler;
import com.irledger.adapter.in.web.investor.InvestorHandler;
import com.irledger.adapter.in.web.messaging.MessagingHandler;
import com.irledger.adapter.in.web.withdrawal.WithdrawalHandler;
import io.vertx.ext.web.Router;
import lombok.RequiredArgsConstructor;

/**
 * Router configuration for the ledger API
 * Static paths are registered before the {@code :id} routes they would otherwise collide with.
 */
@RequiredArgsConstructor
public class WebRouter {

    private final Router router;
    private final InvestorHandler investorHandler;
    private final WithdrawalHandler withdrawalHandler;
    private final CommissionHandler commissionHandler;
    private final MessagingHandler messagingHandler;

    public void setupRoutes() {
        // CORS headers
        router.route().handler(ctx -> {
            ctx.response()
                    .putHeader("Access-Control-Allow-Origin", "*")
                    .putHeader("Access-Control-Allow-Methods", "GET, POST, PATCH, OPTIONS")
                    .putHeader("Access-Control-Allow-Headers", "Content-Type, Authorization, X-Requested-With")
                    .putHeader("Access-Control-Allow-Credentials", "true");
            ctx.next();
        });

        // Preflight
        router.options("/api/*").handler(ctx -> ctx.response().setStatusCode(204).end());

        // Investors
        router.get("/api/investors/stream").handler(investorHandler::streamInvestors);
        router.get("/api/investors/aum").handler(investorHandler::assetsUnderManagement);
        router.get("/api/investors").handler(investorHandler::list);
        router.post("/api/investors").handler(investorHandler::create);
        router.get("/api/investors/:id").handler(investorHandler::get);
        router.patch("/api/investors/:id").handler(investorHandler::update);
        router.get("/api/investors/:id/balance").handler(investorHandler::balance);
        router.get("/api/investors/:id/stream").handler(investorHandler::streamInvestor);
        router.post("/api/investors/:id/credit").handler(investorHandler::credit);
        router.post("/api/investors/:id/closure").handler(investorHandler::requestClosure);
        router.post("/api/investors/:id/profile-changes").handler(investorHandler::submitProfileChange);
        router.get("/api/profile-changes").handler(investorHandler::profileChangeRequests);

        // Transactions
        router.get("/api/transactions/stream").handler(investorHandler::streamTransactions);
        router.get("/api/transactions").handler(investorHandler::transactions);
        router.post("/api/transactions").handler(investorHandler::postTransaction);
        router.patch("/api/transactions/:id").handler(investorHandler::updateTransaction);

        // Withdrawals
        router.get("/api/withdrawals/stream").handler(withdrawalHandler::stream);
        router.get("/api/withdrawals").handler(withdrawalHandler::list);
        router.post("/api/withdrawals").handler(withdrawalHandler::submit);
        router.get("/api/withdrawals/:id").handler(withdrawalHandler::get);
        router.post("/api/withdrawals/:id/decision").handler(withdrawalHandler::decide);
        router.post("/api/withdrawals/:id/w8ben").handler(withdrawalHandler::taxForm);

        // Commissions
        router.get("/api/commissions/stream").handler(commissionHandler::stream);
        router.get("/api/commissions/total").handler(commissionHandler::total);
        router.get("/api/commissions").handler(commissionHandler::list);
        router.post("/api/commissions/payouts").handler(commissionHandler::requestPayout);

        // Conversations and messages
        router.get("/api/conversations/stream").handler(messagingHandler::streamConversations);
        router.post("/api/conversations/resolve").handler(messagingHandler::resolve);
        router.get("/api/conversations").handler(messagingHandler::list);
        router.post("/api/conversations").handler(messagingHandler::start);
        router.get("/api/conversations/:id").handler(messagingHandler::get);
        router.get("/api/conversations/:id/messages/stream").handler(messagingHandler::streamMessages);
        router.get("/api/conversations/:id/messages").handler(messagingHandler::messages);
        router.post("/api/conversations/:id/messages").handler(messagingHandler::append);
        router.post("/api/messages").handler(messagingHandler::send);

        // Health check endpoint
        router.get("/health")
                .handler(ctx -> {
                    ctx.response()
                            .putHeader("Content-Type", "application/json")
                            .end("{\"status\":\"UP\",\"service\":\"investor-ledger\"}");
                });

        // Root endpoint
        router.get("/")
                .handler(ctx -> {
                    ctx.response()
                            .putHeader("Content-Type", "application/json")
                            .end("{\"name\":\"Investor Ledger\",\"version\":\"1.0.0\"}");
                });
    }
}
