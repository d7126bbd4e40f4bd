package com.irledger.adapter.in.web.investor;

import com.irledger.adapter.in.web.HttpResponses;
import com.irledger.application.port.in.AccountLedgerUseCase;
import com.irledger.application.port.in.AccountLedgerUseCase.InvestorProfile;
import com.irledger.application.port.in.AccountLedgerUseCase.InvestorUpdate;
import com.irledger.application.port.in.AccountLedgerUseCase.TransactionEntry;
import com.irledger.application.port.in.AccountLedgerUseCase.TransactionUpdate;
import com.irledger.domain.model.Investor;
import com.irledger.domain.model.Transaction;
import com.irledger.domain.model.TransactionType;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

import static com.irledger.adapter.in.web.HttpResponses.requireBody;
import static com.irledger.adapter.in.web.HttpResponses.sendError;
import static com.irledger.adapter.in.web.HttpResponses.sendJson;
import static com.irledger.adapter.in.web.HttpResponses.stream;

/**
 * HTTP handlers for investor accounts and the transaction log
 * Routes are registered by WebRouter.
 */
@Slf4j
@RequiredArgsConstructor
public class InvestorHandler {

    private static final int DEFAULT_RECENT_LIMIT = 10;

    private final AccountLedgerUseCase ledger;

    public void create(RoutingContext context) {
        JsonObject body = requireBody(context);
        if (body == null) {
            return;
        }

        CreateInvestorRequest request;
        try {
            request = body.mapTo(CreateInvestorRequest.class);
        } catch (Exception e) {
            sendError(context, 400, "Invalid request format: " + e.getMessage());
            return;
        }
        if (request.getId() == null || request.getId().isBlank() || request.getName() == null) {
            sendError(context, 400, "id and name are required");
            return;
        }

        InvestorProfile profile = new InvestorProfile(
                request.getName(),
                request.getEmail(),
                request.getPhone(),
                request.getCountry(),
                request.getInitialBalance(),
                request.getAccountType()
        );

        ledger.createInvestor(request.getId(), profile)
                .onSuccess(investor -> sendJson(context, 201, investor))
                .onFailure(error -> sendError(context, error));
    }

    public void list(RoutingContext context) {
        String status = context.queryParams().get("status");
        String search = context.queryParams().get("q");

        if (search != null) {
            ledger.searchInvestors(search)
                    .onSuccess(investors -> sendJson(context, 200, investors))
                    .onFailure(error -> sendError(context, error));
        } else if (status != null) {
            ledger.investorsByStatus(status)
                    .onSuccess(investors -> sendJson(context, 200, investors))
                    .onFailure(error -> sendError(context, error));
        } else {
            ledger.listInvestors()
                    .onSuccess(investors -> sendJson(context, 200, investors))
                    .onFailure(error -> sendError(context, error));
        }
    }

    public void update(RoutingContext context) {
        JsonObject body = requireBody(context);
        if (body == null) {
            return;
        }
        if (body.containsKey("currentBalance")) {
            sendError(context, 400, "currentBalance changes go through transactions");
            return;
        }

        InvestorUpdate update;
        try {
            UpdateInvestorRequest request = body.mapTo(UpdateInvestorRequest.class);
            update = new InvestorUpdate(
                    request.getName(),
                    request.getEmail(),
                    request.getPhone(),
                    request.getCountry(),
                    request.getAccountType(),
                    request.getAccountStatus(),
                    request.getActive(),
                    request.getAccountFlags(),
                    request.getTradingData()
            );
        } catch (Exception e) {
            sendError(context, 400, "Invalid request format: " + e.getMessage());
            return;
        }

        ledger.updateInvestor(context.pathParam("id"), update)
                .onSuccess(investor -> sendJson(context, 200, investor))
                .onFailure(error -> sendError(context, error));
    }

    public void submitProfileChange(RoutingContext context) {
        JsonObject body = requireBody(context);
        if (body == null) {
            return;
        }

        ProfileChangeSubmission submission;
        try {
            submission = body.mapTo(ProfileChangeSubmission.class);
        } catch (Exception e) {
            sendError(context, 400, "Invalid request format: " + e.getMessage());
            return;
        }

        ledger.submitProfileChange(context.pathParam("id"), submission.getRequestedChanges())
                .onSuccess(id -> sendJson(context, 201, Map.of("requestId", id)))
                .onFailure(error -> sendError(context, error));
    }

    public void profileChangeRequests(RoutingContext context) {
        ledger.profileChangeRequests(context.queryParams().get("investorId"))
                .onSuccess(requests -> sendJson(context, 200, requests))
                .onFailure(error -> sendError(context, error));
    }

    public void get(RoutingContext context) {
        ledger.getInvestor(context.pathParam("id"))
                .onSuccess(investor -> sendJson(context, 200, investor))
                .onFailure(error -> sendError(context, error));
    }

    public void balance(RoutingContext context) {
        String investorId = context.pathParam("id");
        ledger.getBalance(investorId)
                .onSuccess(balance -> sendJson(context, 200, Map.of("investorId", investorId, "currentBalance", balance)))
                .onFailure(error -> sendError(context, error));
    }

    public void assetsUnderManagement(RoutingContext context) {
        ledger.totalAssetsUnderManagement()
                .onSuccess(total -> sendJson(context, 200, Map.of("totalAum", total)))
                .onFailure(error -> sendError(context, error));
    }

    public void credit(RoutingContext context) {
        JsonObject body = requireBody(context);
        if (body == null) {
            return;
        }

        String investorId = context.pathParam("id");
        try {
            CreditRequest request = body.mapTo(CreditRequest.class);
            ledger.credit(investorId, request.getAmount(), request.getActorId())
                    .onSuccess(balance -> sendJson(context, 200, Map.of("investorId", investorId, "currentBalance", balance)))
                    .onFailure(error -> sendError(context, error));
        } catch (Exception e) {
            log.error("Error parsing credit request", e);
            sendError(context, 400, "Invalid request format: " + e.getMessage());
        }
    }

    public void requestClosure(RoutingContext context) {
        JsonObject body = requireBody(context);
        if (body == null) {
            return;
        }

        try {
            ClosureRequest request = body.mapTo(ClosureRequest.class);
            ledger.requestAccountClosure(context.pathParam("id"), request.getReason(), request.getAdminId())
                    .onSuccess(v -> sendJson(context, 202, Map.of("accountStatus", Investor.STATUS_CLOSURE_REQUESTED)))
                    .onFailure(error -> sendError(context, error));
        } catch (Exception e) {
            sendError(context, 400, "Invalid request format: " + e.getMessage());
        }
    }

    public void streamInvestors(RoutingContext context) {
        stream(context, ledger::subscribeInvestors);
    }

    public void streamInvestor(RoutingContext context) {
        String investorId = context.pathParam("id");
        HttpResponses.<Investor>stream(context, callback -> ledger.subscribeInvestor(investorId, callback));
    }

    public void transactions(RoutingContext context) {
        String investorId = context.queryParams().get("investorId");
        String limit = context.queryParams().get("limit");

        if (limit != null && investorId == null) {
            int max;
            try {
                max = Integer.parseInt(limit);
            } catch (NumberFormatException e) {
                sendError(context, 400, "limit must be a number");
                return;
            }
            ledger.recentTransactions(max > 0 ? max : DEFAULT_RECENT_LIMIT)
                    .onSuccess(rows -> sendJson(context, 200, rows))
                    .onFailure(error -> sendError(context, error));
            return;
        }

        ledger.getTransactions(investorId)
                .onSuccess(rows -> sendJson(context, 200, rows))
                .onFailure(error -> sendError(context, error));
    }

    /**
     * POST /api/transactions moves the balance and appends the entry.
     * With {@code ?recordOnly=true} only the entry is appended.
     */
    public void postTransaction(RoutingContext context) {
        JsonObject body = requireBody(context);
        if (body == null) {
            return;
        }

        TransactionEntry entry;
        try {
            TransactionRequest request = body.mapTo(TransactionRequest.class);
            entry = new TransactionEntry(
                    request.getInvestorId(),
                    TransactionType.fromValue(request.getType()),
                    request.getAmount(),
                    request.getDate(),
                    request.getStatus(),
                    request.getDescription()
            );
        } catch (Exception e) {
            sendError(context, 400, "Invalid request format: " + e.getMessage());
            return;
        }

        if (Boolean.parseBoolean(context.queryParams().get("recordOnly"))) {
            ledger.recordTransaction(entry)
                    .onSuccess(id -> sendJson(context, 201, Map.of("transactionId", id)))
                    .onFailure(error -> sendError(context, error));
        } else {
            ledger.applyTransaction(entry)
                    .onSuccess(balance -> sendJson(context, 201, Map.of("investorId", entry.investorId(), "currentBalance", balance)))
                    .onFailure(error -> sendError(context, error));
        }
    }

    public void updateTransaction(RoutingContext context) {
        JsonObject body = requireBody(context);
        if (body == null) {
            return;
        }

        try {
            UpdateTransactionRequest request = body.mapTo(UpdateTransactionRequest.class);
            ledger.updateTransaction(context.pathParam("id"),
                            new TransactionUpdate(request.getStatus(), request.getDescription(), request.getDate()))
                    .onSuccess(v -> sendJson(context, 200, Map.of("transactionId", context.pathParam("id"))))
                    .onFailure(error -> sendError(context, error));
        } catch (Exception e) {
            sendError(context, 400, "Invalid request format: " + e.getMessage());
        }
    }

    public void streamTransactions(RoutingContext context) {
        String investorId = context.queryParams().get("investorId");
        HttpResponses.<Transaction>stream(context, callback -> ledger.subscribeTransactions(investorId, callback));
    }
}
