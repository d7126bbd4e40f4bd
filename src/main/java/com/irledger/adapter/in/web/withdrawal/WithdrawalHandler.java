package com.irledger.adapter.in.web.withdrawal;

import com.irledger.adapter.in.web.HttpResponses;
import com.irledger.application.port.in.WithdrawalUseCase;
import com.irledger.application.port.in.WithdrawalUseCase.ProcessWithdrawalCommand;
import com.irledger.application.port.in.WithdrawalUseCase.SubmitWithdrawalCommand;
import com.irledger.domain.model.TaxFormStatus;
import com.irledger.domain.model.WithdrawalRequest;
import com.irledger.domain.model.WithdrawalStatus;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

import static com.irledger.adapter.in.web.HttpResponses.requireBody;
import static com.irledger.adapter.in.web.HttpResponses.sendError;
import static com.irledger.adapter.in.web.HttpResponses.sendJson;

/**
 * HTTP handlers for the withdrawal request lifecycle
 */
@Slf4j
@RequiredArgsConstructor
public class WithdrawalHandler {

    private final WithdrawalUseCase withdrawals;

    public void submit(RoutingContext context) {
        JsonObject body = requireBody(context);
        if (body == null) {
            return;
        }

        SubmitWithdrawalCommand command;
        try {
            SubmitWithdrawalRequest request = body.mapTo(SubmitWithdrawalRequest.class);
            command = new SubmitWithdrawalCommand(
                    request.getId(),
                    request.getInvestorId(),
                    request.getInvestorName(),
                    request.getAmount(),
                    request.getW8benStatus() != null ? TaxFormStatus.fromValue(request.getW8benStatus()) : null
            );
        } catch (Exception e) {
            log.error("Error parsing withdrawal request", e);
            sendError(context, 400, "Invalid request format: " + e.getMessage());
            return;
        }

        withdrawals.submit(command)
                .onSuccess(id -> sendJson(context, 201, Map.of("requestId", id)))
                .onFailure(error -> sendError(context, error));
    }

    public void get(RoutingContext context) {
        withdrawals.get(context.pathParam("id"))
                .onSuccess(request -> sendJson(context, 200, request))
                .onFailure(error -> sendError(context, error));
    }

    public void list(RoutingContext context) {
        withdrawals.list(context.queryParams().get("investorId"))
                .onSuccess(requests -> sendJson(context, 200, requests))
                .onFailure(error -> sendError(context, error));
    }

    public void decide(RoutingContext context) {
        JsonObject body = requireBody(context);
        if (body == null) {
            return;
        }

        ProcessWithdrawalCommand command;
        try {
            DecisionRequest request = body.mapTo(DecisionRequest.class);
            command = new ProcessWithdrawalCommand(
                    context.pathParam("id"),
                    WithdrawalStatus.fromValue(request.getDecision()),
                    request.getProcessedBy(),
                    request.getReason()
            );
        } catch (Exception e) {
            sendError(context, 400, "Invalid request format: " + e.getMessage());
            return;
        }

        withdrawals.process(command)
                .onSuccess(updated -> sendJson(context, 200, updated))
                .onFailure(error -> sendError(context, error));
    }

    public void taxForm(RoutingContext context) {
        JsonObject body = requireBody(context);
        if (body == null) {
            return;
        }

        String requestId = context.pathParam("id");
        TaxFormRequest request;
        TaxFormStatus status;
        try {
            request = body.mapTo(TaxFormRequest.class);
            status = TaxFormStatus.fromValue(request.getStatus());
        } catch (Exception e) {
            sendError(context, 400, "Invalid request format: " + e.getMessage());
            return;
        }

        withdrawals.setTaxFormStatus(requestId, status, request.getProcessedBy(), request.getReason())
                .compose(v -> withdrawals.get(requestId))
                .onSuccess(updated -> sendJson(context, 200, updated))
                .onFailure(error -> sendError(context, error));
    }

    public void stream(RoutingContext context) {
        String investorId = context.queryParams().get("investorId");
        HttpResponses.<WithdrawalRequest>stream(context, callback -> withdrawals.subscribe(investorId, callback));
    }
}
