package com.irledger.adapter.in.web.commission;

import com.irledger.adapter.in.web.HttpResponses;
import com.irledger.application.port.in.CommissionUseCase;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;

import java.util.Map;

import static com.irledger.adapter.in.web.HttpResponses.requireBody;
import static com.irledger.adapter.in.web.HttpResponses.sendError;
import static com.irledger.adapter.in.web.HttpResponses.sendJson;

/**
 * HTTP handlers for commissions and payout requests
 */
@RequiredArgsConstructor
public class CommissionHandler {

    private final CommissionUseCase commissions;

    public void list(RoutingContext context) {
        commissions.list()
                .onSuccess(rows -> sendJson(context, 200, rows))
                .onFailure(error -> sendError(context, error));
    }

    public void total(RoutingContext context) {
        commissions.totalEarned()
                .onSuccess(total -> sendJson(context, 200, Map.of("totalEarned", total)))
                .onFailure(error -> sendError(context, error));
    }

    public void requestPayout(RoutingContext context) {
        JsonObject body = requireBody(context);
        if (body == null) {
            return;
        }

        PayoutRequest request;
        try {
            request = body.mapTo(PayoutRequest.class);
        } catch (Exception e) {
            sendError(context, 400, "Invalid request format: " + e.getMessage());
            return;
        }

        commissions.requestPayout(request.getAffiliateId(), request.getAffiliateName(), request.getAmount())
                .onSuccess(id -> sendJson(context, 201, Map.of("requestId", id)))
                .onFailure(error -> sendError(context, error));
    }

    public void stream(RoutingContext context) {
        HttpResponses.stream(context, commissions::subscribe);
    }
}
