package com.irledger.adapter.in.web;

import com.irledger.adapter.in.web.dto.ApiResponse;
import com.irledger.application.service.Subscription;
import com.irledger.domain.exception.IndexUnavailableException;
import com.irledger.domain.exception.InvalidTransitionException;
import com.irledger.domain.exception.NotFoundException;
import com.irledger.domain.exception.StoreUnavailableException;
import com.irledger.domain.exception.WriteConflictException;
import io.vertx.core.Handler;
import io.vertx.core.http.HttpServerResponse;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.Json;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.function.Function;

/**
 * Shared response writing for the HTTP handlers: JSON envelopes, error
 * status mapping and Server-Sent Events for live feeds
 */
@Slf4j
public final class HttpResponses {

    private HttpResponses() {
    }

    /**
     * HTTP status for a failed operation. Client errors are kept apart from
     * store failures, where a retry may help.
     */
    public static int statusFor(Throwable error) {
        if (error instanceof IllegalArgumentException) {
            return 400;
        }
        if (error instanceof NotFoundException) {
            return 404;
        }
        if (error instanceof InvalidTransitionException || error instanceof WriteConflictException) {
            return 409;
        }
        if (error instanceof StoreUnavailableException || error instanceof IndexUnavailableException) {
            return 503;
        }
        return 500;
    }

    public static void sendJson(RoutingContext context, int statusCode, Object data) {
        context.response()
                .setStatusCode(statusCode)
                .putHeader("Content-Type", "application/json")
                .end(Json.encode(ApiResponse.success(data)));
    }

    public static void sendError(RoutingContext context, Throwable error) {
        int statusCode = statusFor(error);
        if (statusCode >= 500) {
            log.error("Request {} {} failed", context.request().method(), context.request().path(), error);
        } else {
            log.warn("Request {} {} rejected: {}", context.request().method(), context.request().path(),
                    error.getMessage());
        }
        sendError(context, statusCode, error.getMessage());
    }

    public static void sendError(RoutingContext context, int statusCode, String message) {
        context.response()
                .setStatusCode(statusCode)
                .putHeader("Content-Type", "application/json")
                .end(Json.encode(ApiResponse.error(message)));
    }

    /**
     * Request body as JSON, or a 400 response and null when it is missing
     */
    public static JsonObject requireBody(RoutingContext context) {
        JsonObject body;
        try {
            body = context.body().isEmpty() ? null : context.body().asJsonObject();
        } catch (DecodeException e) {
            sendError(context, 400, "Request body is not valid JSON: " + e.getMessage());
            return null;
        }
        if (body == null) {
            sendError(context, 400, "Request body is required");
        }
        return body;
    }

    /**
     * Stream a live feed as Server-Sent Events. Every delivery becomes one
     * {@code data:} event holding the full result set. The subscription is
     * cancelled when the client disconnects.
     */
    public static <T> void stream(RoutingContext context, Function<Handler<List<T>>, Subscription> subscribe) {
        HttpServerResponse response = context.response()
                .setChunked(true)
                .putHeader("Content-Type", "text/event-stream")
                .putHeader("Cache-Control", "no-cache")
                .putHeader("Connection", "keep-alive");

        Subscription subscription = subscribe.apply(items -> {
            if (!response.closed() && !response.ended()) {
                response.write("data: " + Json.encode(items) + "\n\n");
            }
        });

        response.closeHandler(v -> {
            subscription.cancel();
            log.debug("SSE client on {} disconnected", context.request().path());
        });
        if (response.closed()) {
            subscription.cancel();
        }
    }
}
