package com.finexec.adapter.in.web;

import com.finexec.adapter.in.web.dto.ApiResponse;
import com.finexec.adapter.in.web.dto.ReportResponse;
import com.finexec.application.port.in.ReportView;
import com.finexec.application.service.ReportNotFoundException;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import lombok.extern.slf4j.Slf4j;

/**
 * Shared response writing for the report handlers
 */
@Slf4j
public final class ApiResponses {

    private ApiResponses() {
    }

    public static void sendReport(RoutingContext context, int statusCode, ReportView view) {
        sendJson(context, statusCode, ReportResponse.from(view));
    }

    public static void sendJson(RoutingContext context, int statusCode, Object body) {
        context.response()
                .setStatusCode(statusCode)
                .putHeader("Content-Type", "application/json")
                .end(JsonObject.mapFrom(body).encode());
    }

    public static void sendError(RoutingContext context, int statusCode, String message) {
        sendJson(context, statusCode, ApiResponse.error(message));
    }

    /**
     * Map a use-case failure: rejected input is 400, an unknown report 404, anything else 500
     */
    public static void sendFailure(RoutingContext context, Throwable error) {
        int statusCode = statusOf(error);
        if (statusCode == 500) {
            log.error("Request {} {} failed", context.request().method(), context.request().path(), error);
        } else {
            log.warn("Request {} {} rejected: {}", context.request().method(), context.request().path(),
                    error.getMessage());
        }
        sendError(context, statusCode, error.getMessage());
    }

    static int statusOf(Throwable error) {
        if (error instanceof ReportNotFoundException) {
            return 404;
        }
        if (error instanceof IllegalArgumentException) {
            return 400;
        }
        return 500;
    }

    /**
     * Request body as JSON, or {@code null} after answering 400 when it is missing or malformed
     */
    public static JsonObject requireBody(RoutingContext context) {
        JsonObject body;
        try {
            body = context.body().asJsonObject();
        } catch (RuntimeException e) {
            log.warn("Malformed request body: {}", e.getMessage());
            sendError(context, 400, "Invalid request format: " + e.getMessage());
            return null;
        }
        if (body == null) {
            log.warn("Request body is null");
            sendError(context, 400, "Request body is required");
        }
        return body;
    }
}
