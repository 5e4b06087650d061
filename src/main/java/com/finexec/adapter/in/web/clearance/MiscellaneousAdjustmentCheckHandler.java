package com.finexec.adapter.in.web.clearance;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.finexec.adapter.in.web.ApiResponses;
import com.finexec.application.port.in.ExecutionReportUseCase;
import com.finexec.domain.model.MiscellaneousAdjustmentCheck;
import com.finexec.domain.service.Amounts;
import io.vertx.core.Handler;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;

/**
 * Checks a proposed miscellaneous adjustment against available cash without changing the report
 * Handles POST /api/executions/reports/:reportId/miscellaneous-adjustments/check
 */
@Slf4j
@RequiredArgsConstructor
public class MiscellaneousAdjustmentCheckHandler implements Handler<RoutingContext> {

    private final ExecutionReportUseCase reportUseCase;

    @Override
    public void handle(RoutingContext context) {
        JsonObject requestBody = ApiResponses.requireBody(context);
        if (requestBody == null) {
            return;
        }

        BigDecimal amount;
        try {
            amount = Amounts.orZero(Amounts.parse(requestBody.mapTo(CheckRequest.class).amount()));
        } catch (Exception e) {
            log.error("Error parsing request body", e);
            ApiResponses.sendError(context, 400, "Invalid request format: " + e.getMessage());
            return;
        }

        reportUseCase.checkMiscellaneousAdjustment(context.pathParam("reportId"), amount)
                .onSuccess(check -> ApiResponses.sendJson(context, 200, CheckResponse.from(check)))
                .onFailure(error -> ApiResponses.sendFailure(context, error));
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CheckRequest(@JsonProperty("amount") Object amount) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record CheckResponse(
            @JsonProperty("isValid") boolean isValid,
            String error,
            BigDecimal maxAllowableAmount
    ) {
        static CheckResponse from(MiscellaneousAdjustmentCheck check) {
            return new CheckResponse(check.isValid(), check.error(), check.maxAllowableAmount());
        }
    }
}
