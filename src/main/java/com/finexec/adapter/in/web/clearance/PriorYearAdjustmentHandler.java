package com.finexec.adapter.in.web.clearance;

import com.finexec.adapter.in.web.ApiResponses;
import com.finexec.application.port.in.ExecutionReportUseCase;
import com.finexec.application.port.in.ExecutionReportUseCase.PriorYearAdjustmentCommand;
import com.finexec.domain.service.Amounts;
import io.vertx.core.Handler;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Handles POST /api/executions/reports/:reportId/prior-year-adjustments
 */
@Slf4j
@RequiredArgsConstructor
public class PriorYearAdjustmentHandler implements Handler<RoutingContext> {

    private final ExecutionReportUseCase reportUseCase;

    @Override
    public void handle(RoutingContext context) {
        JsonObject requestBody = ApiResponses.requireBody(context);
        if (requestBody == null) {
            return;
        }

        PriorYearAdjustmentCommand command;
        try {
            PriorYearAdjustmentRequest request = requestBody.mapTo(PriorYearAdjustmentRequest.class);
            command = new PriorYearAdjustmentCommand(context.pathParam("reportId"), request.adjustmentCode(),
                    request.targetCode(), request.direction(), Amounts.parse(request.amount()));
        } catch (Exception e) {
            log.error("Error parsing request body", e);
            ApiResponses.sendError(context, 400, "Invalid request format: " + e.getMessage());
            return;
        }

        log.info("Prior-year adjustment {} {} via {} on {} in report {}", command.direction(), command.amount(),
                command.adjustmentCode(), command.targetCode(), command.reportId());
        reportUseCase.applyPriorYearAdjustment(command)
                .onSuccess(view -> ApiResponses.sendReport(context, 200, view))
                .onFailure(error -> ApiResponses.sendFailure(context, error));
    }
}
