package com.finexec.adapter.in.web.clearance;

import com.finexec.adapter.in.web.ApiResponses;
import com.finexec.application.port.in.ExecutionReportUseCase;
import com.finexec.application.port.in.ExecutionReportUseCase.ClearanceCommand;
import com.finexec.domain.service.Amounts;
import io.vertx.core.Handler;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * HTTP handler for clearances
 * Handles POST /api/executions/reports/:reportId/clearances
 */
@Slf4j
@RequiredArgsConstructor
public class ClearanceHandler implements Handler<RoutingContext> {

    private final ExecutionReportUseCase reportUseCase;

    @Override
    public void handle(RoutingContext context) {
        JsonObject requestBody = ApiResponses.requireBody(context);
        if (requestBody == null) {
            return;
        }

        ClearanceCommand command;
        try {
            ClearanceRequest request = requestBody.mapTo(ClearanceRequest.class);
            command = new ClearanceCommand(context.pathParam("reportId"), request.clearanceType(),
                    request.activityCode(), Amounts.parse(request.amount()));
        } catch (Exception e) {
            log.error("Error parsing request body", e);
            ApiResponses.sendError(context, 400, "Invalid request format: " + e.getMessage());
            return;
        }

        log.info("Clearing {} {} of {} in report {}", command.clearanceType(), command.amount(),
                command.activityCode(), command.reportId());
        reportUseCase.clear(command)
                .onSuccess(view -> ApiResponses.sendReport(context, 200, view))
                .onFailure(error -> ApiResponses.sendFailure(context, error));
    }
}
