package com.finexec.adapter.in.web.edit;

import com.finexec.adapter.in.web.ApiResponses;
import com.finexec.application.port.in.ExecutionReportUseCase;
import com.finexec.application.port.in.ExecutionReportUseCase.UpdateAmountCommand;
import com.finexec.domain.service.Amounts;
import io.vertx.core.Handler;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * HTTP handler for editing an activity's amount in the active quarter
 * Handles PUT /api/executions/reports/:reportId/activities/:code/amount
 */
@Slf4j
@RequiredArgsConstructor
public class UpdateAmountHandler implements Handler<RoutingContext> {

    private final ExecutionReportUseCase reportUseCase;

    @Override
    public void handle(RoutingContext context) {
        JsonObject requestBody = ApiResponses.requireBody(context);
        if (requestBody == null) {
            return;
        }

        UpdateAmountCommand command;
        try {
            EditRequests.AmountRequest request = requestBody.mapTo(EditRequests.AmountRequest.class);
            command = new UpdateAmountCommand(context.pathParam("reportId"), context.pathParam("code"),
                    Amounts.parse(request.amount()));
        } catch (Exception e) {
            log.error("Error parsing request body", e);
            ApiResponses.sendError(context, 400, "Invalid request format: " + e.getMessage());
            return;
        }

        log.debug("Updating amount of {} in report {}", command.activityCode(), command.reportId());
        reportUseCase.updateAmount(command)
                .onSuccess(view -> ApiResponses.sendReport(context, 200, view))
                .onFailure(error -> ApiResponses.sendFailure(context, error));
    }
}
