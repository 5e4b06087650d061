package com.finexec.adapter.in.web.edit;

import com.finexec.adapter.in.web.ApiResponses;
import com.finexec.application.port.in.ExecutionReportUseCase;
import com.finexec.application.port.in.ExecutionReportUseCase.RecordVatExpenseCommand;
import com.finexec.domain.service.Amounts;
import io.vertx.core.Handler;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * HTTP handler for the net/VAT split of a VAT-applicable expense
 * Handles PUT /api/executions/reports/:reportId/activities/:code/vat
 */
@Slf4j
@RequiredArgsConstructor
public class RecordVatExpenseHandler implements Handler<RoutingContext> {

    private final ExecutionReportUseCase reportUseCase;

    @Override
    public void handle(RoutingContext context) {
        JsonObject requestBody = ApiResponses.requireBody(context);
        if (requestBody == null) {
            return;
        }

        RecordVatExpenseCommand command;
        try {
            EditRequests.VatExpenseRequest request = requestBody.mapTo(EditRequests.VatExpenseRequest.class);
            command = new RecordVatExpenseCommand(context.pathParam("reportId"), context.pathParam("code"),
                    Amounts.parse(request.netAmount()), Amounts.parse(request.vatAmount()));
        } catch (Exception e) {
            log.error("Error parsing request body", e);
            ApiResponses.sendError(context, 400, "Invalid request format: " + e.getMessage());
            return;
        }

        reportUseCase.recordVatExpense(command)
                .onSuccess(view -> ApiResponses.sendReport(context, 200, view))
                .onFailure(error -> ApiResponses.sendFailure(context, error));
    }
}
