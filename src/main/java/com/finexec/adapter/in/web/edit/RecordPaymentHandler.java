package com.finexec.adapter.in.web.edit;

import com.finexec.adapter.in.web.ApiResponses;
import com.finexec.application.port.in.ExecutionReportUseCase;
import com.finexec.application.port.in.ExecutionReportUseCase.RecordPaymentCommand;
import com.finexec.domain.service.Amounts;
import io.vertx.core.Handler;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * HTTP handler for the payment status of an expense
 * Handles PUT /api/executions/reports/:reportId/activities/:code/payment
 */
@Slf4j
@RequiredArgsConstructor
public class RecordPaymentHandler implements Handler<RoutingContext> {

    private final ExecutionReportUseCase reportUseCase;

    @Override
    public void handle(RoutingContext context) {
        JsonObject requestBody = ApiResponses.requireBody(context);
        if (requestBody == null) {
            return;
        }

        RecordPaymentCommand command;
        try {
            EditRequests.PaymentRequest request = requestBody.mapTo(EditRequests.PaymentRequest.class);
            command = new RecordPaymentCommand(context.pathParam("reportId"), context.pathParam("code"),
                    request.paymentStatus(), Amounts.parse(request.amountPaid()));
        } catch (Exception e) {
            log.error("Error parsing request body", e);
            ApiResponses.sendError(context, 400, "Invalid request format: " + e.getMessage());
            return;
        }

        log.debug("Recording payment {} for {} in report {}", command.paymentStatus(), command.activityCode(),
                command.reportId());
        reportUseCase.recordPayment(command)
                .onSuccess(view -> ApiResponses.sendReport(context, 200, view))
                .onFailure(error -> ApiResponses.sendFailure(context, error));
    }
}
