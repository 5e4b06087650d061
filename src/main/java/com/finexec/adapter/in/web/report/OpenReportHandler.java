package com.finexec.adapter.in.web.report;

import com.finexec.adapter.in.web.ApiResponses;
import com.finexec.application.port.in.ExecutionReportUseCase;
import com.finexec.application.port.in.ExecutionReportUseCase.OpenReportCommand;
import com.finexec.domain.model.ActivityValue;
import com.finexec.domain.service.Amounts;
import io.vertx.core.Handler;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * HTTP handler for opening a report session
 * Handles POST /api/executions/reports
 */
@Slf4j
@RequiredArgsConstructor
public class OpenReportHandler implements Handler<RoutingContext> {

    private final ExecutionReportUseCase reportUseCase;

    @Override
    public void handle(RoutingContext context) {
        JsonObject requestBody = ApiResponses.requireBody(context);
        if (requestBody == null) {
            return;
        }

        OpenReportCommand command;
        try {
            OpenReportRequest request = requestBody.mapTo(OpenReportRequest.class);
            log.info("Received open report request: facility {} program {}", request.facilityId(), request.programType());
            command = toCommand(request);
        } catch (Exception e) {
            log.error("Error parsing request body", e);
            ApiResponses.sendError(context, 400, "Invalid request format: " + e.getMessage());
            return;
        }

        reportUseCase.openReport(command)
                .onSuccess(view -> ApiResponses.sendReport(context, 201, view))
                .onFailure(error -> ApiResponses.sendFailure(context, error));
    }

    private OpenReportCommand toCommand(OpenReportRequest request) {
        Map<String, ActivityValue> values = new LinkedHashMap<>();
        if (request.values() != null) {
            request.values().forEach((code, value) -> {
                if (value != null) {
                    values.put(code, value.toActivityValue());
                }
            });
        }
        return new OpenReportCommand(
                request.programType(),
                request.facilityType(),
                request.facilityId(),
                request.fiscalYear(),
                request.quarter() == null ? null : request.quarter().toUpperCase(),
                values,
                request.previousQuarterBalances() == null ? null : request.previousQuarterBalances().toPreviousQuarterBalances(),
                Amounts.parse(request.plannedBudget())
        );
    }
}
