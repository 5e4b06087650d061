package com.finexec.adapter.in.web.report;

import com.finexec.adapter.in.web.ApiResponses;
import com.finexec.application.port.in.ExecutionReportUseCase;
import io.vertx.core.Handler;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Handles POST /api/executions/reports/:reportId/closing-balances
 */
@Slf4j
@RequiredArgsConstructor
public class PublishClosingBalancesHandler implements Handler<RoutingContext> {

    private final ExecutionReportUseCase reportUseCase;

    @Override
    public void handle(RoutingContext context) {
        String reportId = context.pathParam("reportId");
        log.info("Publishing closing balances of report {}", reportId);
        reportUseCase.publishClosingBalances(reportId)
                .onSuccess(balances -> ApiResponses.sendJson(context, 201,
                        ClosingBalancesResponse.from(reportId, balances)))
                .onFailure(error -> ApiResponses.sendFailure(context, error));
    }
}
