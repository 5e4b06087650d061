package com.finexec.adapter.in.web;

import com.finexec.adapter.in.web.clearance.ClearanceHandler;
import com.finexec.adapter.in.web.clearance.MiscellaneousAdjustmentCheckHandler;
import com.finexec.adapter.in.web.clearance.PriorYearAdjustmentHandler;
import com.finexec.adapter.in.web.edit.RecordPaymentHandler;
import com.finexec.adapter.in.web.edit.RecordVatExpenseHandler;
import com.finexec.adapter.in.web.edit.UpdateAmountHandler;
import com.finexec.adapter.in.web.edit.UpdateCommentHandler;
import com.finexec.adapter.in.web.report.GetReportHandler;
import com.finexec.adapter.in.web.report.OpenReportHandler;
import com.finexec.adapter.in.web.report.PublishClosingBalancesHandler;
import com.finexec.application.port.in.ExecutionReportUseCase;
import io.vertx.ext.web.Router;

/**
 * Router configuration for execution report endpoints
 */
public class WebRouter {

    static final String REPORTS = "/api/executions/reports";
    static final String REPORT = REPORTS + "/:reportId";
    static final String ACTIVITY = REPORT + "/activities/:code";

    private final Router router;
    private final ExecutionReportUseCase reportUseCase;

    public WebRouter(Router router, ExecutionReportUseCase reportUseCase) {
        this.router = router;
        this.reportUseCase = reportUseCase;
    }

    public void setupRoutes() {
        // CORS headers
        router.route().handler(ctx -> {
            ctx.response()
                    .putHeader("Access-Control-Allow-Origin", "*")
                    .putHeader("Access-Control-Allow-Methods", "GET, POST, PUT, OPTIONS")
                    .putHeader("Access-Control-Allow-Headers", "Content-Type, Authorization, X-Requested-With")
                    .putHeader("Access-Control-Allow-Credentials", "true");
            ctx.next();
        });

        // Handle OPTIONS preflight requests
        router.options("/api/executions/*").handler(ctx -> ctx.response().setStatusCode(204).end());

        router.post(REPORTS).handler(new OpenReportHandler(reportUseCase));
        router.get(REPORT).handler(new GetReportHandler(reportUseCase));

        router.put(ACTIVITY + "/amount").handler(new UpdateAmountHandler(reportUseCase));
        router.put(ACTIVITY + "/comment").handler(new UpdateCommentHandler(reportUseCase));
        router.put(ACTIVITY + "/payment").handler(new RecordPaymentHandler(reportUseCase));
        router.put(ACTIVITY + "/vat").handler(new RecordVatExpenseHandler(reportUseCase));

        router.post(REPORT + "/clearances").handler(new ClearanceHandler(reportUseCase));
        router.post(REPORT + "/prior-year-adjustments").handler(new PriorYearAdjustmentHandler(reportUseCase));
        router.post(REPORT + "/miscellaneous-adjustments/check")
                .handler(new MiscellaneousAdjustmentCheckHandler(reportUseCase));
        router.post(REPORT + "/closing-balances").handler(new PublishClosingBalancesHandler(reportUseCase));

        // Health check endpoint
        router.get("/health")
                .handler(ctx -> {
                    ctx.response()
                            .putHeader("Content-Type", "application/json")
                            .end("{\"status\":\"UP\",\"service\":\"financial-execution-engine\"}");
                });

        // Root endpoint
        router.get("/")
                .handler(ctx -> {
                    ctx.response()
                            .putHeader("Content-Type", "application/json")
                            .end("{\"name\":\"Financial Execution Reporting Engine\",\"version\":\"1.0.0\"}");
                });
    }
}
