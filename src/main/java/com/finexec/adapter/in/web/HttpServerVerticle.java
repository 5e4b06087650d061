package com.finexec.adapter.in.web;

import com.finexec.adapter.out.catalog.ClasspathActivityCatalogAdapter;
import com.finexec.adapter.out.http.BalanceVerificationHttpAdapter;
import com.finexec.adapter.out.http.LocalBalanceVerificationAdapter;
import com.finexec.adapter.out.persistence.ConfiguredPlannedBudgetAdapter;
import com.finexec.adapter.out.persistence.InMemoryClosingBalancesAdapter;
import com.finexec.adapter.out.persistence.InMemoryReportDraftAdapter;
import com.finexec.application.port.in.ExecutionReportUseCase;
import com.finexec.application.port.out.BalanceVerificationProvider;
import com.finexec.application.service.BalanceVerificationService;
import com.finexec.application.service.ExecutionReportService;
import com.finexec.application.service.ExecutionValidator;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.http.HttpServer;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.handler.BodyHandler;
import io.vertx.ext.web.handler.LoggerHandler;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Clock;

/**
 * HTTP Server Verticle - handles all HTTP requests
 * Infrastructure component that wires up the hexagonal architecture
 */
@Slf4j
public class HttpServerVerticle extends AbstractVerticle {

    private static final int DEFAULT_PORT = 8081;
    private static final long DEFAULT_DEBOUNCE_MS = 300;

    private final Clock clock;

    private ExecutionReportUseCase reportUseCase;
    private BalanceVerificationService verificationService;
    private HttpServer server;

    public HttpServerVerticle() {
        this(Clock.systemDefaultZone());
    }

    public HttpServerVerticle(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void start(Promise<Void> startPromise) {
        log.info("Starting HTTP Server Verticle...");

        initializeServices()
                .compose(v -> {
                    log.info("All services initialized successfully");
                    return startHttpServer();
                })
                .onSuccess(v -> {
                    log.info("HTTP Server Verticle started successfully on port {}", actualPort());
                    startPromise.complete();
                })
                .onFailure(error -> {
                    log.error("Failed to start HTTP Server Verticle", error);
                    startPromise.fail(error);
                });
    }

    @Override
    public void stop() {
        if (verificationService != null) {
            verificationService.stop();
        }
        log.info("HTTP Server Verticle stopped");
    }

    /**
     * Port the server is bound to; differs from the configured one when port 0 was requested
     */
    public int actualPort() {
        return server == null ? getPort() : server.actualPort();
    }

    private Future<Void> initializeServices() {
        try {
            JsonObject verificationConfig = config().getJsonObject("verification", new JsonObject());
            BigDecimal tolerance = new BigDecimal(config().getValue("validation.tolerance",
                    ExecutionValidator.DEFAULT_TOLERANCE).toString());

            // Output ports (adapters)
            ClasspathActivityCatalogAdapter catalogAdapter = new ClasspathActivityCatalogAdapter(vertx,
                    config().getString("catalog.directory", "catalog"));
            InMemoryClosingBalancesAdapter closingBalancesAdapter = new InMemoryClosingBalancesAdapter();
            ConfiguredPlannedBudgetAdapter budgetAdapter = new ConfiguredPlannedBudgetAdapter(
                    config().getJsonObject("budgets", new JsonObject()));
            InMemoryReportDraftAdapter draftAdapter = new InMemoryReportDraftAdapter();

            BalanceVerificationProvider verificationProvider;
            if (verificationConfig.getBoolean("enabled", false)) {
                log.info("Remote balance verification at {}:{}{}", verificationConfig.getString("host"),
                        verificationConfig.getInteger("port"), verificationConfig.getString("path"));
                verificationProvider = new BalanceVerificationHttpAdapter(vertx, verificationConfig);
            } else {
                log.info("Remote balance verification disabled, verifying locally");
                verificationProvider = new LocalBalanceVerificationAdapter(tolerance);
            }

            // Application services (use cases)
            verificationService = new BalanceVerificationService(vertx, verificationProvider,
                    verificationConfig.getLong("debounceMs", DEFAULT_DEBOUNCE_MS));
            reportUseCase = new ExecutionReportService(
                    catalogAdapter,
                    closingBalancesAdapter,
                    budgetAdapter,
                    draftAdapter,
                    closingBalancesAdapter,
                    verificationService,
                    new ExecutionValidator(tolerance),
                    clock
            );

            log.info("Services wired up (Hexagonal Architecture)");
            return Future.succeededFuture();
        } catch (Exception e) {
            log.error("Error initializing services", e);
            return Future.failedFuture(e);
        }
    }

    private Future<Void> startHttpServer() {
        Router router = Router.router(vertx);

        // Global handlers
        router.route().handler(LoggerHandler.create());
        router.route().handler(BodyHandler.create());

        // Setup routes
        WebRouter webRouter = new WebRouter(router, reportUseCase);
        webRouter.setupRoutes();

        // Default route - 404
        router.route().handler(ctx -> ApiResponses.sendError(ctx, 404, "Endpoint not found"));

        int port = getPort();

        return vertx.createHttpServer()
                .requestHandler(router)
                .listen(port)
                .onSuccess(listening -> {
                    server = listening;
                    log.info("HTTP server listening on port {}", listening.actualPort());
                })
                .mapEmpty();
    }

    private int getPort() {
        return config().getInteger("http.port", DEFAULT_PORT);
    }
}
