package com.finexec;

import com.finexec.adapter.in.web.HttpServerVerticle;
import io.vertx.core.DeploymentOptions;
import io.vertx.core.Vertx;
import io.vertx.core.VertxOptions;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileWriter;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Main application entry point
 */
public class Main {
    private static final String CONFIG_RESOURCE = "application.json";
    private static final String OVERRIDE_PREFIX = "finexec.";

    static {
        // Route Vert.x internal logging through SLF4J
        System.setProperty("vertx.logger-delegate-factory-class-name", "io.vertx.core.logging.SLF4JLogDelegateFactory");
    }

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        log.info("Starting Financial Execution Reporting Engine...");

        // Write PID to file for easy process management
        writePidToFile();

        VertxOptions options = new VertxOptions()
                .setWorkerPoolSize(10)
                .setEventLoopPoolSize(5);

        Vertx vertx = Vertx.vertx(options);

        JsonObject config = loadConfig();
        int port = config.getInteger("http.port");

        vertx.deployVerticle(new HttpServerVerticle(), new DeploymentOptions()
                .setConfig(config)
                .setInstances(1))
                .onSuccess(deploymentId -> {
                    log.info("HTTP Server Verticle deployed successfully: {}", deploymentId);

                    Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                        log.info("Shutting down Financial Execution Reporting Engine...");
                        vertx.close();
                    }));

                    log.info("Financial Execution Reporting Engine is ready!");
                    log.info("API Endpoint: http://localhost:{}/api/executions/reports", port);
                    log.info("Health Check: http://localhost:{}/health", port);
                })
                .onFailure(error -> {
                    log.error("Failed to deploy HTTP Server Verticle", error);
                    vertx.close();
                });
    }

    /**
     * Classpath application.json; any top-level key can be overridden with -Dfinexec.&lt;key&gt;
     */
    static JsonObject loadConfig() {
        JsonObject config;
        try (InputStream is = Main.class.getClassLoader().getResourceAsStream(CONFIG_RESOURCE)) {
            if (is == null) {
                throw new IllegalStateException(CONFIG_RESOURCE + " not found in classpath");
            }
            config = new JsonObject(new String(is.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            log.error("Failed to load {}: {}", CONFIG_RESOURCE, e.getMessage());
            throw new IllegalStateException("Configuration error: " + CONFIG_RESOURCE + " required", e);
        }
        applyOverrides(config);
        log.info("Loaded configuration from {}", CONFIG_RESOURCE);
        return config;
    }

    static void applyOverrides(JsonObject config) {
        for (String key : config.fieldNames().toArray(new String[0])) {
            String override = System.getProperty(OVERRIDE_PREFIX + key);
            if (override == null) {
                continue;
            }
            Object current = config.getValue(key);
            if (current instanceof Integer) {
                config.put(key, Integer.parseInt(override));
            } else if (current instanceof Number) {
                config.put(key, Double.parseDouble(override));
            } else if (current instanceof Boolean) {
                config.put(key, Boolean.parseBoolean(override));
            } else if (current instanceof JsonObject) {
                config.put(key, new JsonObject(override));
            } else {
                config.put(key, override);
            }
            log.info("Configuration {} overridden from system property", key);
        }
    }

    /**
     * Write the current process PID to a file for easy management
     */
    private static void writePidToFile() {
        try {
            String pid = String.valueOf(ProcessHandle.current().pid());
            try (FileWriter writer = new FileWriter("app.pid")) {
                writer.write(pid);
            }
            log.info("PID written to app.pid: {}", pid);
        } catch (IOException e) {
            log.warn("Failed to write PID to file: {}", e.getMessage());
        }
    }
}
