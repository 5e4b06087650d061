package com.finexec.adapter.in.web;

import io.vertx.core.DeploymentOptions;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.HttpClient;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end test: deploys the verticle on a free port and drives the report API over HTTP
 */
class HttpServerVerticleTest {

    private static final String EXPENSE_CODE = "HIV_EXEC_HOSPITAL_B_B-01_1";

    private Vertx vertx;
    private HttpClient client;
    private int port;

    @BeforeEach
    void setUp() throws Exception {
        vertx = Vertx.vertx();
        HttpServerVerticle verticle = new HttpServerVerticle(
                Clock.fixed(Instant.parse("2025-08-10T10:00:00Z"), ZoneOffset.UTC));
        JsonObject config = new JsonObject()
                .put("http.port", 0)
                .put("catalog.directory", "catalog")
                .put("verification", new JsonObject().put("enabled", false).put("debounceMs", 10));
        vertx.deployVerticle(verticle, new DeploymentOptions().setConfig(config))
                .toCompletionStage().toCompletableFuture().get(10, TimeUnit.SECONDS);
        port = verticle.actualPort();
        client = vertx.createHttpClient();
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);
        vertx.close().onComplete(ar -> latch.countDown());
        latch.await(5, TimeUnit.SECONDS);
    }

    @Test
    void testHealthEndpoint() throws Exception {
        Reply reply = call(HttpMethod.GET, "/health", null);

        assertEquals(200, reply.status);
        assertEquals("UP", reply.json().getString("status"));
    }

    @Test
    void testOpenReportAndEditAmount() throws Exception {
        // Given
        Reply opened = call(HttpMethod.POST, WebRouter.REPORTS, openRequest());
        assertEquals(201, opened.status);
        String reportId = opened.json().getString("reportId");
        assertNotNull(reportId);
        assertEquals("Q1", opened.json().getString("quarter"));

        // When
        Reply updated = call(HttpMethod.PUT,
                WebRouter.REPORTS + "/" + reportId + "/activities/" + EXPENSE_CODE + "/amount",
                new JsonObject().put("amount", 1200));

        // Then
        assertEquals(200, updated.status);
        JsonObject amounts = updated.json().getJsonObject("activities").getJsonObject(EXPENSE_CODE)
                .getJsonObject("amounts");
        assertEquals(0, new BigDecimal("1200").compareTo(new BigDecimal(amounts.getValue("q1").toString())));

        Reply fetched = call(HttpMethod.GET, WebRouter.REPORTS + "/" + reportId, null);
        assertEquals(200, fetched.status);
        assertEquals(reportId, fetched.json().getString("reportId"));
    }

    @Test
    void testOpenReport_withInvalidQuarter_shouldReturn400() throws Exception {
        Reply reply = call(HttpMethod.POST, WebRouter.REPORTS, openRequest().put("quarter", "Q5"));

        assertEquals(400, reply.status);
        assertEquals("error", reply.json().getString("status"));
    }

    @Test
    void testOpenReport_withoutBody_shouldReturn400() throws Exception {
        Reply reply = call(HttpMethod.POST, WebRouter.REPORTS, null);

        assertEquals(400, reply.status);
    }

    @Test
    void testUnknownReport_shouldReturn404() throws Exception {
        Reply reply = call(HttpMethod.GET, WebRouter.REPORTS + "/missing", null);

        assertEquals(404, reply.status);
        assertEquals("Report not found: missing", reply.json().getString("message"));
    }

    @Test
    void testUnknownEndpoint_shouldReturn404() throws Exception {
        Reply reply = call(HttpMethod.GET, "/api/unknown", null);

        assertEquals(404, reply.status);
        assertEquals("Endpoint not found", reply.json().getString("message"));
    }

    private JsonObject openRequest() {
        return new JsonObject()
                .put("programType", "HIV")
                .put("facilityType", "hospital")
                .put("facilityId", "FAC-001")
                .put("fiscalYear", 2025)
                .put("quarter", "Q1");
    }

    private Reply call(HttpMethod method, String uri, JsonObject body) throws Exception {
        Future<Reply> reply = client.request(method, port, "localhost", uri)
                .compose(request -> {
                    request.putHeader("Content-Type", "application/json");
                    return body == null ? request.send() : request.send(Buffer.buffer(body.encode()));
                })
                .compose(response -> response.body().map(buffer -> new Reply(response.statusCode(), buffer)));
        return reply.toCompletionStage().toCompletableFuture().get(10, TimeUnit.SECONDS);
    }

    private static final class Reply {
        private final int status;
        private final Buffer body;

        private Reply(int status, Buffer body) {
            this.status = status;
            this.body = body;
        }

        private JsonObject json() {
            return body.toJsonObject();
        }
    }
}
