package com.finexec.adapter.out.http;

import com.finexec.application.port.out.BalanceVerificationProvider;
import com.finexec.domain.model.ActivityValue;
import com.finexec.domain.model.BalanceVerification;
import com.finexec.domain.model.BalanceVerificationRequest;
import com.finexec.domain.model.Quarter;
import com.finexec.domain.model.VerificationSource;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpClient;
import io.vertx.core.http.HttpClientOptions;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.http.RequestOptions;
import io.vertx.core.json.JsonObject;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.Map;

/**
 * HTTP adapter calling the external accounting-equation verification endpoint.
 * Implements BalanceVerificationProvider output port.
 *
 * Request:  {@code {reportId, quarter, activities: {code: {q1..q4}}, netFinancialAssets, closingBalance}}
 * Response: {@code {isBalanced, difference, netFinancialAssets, closingBalance}}
 */
@Slf4j
public class BalanceVerificationHttpAdapter implements BalanceVerificationProvider {

    private final HttpClient client;
    private final String host;
    private final int port;
    private final String path;
    private final long timeoutMs;

    public BalanceVerificationHttpAdapter(Vertx vertx, JsonObject config) {
        this.host = config.getString("host", "localhost");
        this.port = config.getInteger("port", 8090);
        this.path = config.getString("path", "/api/verify-balance");
        this.timeoutMs = config.getLong("timeoutMs", 5000L);
        this.client = vertx.createHttpClient(new HttpClientOptions()
                .setConnectTimeout((int) timeoutMs));
    }

    @Override
    public Future<BalanceVerification> verify(BalanceVerificationRequest request) {
        JsonObject body = toRequestBody(request);
        log.debug("Posting verification of report {} to {}:{}{}", request.reportId(), host, port, path);

        RequestOptions options = new RequestOptions()
                .setMethod(HttpMethod.POST)
                .setHost(host)
                .setPort(port)
                .setURI(path)
                .setIdleTimeout(timeoutMs)
                .putHeader("Content-Type", "application/json");

        return client.request(options)
                .compose(req -> req.send(body.toBuffer()))
                .compose(response -> {
                    if (response.statusCode() != 200) {
                        return Future.failedFuture(new IllegalStateException(
                                "Verification endpoint returned HTTP " + response.statusCode()));
                    }
                    return response.body();
                })
                .map(buffer -> toVerification(buffer.toJsonObject()));
    }

    public Future<Void> close() {
        return client.close();
    }

    static JsonObject toRequestBody(BalanceVerificationRequest request) {
        JsonObject activities = new JsonObject();
        for (Map.Entry<String, ActivityValue> entry : request.state().asMap().entrySet()) {
            JsonObject quarters = new JsonObject();
            for (Quarter quarter : Quarter.values()) {
                quarters.put(quarter.key(), entry.getValue().getAmounts().get(quarter));
            }
            activities.put(entry.getKey(), quarters);
        }
        return new JsonObject()
                .put("reportId", request.reportId())
                .put("quarter", request.quarter().getValue())
                .put("activities", activities)
                .put("netFinancialAssets", request.computedValues().getNetFinancialAssets().getCumulativeBalance())
                .put("closingBalance", request.computedValues().getClosingBalance().getCumulativeBalance());
    }

    static BalanceVerification toVerification(JsonObject json) {
        if (json == null || !json.containsKey("isBalanced")) {
            throw new IllegalStateException("Verification response is missing isBalanced");
        }
        return new BalanceVerification(
                json.getBoolean("isBalanced"),
                decimal(json, "netFinancialAssets"),
                decimal(json, "closingBalance"),
                json.containsKey("difference") ? decimal(json, "difference") : BigDecimal.ZERO,
                VerificationSource.REMOTE
        );
    }

    private static BigDecimal decimal(JsonObject json, String key) {
        Object raw = json.getValue(key);
        return raw == null ? null : new BigDecimal(raw.toString());
    }
}
