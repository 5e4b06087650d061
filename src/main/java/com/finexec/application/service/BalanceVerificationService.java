package com.finexec.application.service;

import com.finexec.application.port.out.BalanceVerificationProvider;
import com.finexec.domain.model.BalanceVerification;
import com.finexec.domain.model.BalanceVerificationRequest;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Debounced accounting-equation verification.
 * Rapid edits of a report coalesce into one call after the debounce window; a result is applied
 * only if no newer call was issued for the same report in the meantime. A failed call degrades
 * to "balanced" so local validation alone decides.
 */
@Slf4j
public class BalanceVerificationService {

    private final Vertx vertx;
    private final BalanceVerificationProvider provider;
    private final long debounceMs;

    private final Map<String, Long> pendingTimers = new ConcurrentHashMap<>();
    private final Map<String, Long> issuedGenerations = new ConcurrentHashMap<>();
    private final Map<String, BalanceVerification> latestResults = new ConcurrentHashMap<>();

    public BalanceVerificationService(Vertx vertx, BalanceVerificationProvider provider, long debounceMs) {
        this.vertx = vertx;
        this.provider = provider;
        this.debounceMs = debounceMs;
    }

    /**
     * (Re)start the debounce window for the report; the latest request wins
     */
    public void schedule(BalanceVerificationRequest request) {
        String reportId = request.reportId();
        long timerId = vertx.setTimer(debounceMs, id -> {
            if (pendingTimers.remove(reportId, id)) {
                verifyNow(request);
            }
        });
        Long previous = pendingTimers.put(reportId, timerId);
        if (previous != null) {
            vertx.cancelTimer(previous);
            log.debug("Verification of report {} rescheduled", reportId);
        }
    }

    public Optional<BalanceVerification> latest(String reportId) {
        return Optional.ofNullable(latestResults.get(reportId));
    }

    public void cancel(String reportId) {
        Long timerId = pendingTimers.remove(reportId);
        if (timerId != null) {
            vertx.cancelTimer(timerId);
        }
    }

    /**
     * Forget the report: pending call, generation counter and last result. A call still in flight is discarded.
     */
    public void release(String reportId) {
        cancel(reportId);
        issuedGenerations.remove(reportId);
        latestResults.remove(reportId);
        log.debug("Verification state of report {} released", reportId);
    }

    public void stop() {
        pendingTimers.values().forEach(vertx::cancelTimer);
        pendingTimers.clear();
        log.info("Balance verification service stopped");
    }

    private void verifyNow(BalanceVerificationRequest request) {
        String reportId = request.reportId();
        long generation = issuedGenerations.merge(reportId, 1L, Long::sum);
        log.debug("Verifying report {} (generation {})", reportId, generation);

        provider.verify(request)
                .recover(error -> {
                    log.warn("Balance verification for report {} failed, assuming balanced: {}",
                            reportId, error.getMessage());
                    return Future.succeededFuture(BalanceVerification.fallback());
                })
                .onSuccess(result -> apply(reportId, generation, result));
    }

    private void apply(String reportId, long generation, BalanceVerification result) {
        Long newest = issuedGenerations.get(reportId);
        if (newest == null || newest != generation) {
            log.debug("Discarding stale verification of report {} (generation {}, newest {})",
                    reportId, generation, newest);
            return;
        }
        latestResults.put(reportId, result);
        log.info("Verification of report {} applied: balanced={}, difference={}, source={}",
                reportId, result.balanced(), result.difference(), result.source());
    }
}
