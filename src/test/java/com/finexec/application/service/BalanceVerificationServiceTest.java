package com.finexec.application.service;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import static org.mockito.ArgumentMatchers.any;
import org.mockito.Mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import org.mockito.MockitoAnnotations;

import com.finexec.application.port.out.BalanceVerificationProvider;
import com.finexec.domain.model.BalanceVerification;
import com.finexec.domain.model.BalanceVerificationRequest;
import com.finexec.domain.model.Quarter;
import com.finexec.domain.model.ReportState;
import com.finexec.domain.model.VerificationSource;

import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;

/**
 * Unit test for BalanceVerificationService
 * Uses a real Vert.x instance for the debounce timers and a mocked provider
 */
class BalanceVerificationServiceTest {

    private static final long DEBOUNCE_MS = 100;

    @Mock
    private BalanceVerificationProvider provider;

    private Vertx vertx;
    private BalanceVerificationService service;
    private AutoCloseable mocks;

    @BeforeEach
    void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
        vertx = Vertx.vertx();
        service = new BalanceVerificationService(vertx, provider, DEBOUNCE_MS);
    }

    @AfterEach
    void tearDown() throws Exception {
        service.stop();
        if (vertx != null) {
            CountDownLatch latch = new CountDownLatch(1);
            vertx.close().onComplete(ar -> latch.countDown());
            latch.await(5, TimeUnit.SECONDS);
        }
        if (mocks != null) {
            mocks.close();
        }
    }

    private static BalanceVerificationRequest request(String reportId, Quarter quarter) {
        return new BalanceVerificationRequest(reportId, quarter, ReportState.empty(), null);
    }

    private static BalanceVerification remote(boolean balanced, String difference) {
        return new BalanceVerification(balanced, BigDecimal.ZERO, BigDecimal.ZERO, new BigDecimal(difference),
                VerificationSource.REMOTE);
    }

    private Optional<BalanceVerification> awaitLatest(String reportId) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (System.currentTimeMillis() < deadline) {
            Optional<BalanceVerification> latest = service.latest(reportId);
            if (latest.isPresent()) {
                return latest;
            }
            Thread.sleep(20);
        }
        return Optional.empty();
    }

    @Test
    void schedule_shouldCoalesceRapidEdits() throws InterruptedException {
        // Given
        when(provider.verify(any())).thenReturn(Future.succeededFuture(remote(true, "0")));

        // When
        service.schedule(request("R-1", Quarter.Q1));
        service.schedule(request("R-1", Quarter.Q2));
        service.schedule(request("R-1", Quarter.Q3));

        // Then - one call with the latest request
        ArgumentCaptor<BalanceVerificationRequest> captor = ArgumentCaptor.forClass(BalanceVerificationRequest.class);
        verify(provider, timeout(2000).times(1)).verify(captor.capture());
        Thread.sleep(DEBOUNCE_MS * 3);
        verify(provider, times(1)).verify(any());
        assertEquals(Quarter.Q3, captor.getValue().quarter());
        assertTrue(awaitLatest("R-1").isPresent());
    }

    @Test
    void schedule_shouldKeepReportsIndependent() throws InterruptedException {
        // Given
        when(provider.verify(any())).thenReturn(Future.succeededFuture(remote(true, "0")));

        // When
        service.schedule(request("R-1", Quarter.Q1));
        service.schedule(request("R-2", Quarter.Q1));

        // Then
        verify(provider, timeout(2000).times(2)).verify(any());
        assertTrue(awaitLatest("R-1").isPresent());
        assertTrue(awaitLatest("R-2").isPresent());
    }

    @Test
    void staleResult_shouldBeDiscarded() throws InterruptedException {
        // Given - the first call hangs until the second one has been applied
        Promise<BalanceVerification> slow = Promise.promise();
        when(provider.verify(any())).thenReturn(slow.future(), Future.succeededFuture(remote(true, "0")));

        // When
        service.schedule(request("R-1", Quarter.Q1));
        verify(provider, timeout(2000).times(1)).verify(any());
        service.schedule(request("R-1", Quarter.Q1));
        verify(provider, timeout(2000).times(2)).verify(any());
        Optional<BalanceVerification> applied = awaitLatest("R-1");
        slow.complete(remote(false, "250"));

        // Then
        assertTrue(applied.isPresent());
        assertTrue(service.latest("R-1").orElseThrow().balanced());
        assertEquals(0, BigDecimal.ZERO.compareTo(service.latest("R-1").orElseThrow().difference()));
    }

    @Test
    void failedCall_shouldFallBackToBalanced() throws InterruptedException {
        // Given
        when(provider.verify(any())).thenReturn(Future.failedFuture("Connection refused"));

        // When
        service.schedule(request("R-1", Quarter.Q1));

        // Then
        BalanceVerification result = awaitLatest("R-1").orElseThrow();
        assertTrue(result.balanced());
        assertEquals(VerificationSource.FALLBACK, result.source());
    }

    @Test
    void cancel_shouldDropPendingVerification() throws InterruptedException {
        // When
        service.schedule(request("R-1", Quarter.Q1));
        service.cancel("R-1");
        Thread.sleep(DEBOUNCE_MS * 3);

        // Then
        verify(provider, never()).verify(any());
        assertTrue(service.latest("R-1").isEmpty());
    }

    @Test
    void release_shouldForgetReportAndDiscardCallInFlight() throws InterruptedException {
        // Given
        Promise<BalanceVerification> inFlight = Promise.promise();
        when(provider.verify(any())).thenReturn(Future.succeededFuture(remote(true, "0")), inFlight.future());
        service.schedule(request("R-1", Quarter.Q1));
        assertTrue(awaitLatest("R-1").isPresent());
        service.schedule(request("R-1", Quarter.Q1));
        verify(provider, timeout(2000).times(2)).verify(any());

        // When
        service.release("R-1");
        inFlight.complete(remote(false, "75"));

        // Then
        assertTrue(service.latest("R-1").isEmpty());
    }
}
