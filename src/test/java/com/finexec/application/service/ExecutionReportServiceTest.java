package com.finexec.application.service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import org.mockito.Mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import org.mockito.MockitoAnnotations;

import com.finexec.adapter.out.persistence.InMemoryReportDraftAdapter;
import com.finexec.application.port.in.ExecutionReportUseCase.ClearanceCommand;
import com.finexec.application.port.in.ExecutionReportUseCase.OpenReportCommand;
import com.finexec.application.port.in.ExecutionReportUseCase.PriorYearAdjustmentCommand;
import com.finexec.application.port.in.ExecutionReportUseCase.RecordPaymentCommand;
import com.finexec.application.port.in.ExecutionReportUseCase.UpdateAmountCommand;
import com.finexec.application.port.in.ExecutionReportUseCase.UpdateCommentCommand;
import com.finexec.application.port.in.ReportView;
import com.finexec.application.port.out.ActivityCatalogProvider;
import com.finexec.application.port.out.ClosingBalancesRepository;
import com.finexec.application.port.out.PlannedBudgetProvider;
import com.finexec.application.port.out.PreviousQuarterBalancesProvider;
import com.finexec.domain.ReportFixtures;
import com.finexec.domain.model.ActivityValue;
import com.finexec.domain.model.ClosingBalances;
import com.finexec.domain.model.MiscellaneousAdjustmentCheck;
import com.finexec.domain.model.PreviousQuarterBalances;
import com.finexec.domain.model.Quarter;
import com.finexec.domain.service.InvalidReportActionException;

import static com.finexec.domain.ReportFixtures.*;

import io.vertx.core.Future;

/**
 * Unit test for ExecutionReportService
 * Catalog, rollover, budget and verification collaborators are mocked; drafts live in memory
 */
class ExecutionReportServiceTest {

    @Mock
    private ActivityCatalogProvider catalogProvider;

    @Mock
    private PreviousQuarterBalancesProvider previousProvider;

    @Mock
    private PlannedBudgetProvider budgetProvider;

    @Mock
    private ClosingBalancesRepository closingRepository;

    @Mock
    private BalanceVerificationService verificationService;

    private ExecutionReportService service;
    private AutoCloseable mocks;

    @BeforeEach
    void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
        // 10 Aug 2025 is Q1 of FY2025
        Clock clock = Clock.fixed(Instant.parse("2025-08-10T08:00:00Z"), ZoneOffset.UTC);
        service = new ExecutionReportService(catalogProvider, previousProvider, budgetProvider,
                new InMemoryReportDraftAdapter(), closingRepository, verificationService, new ExecutionValidator(),
                clock);

        when(catalogProvider.fetchActivityTree("HIV", "hospital"))
                .thenReturn(Future.succeededFuture(ReportFixtures.tree()));
        when(previousProvider.fetchPreviousQuarterBalances(anyString(), anyString(), anyInt(), any()))
                .thenReturn(Future.succeededFuture(PreviousQuarterBalances.none()));
        when(budgetProvider.fetchPlannedBudget(anyString(), anyString(), any()))
                .thenReturn(Future.succeededFuture(Optional.empty()));
        when(verificationService.latest(anyString())).thenReturn(Optional.empty());
    }

    @AfterEach
    void tearDown() throws Exception {
        if (mocks != null) {
            mocks.close();
        }
    }

    private static <T> T await(Future<T> future) throws Exception {
        return future.toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
    }

    private static Throwable awaitFailure(Future<?> future) throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);
        Throwable[] cause = new Throwable[1];
        future.onComplete(ar -> {
            assertTrue(ar.failed(), "Expected a failure");
            cause[0] = ar.cause();
            latch.countDown();
        });
        assertTrue(latch.await(5, TimeUnit.SECONDS));
        return cause[0];
    }

    private static OpenReportCommand open(Map<String, ActivityValue> values, PreviousQuarterBalances previous) {
        return new OpenReportCommand("HIV", "hospital", "FAC-001", null, null, values, previous, null);
    }

    private String openEmpty() throws Exception {
        return await(service.openReport(open(null, null))).draft().getReportId();
    }

    @Test
    void openReport_shouldDefaultToCurrentFiscalQuarter() throws Exception {
        // When
        ReportView view = await(service.openReport(open(null, null)));

        // Then
        assertNotNull(view.draft().getReportId());
        assertEquals(Quarter.Q1, view.draft().getQuarter());
        assertEquals(2025, view.draft().getFiscalYear());
        assertTrue(view.canSubmit());
        assertNull(view.verification());
        verify(previousProvider, times(1)).fetchPreviousQuarterBalances("FAC-001", "HIV", 2025, Quarter.Q1);
        verify(verificationService, times(1)).schedule(any());
    }

    @Test
    void openReport_shouldRollForwardProvidedSnapshot() throws Exception {
        // Given
        when(previousProvider.fetchPreviousQuarterBalances(anyString(), anyString(), anyInt(), any()))
                .thenReturn(Future.succeededFuture(PreviousQuarterBalances.of(Quarter.Q4, ClosingBalances.builder()
                        .assets(Map.of(CASH, bd("750")))
                        .closingBalanceTotal(bd("750"))
                        .build())));

        // When
        ReportView view = await(service.openReport(open(null, null)));

        // Then
        assertEquals(0, bd("750").compareTo(view.recalculation().state().amount(CASH, Quarter.Q1)));
        assertTrue(view.validation().warnings().isEmpty());
    }

    @Test
    void openReport_shouldStartFromZeroWhenRolloverFails() throws Exception {
        // Given
        when(previousProvider.fetchPreviousQuarterBalances(anyString(), anyString(), anyInt(), any()))
                .thenReturn(Future.failedFuture("Store unavailable"));

        // When
        ReportView view = await(service.openReport(open(null, null)));

        // Then
        assertEquals(0, BigDecimal.ZERO.compareTo(view.recalculation().balances().getOpeningCash()));
    }

    @Test
    void openReport_shouldUseSuppliedSnapshotWithoutAskingProvider() throws Exception {
        // When
        await(service.openReport(open(null, PreviousQuarterBalances.none())));

        // Then
        verify(previousProvider, never()).fetchPreviousQuarterBalances(anyString(), anyString(), anyInt(), any());
    }

    @Test
    void openReport_shouldResolveLegacyCodesAndDropUnknownOnes() throws Exception {
        // Given
        Map<String, ActivityValue> values = Map.of(
                PREFIX + "_D_D-01_1", ActivityValue.builder().comment("legacy").build(),
                "SOMETHING_ELSE_1", ActivityValue.builder().comment("dropped").build());

        // When
        ReportView view = await(service.openReport(open(values, null)));

        // Then
        assertEquals("legacy", view.draft().getState().value(VAT_COMMUNICATION).getComment());
        assertFalse(view.draft().getState().contains("SOMETHING_ELSE_1"));
    }

    @Test
    void openReport_shouldRejectInvalidCommand() throws Exception {
        // When
        Throwable missing = awaitFailure(service.openReport(
                new OpenReportCommand("HIV", "hospital", " ", null, null, null, null, null)));
        Throwable badQuarter = awaitFailure(service.openReport(
                new OpenReportCommand("HIV", "hospital", "FAC-001", null, "Q5", null, null, null)));

        // Then
        assertInstanceOf(IllegalArgumentException.class, missing);
        assertTrue(missing.getMessage().contains("facilityId is required"));
        assertTrue(badQuarter.getMessage().contains("quarter must be one of"));
        verify(catalogProvider, never()).fetchActivityTree(anyString(), anyString());
    }

    @Test
    void openReport_shouldFailForUnknownCatalog() throws Exception {
        // Given
        when(catalogProvider.fetchActivityTree("TB", "hospital"))
                .thenReturn(Future.failedFuture(new IllegalArgumentException("No activity catalog found")));

        // When
        Throwable error = awaitFailure(service.openReport(
                new OpenReportCommand("TB", "hospital", "FAC-001", null, null, null, null, null)));

        // Then
        assertEquals("No activity catalog found", error.getMessage());
    }

    @Test
    void updateAmount_shouldRecomputeAndReschedule() throws Exception {
        // Given
        String reportId = openEmpty();

        // When
        ReportView view = await(service.updateAmount(new UpdateAmountCommand(reportId, RECEIPTS, bd("500"))));

        // Then
        assertEquals(0, bd("500").compareTo(view.recalculation().state().amount(CASH, Quarter.Q1)));
        assertEquals(0, bd("500").compareTo(view.recalculation().computedValues().getSurplus().getCumulativeBalance()));
        verify(verificationService, times(2)).schedule(any());
        assertEquals(0, bd("500").compareTo(await(service.getReport(reportId)).draft().getState()
                .amount(RECEIPTS, Quarter.Q1)));
    }

    @Test
    void updateAmount_shouldRejectComputedLineAndKeepDraft() throws Exception {
        // Given
        String reportId = openEmpty();

        // When
        Throwable error = awaitFailure(service.updateAmount(new UpdateAmountCommand(reportId, CASH, bd("5"))));

        // Then
        assertInstanceOf(InvalidReportActionException.class, error);
        verify(verificationService, times(1)).schedule(any());
    }

    @Test
    void mutation_shouldFailForUnknownReport() throws Exception {
        Throwable error = awaitFailure(service.updateComment(new UpdateCommentCommand("missing", NURSE, "x")));

        assertInstanceOf(ReportNotFoundException.class, error);
    }

    @Test
    void recordPayment_shouldRejectUnknownStatus() throws Exception {
        String reportId = openEmpty();

        Throwable error = awaitFailure(service.recordPayment(
                new RecordPaymentCommand(reportId, NURSE, "maybe", null)));

        assertTrue(error.getMessage().contains("Unknown payment status"));
    }

    @Test
    void clear_shouldPostPayableClearanceAgainstCash() throws Exception {
        // Given
        String reportId = openEmpty();
        await(service.updateAmount(new UpdateAmountCommand(reportId, RECEIPTS, bd("500"))));
        await(service.updateAmount(new UpdateAmountCommand(reportId, NURSE, bd("200"))));

        // When
        ReportView view = await(service.clear(new ClearanceCommand(reportId, "payable", SALARIES_PAYABLE, bd("80"))));

        // Then - 500 - 80; the remaining 120 stays payable
        assertEquals(0, bd("420").compareTo(view.recalculation().state().amount(CASH, Quarter.Q1)));
        assertEquals(0, bd("120").compareTo(view.recalculation().state().amount(SALARIES_PAYABLE, Quarter.Q1)));
        assertTrue(view.canSubmit());
    }

    @Test
    void priorYearAdjustment_withoutTarget_shouldAdjustCash() throws Exception {
        // Given
        String reportId = openEmpty();

        // When
        ReportView view = await(service.applyPriorYearAdjustment(
                new PriorYearAdjustmentCommand(reportId, PRIOR_YEAR_CASH, null, "increase", bd("40"))));

        // Then
        assertEquals(0, bd("40").compareTo(view.recalculation().state().amount(CASH, Quarter.Q1)));
        assertEquals(0, bd("40").compareTo(
                view.recalculation().computedValues().getClosingBalance().getCumulativeBalance()));
    }

    @Test
    void checkMiscellaneousAdjustment_shouldUseCurrentCash() throws Exception {
        // Given
        String reportId = openEmpty();
        await(service.updateAmount(new UpdateAmountCommand(reportId, RECEIPTS, bd("300"))));

        // When
        MiscellaneousAdjustmentCheck check = await(service.checkMiscellaneousAdjustment(reportId, bd("301")));

        // Then
        assertFalse(check.isValid());
        assertEquals(0, bd("300").compareTo(check.maxAllowableAmount()));
    }

    @Test
    void plannedBudget_shouldBlockOverspending() throws Exception {
        // Given
        when(budgetProvider.fetchPlannedBudget(anyString(), anyString(), any()))
                .thenReturn(Future.succeededFuture(Optional.of(bd("100"))));
        String reportId = openEmpty();

        // When
        ReportView view = await(service.updateAmount(new UpdateAmountCommand(reportId, NURSE, bd("150"))));

        // Then
        assertFalse(view.canSubmit());
    }

    @Test
    void publishClosingBalances_shouldStoreSnapshot() throws Exception {
        // Given
        when(closingRepository.saveClosingBalances(anyString(), anyString(), anyInt(), any(), any()))
                .thenReturn(Future.succeededFuture());
        String reportId = openEmpty();
        await(service.updateAmount(new UpdateAmountCommand(reportId, RECEIPTS, bd("500"))));

        // When
        ClosingBalances closing = await(service.publishClosingBalances(reportId));

        // Then
        assertEquals(0, bd("500").compareTo(closing.getAssets().get(CASH)));
        verify(closingRepository, times(1)).saveClosingBalances(eq("FAC-001"), eq("HIV"), eq(2025), eq(Quarter.Q1),
                eq(closing));
    }

    @Test
    void publishClosingBalances_shouldCloseTheSession() throws Exception {
        // Given
        when(closingRepository.saveClosingBalances(anyString(), anyString(), anyInt(), any(), any()))
                .thenReturn(Future.succeededFuture());
        String reportId = openEmpty();

        // When
        await(service.publishClosingBalances(reportId));

        // Then
        verify(verificationService).release(reportId);
        assertInstanceOf(ReportNotFoundException.class, awaitFailure(service.getReport(reportId)));
    }
}
