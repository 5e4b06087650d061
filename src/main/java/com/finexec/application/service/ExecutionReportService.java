package com.finexec.application.service;

import com.finexec.application.port.in.ExecutionReportUseCase;
import com.finexec.application.port.in.ReportView;
import com.finexec.application.port.out.ActivityCatalogProvider;
import com.finexec.application.port.out.ClosingBalancesRepository;
import com.finexec.application.port.out.PlannedBudgetProvider;
import com.finexec.application.port.out.PreviousQuarterBalancesProvider;
import com.finexec.application.port.out.ReportDraftRepository;
import com.finexec.domain.model.ActivityTree;
import com.finexec.domain.model.ActivityValue;
import com.finexec.domain.model.AdjustmentDirection;
import com.finexec.domain.model.BalanceVerificationRequest;
import com.finexec.domain.model.ClearanceType;
import com.finexec.domain.model.ClosingBalances;
import com.finexec.domain.model.MiscellaneousAdjustmentCheck;
import com.finexec.domain.model.PaymentStatus;
import com.finexec.domain.model.PreviousQuarterBalances;
import com.finexec.domain.model.Quarter;
import com.finexec.domain.model.Recalculation;
import com.finexec.domain.model.ReportDraft;
import com.finexec.domain.model.ReportState;
import com.finexec.domain.service.ClosingBalancesExtractor;
import com.finexec.domain.service.CodeMappingTable;
import com.finexec.domain.service.FiscalCalendar;
import com.finexec.domain.service.QuarterContext;
import com.finexec.domain.service.ReportActions;
import com.finexec.domain.service.ReportContext;
import com.finexec.domain.service.ReportRecalculationEngine;
import io.vertx.core.Future;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.BiFunction;

/**
 * Use case implementation for execution report sessions.
 * Each mutation applies the action, recomputes the whole report synchronously, stores the draft
 * and schedules the debounced external verification.
 */
@Slf4j
public class ExecutionReportService implements ExecutionReportUseCase {

    private final ActivityCatalogProvider catalogProvider;
    private final PreviousQuarterBalancesProvider previousBalancesProvider;
    private final PlannedBudgetProvider budgetProvider;
    private final ReportDraftRepository draftRepository;
    private final ClosingBalancesRepository closingBalancesRepository;
    private final BalanceVerificationService verificationService;
    private final ExecutionValidator validator;
    private final Clock clock;

    private final CodeMappingTable codeMapping = CodeMappingTable.defaultTable();
    private final ReportRecalculationEngine engine = new ReportRecalculationEngine(codeMapping);
    private final ClosingBalancesExtractor closingBalancesExtractor = new ClosingBalancesExtractor();

    public ExecutionReportService(
            ActivityCatalogProvider catalogProvider,
            PreviousQuarterBalancesProvider previousBalancesProvider,
            PlannedBudgetProvider budgetProvider,
            ReportDraftRepository draftRepository,
            ClosingBalancesRepository closingBalancesRepository,
            BalanceVerificationService verificationService,
            ExecutionValidator validator,
            Clock clock
    ) {
        this.catalogProvider = catalogProvider;
        this.previousBalancesProvider = previousBalancesProvider;
        this.budgetProvider = budgetProvider;
        this.draftRepository = draftRepository;
        this.closingBalancesRepository = closingBalancesRepository;
        this.verificationService = verificationService;
        this.validator = validator;
        this.clock = clock;
    }

    @Override
    public Future<ReportView> openReport(OpenReportCommand command) {
        List<String> errors = validateOpenCommand(command);
        if (!errors.isEmpty()) {
            return Future.failedFuture(new IllegalArgumentException("Validation failed: " + errors));
        }

        LocalDate today = LocalDate.now(clock);
        Quarter quarter = command.quarter() == null ? FiscalCalendar.quarterOf(today) : Quarter.fromValue(command.quarter());
        int fiscalYear = command.fiscalYear() == null ? FiscalCalendar.fiscalYear(today) : command.fiscalYear();

        log.info("Opening {} report for facility {} ({}) FY{} {}", command.programType(), command.facilityId(),
                command.facilityType(), fiscalYear, quarter.getValue());

        return catalogProvider.fetchActivityTree(command.programType(), command.facilityType())
                .compose(tree -> previousBalances(command, fiscalYear, quarter)
                        .compose(previous -> plannedBudget(command, quarter)
                                .map(budget -> ReportDraft.builder()
                                        .reportId(UUID.randomUUID().toString())
                                        .programType(command.programType())
                                        .facilityType(command.facilityType())
                                        .facilityId(command.facilityId())
                                        .fiscalYear(fiscalYear)
                                        .quarter(quarter)
                                        .tree(tree)
                                        .previous(previous)
                                        .plannedBudget(budget.orElse(null))
                                        .state(initialState(tree, command.values()))
                                        .build())))
                .compose(draft -> recomputeAndStore(draft, draft.getState()))
                .onSuccess(view -> log.info("Report {} opened", view.draft().getReportId()));
    }

    @Override
    public Future<ReportView> getReport(String reportId) {
        return loadDraft(reportId).map(draft -> {
            ReportContext context = contextOf(draft);
            return toView(draft, context, engine.recompute(context, draft.getState()));
        });
    }

    @Override
    public Future<ReportView> updateAmount(UpdateAmountCommand command) {
        return mutate(command.reportId(), (actions, state) ->
                actions.setAmount(state, command.activityCode(), command.amount()));
    }

    @Override
    public Future<ReportView> updateComment(UpdateCommentCommand command) {
        return mutate(command.reportId(), (actions, state) ->
                actions.setComment(state, command.activityCode(), command.comment()));
    }

    @Override
    public Future<ReportView> recordPayment(RecordPaymentCommand command) {
        return mutate(command.reportId(), (actions, state) ->
                actions.recordPayment(state, command.activityCode(),
                        PaymentStatus.fromValue(command.paymentStatus()), command.amountPaid()));
    }

    @Override
    public Future<ReportView> recordVatExpense(RecordVatExpenseCommand command) {
        return mutate(command.reportId(), (actions, state) ->
                actions.recordVatExpense(state, command.activityCode(), command.netAmount(), command.vatAmount()));
    }

    @Override
    public Future<ReportView> clear(ClearanceCommand command) {
        return mutate(command.reportId(), (actions, state) -> {
            switch (ClearanceType.fromValue(command.clearanceType())) {
                case PAYABLE:
                    return actions.clearPayable(state, command.activityCode(), command.amount());
                case VAT:
                    return actions.clearVat(state, command.activityCode(), command.amount());
                default:
                    return actions.clearOtherReceivable(state, command.activityCode(), command.amount());
            }
        });
    }

    @Override
    public Future<ReportView> applyPriorYearAdjustment(PriorYearAdjustmentCommand command) {
        return mutate(command.reportId(), (actions, state) -> {
            AdjustmentDirection direction = AdjustmentDirection.fromValue(command.direction());
            if (command.targetCode() == null || command.targetCode().isBlank()) {
                return actions.applyPriorYearCashAdjustment(state, command.adjustmentCode(), direction,
                        command.amount());
            }
            return actions.applyPriorYearAdjustment(state, command.adjustmentCode(), command.targetCode(),
                    direction, command.amount());
        });
    }

    @Override
    public Future<MiscellaneousAdjustmentCheck> checkMiscellaneousAdjustment(String reportId, BigDecimal amount) {
        return loadDraft(reportId).map(draft -> {
            ReportContext context = contextOf(draft);
            Recalculation recalculation = engine.recompute(context, draft.getState());
            return validator.checkMiscellaneousAdjustment(amount, recalculation.balances());
        });
    }

    @Override
    public Future<ClosingBalances> publishClosingBalances(String reportId) {
        return loadDraft(reportId).compose(draft -> {
            ReportContext context = contextOf(draft);
            ClosingBalances closing = closingBalancesExtractor.extract(context, engine.recompute(context, draft.getState()));
            return closingBalancesRepository.saveClosingBalances(draft.getFacilityId(), draft.getProgramType(),
                            draft.getFiscalYear(), draft.getQuarter(), closing)
                    .compose(v -> draftRepository.delete(reportId))
                    .map(v -> {
                        verificationService.release(reportId);
                        return closing;
                    })
                    .onSuccess(v -> log.info("Closing balances of report {} published for FY{} {}, session closed",
                            reportId, draft.getFiscalYear(), draft.getQuarter().getValue()));
        });
    }

    private Future<ReportView> mutate(String reportId, BiFunction<ReportActions, ReportState, ReportState> action) {
        return loadDraft(reportId).compose(draft -> {
            ReportState changed;
            try {
                changed = action.apply(new ReportActions(contextOf(draft)), draft.getState());
            } catch (IllegalArgumentException e) {
                log.debug("Rejected action on report {}: {}", reportId, e.getMessage());
                return Future.failedFuture(e);
            }
            return recomputeAndStore(draft, changed);
        });
    }

    private Future<ReportView> recomputeAndStore(ReportDraft draft, ReportState state) {
        ReportContext context = contextOf(draft);
        Recalculation recalculation = engine.recompute(context, state);
        ReportDraft updated = draft.toBuilder().state(recalculation.state()).build();

        return draftRepository.save(updated).map(v -> {
            verificationService.schedule(new BalanceVerificationRequest(updated.getReportId(), updated.getQuarter(),
                    recalculation.state(), recalculation.computedValues()));
            return toView(updated, context, recalculation);
        });
    }

    private ReportView toView(ReportDraft draft, ReportContext context, Recalculation recalculation) {
        ValidationResult validation = validator.validate(context, recalculation, draft.getPlannedBudget());
        QuarterContext quarters = QuarterContext.of(draft.getQuarter());
        return new ReportView(
                draft,
                recalculation,
                validation,
                verificationService.latest(draft.getReportId()).orElse(null),
                quarters.visibleQuarters(recalculation.state()),
                quarters.lockedQuarters()
        );
    }

    private Future<ReportDraft> loadDraft(String reportId) {
        return draftRepository.findById(reportId)
                .compose(found -> found
                        .map(Future::succeededFuture)
                        .orElseGet(() -> Future.failedFuture(new ReportNotFoundException(reportId))));
    }

    private ReportContext contextOf(ReportDraft draft) {
        return ReportContext.create(draft.getTree(), draft.getQuarter(), draft.getPrevious());
    }

    private Future<PreviousQuarterBalances> previousBalances(OpenReportCommand command, int fiscalYear, Quarter quarter) {
        if (command.previousQuarterBalances() != null) {
            return Future.succeededFuture(command.previousQuarterBalances());
        }
        return previousBalancesProvider.fetchPreviousQuarterBalances(
                        command.facilityId(), command.programType(), fiscalYear, quarter)
                .recover(error -> {
                    log.warn("Previous quarter balances unavailable for facility {}, starting from zero: {}",
                            command.facilityId(), error.getMessage());
                    return Future.succeededFuture(PreviousQuarterBalances.none());
                });
    }

    private Future<Optional<BigDecimal>> plannedBudget(OpenReportCommand command, Quarter quarter) {
        if (command.plannedBudget() != null) {
            return Future.succeededFuture(Optional.of(command.plannedBudget()));
        }
        return budgetProvider.fetchPlannedBudget(command.facilityId(), command.programType(), quarter)
                .recover(error -> {
                    log.warn("Planned budget unavailable for facility {}: {}", command.facilityId(), error.getMessage());
                    return Future.succeededFuture(Optional.empty());
                });
    }

    /**
     * Initial values keyed by catalog code; legacy codes are resolved, unknown codes dropped
     */
    private ReportState initialState(ActivityTree tree, Map<String, ActivityValue> values) {
        if (values == null || values.isEmpty()) {
            return ReportState.empty();
        }
        Map<String, ActivityValue> imported = new LinkedHashMap<>();
        values.forEach((code, value) -> {
            String target = tree.contains(code) ? code : codeMapping.resolve(code);
            if (tree.contains(target)) {
                imported.put(target, value);
            } else {
                log.warn("Dropping value for unknown activity code {}", code);
            }
        });
        return ReportState.of(imported);
    }

    private List<String> validateOpenCommand(OpenReportCommand command) {
        List<String> errors = new ArrayList<>();
        if (isBlank(command.programType())) {
            errors.add("programType is required");
        }
        if (isBlank(command.facilityType())) {
            errors.add("facilityType is required");
        }
        if (isBlank(command.facilityId())) {
            errors.add("facilityId is required");
        }
        if (command.quarter() != null && !Quarter.isValid(command.quarter())) {
            errors.add("quarter must be one of Q1, Q2, Q3, Q4");
        }
        return errors;
    }

    private boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
