package com.finexec.adapter.out.persistence;

import com.finexec.application.port.out.ClosingBalancesRepository;
import com.finexec.application.port.out.PreviousQuarterBalancesProvider;
import com.finexec.domain.model.ClosingBalances;
import com.finexec.domain.model.PreviousQuarterBalances;
import com.finexec.domain.model.Quarter;
import io.vertx.core.Future;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory store of published closing snapshots.
 * The quarter before Q1 is Q4 of the previous fiscal year.
 */
@Slf4j
public class InMemoryClosingBalancesAdapter implements ClosingBalancesRepository, PreviousQuarterBalancesProvider {

    private final Map<String, ClosingBalances> snapshots = new ConcurrentHashMap<>();

    @Override
    public Future<Void> saveClosingBalances(String facilityId, String programType, int fiscalYear, Quarter quarter,
                                            ClosingBalances closingBalances) {
        snapshots.put(key(facilityId, programType, fiscalYear, quarter), closingBalances);
        log.info("Stored closing balances for facility {} {} FY{} {}", facilityId, programType, fiscalYear,
                quarter.getValue());
        return Future.succeededFuture();
    }

    @Override
    public Future<PreviousQuarterBalances> fetchPreviousQuarterBalances(String facilityId, String programType,
                                                                        int fiscalYear, Quarter quarter) {
        Quarter previousQuarter = quarter.previous().orElse(Quarter.Q4);
        int previousYear = quarter == Quarter.Q1 ? fiscalYear - 1 : fiscalYear;

        ClosingBalances closing = snapshots.get(key(facilityId, programType, previousYear, previousQuarter));
        if (closing == null) {
            log.debug("No closing balances for facility {} {} FY{} {}", facilityId, programType, previousYear,
                    previousQuarter.getValue());
            return Future.succeededFuture(PreviousQuarterBalances.none());
        }
        return Future.succeededFuture(PreviousQuarterBalances.of(previousQuarter, closing));
    }

    private static String key(String facilityId, String programType, int fiscalYear, Quarter quarter) {
        return facilityId + "|" + programType.toUpperCase() + "|" + fiscalYear + "|" + quarter.getValue();
    }
}
