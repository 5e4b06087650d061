package com.finexec.application.port.out;

import com.finexec.domain.model.PreviousQuarterBalances;
import com.finexec.domain.model.Quarter;
import io.vertx.core.Future;

/**
 * Output port for the closing snapshot of the quarter preceding a report
 */
public interface PreviousQuarterBalancesProvider {

    /**
     * @return snapshot of the quarter before {@code quarter}, or {@link PreviousQuarterBalances#none()}
     */
    Future<PreviousQuarterBalances> fetchPreviousQuarterBalances(
            String facilityId, String programType, int fiscalYear, Quarter quarter);
}
