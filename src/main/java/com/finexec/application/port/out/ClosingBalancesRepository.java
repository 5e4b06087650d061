package com.finexec.application.port.out;

import com.finexec.domain.model.ClosingBalances;
import com.finexec.domain.model.Quarter;
import io.vertx.core.Future;

/**
 * Output port storing published quarter-closing snapshots
 */
public interface ClosingBalancesRepository {

    Future<Void> saveClosingBalances(String facilityId, String programType, int fiscalYear, Quarter quarter,
                                     ClosingBalances closingBalances);
}
