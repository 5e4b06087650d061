package com.finexec.application.port.out;

import com.finexec.domain.model.Quarter;
import io.vertx.core.Future;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Output port for the planned budget of a facility's quarter
 */
public interface PlannedBudgetProvider {

    Future<Optional<BigDecimal>> fetchPlannedBudget(String facilityId, String programType, Quarter quarter);
}
