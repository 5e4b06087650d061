package com.finexec.adapter.out.persistence;

import com.finexec.application.port.out.PlannedBudgetProvider;
import com.finexec.domain.model.Quarter;
import com.finexec.domain.service.Amounts;
import io.vertx.core.Future;
import io.vertx.core.json.JsonObject;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Planned budgets taken from the "budgets" configuration block,
 * keyed "{facilityId}:{programType}:{quarter}"
 */
@Slf4j
public class ConfiguredPlannedBudgetAdapter implements PlannedBudgetProvider {

    private final JsonObject budgets;

    public ConfiguredPlannedBudgetAdapter(JsonObject budgets) {
        this.budgets = budgets == null ? new JsonObject() : budgets;
    }

    @Override
    public Future<Optional<BigDecimal>> fetchPlannedBudget(String facilityId, String programType, Quarter quarter) {
        String key = facilityId + ":" + programType.toUpperCase() + ":" + quarter.getValue();
        BigDecimal budget = Amounts.parse(budgets.getValue(key));
        log.debug("Planned budget for {}: {}", key, budget);
        return Future.succeededFuture(Optional.ofNullable(budget));
    }
}
