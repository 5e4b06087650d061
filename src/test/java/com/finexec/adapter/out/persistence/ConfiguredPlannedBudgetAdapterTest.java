package com.finexec.adapter.out.persistence;

import com.finexec.domain.model.Quarter;
import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ConfiguredPlannedBudgetAdapterTest {

    @Test
    void fetchPlannedBudget_shouldReadConfiguredKey() {
        ConfiguredPlannedBudgetAdapter adapter = new ConfiguredPlannedBudgetAdapter(new JsonObject()
                .put("FAC-001:HIV:Q1", 500000)
                .put("FAC-001:HIV:Q2", "250000.50"));

        assertEquals(0, new BigDecimal("500000").compareTo(
                adapter.fetchPlannedBudget("FAC-001", "hiv", Quarter.Q1).result().orElseThrow()));
        assertEquals(0, new BigDecimal("250000.50").compareTo(
                adapter.fetchPlannedBudget("FAC-001", "HIV", Quarter.Q2).result().orElseThrow()));
    }

    @Test
    void fetchPlannedBudget_shouldBeEmptyWhenNotConfigured() {
        assertEquals(Optional.empty(),
                new ConfiguredPlannedBudgetAdapter(null).fetchPlannedBudget("FAC-001", "HIV", Quarter.Q3).result());
    }
}
