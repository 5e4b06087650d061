package com.finexec.adapter.out.catalog;

import com.finexec.domain.model.Activity;
import com.finexec.domain.model.ActivityTree;
import com.finexec.domain.model.ActivityType;
import com.finexec.domain.model.LineRole;
import com.finexec.domain.model.Section;
import com.finexec.domain.model.VatCategory;
import com.finexec.domain.service.ActivityMappings;
import io.vertx.core.Vertx;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test for ClasspathActivityCatalogAdapter against the bundled HIV hospital catalog
 */
class ClasspathActivityCatalogAdapterTest {

    private static final String PREFIX = "HIV_EXEC_HOSPITAL";

    private Vertx vertx;
    private ClasspathActivityCatalogAdapter adapter;

    @BeforeEach
    void setUp() {
        vertx = Vertx.vertx();
        adapter = new ClasspathActivityCatalogAdapter(vertx, "catalog");
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);
        vertx.close().onComplete(ar -> latch.countDown());
        latch.await(5, TimeUnit.SECONDS);
    }

    @Test
    void load_shouldBuildTreeFromJson() throws Exception {
        // When
        ActivityTree tree = adapter.load("catalog/HIV_hospital.json");

        // Then
        assertEquals("HIV", tree.getProgramType());
        assertEquals(13, tree.expenses().size());
        assertEquals(11, tree.payables().size());
        assertEquals(4, tree.vatReceivables().size());
        assertTrue(tree.category(Section.C).orElseThrow().isComputed());
        assertTrue(tree.find(PREFIX + "_A_3").orElseThrow().isTotalRow());
    }

    @Test
    void load_shouldMapItemAttributes() throws Exception {
        ActivityTree tree = adapter.load("catalog/HIV_hospital.json");

        Activity cash = tree.find(PREFIX + "_D_1").orElseThrow();
        Activity receipts = tree.find(PREFIX + "_A_1").orElseThrow();
        Activity period = tree.find(PREFIX + "_G_4").orElseThrow();
        Activity fuel = tree.find(PREFIX + "_B_B-04_3").orElseThrow();

        assertEquals(ActivityType.COMPUTED_ASSET, cash.getActivityType());
        assertEquals(LineRole.CASH_AT_BANK, cash.getRole());
        assertFalse(cash.isUserEditable());
        assertTrue(receipts.isUserEditable());
        assertTrue(period.isComputed());
        assertEquals(LineRole.PERIOD_SURPLUS, period.getRole());
        assertEquals(VatCategory.FUEL, fuel.getVatCategory());
        assertEquals("B-04", fuel.getSubCategoryCode());
    }

    @Test
    void load_shouldMapEveryExpenseToAPayable() throws Exception {
        ActivityMappings mappings = ActivityMappings.from(adapter.load("catalog/HIV_hospital.json"));

        assertTrue(mappings.unmappedExpenses().isEmpty());
        assertEquals(Optional.of(PREFIX + "_E_6"), mappings.payableFor(PREFIX + "_B_B-04_5"));
        assertEquals(Optional.of(PREFIX + "_E_7"), mappings.payableFor(PREFIX + "_B_B-04_6"));
        assertEquals(Optional.of(PREFIX + "_E_13"), mappings.payableFor(PREFIX + "_B_B-04_2"));
        assertTrue(mappings.payableFor(PREFIX + "_B_B-05_1").isEmpty());
    }

    @Test
    void fetchActivityTree_shouldNormalizeNamesAndCache() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);
        ActivityTree[] trees = new ActivityTree[2];

        adapter.fetchActivityTree("hiv", "Hospital")
                .compose(first -> {
                    trees[0] = first;
                    return adapter.fetchActivityTree("HIV", "hospital");
                })
                .onComplete(ar -> {
                    assertTrue(ar.succeeded(), () -> String.valueOf(ar.cause()));
                    trees[1] = ar.result();
                    latch.countDown();
                });

        assertTrue(latch.await(5, TimeUnit.SECONDS));
        assertNotNull(trees[0]);
        assertSame(trees[0], trees[1]);
    }

    @Test
    void fetchActivityTree_shouldFailForUnknownPair() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);

        adapter.fetchActivityTree("TB", "health_center")
                .onComplete(ar -> {
                    assertTrue(ar.failed());
                    assertInstanceOf(IllegalArgumentException.class, ar.cause());
                    assertTrue(ar.cause().getMessage().startsWith("No activity catalog found"));
                    latch.countDown();
                });

        assertTrue(latch.await(5, TimeUnit.SECONDS));
    }
}
