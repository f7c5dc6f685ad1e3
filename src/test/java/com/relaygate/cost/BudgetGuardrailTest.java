package com.relaygate.cost;

import com.relaygate.TestFixtures;
import com.relaygate.config.GatewayProperties;
import com.relaygate.exception.BudgetExceededException;
import com.relaygate.metrics.GatewayMetrics;
import com.relaygate.model.UsageRecord;
import com.relaygate.registry.ProviderRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for BudgetGuardrail.
 */
class BudgetGuardrailTest {

    private GatewayProperties properties;
    private CostTracker costTracker;
    private BudgetGuardrail guardrail;

    @BeforeEach
    void setUp() {
        properties = new GatewayProperties();
        properties.getBudget().getTenantMonthlyRevenue().put("acme", 100.0);
        properties.getBudget().getTenantMonthlyRevenue().put("freeloader", 0.0);

        costTracker = new CostTracker(properties, new ProviderRegistry(List.of()),
                new GatewayMetrics(new SimpleMeterRegistry()), TestFixtures.clock());
        guardrail = new BudgetGuardrail(properties, costTracker);
    }

    @Test
    void testStrictInequalityAtGuardrailRatio() {
        assertTrue(guardrail.wouldExceedBudget("acme", 75.0));
        assertFalse(guardrail.wouldExceedBudget("acme", 70.0));
        assertFalse(guardrail.wouldExceedBudget("acme", 10.0));
    }

    @Test
    void testTenantWithoutRevenueAlwaysTrips() {
        assertTrue(guardrail.wouldExceedBudget("freeloader", 0.01));
        assertEquals(Double.POSITIVE_INFINITY, guardrail.forecastRatio("freeloader", 1.0));
    }

    @Test
    void testUnknownTenantUsesDefaultRevenue() {
        properties.getBudget().setDefaultMonthlyRevenue(10.0);

        assertEquals(10.0, guardrail.monthlyRevenue("new-tenant"));
        assertTrue(guardrail.wouldExceedBudget("new-tenant", 7.5));
    }

    @Test
    void testCheckCallIncludesMonthToDateSpend() {
        costTracker.record(UsageRecord.builder()
                .tenantId("acme")
                .providerId("a")
                .costUSD(69.0)
                .timestamp(TestFixtures.NOW)
                .build());

        assertDoesNotThrow(() -> guardrail.checkCall("acme", 1.0));

        BudgetExceededException e = assertThrows(BudgetExceededException.class,
                () -> guardrail.checkCall("acme", 2.0));
        assertEquals(0.71, e.getForecastRatio(), 1e-9);
    }

    @Test
    void testFreeCallsAlwaysPass() {
        assertDoesNotThrow(() -> guardrail.checkCall("freeloader", 0.0));
    }

    @Test
    void testZeroRevenueRejectionHasNoRatio() {
        BudgetExceededException e = assertThrows(BudgetExceededException.class,
                () -> guardrail.checkCall("freeloader", 0.001));
        assertNull(e.getForecastRatio());
    }
}
