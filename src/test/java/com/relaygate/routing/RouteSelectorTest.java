package com.relaygate.routing;

import com.relaygate.TestFixtures;
import com.relaygate.config.GatewayProperties;
import com.relaygate.cost.BudgetGuardrail;
import com.relaygate.cost.CostTracker;
import com.relaygate.exception.BudgetExceededException;
import com.relaygate.exception.NoEligibleProviderException;
import com.relaygate.metrics.GatewayMetrics;
import com.relaygate.model.ComplexityClass;
import com.relaygate.model.OptimizationStrategy;
import com.relaygate.model.ProviderDescriptor;
import com.relaygate.model.RouteDecision;
import com.relaygate.registry.ProviderRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.relaygate.TestFixtures.provider;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for RouteSelector.
 */
class RouteSelectorTest {

    // base unit cost 0.015: simple 0.015, moderate 0.03
    private final ProviderDescriptor a = provider("a", 0.9, 0.01, 0.02);
    // base unit cost 0.0025: simple 0.0025, moderate 0.005
    private final ProviderDescriptor b = provider("b", 0.6, 0.002, 0.003);

    private GatewayProperties properties;
    private RouteSelector selector;

    @BeforeEach
    void setUp() {
        properties = new GatewayProperties();
        ProviderRegistry registry = new ProviderRegistry(List.of(a, b));
        CostTracker costTracker = new CostTracker(properties, registry,
                new GatewayMetrics(new SimpleMeterRegistry()), TestFixtures.clock());
        BudgetGuardrail guardrail = new BudgetGuardrail(properties, costTracker);
        selector = new RouteSelector(costTracker, guardrail, properties);
    }

    @Test
    void testCostStrategyExcludesProvidersBelowQualityFloor() {
        RouteDecision decision = selector.select(OptimizationStrategy.COST, ComplexityClass.SIMPLE, List.of(a, b), null);

        assertEquals("a", decision.getProviderId());
        assertTrue(decision.getFallbackChain().isEmpty());
        assertEquals("cost-optimized", decision.getReason());
        assertEquals(0.015, decision.getEstimatedCostUSD(), 1e-9);
    }

    @Test
    void testBalancedHasNoQualityFloorAndHonoursCeiling() {
        RouteDecision decision = selector.select(OptimizationStrategy.BALANCED, ComplexityClass.MODERATE, List.of(a, b), 0.01);

        assertEquals("b", decision.getProviderId());
        assertTrue(decision.getFallbackChain().isEmpty());
        assertEquals("balanced", decision.getReason());
        assertTrue(decision.getEstimatedCostUSD() <= 0.01);
    }

    @Test
    void testCostStrategyUsesHigherFloorForComplexPrompts() {
        ProviderDescriptor strong = provider("strong", 0.85, 0.002, 0.006);
        ProviderDescriptor cheap = provider("cheap", 0.75, 0.0005, 0.0008);

        RouteDecision simple = selector.select(OptimizationStrategy.COST, ComplexityClass.SIMPLE, List.of(strong, cheap), null);
        RouteDecision complex = selector.select(OptimizationStrategy.COST, ComplexityClass.COMPLEX, List.of(strong, cheap), null);

        assertEquals("cheap", simple.getProviderId());
        assertEquals(List.of("strong"), simple.getFallbackChain());
        assertEquals("strong", complex.getProviderId());
        assertTrue(complex.getFallbackChain().isEmpty());
    }

    @Test
    void testBalancedCeilingBelowEveryCandidateFails() {
        BudgetExceededException e = assertThrows(BudgetExceededException.class,
                () -> selector.select(OptimizationStrategy.BALANCED, ComplexityClass.MODERATE, List.of(a, b), 0.001));
        assertEquals("BUDGET_EXCEEDED", e.getErrorCode());
        assertNull(e.getForecastRatio());
    }

    @Test
    void testCostCeilingBelowEveryCandidateFails() {
        assertThrows(NoEligibleProviderException.class,
                () -> selector.select(OptimizationStrategy.COST, ComplexityClass.SIMPLE, List.of(a, b), 0.0001));
    }

    @Test
    void testQualityIgnoresCostCeiling() {
        RouteDecision decision = selector.select(OptimizationStrategy.QUALITY, ComplexityClass.SIMPLE, List.of(b, a), 0.0001);

        assertEquals("a", decision.getProviderId());
        assertEquals(List.of("b"), decision.getFallbackChain());
        assertEquals("quality-optimized", decision.getReason());
    }

    @Test
    void testSpeedPrefersFastTierThenRest() {
        ProviderDescriptor openai = provider("openai", 0.95, 0.03, 0.06);
        ProviderDescriptor groq = provider("groq", 0.75, 0.0005, 0.0008);
        ProviderDescriptor deepseek = provider("deepseek", 0.70, 0.0001, 0.0002);

        RouteDecision decision = selector.select(OptimizationStrategy.SPEED, ComplexityClass.SIMPLE,
                List.of(openai, groq, deepseek), null);

        assertEquals("groq", decision.getProviderId());
        assertEquals(List.of("deepseek", "openai"), decision.getFallbackChain());
        assertEquals("speed-optimized", decision.getReason());
    }

    @Test
    void testSpeedHonoursCostCeiling() {
        ProviderDescriptor openai = provider("openai", 0.95, 0.03, 0.06);
        ProviderDescriptor groq = provider("groq", 0.75, 0.0005, 0.0008);

        RouteDecision decision = selector.select(OptimizationStrategy.SPEED, ComplexityClass.SIMPLE,
                List.of(openai, groq), 0.01);

        assertEquals("groq", decision.getProviderId());
        assertTrue(decision.getFallbackChain().isEmpty());
    }

    @Test
    void testTiesGoToRegistryOrder() {
        ProviderDescriptor first = provider("first", 0.8, 0.001, 0.002);
        ProviderDescriptor second = provider("second", 0.8, 0.001, 0.002);

        for (OptimizationStrategy strategy : OptimizationStrategy.values()) {
            RouteDecision decision = selector.select(strategy, ComplexityClass.SIMPLE, List.of(first, second), null);
            assertEquals("first", decision.getProviderId(), strategy.name());
            assertEquals(List.of("second"), decision.getFallbackChain(), strategy.name());
        }
    }

    @Test
    void testFallbackChainIsCappedAndExcludesPrimary() {
        List<ProviderDescriptor> candidates = List.of(
                provider("p1", 0.9, 0.001, 0.001),
                provider("p2", 0.9, 0.002, 0.002),
                provider("p3", 0.9, 0.003, 0.003),
                provider("p4", 0.9, 0.004, 0.004),
                provider("p5", 0.9, 0.005, 0.005));

        RouteDecision decision = selector.select(OptimizationStrategy.COST, ComplexityClass.SIMPLE, candidates, null);

        assertEquals("p1", decision.getProviderId());
        assertEquals(List.of("p2", "p3", "p4"), decision.getFallbackChain());
        assertEquals(List.of("p1", "p2", "p3", "p4"), decision.attemptOrder());
    }

    @Test
    void testFallbackChainRespectsConfiguredLength() {
        properties.getRouting().setFallbackChainLength(0);

        RouteDecision decision = selector.select(OptimizationStrategy.QUALITY, ComplexityClass.SIMPLE, List.of(a, b), null);

        assertEquals("a", decision.getProviderId());
        assertTrue(decision.getFallbackChain().isEmpty());
    }

    @Test
    void testBalancedScore() {
        // 0.9 / (0.015 * 1.0)
        assertEquals(60.0, selector.balancedScore(a, ComplexityClass.MODERATE), 1e-9);
        // 0.9 / (0.015 * 2.0)
        assertEquals(30.0, selector.balancedScore(a, ComplexityClass.COMPLEX), 1e-9);
    }

    @Test
    void testFreeProviderOutranksPaidInBalanced() {
        ProviderDescriptor local = provider("local", 0.5, 0.0, 0.0);

        assertEquals(Double.POSITIVE_INFINITY, selector.balancedScore(local, ComplexityClass.SIMPLE));
        RouteDecision decision = selector.select(OptimizationStrategy.BALANCED, ComplexityClass.SIMPLE, List.of(a, b, local), null);
        assertEquals("local", decision.getProviderId());
        assertEquals(0.0, decision.getEstimatedCostUSD());
    }

    @Test
    void testIneligibleProvidersAreNeverSelected() {
        ProviderDescriptor disabled = a.toBuilder().enabled(false).build();
        ProviderDescriptor keyless = b.toBuilder().apiKey(null).build();

        assertThrows(NoEligibleProviderException.class,
                () -> selector.select(OptimizationStrategy.QUALITY, ComplexityClass.SIMPLE, List.of(disabled, keyless), null));
    }

    @Test
    void testGuardrailRejectsTenantOverMargin() {
        properties.getBudget().getTenantMonthlyRevenue().put("small", 0.01);

        BudgetExceededException e = assertThrows(BudgetExceededException.class,
                () -> selector.selectForTenant("small", OptimizationStrategy.QUALITY, ComplexityClass.SIMPLE, List.of(a, b), null));

        // 0.015 / 0.01
        assertEquals(1.5, e.getForecastRatio(), 1e-9);
    }

    @Test
    void testGuardrailPassesTenantWithinMargin() {
        RouteDecision decision = selector.selectForTenant("acme", OptimizationStrategy.QUALITY,
                ComplexityClass.SIMPLE, List.of(a, b), null);
        assertEquals("a", decision.getProviderId());
    }
}
