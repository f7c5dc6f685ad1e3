package com.relaygate.routing;

import com.relaygate.config.GatewayProperties;
import com.relaygate.cost.BudgetGuardrail;
import com.relaygate.cost.CostTracker;
import com.relaygate.exception.BudgetExceededException;
import com.relaygate.exception.NoEligibleProviderException;
import com.relaygate.model.ComplexityClass;
import com.relaygate.model.OptimizationStrategy;
import com.relaygate.model.ProviderDescriptor;
import com.relaygate.model.RouteDecision;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Picks a provider and its fallback chain for a strategy.
 *
 * Candidate order is registry iteration order; every sort here is stable, so ties
 * go to the provider listed first. Disabled providers must already be filtered out
 * by the caller (the registry only lists eligible ones), but are dropped again here.
 */
@Slf4j
@Component
public class RouteSelector {

    private final CostTracker costTracker;
    private final BudgetGuardrail guardrail;
    private final GatewayProperties.RoutingConfig config;

    public RouteSelector(CostTracker costTracker, BudgetGuardrail guardrail, GatewayProperties properties) {
        this.costTracker = costTracker;
        this.guardrail = guardrail;
        this.config = properties.getRouting();
    }

    /**
     * Select for a tenant, then consult the margin guardrail before committing to a
     * paid primary. Fails closed: a tripped guardrail rejects, it does not downgrade.
     */
    public RouteDecision selectForTenant(String tenantId,
                                         OptimizationStrategy strategy,
                                         ComplexityClass complexity,
                                         List<ProviderDescriptor> candidates,
                                         Double maxCostUSD) {
        RouteDecision decision = select(strategy, complexity, candidates, maxCostUSD);
        guardrail.checkCall(tenantId, decision.getEstimatedCostUSD());
        return decision;
    }

    /**
     * @throws NoEligibleProviderException when no candidate qualifies
     * @throws BudgetExceededException     when the balanced strategy's cost ceiling
     *                                     removes every candidate
     */
    public RouteDecision select(OptimizationStrategy strategy,
                                ComplexityClass complexity,
                                List<ProviderDescriptor> candidates,
                                Double maxCostUSD) {
        List<ProviderDescriptor> eligible = candidates.stream()
                .filter(ProviderDescriptor::isEligible)
                .toList();
        if (eligible.isEmpty()) {
            throw new NoEligibleProviderException("No enabled providers available");
        }

        RouteDecision decision = switch (strategy) {
            case COST -> selectByCost(eligible, complexity, maxCostUSD);
            case QUALITY -> selectByQuality(eligible, complexity);
            case SPEED -> selectBySpeed(eligible, complexity, maxCostUSD);
            case BALANCED -> selectBalanced(eligible, complexity, maxCostUSD);
        };

        log.info("Route selected: strategy={}, complexity={}, provider={}, fallback={}, est=${}",
                strategy, complexity, decision.getProviderId(), decision.getFallbackChain(),
                String.format("%.6f", decision.getEstimatedCostUSD()));
        return decision;
    }

    /**
     * Cheapest provider that meets the complexity-derived quality floor and the
     * optional cost ceiling.
     */
    private RouteDecision selectByCost(List<ProviderDescriptor> candidates,
                                       ComplexityClass complexity,
                                       Double maxCostUSD) {
        double minQuality = complexity.getMinimumCostQuality();

        List<ProviderDescriptor> sorted = candidates.stream()
                .filter(p -> p.getQualityScore() >= minQuality)
                .filter(p -> withinCeiling(p, complexity, maxCostUSD))
                .sorted(Comparator.comparingDouble(ProviderDescriptor::combinedPricePer1k))
                .toList();

        if (sorted.isEmpty()) {
            throw new NoEligibleProviderException(maxCostUSD == null
                    ? "No provider meets minimum quality " + minQuality
                    : "No provider meets minimum quality " + minQuality + " within $" + maxCostUSD);
        }
        return decide(sorted, complexity, OptimizationStrategy.COST, "cost-optimized");
    }

    /**
     * Highest quality wins. The cost ceiling is deliberately not applied: the caller
     * accepts the cost risk when asking for quality.
     */
    private RouteDecision selectByQuality(List<ProviderDescriptor> candidates, ComplexityClass complexity) {
        List<ProviderDescriptor> sorted = candidates.stream()
                .sorted(Comparator.comparingDouble(ProviderDescriptor::getQualityScore).reversed())
                .toList();
        return decide(sorted, complexity, OptimizationStrategy.QUALITY, "quality-optimized");
    }

    /**
     * Low-latency tier members first (candidate order), then everyone else.
     */
    private RouteDecision selectBySpeed(List<ProviderDescriptor> candidates,
                                        ComplexityClass complexity,
                                        Double maxCostUSD) {
        Set<String> tier = Set.copyOf(config.getSpeedTier());

        List<ProviderDescriptor> affordable = candidates.stream()
                .filter(p -> withinCeiling(p, complexity, maxCostUSD))
                .toList();
        if (affordable.isEmpty()) {
            throw new NoEligibleProviderException("No provider within $" + maxCostUSD);
        }

        List<ProviderDescriptor> ordered = new ArrayList<>();
        affordable.stream().filter(p -> tier.contains(p.getId())).forEach(ordered::add);
        affordable.stream().filter(p -> !tier.contains(p.getId())).forEach(ordered::add);

        String reason = tier.contains(ordered.get(0).getId()) ? "speed-optimized" : "speed-optimized (no fast-tier match)";
        return decide(ordered, complexity, OptimizationStrategy.SPEED, reason);
    }

    /**
     * Score = quality / (base cost * complexity multiplier). No quality floor: the
     * score already weighs quality.
     */
    private RouteDecision selectBalanced(List<ProviderDescriptor> candidates,
                                         ComplexityClass complexity,
                                         Double maxCostUSD) {
        List<ScoredProvider> scored = candidates.stream()
                .filter(p -> withinCeiling(p, complexity, maxCostUSD))
                .map(p -> new ScoredProvider(p, balancedScore(p, complexity)))
                .sorted(Comparator.comparingDouble(ScoredProvider::score).reversed())
                .toList();

        if (scored.isEmpty()) {
            throw new BudgetExceededException("No providers within budget: $" + maxCostUSD);
        }

        log.debug("Balanced scores: {}", scored.stream()
                .map(s -> s.provider().getId() + "=" + String.format("%.2f", s.score()))
                .toList());

        List<ProviderDescriptor> sorted = scored.stream().map(ScoredProvider::provider).toList();
        return decide(sorted, complexity, OptimizationStrategy.BALANCED, "balanced");
    }

    double balancedScore(ProviderDescriptor provider, ComplexityClass complexity) {
        double cost = costTracker.baseUnitCost(provider) * complexity.getBalancedMultiplier();
        if (cost <= 0.0) {
            // free providers outrank every paid one
            return Double.POSITIVE_INFINITY;
        }
        return provider.getQualityScore() / cost;
    }

    private boolean withinCeiling(ProviderDescriptor provider, ComplexityClass complexity, Double maxCostUSD) {
        return maxCostUSD == null || costTracker.estimate(provider, complexity) <= maxCostUSD;
    }

    private RouteDecision decide(List<ProviderDescriptor> ordered,
                                 ComplexityClass complexity,
                                 OptimizationStrategy strategy,
                                 String reason) {
        ProviderDescriptor winner = ordered.get(0);
        List<String> chain = ordered.stream()
                .skip(1)
                .limit(config.getFallbackChainLength())
                .map(ProviderDescriptor::getId)
                .toList();

        return RouteDecision.builder()
                .providerId(winner.getId())
                .fallbackChain(chain)
                .estimatedCostUSD(costTracker.estimate(winner, complexity))
                .reason(reason)
                .strategy(strategy)
                .complexity(complexity)
                .build();
    }

    private record ScoredProvider(ProviderDescriptor provider, double score) {
    }
}
