package com.relaygate.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Output of the route selector: the chosen provider and the ordered alternates.
 */
@Value
@Builder
public class RouteDecision {
    String providerId;

    @Singular("fallback")
    List<String> fallbackChain;

    double estimatedCostUSD;
    String reason;
    OptimizationStrategy strategy;
    ComplexityClass complexity;

    /**
     * Primary followed by the fallback chain.
     */
    public List<String> attemptOrder() {
        List<String> order = new ArrayList<>(fallbackChain.size() + 1);
        order.add(providerId);
        order.addAll(fallbackChain);
        return order;
    }
}
