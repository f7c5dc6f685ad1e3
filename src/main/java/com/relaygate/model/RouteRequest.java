package com.relaygate.model;

import lombok.Builder;
import lombok.Value;

/**
 * Validated inbound routing request. Created per call, never persisted.
 */
@Value
@Builder
public class RouteRequest {
    String promptText;
    String tenantId;
    OptimizationStrategy strategy;

    /**
     * Optional per-call cost ceiling in USD.
     */
    Double maxCostUSD;

    public boolean hasCostCeiling() {
        return maxCostUSD != null;
    }
}
