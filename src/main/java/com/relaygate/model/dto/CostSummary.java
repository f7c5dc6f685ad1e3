package com.relaygate.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Spend over a look-back window.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CostSummary {

    private String period;

    private double total;

    private long callCount;

    private double avgCostPerCall;

    private Map<String, ProviderUsage> byProvider;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ProviderUsage {
        private double cost;
        private long calls;
        private long units;
    }
}
