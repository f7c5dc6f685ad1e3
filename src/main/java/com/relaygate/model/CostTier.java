package com.relaygate.model;

/**
 * Multipliers applied to a provider's base unit cost when estimating a call.
 */
public enum CostTier {
    SIMPLE(1),
    MODERATE(2),
    ADVANCED(4),
    EXPERT(8);

    private final int multiplier;

    CostTier(int multiplier) {
        this.multiplier = multiplier;
    }

    public int getMultiplier() {
        return multiplier;
    }
}
