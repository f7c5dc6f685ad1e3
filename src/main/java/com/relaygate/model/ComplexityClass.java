package com.relaygate.model;

/**
 * Coarse bucket for how demanding a prompt is.
 */
public enum ComplexityClass {
    SIMPLE(0.65, 0.5, CostTier.SIMPLE),
    MODERATE(0.65, 1.0, CostTier.MODERATE),
    COMPLEX(0.80, 2.0, CostTier.ADVANCED);

    private final double minimumCostQuality;
    private final double balancedMultiplier;
    private final CostTier costTier;

    ComplexityClass(double minimumCostQuality, double balancedMultiplier, CostTier costTier) {
        this.minimumCostQuality = minimumCostQuality;
        this.balancedMultiplier = balancedMultiplier;
        this.costTier = costTier;
    }

    /**
     * Quality floor used by the cost strategy.
     */
    public double getMinimumCostQuality() {
        return minimumCostQuality;
    }

    /**
     * Divisor weight used by the balanced score.
     */
    public double getBalancedMultiplier() {
        return balancedMultiplier;
    }

    public CostTier getCostTier() {
        return costTier;
    }
}
