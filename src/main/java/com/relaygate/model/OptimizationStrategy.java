package com.relaygate.model;

import java.util.Locale;
import java.util.Optional;

/**
 * What the route selector optimizes for.
 */
public enum OptimizationStrategy {

    /**
     * Cheapest provider that clears the complexity-derived quality floor.
     */
    COST,

    /**
     * Highest quality score; cost ceiling is not applied.
     */
    QUALITY,

    /**
     * Providers from the configured low-latency tier first.
     */
    SPEED,

    /**
     * Best quality per estimated dollar, scaled by complexity.
     */
    BALANCED;

    /**
     * Case-insensitive lookup, empty for unknown values.
     */
    public static Optional<OptimizationStrategy> fromValue(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
