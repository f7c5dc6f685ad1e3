package com.relaygate.cost;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

/**
 * Look-back windows for usage summaries.
 */
public enum UsagePeriod {
    HOUR(Duration.ofHours(1)),
    DAY(Duration.ofDays(1)),
    WEEK(Duration.ofDays(7)),
    MONTH(Duration.ofDays(30));

    private final Duration length;

    UsagePeriod(Duration length) {
        this.length = length;
    }

    public Duration getLength() {
        return length;
    }

    public static Optional<UsagePeriod> fromValue(String value) {
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
