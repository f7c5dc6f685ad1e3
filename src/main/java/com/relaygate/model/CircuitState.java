package com.relaygate.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Point-in-time view of one provider's breaker.
 */
@Value
@Builder
public class CircuitState {
    String providerId;
    BreakerState state;
    int failureCount;
    Instant lastFailureAt;
    Instant openedAt;
    float failureRatePct;
}
