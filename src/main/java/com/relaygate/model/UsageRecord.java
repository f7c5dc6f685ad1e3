package com.relaygate.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * One billed provider call. Append-only.
 */
@Value
@Builder
public class UsageRecord {
    String tenantId;
    String providerId;
    long inputUnits;
    long outputUnits;
    double costUSD;
    Instant timestamp;

    public long totalUnits() {
        return inputUnits + outputUnits;
    }
}
