package com.relaygate.model;

import lombok.Builder;
import lombok.Value;

/**
 * Normalized provider reply, independent of the wire protocol.
 */
@Value
@Builder
public class ProviderResult {
    String providerId;
    String model;
    String content;
    long inputUnits;
    long outputUnits;
}
