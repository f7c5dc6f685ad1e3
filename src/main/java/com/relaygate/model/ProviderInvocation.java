package com.relaygate.model;

import lombok.Builder;
import lombok.Value;

/**
 * What is sent to an upstream provider.
 */
@Value
@Builder
public class ProviderInvocation {
    String prompt;
    String model;
    int maxTokens;
}
