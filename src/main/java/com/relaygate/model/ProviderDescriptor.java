package com.relaygate.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Immutable catalog entry for one upstream provider.
 */
@Value
@Builder(toBuilder = true)
public class ProviderDescriptor {

    String id;
    String baseEndpoint;
    AuthMethod authMethod;
    ApiStyle apiStyle;

    /**
     * Never serialized or logged.
     */
    @lombok.ToString.Exclude
    String apiKey;

    @Singular
    List<String> supportedModels;

    double priceInputPer1k;
    double priceOutputPer1k;
    double qualityScore;
    int priority;
    boolean enabled;

    /**
     * Whether this provider may be routed to: switched on and, when the auth method
     * needs one, holding a key.
     */
    public boolean isEligible() {
        if (!enabled) {
            return false;
        }
        return !authMethod.requiresKey() || (apiKey != null && !apiKey.isBlank());
    }

    /**
     * Sum of input and output price, the ordering key of the cost strategy.
     */
    public double combinedPricePer1k() {
        return priceInputPer1k + priceOutputPer1k;
    }

    public String defaultModel() {
        return supportedModels.isEmpty() ? null : supportedModels.get(0);
    }

    public boolean supports(String model) {
        return model != null && supportedModels.contains(model);
    }
}
