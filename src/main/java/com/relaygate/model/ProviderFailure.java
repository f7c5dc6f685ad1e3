package com.relaygate.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * Why one attempt in the fallback chain did not produce a response.
 */
@Value
public class ProviderFailure {

    @JsonProperty("providerId")
    String providerId;

    @JsonProperty("errorCode")
    String errorCode;

    @JsonProperty("reason")
    String reason;
}
