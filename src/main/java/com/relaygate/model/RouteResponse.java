package com.relaygate.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Successful body of {@code POST /v1/route}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RouteResponse {

    @JsonProperty("providerId")
    private String providerId;

    @JsonProperty("content")
    private String content;

    @JsonProperty("costUSD")
    private double costUSD;
}
