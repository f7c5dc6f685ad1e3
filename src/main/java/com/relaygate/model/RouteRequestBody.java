package com.relaygate.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * JSON body of {@code POST /v1/route}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RouteRequestBody {

    @JsonProperty("prompt")
    private String prompt;

    @JsonProperty("tenantId")
    private String tenantId;

    @JsonProperty("strategy")
    private String strategy;

    @JsonProperty("maxCostUSD")
    private Double maxCostUSD;
}
