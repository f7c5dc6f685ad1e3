package com.relaygate.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Structured body for every user-visible failure.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    @JsonProperty("errorCode")
    private String errorCode;

    @JsonProperty("message")
    private String message;

    // Only for ALL_PROVIDERS_FAILED
    @JsonProperty("failures")
    private List<ProviderFailure> failures;

    // Only for BUDGET_EXCEEDED from the guardrail
    @JsonProperty("forecastRatio")
    private Double forecastRatio;
}
