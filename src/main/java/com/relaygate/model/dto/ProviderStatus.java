package com.relaygate.model.dto;

import com.relaygate.model.ApiStyle;
import com.relaygate.model.AuthMethod;
import com.relaygate.model.CircuitState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Admin view of a registered provider. Credentials are never included.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProviderStatus {

    private String id;

    private boolean enabled;

    // enabled and holding a credential where one is required
    private boolean eligible;

    private int priority;

    private String baseEndpoint;

    private AuthMethod authMethod;

    private ApiStyle apiStyle;

    private List<String> models;

    private double priceInputPer1k;

    private double priceOutputPer1k;

    private double qualityScore;

    private CircuitState breaker;

    private double todaySpendUSD;

    private Double dailyLimitUSD;

    private boolean budgetExhausted;
}
