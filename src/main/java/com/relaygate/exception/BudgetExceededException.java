package com.relaygate.exception;

import org.springframework.http.HttpStatus;

/**
 * Spend would break the tenant's margin guardrail or the per-call cost ceiling.
 */
public class BudgetExceededException extends GatewayException {

    private final Double forecastRatio;

    public BudgetExceededException(String message) {
        this(message, null);
    }

    public BudgetExceededException(String message, Double forecastRatio) {
        super("BUDGET_EXCEEDED", HttpStatus.FORBIDDEN, message);
        this.forecastRatio = forecastRatio;
    }

    /**
     * Forecast spend divided by monthly revenue, or null when the ceiling that tripped
     * was the request's own {@code maxCostUSD}.
     */
    public Double getForecastRatio() {
        return forecastRatio;
    }
}
