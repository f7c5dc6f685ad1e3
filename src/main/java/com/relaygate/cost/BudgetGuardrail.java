package com.relaygate.cost;

import com.relaygate.config.GatewayProperties;
import com.relaygate.exception.BudgetExceededException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Margin guardrail: a tenant may not be forecast to spend more than a fixed fraction
 * of its monthly revenue on providers.
 */
@Slf4j
@Component
public class BudgetGuardrail {

    private final GatewayProperties.BudgetConfig config;
    private final CostTracker costTracker;

    public BudgetGuardrail(GatewayProperties properties, CostTracker costTracker) {
        this.config = properties.getBudget();
        this.costTracker = costTracker;
    }

    /**
     * True when {@code forecastCostUSD / monthlyRevenue} is strictly above the guardrail
     * ratio. Tenants without positive revenue always trip.
     */
    public boolean wouldExceedBudget(String tenantId, double forecastCostUSD) {
        return forecastRatio(tenantId, forecastCostUSD) > config.getGuardrailRatio();
    }

    public double forecastRatio(String tenantId, double forecastCostUSD) {
        double revenue = monthlyRevenue(tenantId);
        if (revenue <= 0.0) {
            return Double.POSITIVE_INFINITY;
        }
        return forecastCostUSD / revenue;
    }

    /**
     * Reject a paid call whose forecast (month-to-date spend plus this estimate) would
     * break the guardrail. Free calls always pass.
     *
     * @throws BudgetExceededException when the guardrail trips
     */
    public void checkCall(String tenantId, double estimatedCostUSD) {
        if (estimatedCostUSD <= 0.0) {
            return;
        }
        double forecast = costTracker.monthToDateSpend(tenantId) + estimatedCostUSD;
        if (wouldExceedBudget(tenantId, forecast)) {
            double ratio = forecastRatio(tenantId, forecast);
            log.warn("Margin guardrail tripped for tenant {}: forecast ${} ratio {}",
                    tenantId, String.format("%.4f", forecast), ratio);
            throw new BudgetExceededException(
                    "Forecast spend would exceed " + Math.round(config.getGuardrailRatio() * 100)
                            + "% of monthly revenue",
                    Double.isInfinite(ratio) ? null : ratio);
        }
    }

    public double monthlyRevenue(String tenantId) {
        Double revenue = config.getTenantMonthlyRevenue().get(tenantId);
        return revenue != null ? revenue : config.getDefaultMonthlyRevenue();
    }
}
