package com.relaygate.service;

import com.relaygate.config.GatewayProperties;
import com.relaygate.cost.CostTracker;
import com.relaygate.cost.UsagePeriod;
import com.relaygate.exception.ValidationException;
import com.relaygate.model.CircuitState;
import com.relaygate.model.ProviderDescriptor;
import com.relaygate.model.dto.CostProjection;
import com.relaygate.model.dto.CostSummary;
import com.relaygate.model.dto.ProviderStatus;
import com.relaygate.registry.ProviderCatalogLoader;
import com.relaygate.registry.ProviderRegistry;
import com.relaygate.resilience.CircuitBreakerBank;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Service for provider administration and spend reporting.
 */
@Slf4j
@Service
public class AdminService {

    private final ProviderRegistry registry;
    private final ProviderCatalogLoader catalogLoader;
    private final CircuitBreakerBank breakers;
    private final CostTracker costTracker;
    private final GatewayProperties properties;

    public AdminService(ProviderRegistry registry,
                        ProviderCatalogLoader catalogLoader,
                        CircuitBreakerBank breakers,
                        CostTracker costTracker,
                        GatewayProperties properties) {
        this.registry = registry;
        this.catalogLoader = catalogLoader;
        this.breakers = breakers;
        this.costTracker = costTracker;
        this.properties = properties;
    }

    /**
     * All registered providers, eligible or not, in routing order.
     */
    public List<ProviderStatus> getProviders() {
        return registry.all().stream()
                .map(this::toStatus)
                .toList();
    }

    /**
     * Replace the provider catalog. The new catalog is validated in full before it is
     * swapped in; on error the current catalog stays.
     */
    public List<ProviderStatus> reloadProviders(Map<String, GatewayProperties.ProviderConfig> providers) {
        List<ProviderDescriptor> descriptors;
        try {
            descriptors = catalogLoader.load(providers);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid provider catalog: " + e.getMessage());
        }

        registry.reload(descriptors);
        log.info("Admin: provider catalog reloaded with {} providers", descriptors.size());
        return getProviders();
    }

    public List<CircuitState> getBreakers() {
        return breakers.states();
    }

    public CostSummary getUsageSummary(String period) {
        UsagePeriod usagePeriod = UsagePeriod.fromValue(period)
                .orElseThrow(() -> new ValidationException("Unknown period: " + period));
        return costTracker.summary(usagePeriod);
    }

    public CostProjection getProjection() {
        return costTracker.projection();
    }

    private ProviderStatus toStatus(ProviderDescriptor provider) {
        Double dailyLimit = properties.getBudget().getProviderDailyLimits().get(provider.getId());

        return ProviderStatus.builder()
                .id(provider.getId())
                .enabled(provider.isEnabled())
                .eligible(provider.isEligible())
                .priority(provider.getPriority())
                .baseEndpoint(provider.getBaseEndpoint())
                .authMethod(provider.getAuthMethod())
                .apiStyle(provider.getApiStyle())
                .models(provider.getSupportedModels())
                .priceInputPer1k(provider.getPriceInputPer1k())
                .priceOutputPer1k(provider.getPriceOutputPer1k())
                .qualityScore(provider.getQualityScore())
                .breaker(breakers.state(provider.getId()))
                .todaySpendUSD(costTracker.todaySpend(provider.getId()))
                .dailyLimitUSD(dailyLimit)
                .budgetExhausted(costTracker.isProviderBudgetExhausted(provider.getId()))
                .build();
    }
}
