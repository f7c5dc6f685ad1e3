package com.relaygate.registry;

import com.relaygate.config.GatewayProperties;
import com.relaygate.model.ProviderDescriptor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Turns provider configuration into validated, ordered descriptors.
 *
 * Order: ascending priority, ties keep configuration order. This order is the
 * registry iteration order every strategy tie-breaks on.
 */
@Slf4j
@Component
public class ProviderCatalogLoader {

    /**
     * Build descriptors from a configuration map.
     *
     * @param providers provider id to configuration, in declaration order
     * @return descriptors sorted by priority (stable)
     * @throws IllegalArgumentException if an entry is invalid
     */
    public List<ProviderDescriptor> load(Map<String, GatewayProperties.ProviderConfig> providers) {
        List<ProviderDescriptor> descriptors = new ArrayList<>();
        if (providers == null) {
            return descriptors;
        }

        providers.forEach((id, config) -> descriptors.add(toDescriptor(id, config)));

        // List.sort is stable
        descriptors.sort(Comparator.comparingInt(ProviderDescriptor::getPriority));

        log.info("Loaded provider catalog: {}",
                descriptors.stream()
                        .map(d -> d.getId() + (d.isEligible() ? "" : "(disabled)"))
                        .toList());
        return descriptors;
    }

    private ProviderDescriptor toDescriptor(String id, GatewayProperties.ProviderConfig config) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Provider id must not be blank");
        }
        if (config == null) {
            throw new IllegalArgumentException("Provider " + id + " has no configuration");
        }
        if (config.isEnabled() && (config.getBaseUrl() == null || config.getBaseUrl().isBlank())) {
            throw new IllegalArgumentException("Provider " + id + " is enabled but has no base-url");
        }
        if (config.getQualityScore() < 0.0 || config.getQualityScore() > 1.0) {
            throw new IllegalArgumentException("Provider " + id + " quality-score must be within [0,1]");
        }
        if (config.getPriceInputPer1k() < 0.0 || config.getPriceOutputPer1k() < 0.0) {
            throw new IllegalArgumentException("Provider " + id + " prices must not be negative");
        }
        if (config.getAuthMethod() == null || config.getApiStyle() == null) {
            throw new IllegalArgumentException("Provider " + id + " needs auth-method and api-style");
        }

        return ProviderDescriptor.builder()
                .id(id)
                .baseEndpoint(stripTrailingSlash(config.getBaseUrl()))
                .authMethod(config.getAuthMethod())
                .apiStyle(config.getApiStyle())
                .apiKey(config.getApiKey())
                .supportedModels(config.getModels() == null ? List.of() : config.getModels())
                .priceInputPer1k(config.getPriceInputPer1k())
                .priceOutputPer1k(config.getPriceOutputPer1k())
                .qualityScore(config.getQualityScore())
                .priority(config.getPriority())
                .enabled(config.isEnabled())
                .build();
    }

    private String stripTrailingSlash(String url) {
        if (url == null) {
            return null;
        }
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
