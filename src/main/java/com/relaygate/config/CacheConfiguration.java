package com.relaygate.config;

import com.relaygate.idempotency.CaffeineIdempotencyStore;
import com.relaygate.idempotency.IdempotencyStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.cache.CaffeineCacheMetrics;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * In-process Caffeine idempotency store, the default.
 */
@Configuration
@ConditionalOnProperty(prefix = "gateway.idempotency", name = "store", havingValue = "CAFFEINE", matchIfMissing = true)
public class CacheConfiguration {

    private final GatewayProperties properties;

    public CacheConfiguration(GatewayProperties properties) {
        this.properties = properties;
    }

    @Bean
    public IdempotencyStore idempotencyStore(MeterRegistry meterRegistry) {
        GatewayProperties.IdempotencyConfig config = properties.getIdempotency();
        CaffeineIdempotencyStore store = new CaffeineIdempotencyStore(config.getMaxEntries(), config.getTtl());
        CaffeineCacheMetrics.monitor(meterRegistry, store.getCache(), "idempotency");
        return store;
    }
}
