package com.relaygate.config;

import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.micrometer.tagged.TaggedCircuitBreakerMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Resilience4j wiring for the per-provider breakers.
 */
@Slf4j
@Configuration
public class ResilienceConfiguration {

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(GatewayProperties properties, MeterRegistry meterRegistry) {
        CircuitBreakerRegistry registry = CircuitBreakerRegistry.of(breakerConfig(properties.getBreaker()));

        // resilience4j_circuitbreaker_state{name=<provider>} and friends
        TaggedCircuitBreakerMetrics.ofCircuitBreakerRegistry(registry).bindTo(meterRegistry);

        log.info("Configured provider breakers: threshold={}%, window={}, resetTimeout={}",
                properties.getBreaker().getErrorThresholdPct(),
                properties.getBreaker().getSlidingWindowSize(),
                properties.getBreaker().getResetTimeout());
        return registry;
    }

    /**
     * Count-based window; opens when the failure rate reaches the threshold once the
     * minimum number of calls is recorded. HALF_OPEN admits exactly one trial call and
     * is entered lazily on the first call after the reset timeout.
     */
    public static CircuitBreakerConfig breakerConfig(GatewayProperties.BreakerConfig config) {
        return CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(config.getSlidingWindowSize())
                .minimumNumberOfCalls(config.getMinimumCalls())
                .failureRateThreshold(config.getErrorThresholdPct())
                .waitDurationInOpenState(config.getResetTimeout())
                .permittedNumberOfCallsInHalfOpenState(1)
                .automaticTransitionFromOpenToHalfOpenEnabled(false)
                .build();
    }
}
