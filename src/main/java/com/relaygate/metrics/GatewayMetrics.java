package com.relaygate.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Gateway meters, exported through the Prometheus scrape at {@code /metrics}.
 * Breaker state gauges are bound separately from the resilience4j registry.
 */
@Component
public class GatewayMetrics {

    private final MeterRegistry registry;

    public GatewayMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordBreakerTrip(String providerId) {
        Counter.builder("gateway.breaker.trips")
                .description("Transitions of a provider breaker into OPEN")
                .tag("provider", providerId)
                .register(registry)
                .increment();
    }

    public void recordUsage(String tenantId, long inputUnits, long outputUnits, double costUSD) {
        Counter.builder("gateway.tenant.cost.usd")
                .description("Provider spend attributed to a tenant")
                .tag("tenant", tenantId)
                .register(registry)
                .increment(costUSD);
        Counter.builder("gateway.tenant.units")
                .tag("tenant", tenantId)
                .tag("direction", "input")
                .register(registry)
                .increment(inputUnits);
        Counter.builder("gateway.tenant.units")
                .tag("tenant", tenantId)
                .tag("direction", "output")
                .register(registry)
                .increment(outputUnits);
    }

    public void recordRequest(String strategy, String outcome, Duration latency) {
        Timer.builder("gateway.request.latency")
                .description("End-to-end latency of routed requests")
                .tag("strategy", strategy)
                .tag("outcome", outcome)
                .publishPercentileHistogram()
                .register(registry)
                .record(latency);
    }

    public void recordIdempotentReplay() {
        Counter.builder("gateway.idempotency.replays")
                .description("Requests answered from the idempotency cache")
                .register(registry)
                .increment();
    }

    public MeterRegistry getRegistry() {
        return registry;
    }
}
