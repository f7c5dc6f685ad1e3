package com.relaygate.resilience;

import com.relaygate.exception.CircuitOpenException;
import com.relaygate.exception.UpstreamCallException;
import com.relaygate.metrics.GatewayMetrics;
import com.relaygate.model.BreakerState;
import com.relaygate.model.CircuitState;
import com.relaygate.model.ProviderDescriptor;
import com.relaygate.registry.ProviderRegistry;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * One breaker per known provider, kept in step with the registry.
 *
 * State transitions are delegated to resilience4j's state machine, which is
 * linearizable per breaker: in HALF_OPEN exactly one trial call holds the permit and
 * every other caller gets a {@link CircuitOpenException} until it resolves.
 */
@Slf4j
@Component
public class CircuitBreakerBank {

    private final CircuitBreakerRegistry breakers;
    private final GatewayMetrics metrics;
    private final Clock clock;
    private final Map<String, Timestamps> timestamps = new ConcurrentHashMap<>();

    public CircuitBreakerBank(CircuitBreakerRegistry breakers,
                              ProviderRegistry providers,
                              GatewayMetrics metrics,
                              Clock clock) {
        this.breakers = breakers;
        this.metrics = metrics;
        this.clock = clock;

        // Fires once per breaker instance, so listeners are never attached twice
        breakers.getEventPublisher().onEntryAdded(event -> attachListeners(event.getAddedEntry()));

        reconcile(providers.all());
        providers.addReloadListener(this::reconcile);
    }

    /**
     * Create breakers for new providers and drop those of removed ones. Existing
     * breakers keep their state across a reload.
     */
    public synchronized void reconcile(List<ProviderDescriptor> descriptors) {
        Set<String> ids = descriptors.stream().map(ProviderDescriptor::getId).collect(Collectors.toSet());

        ids.forEach(breakers::circuitBreaker);

        breakers.getAllCircuitBreakers().stream()
                .map(CircuitBreaker::getName)
                .filter(name -> !ids.contains(name))
                .toList()
                .forEach(name -> {
                    breakers.remove(name);
                    timestamps.remove(name);
                    log.info("Removed breaker for deregistered provider {}", name);
                });
    }

    /**
     * Run a call through the provider's breaker. A rejected call emits
     * {@link CircuitOpenException} without subscribing to {@code call}.
     */
    public <T> Mono<T> execute(String providerId, Mono<T> call) {
        CircuitBreaker breaker = breakers.find(providerId).orElse(null);
        if (breaker == null) {
            return Mono.error(new UpstreamCallException("Provider " + providerId + " has no breaker"));
        }
        return call.transformDeferred(CircuitBreakerOperator.of(breaker))
                .onErrorMap(CallNotPermittedException.class, e -> new CircuitOpenException(providerId));
    }

    /**
     * @return the breaker snapshot, or {@code null} when the provider has no breaker
     */
    public CircuitState state(String providerId) {
        CircuitBreaker breaker = breakers.find(providerId).orElse(null);
        if (breaker == null) {
            return null;
        }
        Timestamps times = timestamps.getOrDefault(providerId, Timestamps.EMPTY);
        CircuitBreaker.Metrics breakerMetrics = breaker.getMetrics();

        return CircuitState.builder()
                .providerId(providerId)
                .state(map(breaker.getState()))
                .failureCount(breakerMetrics.getNumberOfFailedCalls())
                .failureRatePct(Math.max(0f, breakerMetrics.getFailureRate()))
                .lastFailureAt(times.lastFailureAt())
                .openedAt(times.openedAt())
                .build();
    }

    public List<CircuitState> states() {
        return breakers.getAllCircuitBreakers().stream()
                .map(CircuitBreaker::getName)
                .sorted()
                .map(this::state)
                .filter(Objects::nonNull)
                .toList();
    }

    private void attachListeners(CircuitBreaker breaker) {
        String providerId = breaker.getName();
        breaker.getEventPublisher()
                .onError(event -> timestamps.compute(providerId,
                        (id, t) -> (t == null ? Timestamps.EMPTY : t).withLastFailureAt(clock.instant())))
                .onStateTransition(event -> {
                    CircuitBreaker.State to = event.getStateTransition().getToState();
                    log.info("Breaker {} transitioned {}", providerId, event.getStateTransition());
                    if (to == CircuitBreaker.State.OPEN) {
                        timestamps.compute(providerId,
                                (id, t) -> (t == null ? Timestamps.EMPTY : t).withOpenedAt(clock.instant()));
                        metrics.recordBreakerTrip(providerId);
                    } else if (to == CircuitBreaker.State.CLOSED) {
                        timestamps.computeIfPresent(providerId, (id, t) -> t.withOpenedAt(null));
                    }
                });
    }

    private BreakerState map(CircuitBreaker.State state) {
        return switch (state) {
            case OPEN, FORCED_OPEN -> BreakerState.OPEN;
            case HALF_OPEN -> BreakerState.HALF_OPEN;
            default -> BreakerState.CLOSED;
        };
    }

    private record Timestamps(Instant lastFailureAt, Instant openedAt) {
        static final Timestamps EMPTY = new Timestamps(null, null);

        Timestamps withLastFailureAt(Instant at) {
            return new Timestamps(at, openedAt);
        }

        Timestamps withOpenedAt(Instant at) {
            return new Timestamps(lastFailureAt, at);
        }
    }
}
