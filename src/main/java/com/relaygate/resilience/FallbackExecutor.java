package com.relaygate.resilience;

import com.relaygate.config.GatewayProperties;
import com.relaygate.exception.AllProvidersFailedException;
import com.relaygate.exception.GatewayException;
import com.relaygate.exception.UpstreamTimeoutException;
import com.relaygate.model.ProviderFailure;
import com.relaygate.model.ProviderInvocation;
import com.relaygate.model.ProviderResult;
import com.relaygate.model.RouteDecision;
import com.relaygate.provider.ProviderGateway;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Walks {@code [primary] + fallbackChain}, one breaker-gated attempt per provider,
 * and stops at the first success.
 *
 * Each attempt has its own timeout; a timeout counts as a failure on that provider's
 * breaker and moves on without retrying the same provider. The whole walk is bounded
 * by the request deadline. Timeouts cancel the in-flight call, which aborts the HTTP
 * exchange.
 */
@Slf4j
@Component
public class FallbackExecutor {

    private static final String DEADLINE = "(deadline)";

    private final ProviderGateway gateway;
    private final CircuitBreakerBank breakers;
    private final Duration attemptTimeout;
    private final Duration requestDeadline;

    public FallbackExecutor(ProviderGateway gateway, CircuitBreakerBank breakers, GatewayProperties properties) {
        this.gateway = gateway;
        this.breakers = breakers;
        this.attemptTimeout = properties.getBreaker().getTimeout();
        this.requestDeadline = properties.getRouting().getRequestDeadline();
    }

    /**
     * @return the first successful result, or {@link AllProvidersFailedException}
     * carrying the failure of every attempt in order
     */
    public Mono<ProviderResult> execute(RouteDecision decision, ProviderInvocation invocation) {
        List<String> order = decision.attemptOrder();
        List<ProviderFailure> failures = Collections.synchronizedList(new ArrayList<>());

        return Mono.defer(() -> attempt(order, 0, invocation, failures))
                .timeout(requestDeadline, Mono.defer(() -> {
                    List<ProviderFailure> soFar = snapshot(failures);
                    soFar.add(new ProviderFailure(DEADLINE, "DEADLINE_EXCEEDED",
                            "deadline exceeded after " + requestDeadline.toMillis() + "ms"));
                    log.warn("Request deadline of {}ms exceeded after {} attempts",
                            requestDeadline.toMillis(), soFar.size() - 1);
                    return Mono.error(new AllProvidersFailedException(soFar));
                }));
    }

    private Mono<ProviderResult> attempt(List<String> order,
                                         int index,
                                         ProviderInvocation invocation,
                                         List<ProviderFailure> failures) {
        if (index >= order.size()) {
            return Mono.error(new AllProvidersFailedException(snapshot(failures)));
        }

        String providerId = order.get(index);
        Mono<ProviderResult> call = Mono.defer(() -> gateway.invoke(providerId, invocation))
                .timeout(attemptTimeout);

        return breakers.execute(providerId, call)
                .onErrorMap(TimeoutException.class, e -> new UpstreamTimeoutException(providerId, attemptTimeout))
                .doOnSuccess(result -> {
                    if (index > 0) {
                        log.info("Provider {} served request after {} failed attempts", providerId, index);
                    }
                })
                .onErrorResume(error -> {
                    ProviderFailure failure = toFailure(providerId, error);
                    failures.add(failure);
                    log.warn("Provider {} failed ({}): {}", providerId, failure.getErrorCode(), failure.getReason());
                    return attempt(order, index + 1, invocation, failures);
                });
    }

    private ProviderFailure toFailure(String providerId, Throwable error) {
        if (error instanceof GatewayException) {
            GatewayException gatewayError = (GatewayException) error;
            return new ProviderFailure(providerId, gatewayError.getErrorCode(), gatewayError.getMessage());
        }
        log.debug("Unexpected error from provider {}", providerId, error);
        return new ProviderFailure(providerId, "UPSTREAM_ERROR", "unexpected " + error.getClass().getSimpleName());
    }

    private List<ProviderFailure> snapshot(List<ProviderFailure> failures) {
        synchronized (failures) {
            return new ArrayList<>(failures);
        }
    }
}
