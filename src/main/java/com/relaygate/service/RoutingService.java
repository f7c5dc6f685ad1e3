package com.relaygate.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.relaygate.config.GatewayProperties;
import com.relaygate.cost.CostTracker;
import com.relaygate.exception.AllProvidersFailedException;
import com.relaygate.exception.BudgetExceededException;
import com.relaygate.exception.GatewayException;
import com.relaygate.exception.NoEligibleProviderException;
import com.relaygate.exception.RateLimitExceededException;
import com.relaygate.exception.ValidationException;
import com.relaygate.metrics.GatewayMetrics;
import com.relaygate.model.ComplexityClass;
import com.relaygate.model.ErrorResponse;
import com.relaygate.model.GatewayHeaders;
import com.relaygate.model.GatewayResponse;
import com.relaygate.model.OptimizationStrategy;
import com.relaygate.model.ProviderDescriptor;
import com.relaygate.model.ProviderInvocation;
import com.relaygate.model.ProviderResult;
import com.relaygate.model.RouteDecision;
import com.relaygate.model.RouteRequest;
import com.relaygate.model.RouteRequestBody;
import com.relaygate.model.RouteResponse;
import com.relaygate.model.UsageRecord;
import com.relaygate.ratelimit.TenantRateLimiter;
import com.relaygate.registry.ProviderRegistry;
import com.relaygate.resilience.FallbackExecutor;
import com.relaygate.routing.ComplexityAnalyzer;
import com.relaygate.routing.RouteSelector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Main routing service: validates the request, applies the tenant rate limit, picks a
 * route and walks it, then records the spend.
 *
 * Every expected failure is turned into a fully formed {@link GatewayResponse} here so
 * the idempotency layer can decide whether to store it. Unexpected exceptions propagate.
 */
@Slf4j
@Service
public class RoutingService {

    private final ObjectMapper objectMapper;
    private final ComplexityAnalyzer complexityAnalyzer;
    private final ProviderRegistry registry;
    private final RouteSelector routeSelector;
    private final FallbackExecutor fallbackExecutor;
    private final CostTracker costTracker;
    private final TenantRateLimiter rateLimiter;
    private final GatewayMetrics metrics;
    private final Clock clock;
    private final GatewayProperties.RoutingConfig config;

    public RoutingService(ObjectMapper objectMapper,
                          ComplexityAnalyzer complexityAnalyzer,
                          ProviderRegistry registry,
                          RouteSelector routeSelector,
                          FallbackExecutor fallbackExecutor,
                          CostTracker costTracker,
                          TenantRateLimiter rateLimiter,
                          GatewayMetrics metrics,
                          Clock clock,
                          GatewayProperties properties) {
        this.objectMapper = objectMapper;
        this.complexityAnalyzer = complexityAnalyzer;
        this.registry = registry;
        this.routeSelector = routeSelector;
        this.fallbackExecutor = fallbackExecutor;
        this.costTracker = costTracker;
        this.rateLimiter = rateLimiter;
        this.metrics = metrics;
        this.clock = clock;
        this.config = properties.getRouting();
    }

    /**
     * Route one raw {@code POST /v1/route} body.
     */
    public Mono<GatewayResponse> route(String rawBody) {
        long started = System.nanoTime();

        RouteRequest request;
        try {
            request = parse(rawBody);
        } catch (ValidationException e) {
            log.debug("Rejected route request: {}", e.getMessage());
            recordLatency("unknown", e.getErrorCode(), started);
            return Mono.just(error(e, Map.of()));
        }

        String strategy = request.getStrategy().name().toLowerCase(Locale.ROOT);

        return Mono.defer(() -> process(request))
                .doOnNext(response -> recordLatency(strategy, "success", started))
                .onErrorResume(GatewayException.class, e -> {
                    log.warn("Route failed for tenant {}: [{}] {}", request.getTenantId(), e.getErrorCode(), e.getMessage());
                    recordLatency(strategy, e.getErrorCode(), started);
                    return Mono.just(error(e, rateLimitHeaders(request.getTenantId())));
                });
    }

    private Mono<GatewayResponse> process(RouteRequest request) {
        String tenantId = request.getTenantId();
        if (!rateLimiter.tryAcquire(tenantId)) {
            throw new RateLimitExceededException(tenantId, rateLimiter.getLimit());
        }

        ComplexityClass complexity = complexityAnalyzer.classify(request.getPromptText());

        List<ProviderDescriptor> candidates = registry.list().stream()
                .filter(p -> !costTracker.isProviderBudgetExhausted(p.getId()))
                .toList();
        if (candidates.isEmpty() && !registry.list().isEmpty()) {
            throw new NoEligibleProviderException("Every enabled provider has exhausted its daily budget");
        }

        RouteDecision decision = routeSelector.selectForTenant(
                tenantId, request.getStrategy(), complexity, candidates, request.getMaxCostUSD());

        ProviderInvocation invocation = ProviderInvocation.builder()
                .prompt(request.getPromptText())
                .maxTokens(config.getMaxOutputTokens())
                .build();

        return fallbackExecutor.execute(decision, invocation)
                .map(result -> success(tenantId, decision, result));
    }

    private GatewayResponse success(String tenantId, RouteDecision decision, ProviderResult result) {
        double cost = registry.get(result.getProviderId())
                .map(p -> costTracker.costOf(p, result.getInputUnits(), result.getOutputUnits()))
                .orElse(0.0);

        costTracker.record(UsageRecord.builder()
                .tenantId(tenantId)
                .providerId(result.getProviderId())
                .inputUnits(result.getInputUnits())
                .outputUnits(result.getOutputUnits())
                .costUSD(cost)
                .timestamp(clock.instant())
                .build());

        log.info("Routed tenant {} to {} ({}), cost=${}",
                tenantId, result.getProviderId(), decision.getReason(), formatCost(cost));

        Map<String, List<String>> headers = rateLimitHeaders(tenantId);
        headers.put(GatewayHeaders.ROUTE_PROVIDER, List.of(result.getProviderId()));
        headers.put(GatewayHeaders.ROUTE_COST_USD, List.of(formatCost(cost)));

        RouteResponse body = RouteResponse.builder()
                .providerId(result.getProviderId())
                .content(result.getContent())
                .costUSD(cost)
                .build();

        return GatewayResponse.builder()
                .status(200)
                .body(toJson(body))
                .headers(headers)
                .build();
    }

    private GatewayResponse error(GatewayException e, Map<String, List<String>> headers) {
        ErrorResponse.ErrorResponseBuilder body = ErrorResponse.builder()
                .errorCode(e.getErrorCode())
                .message(e.getMessage());
        if (e instanceof AllProvidersFailedException) {
            body.failures(((AllProvidersFailedException) e).getFailures());
        }
        if (e instanceof BudgetExceededException) {
            body.forecastRatio(((BudgetExceededException) e).getForecastRatio());
        }

        return GatewayResponse.builder()
                .status(e.getStatus().value())
                .body(toJson(body.build()))
                .headers(headers)
                .build();
    }

    /**
     * @throws ValidationException for a malformed body or out-of-range field
     */
    RouteRequest parse(String rawBody) {
        if (rawBody == null || rawBody.isBlank()) {
            throw new ValidationException("Request body is required");
        }

        RouteRequestBody body;
        try {
            body = objectMapper.readValue(rawBody, RouteRequestBody.class);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Malformed JSON body");
        }
        if (body == null) {
            throw new ValidationException("Request body is required");
        }

        if (body.getPrompt() == null || body.getPrompt().isEmpty()) {
            throw new ValidationException("prompt is required");
        }
        if (body.getTenantId() == null || body.getTenantId().isBlank()) {
            throw new ValidationException("tenantId is required");
        }

        OptimizationStrategy strategy = config.getDefaultStrategy();
        if (body.getStrategy() != null) {
            strategy = OptimizationStrategy.fromValue(body.getStrategy())
                    .orElseThrow(() -> new ValidationException("Unknown strategy: " + body.getStrategy()));
        }

        Double maxCost = body.getMaxCostUSD();
        if (maxCost != null && (maxCost.isNaN() || maxCost < 0)) {
            throw new ValidationException("maxCostUSD must be a non-negative number");
        }

        return RouteRequest.builder()
                .promptText(body.getPrompt())
                .tenantId(body.getTenantId())
                .strategy(strategy)
                .maxCostUSD(maxCost)
                .build();
    }

    private Map<String, List<String>> rateLimitHeaders(String tenantId) {
        Map<String, List<String>> headers = new LinkedHashMap<>();
        headers.put(GatewayHeaders.RATE_LIMIT_LIMIT, List.of(String.valueOf(rateLimiter.getLimit())));
        headers.put(GatewayHeaders.RATE_LIMIT_REMAINING, List.of(String.valueOf(rateLimiter.remaining(tenantId))));
        return headers;
    }

    private String toJson(Object body) {
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize response body", e);
        }
    }

    private void recordLatency(String strategy, String outcome, long startedNanos) {
        metrics.recordRequest(strategy, outcome, Duration.ofNanos(System.nanoTime() - startedNanos));
    }

    private static String formatCost(double cost) {
        return String.format(Locale.ROOT, "%.6f", cost);
    }
}
