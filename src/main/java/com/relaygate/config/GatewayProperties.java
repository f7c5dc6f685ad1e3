package com.relaygate.config;

import com.relaygate.model.ApiStyle;
import com.relaygate.model.AuthMethod;
import com.relaygate.model.OptimizationStrategy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed configuration for the gateway. Every recognized option is listed here with
 * its default; the whole tree is validated once at startup.
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "gateway")
public class GatewayProperties {

    @Valid
    private Map<String, ProviderConfig> providers = new LinkedHashMap<>();

    @Valid
    private RoutingConfig routing = new RoutingConfig();

    @Valid
    private BreakerConfig breaker = new BreakerConfig();

    @Valid
    private IdempotencyConfig idempotency = new IdempotencyConfig();

    @Valid
    private BudgetConfig budget = new BudgetConfig();

    @Valid
    private RateLimitConfig rateLimit = new RateLimitConfig();

    @Valid
    private HttpConfig http = new HttpConfig();

    @Data
    public static class ProviderConfig {
        private boolean enabled = true;
        private String baseUrl;
        private String apiKey;
        @NotNull
        private AuthMethod authMethod = AuthMethod.BEARER;
        @NotNull
        private ApiStyle apiStyle = ApiStyle.OPENAI;
        private List<String> models = new ArrayList<>();
        @DecimalMin("0.0")
        private double priceInputPer1k;
        @DecimalMin("0.0")
        private double priceOutputPer1k;
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double qualityScore = 0.5;
        private int priority = 100;
    }

    @Data
    public static class RoutingConfig {
        @NotNull
        private OptimizationStrategy defaultStrategy = OptimizationStrategy.BALANCED;
        @Min(0)
        private int fallbackChainLength = 3;
        private List<String> speedTier = new ArrayList<>(List.of("groq", "gemini", "deepseek"));
        @NotNull
        private Duration requestDeadline = Duration.ofSeconds(10);
        @Min(1)
        private int maxOutputTokens = 1024;
    }

    @Data
    public static class BreakerConfig {
        @NotNull
        private Duration timeout = Duration.ofMillis(3000);
        @Min(1)
        @Max(100)
        private int errorThresholdPct = 50;
        @Min(1)
        private int slidingWindowSize = 10;
        @Min(1)
        private int minimumCalls = 1;
        @NotNull
        private Duration resetTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class IdempotencyConfig {
        @NotNull
        private StoreType store = StoreType.CAFFEINE;
        @Min(1)
        private long maxEntries = 50_000;
        @NotNull
        private Duration ttl = Duration.ofHours(24);
        @Min(1)
        private int maxKeyLength = 255;

        public enum StoreType {
            CAFFEINE,
            REDIS
        }
    }

    @Data
    public static class BudgetConfig {
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double guardrailRatio = 0.70;
        @DecimalMin("0.0")
        private double defaultMonthlyRevenue = 100.0;
        private Map<String, Double> tenantMonthlyRevenue = new LinkedHashMap<>();
        @Min(1)
        private int estimateUnits = 1000;
        private Map<String, Double> providerDailyLimits = new LinkedHashMap<>();
        @Min(1)
        private int usageRetention = 10_000;
    }

    @Data
    public static class RateLimitConfig {
        private boolean enabled = true;
        @Min(1)
        private int requestsPerWindow = 1000;
        @NotNull
        private Duration window = Duration.ofMinutes(1);
    }

    @Data
    public static class HttpConfig {
        @NotNull
        private Duration connectTimeout = Duration.ofSeconds(5);
    }
}
