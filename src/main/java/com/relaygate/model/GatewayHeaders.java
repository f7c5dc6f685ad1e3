package com.relaygate.model;

/**
 * HTTP headers understood or emitted by the route endpoint.
 */
public class GatewayHeaders {

    // ========== Request Headers ==========

    /**
     * Client token identifying a logically identical retry. Required on
     * {@code POST /v1/route}.
     */
    public static final String IDEMPOTENCY_KEY = "Idempotency-Key";

    // ========== Response Headers ==========

    /**
     * Requests allowed per tenant per rate-limit window.
     */
    public static final String RATE_LIMIT_LIMIT = "X-RateLimit-Limit";

    /**
     * Requests left in the current window for the tenant.
     */
    public static final String RATE_LIMIT_REMAINING = "X-RateLimit-Remaining";

    /**
     * Actual cost of the call in USD, formatted to six decimals.
     */
    public static final String ROUTE_COST_USD = "X-Route-Cost-USD";

    /**
     * Provider that served the response.
     */
    public static final String ROUTE_PROVIDER = "X-Route-Provider";

    private GatewayHeaders() {
    }
}
