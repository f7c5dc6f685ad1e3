package com.relaygate.exception;

import org.springframework.http.HttpStatus;

public class RateLimitExceededException extends GatewayException {

    private final int limit;

    public RateLimitExceededException(String tenantId, int limit) {
        super("RATE_LIMITED", HttpStatus.TOO_MANY_REQUESTS,
                "Rate limit of " + limit + " requests exceeded for tenant " + tenantId);
        this.limit = limit;
    }

    public int getLimit() {
        return limit;
    }
}
