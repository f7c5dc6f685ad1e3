package com.relaygate.exception;

import org.springframework.http.HttpStatus;

/**
 * Provider's breaker rejected the call without a network attempt. Recovered by
 * advancing the fallback chain.
 */
public class CircuitOpenException extends GatewayException {

    public CircuitOpenException(String providerId) {
        super("CIRCUIT_OPEN", HttpStatus.SERVICE_UNAVAILABLE, "Circuit open for provider " + providerId);
    }
}
