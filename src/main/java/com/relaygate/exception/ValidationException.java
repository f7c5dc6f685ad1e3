package com.relaygate.exception;

import org.springframework.http.HttpStatus;

/**
 * Malformed request: missing or invalid idempotency key, unknown strategy, bad body.
 * Never retried.
 */
public class ValidationException extends GatewayException {

    public ValidationException(String message) {
        super("VALIDATION_ERROR", HttpStatus.BAD_REQUEST, message);
    }
}
