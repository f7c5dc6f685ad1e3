package com.relaygate.exception;

import org.springframework.http.HttpStatus;

/**
 * Base exception for gateway failures. Carries a stable error code and the HTTP status
 * it maps to when surfaced to a client.
 */
public class GatewayException extends RuntimeException {

    private final String errorCode;
    private final HttpStatus status;

    public GatewayException(String errorCode, HttpStatus status, String message) {
        super(message);
        this.errorCode = errorCode;
        this.status = status;
    }

    public GatewayException(String errorCode, HttpStatus status, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.status = status;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
