package com.relaygate.exception;

import org.springframework.http.HttpStatus;

/**
 * Provider answered with an error or an unreadable body. The message never contains
 * the upstream body.
 */
public class UpstreamCallException extends GatewayException {

    public UpstreamCallException(String message) {
        super("UPSTREAM_ERROR", HttpStatus.BAD_GATEWAY, message);
    }

    public UpstreamCallException(String message, Throwable cause) {
        super("UPSTREAM_ERROR", HttpStatus.BAD_GATEWAY, message, cause);
    }
}
