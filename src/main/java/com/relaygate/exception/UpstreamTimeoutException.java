package com.relaygate.exception;

import org.springframework.http.HttpStatus;

import java.time.Duration;

public class UpstreamTimeoutException extends GatewayException {

    public UpstreamTimeoutException(String providerId, Duration timeout) {
        super("UPSTREAM_TIMEOUT", HttpStatus.GATEWAY_TIMEOUT,
                "Provider " + providerId + " did not answer within " + timeout.toMillis() + "ms");
    }
}
