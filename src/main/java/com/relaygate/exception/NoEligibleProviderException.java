package com.relaygate.exception;

import org.springframework.http.HttpStatus;

public class NoEligibleProviderException extends GatewayException {

    public NoEligibleProviderException(String message) {
        super("NO_ELIGIBLE_PROVIDER", HttpStatus.UNPROCESSABLE_ENTITY, message);
    }
}
