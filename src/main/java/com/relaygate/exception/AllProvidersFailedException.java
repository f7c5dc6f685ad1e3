package com.relaygate.exception;

import com.relaygate.model.ProviderFailure;
import org.springframework.http.HttpStatus;

import java.util.List;

/**
 * Every entry of the fallback chain failed. Carries the per-provider reasons in
 * attempt order.
 */
public class AllProvidersFailedException extends GatewayException {

    private final List<ProviderFailure> failures;

    public AllProvidersFailedException(List<ProviderFailure> failures) {
        super("ALL_PROVIDERS_FAILED", HttpStatus.SERVICE_UNAVAILABLE,
                "All " + failures.size() + " provider attempts failed");
        this.failures = List.copyOf(failures);
    }

    public List<ProviderFailure> getFailures() {
        return failures;
    }
}
