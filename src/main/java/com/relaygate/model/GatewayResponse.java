package com.relaygate.model;

import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Fully formed HTTP response for the route endpoint: status, serialized body and the
 * gateway's own headers. This is the unit the idempotency cache stores and replays.
 */
@Value
@Builder(toBuilder = true)
public class GatewayResponse {

    int status;

    String body;

    @Builder.Default
    Map<String, List<String>> headers = Collections.emptyMap();

    /**
     * Statuses that are final for the client. Retryable outcomes (429, 5xx) are never
     * recorded so a transient failure does not poison the key.
     */
    public boolean isCacheable() {
        return (status >= 200 && status < 300)
                || status == 400
                || status == 403
                || status == 422;
    }
}
