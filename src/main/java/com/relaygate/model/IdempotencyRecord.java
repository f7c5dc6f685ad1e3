package com.relaygate.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * A fully formed response stored against {@code hash(idempotencyKey + body)}.
 * Written once, read verbatim until it expires.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IdempotencyRecord {

    private String key;

    private int status;

    private String body;

    private Map<String, List<String>> headers;

    private Instant createdAt;

    private Instant expiresAt;

    public boolean isExpired(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }

    public GatewayResponse toResponse() {
        return GatewayResponse.builder()
                .status(status)
                .body(body)
                .headers(headers)
                .build();
    }
}
