package com.relaygate.idempotency;

import com.relaygate.config.GatewayProperties;
import com.relaygate.exception.ValidationException;
import com.relaygate.metrics.GatewayMetrics;
import com.relaygate.model.GatewayResponse;
import com.relaygate.model.IdempotencyRecord;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Replays the stored response for a repeated {@code (Idempotency-Key, body)} pair.
 *
 * Concurrent requests for the same pair share one execution: the first runs the
 * handler, the rest subscribe to its result. Only final statuses are stored.
 */
@Slf4j
@Service
public class IdempotencyService {

    private final IdempotencyStore store;
    private final GatewayMetrics metrics;
    private final Clock clock;
    private final Duration ttl;
    private final int maxKeyLength;

    private final Map<String, Mono<GatewayResponse>> inFlight = new ConcurrentHashMap<>();

    public IdempotencyService(IdempotencyStore store,
                              GatewayMetrics metrics,
                              Clock clock,
                              GatewayProperties properties) {
        this.store = store;
        this.metrics = metrics;
        this.clock = clock;
        this.ttl = properties.getIdempotency().getTtl();
        this.maxKeyLength = properties.getIdempotency().getMaxKeyLength();
    }

    /**
     * Return the stored response for this key and body, or run {@code handler} once and
     * store its response if it is final.
     */
    public Mono<GatewayResponse> execute(String idempotencyKey, String body, Supplier<Mono<GatewayResponse>> handler) {
        try {
            validateKey(idempotencyKey);
        } catch (ValidationException e) {
            return Mono.error(e);
        }

        String recordKey = recordKey(idempotencyKey, body);
        Optional<GatewayResponse> replay = check(recordKey);
        if (replay.isPresent()) {
            return Mono.just(replay.get());
        }

        return inFlight.computeIfAbsent(recordKey, key -> Mono.defer(() -> check(key)
                        .map(Mono::just)
                        .orElseGet(() -> handler.get().doOnNext(response -> store(key, response))))
                .doFinally(signal -> inFlight.remove(key))
                .cache());
    }

    public Optional<GatewayResponse> check(String recordKey) {
        Optional<IdempotencyRecord> record = store.get(recordKey);
        if (record.isPresent() && record.get().isExpired(clock.instant())) {
            store.evict(recordKey);
            return Optional.empty();
        }
        if (record.isPresent()) {
            metrics.recordIdempotentReplay();
            log.debug("Idempotent replay: key={}, status={}", recordKey, record.get().getStatus());
        }
        return record.map(IdempotencyRecord::toResponse);
    }

    /**
     * Store a response if its status is final. Transient failures are not stored.
     */
    public void store(String recordKey, GatewayResponse response) {
        if (!response.isCacheable()) {
            log.debug("Not storing status {} for key {}", response.getStatus(), recordKey);
            return;
        }

        Instant now = clock.instant();
        IdempotencyRecord record = IdempotencyRecord.builder()
                .key(recordKey)
                .status(response.getStatus())
                .body(response.getBody())
                .headers(response.getHeaders())
                .createdAt(now)
                .expiresAt(now.plus(ttl))
                .build();

        if (!store.putIfAbsent(record)) {
            log.debug("Idempotency record already present: {}", recordKey);
        }
    }

    /**
     * SHA-256 of the key and the raw body: the same key with a different body is a
     * different request.
     */
    public String recordKey(String idempotencyKey, String body) {
        return DigestUtils.sha256Hex(idempotencyKey + "\n" + (body == null ? "" : body));
    }

    /**
     * @throws ValidationException unless the key is 1 to {@code max-key-length}
     *                             printable ASCII characters and not blank
     */
    public void validateKey(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new ValidationException("Idempotency-Key header is required");
        }
        if (idempotencyKey.length() > maxKeyLength) {
            throw new ValidationException("Idempotency-Key must be at most " + maxKeyLength + " characters");
        }
        for (int i = 0; i < idempotencyKey.length(); i++) {
            char c = idempotencyKey.charAt(i);
            if (c < 0x20 || c > 0x7E) {
                throw new ValidationException("Idempotency-Key must contain only printable ASCII characters");
            }
        }
    }

    int inFlightCount() {
        return inFlight.size();
    }
}
