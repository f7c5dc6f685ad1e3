package com.relaygate.idempotency;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.relaygate.model.IdempotencyRecord;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Optional;

/**
 * In-process idempotency store. Bounded by entry count and expired by write time;
 * when full, Caffeine's size-based policy decides which entry goes.
 */
@Slf4j
public class CaffeineIdempotencyStore implements IdempotencyStore {

    private final Cache<String, IdempotencyRecord> cache;

    public CaffeineIdempotencyStore(long maxEntries, Duration ttl) {
        this(maxEntries, ttl, Ticker.systemTicker());
    }

    public CaffeineIdempotencyStore(long maxEntries, Duration ttl, Ticker ticker) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxEntries)
                .expireAfterWrite(ttl)
                .ticker(ticker)
                .recordStats()
                .build();
        log.info("Idempotency store: caffeine, maxEntries={}, ttl={}", maxEntries, ttl);
    }

    @Override
    public Optional<IdempotencyRecord> get(String recordKey) {
        return Optional.ofNullable(cache.getIfPresent(recordKey));
    }

    @Override
    public boolean putIfAbsent(IdempotencyRecord record) {
        return cache.asMap().putIfAbsent(record.getKey(), record) == null;
    }

    @Override
    public void evict(String recordKey) {
        cache.invalidate(recordKey);
    }

    @Override
    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    /**
     * Exposed for cache metrics binding and tests.
     */
    public Cache<String, IdempotencyRecord> getCache() {
        return cache;
    }
}
