package com.relaygate.ratelimit;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.relaygate.config.GatewayProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.TimeUnit;

/**
 * Sliding-window request limiter, one window of timestamps per tenant.
 * Single-instance only; the windows live in memory.
 *
 * A tenant idle for a whole window has nothing left to count, so its entry expires
 * after one window without access. Per-tenant updates run inside the map's compute.
 */
@Slf4j
@Component
public class TenantRateLimiter {

    private final GatewayProperties.RateLimitConfig config;
    private final Clock clock;

    /** tenant -> request timestamps (epoch millis) inside the window */
    private final Cache<String, Deque<Long>> windows;

    public TenantRateLimiter(GatewayProperties properties, Clock clock) {
        this.config = properties.getRateLimit();
        this.clock = clock;
        this.windows = Caffeine.newBuilder()
                .expireAfterAccess(config.getWindow())
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .executor(Runnable::run)
                .build();
    }

    public boolean tryAcquire(String tenantId) {
        if (!config.isEnabled()) {
            return true;
        }

        long now = clock.millis();
        boolean[] admitted = new boolean[1];

        windows.asMap().compute(tenantId, (id, existing) -> {
            Deque<Long> timestamps = existing == null ? new ArrayDeque<>() : existing;
            evictExpired(timestamps, now);

            if (timestamps.size() >= config.getRequestsPerWindow()) {
                log.debug("Tenant {} hit rate limit ({}/{})", id, timestamps.size(), config.getRequestsPerWindow());
                return timestamps;
            }

            timestamps.addLast(now);
            admitted[0] = true;
            return timestamps;
        });
        return admitted[0];
    }

    public int remaining(String tenantId) {
        long now = clock.millis();
        int[] used = new int[1];

        // an emptied window is dropped rather than kept
        windows.asMap().computeIfPresent(tenantId, (id, timestamps) -> {
            evictExpired(timestamps, now);
            used[0] = timestamps.size();
            return timestamps.isEmpty() ? null : timestamps;
        });
        return Math.max(0, config.getRequestsPerWindow() - used[0]);
    }

    public int getLimit() {
        return config.getRequestsPerWindow();
    }

    /**
     * Number of tenants with a live window, after expired entries are purged.
     */
    long trackedTenants() {
        windows.cleanUp();
        return windows.estimatedSize();
    }

    private void evictExpired(Deque<Long> timestamps, long now) {
        long windowStart = now - config.getWindow().toMillis();
        while (!timestamps.isEmpty() && timestamps.peekFirst() <= windowStart) {
            timestamps.pollFirst();
        }
    }
}
