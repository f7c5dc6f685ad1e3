package com.relaygate.idempotency;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.relaygate.model.IdempotencyRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.Duration;
import java.util.Optional;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Redis-backed idempotency store, shared between gateway instances.
 * Key pattern: idempotency:{recordKey}. Values are gzipped JSON; expiry is left to Redis.
 *
 * Redis failures degrade to a miss (get) or a skipped write (put): a broken store must
 * not fail the request it is meant to deduplicate.
 */
@Slf4j
public class RedisIdempotencyStore implements IdempotencyStore {

    static final String KEY_PREFIX = "idempotency:";

    private final RedisTemplate<String, byte[]> redisTemplate;
    private final ObjectMapper objectMapper;
    private final Duration ttl;

    public RedisIdempotencyStore(RedisTemplate<String, byte[]> redisTemplate, ObjectMapper objectMapper, Duration ttl) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.ttl = ttl;
    }

    @Override
    public Optional<IdempotencyRecord> get(String recordKey) {
        try {
            byte[] compressed = redisTemplate.opsForValue().get(KEY_PREFIX + recordKey);
            if (compressed == null) {
                return Optional.empty();
            }
            return Optional.of(decompress(compressed));
        } catch (Exception e) {
            log.error("Error reading idempotency record {}", recordKey, e);
            return Optional.empty();
        }
    }

    @Override
    public boolean putIfAbsent(IdempotencyRecord record) {
        try {
            Boolean stored = redisTemplate.opsForValue()
                    .setIfAbsent(KEY_PREFIX + record.getKey(), compress(record), ttl);
            return Boolean.TRUE.equals(stored);
        } catch (Exception e) {
            log.error("Error storing idempotency record {}", record.getKey(), e);
            return false;
        }
    }

    @Override
    public void evict(String recordKey) {
        try {
            redisTemplate.delete(KEY_PREFIX + recordKey);
        } catch (Exception e) {
            log.error("Error evicting idempotency record {}", recordKey, e);
        }
    }

    /**
     * Approximate: counts keys under the prefix.
     */
    @Override
    public long size() {
        try {
            var keys = redisTemplate.keys(KEY_PREFIX + "*");
            return keys == null ? 0 : keys.size();
        } catch (Exception e) {
            log.error("Error counting idempotency records", e);
            return 0;
        }
    }

    private byte[] compress(IdempotencyRecord record) throws IOException {
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream();
             GZIPOutputStream gzipOut = new GZIPOutputStream(baos)) {
            gzipOut.write(objectMapper.writeValueAsBytes(record));
            gzipOut.finish();
            return baos.toByteArray();
        }
    }

    private IdempotencyRecord decompress(byte[] compressed) throws IOException {
        try (GZIPInputStream gzipIn = new GZIPInputStream(new ByteArrayInputStream(compressed))) {
            return objectMapper.readValue(gzipIn.readAllBytes(), IdempotencyRecord.class);
        }
    }
}
