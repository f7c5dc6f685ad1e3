package com.relaygate.idempotency;

import com.relaygate.model.IdempotencyRecord;

import java.util.Optional;

/**
 * Storage for idempotency records, keyed by the record key.
 */
public interface IdempotencyStore {

    Optional<IdempotencyRecord> get(String recordKey);

    /**
     * Store a record unless one already exists for its key. Records are write-once.
     *
     * @return true if the record was stored
     */
    boolean putIfAbsent(IdempotencyRecord record);

    void evict(String recordKey);

    long size();
}
