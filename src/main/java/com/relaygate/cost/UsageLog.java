package com.relaygate.cost;

import com.relaygate.model.UsageRecord;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Append-only usage log holding the most recent {@code retention} records.
 * Appends are lock-free; trimming drops the oldest records.
 */
public class UsageLog {

    private final ConcurrentLinkedDeque<UsageRecord> records = new ConcurrentLinkedDeque<>();
    private final AtomicInteger size = new AtomicInteger();
    private final int retention;

    public UsageLog(int retention) {
        if (retention < 1) {
            throw new IllegalArgumentException("retention must be positive");
        }
        this.retention = retention;
    }

    public void append(UsageRecord record) {
        records.addLast(record);
        if (size.incrementAndGet() > retention) {
            if (records.pollFirst() != null) {
                size.decrementAndGet();
            }
        }
    }

    /**
     * Records with a timestamp at or after {@code from}, oldest first.
     */
    public List<UsageRecord> since(Instant from) {
        List<UsageRecord> result = new ArrayList<>();
        for (UsageRecord record : records) {
            if (!record.getTimestamp().isBefore(from)) {
                result.add(record);
            }
        }
        return result;
    }

    public int size() {
        return size.get();
    }
}
