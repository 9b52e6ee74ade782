package com.edushield.audit.sink;

import com.edushield.audit.AuditRecord;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Bounded in-memory index of delivered records by trace id, in delivery order.
 * <p>
 * Once {@code capacity} records are held, each new record evicts the eldest. Writing a
 * record whose trace id is already held replaces it in place, so a retried write leaves
 * a single copy.
 */
public class InMemoryAuditSink implements AuditSink {

    public static final String NAME = "memory";

    public static final int DEFAULT_CAPACITY = 10_000;

    private final int capacity;
    private final Map<String, AuditRecord> records;

    public InMemoryAuditSink() {
        this(DEFAULT_CAPACITY);
    }

    public InMemoryAuditSink(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
        this.records = new LinkedHashMap<>() {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, AuditRecord> eldest) {
                return size() > InMemoryAuditSink.this.capacity;
            }
        };
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public synchronized void write(AuditRecord record) {
        records.put(record.traceId(), record);
    }

    /**
     * Returns the record for a trace id while it is retained.
     */
    public synchronized Optional<AuditRecord> find(String traceId) {
        return Optional.ofNullable(records.get(traceId));
    }

    /** Snapshot of every retained record, oldest first. */
    public synchronized List<AuditRecord> records() {
        return List.copyOf(records.values());
    }

    public synchronized int size() {
        return records.size();
    }

    public int capacity() {
        return capacity;
    }

    public synchronized void clear() {
        records.clear();
    }
}
