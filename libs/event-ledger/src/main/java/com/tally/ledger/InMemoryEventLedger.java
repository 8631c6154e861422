package com.tally.ledger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link EventLedger} held in process memory.
 *
 * <p>One {@link ReentrantLock} guards both the record list and the running total. Appends push the
 * record and bump the total inside the same critical section, and every read takes the same lock,
 * so the list and the total are never observed out of step. The lock is held only for in-memory
 * work: no I/O and no logging happen while it is held.
 *
 * <p>Nothing is ever evicted. Memory grows linearly with the number of appended events until the
 * process exits; exhaustion is not detected.
 */
public final class InMemoryEventLedger implements EventLedger {

    private static final Logger log = LoggerFactory.getLogger(InMemoryEventLedger.class);

    private static final int DEFAULT_INITIAL_CAPACITY = 1024;

    private final ReentrantLock lock = new ReentrantLock();
    private final List<EventRecord> records;
    private long total;

    public InMemoryEventLedger() {
        this(DEFAULT_INITIAL_CAPACITY);
    }

    /**
     * @param initialCapacity initial size of the backing list
     * @throws IllegalArgumentException if {@code initialCapacity} is negative
     */
    public InMemoryEventLedger(int initialCapacity) {
        if (initialCapacity < 0) {
            throw new IllegalArgumentException("initialCapacity must not be negative");
        }
        this.records = new ArrayList<>(initialCapacity);
    }

    @Override
    public long append(EventRecord record) {
        Objects.requireNonNull(record, "record must not be null");
        long updated;
        lock.lock();
        try {
            records.add(record);
            total += record.quantity();
            updated = total;
        } finally {
            lock.unlock();
        }
        log.debug(
                "Appended {} event for subject {} (quantity={}, total={})",
                record.kind(),
                record.subjectId(),
                record.quantity(),
                updated);
        return updated;
    }

    @Override
    public long total() {
        lock.lock();
        try {
            return total;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<EventRecord> snapshot() {
        lock.lock();
        try {
            return List.copyOf(records);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public LedgerSnapshot state() {
        lock.lock();
        try {
            return new LedgerSnapshot(total, records);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return records.size();
        } finally {
            lock.unlock();
        }
    }
}
