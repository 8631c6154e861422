package com.tally.ledger;

import java.util.List;

/**
 * Append-only store of {@link EventRecord}s plus a running total of their quantities.
 *
 * <p>Implementations must be safe for any number of concurrent producers and readers, and no
 * reader may ever observe a total that does not match some fully applied set of appends.
 *
 * <p>A single instance is created at startup and handed to every caller. Callers only ever go
 * through these operations and never hold the internal sequence.
 */
public interface EventLedger {

    /**
     * Appends a record and adds its quantity to the running total, as one atomic step.
     *
     * @param record a fully built record (already timestamped and validated)
     * @return the running total including this record
     */
    long append(EventRecord record);

    /** Returns the current running total (sum of quantities, not record count). */
    long total();

    /** Returns an immutable copy of all records, in arrival order. */
    List<EventRecord> snapshot();

    /** Returns the total and the records as one consistent pair. */
    LedgerSnapshot state();

    /** Returns the number of records appended so far. */
    int size();
}
