package com.tally.ledger;

import java.util.List;

/**
 * The running total and the record sequence, captured together under a single acquisition of the
 * ledger's guard. {@code total} always equals the sum of {@code records}' quantities.
 *
 * @param total running total at capture time
 * @param records records in arrival order at capture time
 */
public record LedgerSnapshot(long total, List<EventRecord> records) {

    public LedgerSnapshot {
        records = List.copyOf(records);
    }

    /** An empty ledger's state. */
    public static LedgerSnapshot empty() {
        return new LedgerSnapshot(0L, List.of());
    }

    public int size() {
        return records.size();
    }
}
