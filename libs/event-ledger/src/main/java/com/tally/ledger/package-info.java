/**
 * Event ledger: an append-only, thread-safe store of {@link com.tally.ledger.EventRecord}s with a
 * running quantity total, and the {@link com.tally.ledger.WindowQueryEngine} that counts records
 * inside a trailing time window.
 *
 * <p>The ledger is in-memory only. Records are never evicted, so memory grows with the number of
 * events for the life of the process.
 */
package com.tally.ledger;
