package com.tally.tracker.infrastructure.metrics;

import com.tally.ledger.EventLedger;
import com.tally.ledger.EventRecord;
import com.tally.ledger.LedgerSnapshot;
import java.util.List;
import java.util.Objects;

/**
 * {@link EventLedger} decorator that feeds {@link LedgerMetrics}.
 *
 * <p>Meters are updated after the delegate returns, outside its critical section.
 */
public final class MeteredEventLedger implements EventLedger {

    private final EventLedger delegate;
    private final LedgerMetrics metrics;

    public MeteredEventLedger(EventLedger delegate, LedgerMetrics metrics) {
        this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        metrics.bindRunningTotal(delegate);
    }

    @Override
    public long append(EventRecord record) {
        long total = delegate.append(record);
        metrics.recordAppend(record);
        return total;
    }

    @Override
    public long total() {
        return delegate.total();
    }

    @Override
    public List<EventRecord> snapshot() {
        return delegate.snapshot();
    }

    @Override
    public LedgerSnapshot state() {
        return delegate.state();
    }

    @Override
    public int size() {
        return delegate.size();
    }
}
