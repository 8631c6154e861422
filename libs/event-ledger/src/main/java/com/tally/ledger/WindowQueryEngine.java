package com.tally.ledger;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;

/**
 * Counts ledger records whose generation time falls within a trailing window ending at "now".
 *
 * <p>Every query is a linear scan over a fresh snapshot of the ledger. The comparison uses each
 * record's stored timestamp, never its position in the sequence, because arrival order and
 * timestamp order differ under concurrency and with client-supplied timestamps.
 *
 * <p>A record stamped after "now" has a negative elapsed time and is always inside the window.
 */
public final class WindowQueryEngine {

    private static final double SECONDS_PER_HOUR = 3600.0;
    private static final double NANOS_PER_SECOND = 1_000_000_000.0;

    private final EventLedger ledger;
    private final Clock clock;

    /**
     * @param ledger the ledger to read from
     * @param clock supplies "now" for the overloads that omit it; its zone decides local time
     */
    public WindowQueryEngine(EventLedger ledger, Clock clock) {
        this.ledger = Objects.requireNonNull(ledger, "ledger must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /** Counts records generated within the last {@code hours}, ending at the clock's now. */
    public long countWithin(double hours) {
        return countWithin(hours, LocalDateTime.now(clock));
    }

    /**
     * Counts records whose elapsed time {@code now - generatedAt} is at most {@code hours * 3600}
     * seconds.
     *
     * @param hours window size, finite and positive
     * @param now the instant the window ends at
     * @return number of matching records, 0 for an empty ledger
     * @throws IllegalArgumentException if {@code hours} is not finite and positive
     */
    public long countWithin(double hours, LocalDateTime now) {
        requireValidWindow(hours);
        Objects.requireNonNull(now, "now must not be null");
        return count(ledger.snapshot(), hours, now);
    }

    /** Returns the running total and window count at the clock's now. */
    public WindowStatistics statistics(double hours) {
        return statistics(hours, LocalDateTime.now(clock));
    }

    /**
     * Returns the running total and the window count, both computed from one consistent ledger
     * state.
     *
     * @throws IllegalArgumentException if {@code hours} is not finite and positive
     */
    public WindowStatistics statistics(double hours, LocalDateTime now) {
        requireValidWindow(hours);
        Objects.requireNonNull(now, "now must not be null");
        LedgerSnapshot state = ledger.state();
        return new WindowStatistics(state.total(), count(state.records(), hours, now), hours, now);
    }

    /** Returns the clock this engine reads "now" from. */
    public Clock clock() {
        return clock;
    }

    private static long count(List<EventRecord> records, double hours, LocalDateTime now) {
        double windowSeconds = hours * SECONDS_PER_HOUR;
        long matched = 0;
        for (EventRecord record : records) {
            if (elapsedSeconds(record.generatedAt(), now) <= windowSeconds) {
                matched++;
            }
        }
        return matched;
    }

    private static double elapsedSeconds(LocalDateTime from, LocalDateTime to) {
        Duration elapsed = Duration.between(from, to);
        return elapsed.getSeconds() + elapsed.getNano() / NANOS_PER_SECOND;
    }

    private static void requireValidWindow(double hours) {
        if (!(hours > 0) || Double.isInfinite(hours)) {
            throw new IllegalArgumentException(
                    "hours must be a finite positive number, got " + hours);
        }
    }
}
