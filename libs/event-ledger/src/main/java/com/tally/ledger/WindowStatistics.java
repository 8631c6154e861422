package com.tally.ledger;

import java.time.LocalDateTime;

/**
 * Result of a trailing-window query. Both counts come from the same {@link LedgerSnapshot}.
 *
 * @param runningTotal sum of quantities across every record in the ledger
 * @param countWithinWindow number of records generated within the window
 * @param windowHours size of the trailing window in hours
 * @param evaluatedAt the "now" the window ends at
 */
public record WindowStatistics(
        long runningTotal, long countWithinWindow, double windowHours, LocalDateTime evaluatedAt) {}
