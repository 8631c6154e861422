package com.tally.tracker.domain;

import com.tally.ledger.EventLedger;
import com.tally.ledger.EventRecord;
import com.tally.ledger.EventRecords;
import com.tally.ledger.WindowQueryEngine;
import com.tally.ledger.WindowStatistics;
import com.tally.tracker.infrastructure.metrics.LedgerMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Records visits and purchases in the shared ledger and answers window statistics queries.
 *
 * <p>Records are built here, at append time, from the already validated request and its resolved
 * origin. A record that fails construction (e.g. quantity below 1) never reaches the ledger and
 * the exception propagates to the caller.
 */
@Service
public class EventTrackingService {

    private static final Logger log = LoggerFactory.getLogger(EventTrackingService.class);

    private final EventLedger ledger;
    private final WindowQueryEngine windowQueryEngine;
    private final LedgerMetrics metrics;

    public EventTrackingService(
            EventLedger ledger, WindowQueryEngine windowQueryEngine, LedgerMetrics metrics) {
        this.ledger = ledger;
        this.windowQueryEngine = windowQueryEngine;
        this.metrics = metrics;
    }

    /**
     * Logs a product purchase.
     *
     * @return the running total after this purchase
     * @throws com.tally.ledger.InvalidQuantityException if {@code quantity} is below 1
     */
    public long logPurchase(
            long userId, long promotionId, long productId, int quantity, RequestOrigin origin) {
        EventRecord record =
                EventRecords.productPurchase(
                        String.valueOf(userId),
                        String.valueOf(promotionId),
                        String.valueOf(productId),
                        quantity,
                        origin.clientAddress(),
                        origin.generatedAt());
        long total = ledger.append(record);
        log.debug("Purchase logged: user={} product={} quantity={}", userId, productId, quantity);
        return total;
    }

    /**
     * Logs a page visit.
     *
     * @return the running total after this visit
     */
    public long logVisit(long userId, String pageUrl, RequestOrigin origin) {
        EventRecord record =
                EventRecords.pageVisit(
                        String.valueOf(userId), pageUrl, origin.clientAddress(), origin.generatedAt());
        long total = ledger.append(record);
        log.debug("Visit logged: user={} page={}", userId, pageUrl);
        return total;
    }

    /** Returns the running total and the number of events in the last {@code hours}. */
    public WindowStatistics statistics(double hours) {
        return metrics.windowQueryTimer().record(() -> windowQueryEngine.statistics(hours));
    }

    public long runningTotal() {
        return ledger.total();
    }
}
