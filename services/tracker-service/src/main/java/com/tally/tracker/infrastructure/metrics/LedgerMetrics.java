package com.tally.tracker.infrastructure.metrics;

import com.tally.ledger.EventKind;
import com.tally.ledger.EventLedger;
import com.tally.ledger.EventRecord;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.util.EnumMap;
import java.util.Map;

/**
 * Micrometer meters for the event ledger, all tagged with the service name.
 *
 * <ul>
 *   <li>{@value #EVENTS_APPENDED}: counter of appended records, tagged by {@code kind}
 *   <li>{@value #EVENT_QUANTITY}: distribution of appended quantities, tagged by {@code kind}
 *   <li>{@value #RUNNING_TOTAL}: gauge reading the ledger's running total
 *   <li>{@value #WINDOW_QUERY}: timer around trailing-window queries
 * </ul>
 */
public final class LedgerMetrics {

    public static final String EVENTS_APPENDED = "tally.ledger.events.appended";
    public static final String EVENT_QUANTITY = "tally.ledger.event.quantity";
    public static final String RUNNING_TOTAL = "tally.ledger.running.total";
    public static final String WINDOW_QUERY = "tally.ledger.window.query";

    public static final String TAG_SERVICE = "service";
    public static final String TAG_KIND = "kind";

    private final MeterRegistry registry;
    private final String serviceName;
    private final Map<EventKind, Counter> appended = new EnumMap<>(EventKind.class);
    private final Map<EventKind, DistributionSummary> quantities = new EnumMap<>(EventKind.class);
    private final Timer windowQueryTimer;

    /**
     * @param registry the meter registry to register with
     * @param serviceName value of the {@code service} tag
     */
    public LedgerMetrics(MeterRegistry registry, String serviceName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        this.registry = registry;
        this.serviceName = serviceName;

        // one meter per kind, registered eagerly so appends never touch the registry
        for (EventKind kind : EventKind.values()) {
            Tags tags = baseTags().and(TAG_KIND, kind.name().toLowerCase());
            appended.put(
                    kind,
                    Counter.builder(EVENTS_APPENDED)
                            .description("Events appended to the ledger")
                            .tags(tags)
                            .register(registry));
            quantities.put(
                    kind,
                    DistributionSummary.builder(EVENT_QUANTITY)
                            .description("Quantity carried by each appended event")
                            .tags(tags)
                            .register(registry));
        }
        this.windowQueryTimer =
                Timer.builder(WINDOW_QUERY)
                        .description("Time spent scanning the ledger for a window count")
                        .tags(baseTags())
                        .register(registry);
    }

    /** Records one appended event. */
    public void recordAppend(EventRecord record) {
        appended.get(record.kind()).increment();
        quantities.get(record.kind()).record(record.quantity());
    }

    /** Registers a gauge that reads {@code ledger}'s running total on every scrape. */
    public void bindRunningTotal(EventLedger ledger) {
        Gauge.builder(RUNNING_TOTAL, ledger, l -> (double) l.total())
                .description("Sum of quantities of all events in the ledger")
                .tags(baseTags())
                .register(registry);
    }

    public Timer windowQueryTimer() {
        return windowQueryTimer;
    }

    private Tags baseTags() {
        return Tags.of(TAG_SERVICE, serviceName);
    }
}
