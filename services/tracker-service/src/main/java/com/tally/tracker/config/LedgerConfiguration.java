package com.tally.tracker.config;

import com.tally.ledger.EventLedger;
import com.tally.ledger.InMemoryEventLedger;
import com.tally.ledger.WindowQueryEngine;
import com.tally.tracker.infrastructure.metrics.LedgerMetrics;
import com.tally.tracker.infrastructure.metrics.MeteredEventLedger;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the single ledger instance and everything that reads it.
 *
 * <p>The ledger is an ordinary singleton bean injected into its users, not a static. Tests swap it
 * by building their own {@link EventLedger}.
 */
@Configuration
public class LedgerConfiguration {

    private static final Logger log = LoggerFactory.getLogger(LedgerConfiguration.class);

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public LedgerMetrics ledgerMetrics(MeterRegistry registry, TrackerServiceProperties properties) {
        return new LedgerMetrics(registry, properties.name());
    }

    @Bean
    public EventLedger eventLedger(LedgerMetrics metrics) {
        log.info("Creating in-memory event ledger (no persistence, no eviction)");
        return new MeteredEventLedger(new InMemoryEventLedger(), metrics);
    }

    @Bean
    public WindowQueryEngine windowQueryEngine(EventLedger eventLedger, Clock clock) {
        return new WindowQueryEngine(eventLedger, clock);
    }
}
