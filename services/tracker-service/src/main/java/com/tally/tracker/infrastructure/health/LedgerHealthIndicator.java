package com.tally.tracker.infrastructure.health;

import com.tally.ledger.EventLedger;
import com.tally.ledger.LedgerSnapshot;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Actuator health contribution for the event ledger ({@code /actuator/health} component
 * {@code ledger}).
 *
 * <p>Reports the record count and running total. Reports DOWN if reading the ledger fails.
 */
@Component("ledger")
public class LedgerHealthIndicator implements HealthIndicator {

    private final EventLedger ledger;

    public LedgerHealthIndicator(EventLedger ledger) {
        this.ledger = ledger;
    }

    @Override
    public Health health() {
        try {
            LedgerSnapshot state = ledger.state();
            return Health.up()
                    .withDetail("storage", "in-memory")
                    .withDetail("records", state.size())
                    .withDetail("runningTotal", state.total())
                    .build();
        } catch (RuntimeException e) {
            return Health.down().withDetail("error", String.valueOf(e.getMessage())).build();
        }
    }
}
