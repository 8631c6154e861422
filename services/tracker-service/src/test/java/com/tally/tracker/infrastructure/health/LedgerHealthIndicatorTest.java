package com.tally.tracker.infrastructure.health;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.tally.ledger.EventLedger;
import com.tally.ledger.EventRecords;
import com.tally.ledger.InMemoryEventLedger;
import java.time.LocalDateTime;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Status;

@DisplayName("LedgerHealthIndicator")
class LedgerHealthIndicatorTest {

    @Test
    @DisplayName("reports UP with record count and running total")
    void up() {
        var ledger = new InMemoryEventLedger();
        ledger.append(EventRecords.productPurchase("7", "1", "9", 4, null, LocalDateTime.now()));
        ledger.append(EventRecords.pageVisit("7", "/", null, LocalDateTime.now()));

        var health = new LedgerHealthIndicator(ledger).health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails())
                .containsEntry("storage", "in-memory")
                .containsEntry("records", 2)
                .containsEntry("runningTotal", 5L);
    }

    @Test
    @DisplayName("reports DOWN with the error when the ledger cannot be read")
    void down() {
        EventLedger broken = mock(EventLedger.class);
        when(broken.state()).thenThrow(new IllegalStateException("ledger unavailable"));

        var health = new LedgerHealthIndicator(broken).health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("error", "ledger unavailable");
    }
}
