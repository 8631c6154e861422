package com.tally.tracker.infrastructure.metrics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tally.ledger.EventRecords;
import com.tally.ledger.InMemoryEventLedger;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.LocalDateTime;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link LedgerMetrics}. */
@DisplayName("LedgerMetrics")
class LedgerMetricsTest {

    private static final LocalDateTime AT = LocalDateTime.of(2025, 3, 1, 8, 0);

    private SimpleMeterRegistry registry;
    private LedgerMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new LedgerMetrics(registry, "tracker-test");
    }

    @Nested
    @DisplayName("construction")
    class Construction {

        @Test
        @DisplayName("rejects a null registry")
        void nullRegistry() {
            assertThatThrownBy(() -> new LedgerMetrics(null, "svc"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("registry");
        }

        @Test
        @DisplayName("rejects a blank service name")
        void blankServiceName() {
            assertThatThrownBy(() -> new LedgerMetrics(registry, " "))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("serviceName");
        }

        @Test
        @DisplayName("registers a zeroed counter per event kind up front")
        void eagerCounters() {
            assertThat(registry.get(LedgerMetrics.EVENTS_APPENDED)
                            .tag(LedgerMetrics.TAG_KIND, "page_visit")
                            .counter()
                            .count())
                    .isZero();
            assertThat(registry.get(LedgerMetrics.EVENTS_APPENDED)
                            .tag(LedgerMetrics.TAG_KIND, "product_purchase")
                            .counter()
                            .count())
                    .isZero();
        }
    }

    @Test
    @DisplayName("counts appends and quantities per kind")
    void recordAppend() {
        metrics.recordAppend(EventRecords.productPurchase("1", "2", "3", 4, "203.0.113.1", AT));
        metrics.recordAppend(EventRecords.productPurchase("1", "2", "3", 2, "203.0.113.1", AT));
        metrics.recordAppend(EventRecords.pageVisit("1", "/home", "203.0.113.1", AT));

        var purchases =
                registry.get(LedgerMetrics.EVENT_QUANTITY)
                        .tag(LedgerMetrics.TAG_KIND, "product_purchase")
                        .summary();
        assertThat(purchases.count()).isEqualTo(2);
        assertThat(purchases.totalAmount()).isEqualTo(6.0);
        assertThat(registry.get(LedgerMetrics.EVENTS_APPENDED)
                        .tag(LedgerMetrics.TAG_KIND, "page_visit")
                        .counter()
                        .count())
                .isEqualTo(1.0);
    }

    @Test
    @DisplayName("tags every meter with the service name")
    void serviceTag() {
        assertThat(registry.get(LedgerMetrics.WINDOW_QUERY)
                        .tag(LedgerMetrics.TAG_SERVICE, "tracker-test")
                        .timer())
                .isSameAs(metrics.windowQueryTimer());
    }

    @Test
    @DisplayName("gauge follows the bound ledger's running total")
    void runningTotalGauge() {
        var ledger = new InMemoryEventLedger();
        metrics.bindRunningTotal(ledger);

        ledger.append(EventRecords.productPurchase("1", "2", "3", 5, null, AT));

        assertThat(registry.get(LedgerMetrics.RUNNING_TOTAL).gauge().value()).isEqualTo(5.0);
        assertThat(ledger.total()).isEqualTo(5);
    }
}
