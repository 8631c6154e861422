package com.tally.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

/** Tests for {@link CorrelationContextHolder}: ThreadLocal storage, MDC bridge, scoped runs. */
@DisplayName("CorrelationContextHolder")
class CorrelationContextHolderTest {

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
    }

    @Nested
    @DisplayName("set/get/clear lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("returns empty when no context is set")
        void emptyByDefault() {
            assertThat(CorrelationContextHolder.get()).isEmpty();
            assertThat(CorrelationContextHolder.correlationId()).isEmpty();
        }

        @Test
        @DisplayName("stores and returns the context")
        void storesContext() {
            var ctx = new CorrelationContext("corr-1", "req-1", "203.0.113.9");
            CorrelationContextHolder.set(ctx);

            assertThat(CorrelationContextHolder.get()).contains(ctx);
            assertThat(CorrelationContextHolder.correlationId()).contains("corr-1");
        }

        @Test
        @DisplayName("clears the context")
        void clears() {
            CorrelationContextHolder.set(CorrelationContext.of("corr-1"));
            CorrelationContextHolder.clear();

            assertThat(CorrelationContextHolder.get()).isEmpty();
        }

        @Test
        @DisplayName("rejects a null context")
        void rejectsNull() {
            assertThatThrownBy(() -> CorrelationContextHolder.set(null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("context");
        }

        @Test
        @DisplayName("context rejects a blank correlation ID")
        void rejectsBlankCorrelationId() {
            assertThatThrownBy(() -> new CorrelationContext(" ", null, null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("correlationId");
        }
    }

    @Nested
    @DisplayName("MDC bridge")
    class MdcBridge {

        @Test
        @DisplayName("populates MDC keys on set")
        void populatesMdc() {
            CorrelationContextHolder.set(new CorrelationContext("corr-1", "req-1", "203.0.113.9"));

            assertThat(MDC.get("correlationId")).isEqualTo("corr-1");
            assertThat(MDC.get("requestId")).isEqualTo("req-1");
            assertThat(MDC.get("clientAddress")).isEqualTo("203.0.113.9");
        }

        @Test
        @DisplayName("leaves MDC keys unset for null fields")
        void skipsNullFields() {
            CorrelationContextHolder.set(new CorrelationContext("corr-1", "req-1", "203.0.113.9"));
            CorrelationContextHolder.set(CorrelationContext.of("corr-2"));

            assertThat(MDC.get("correlationId")).isEqualTo("corr-2");
            assertThat(MDC.get("requestId")).isNull();
            assertThat(MDC.get("clientAddress")).isNull();
        }

        @Test
        @DisplayName("removes MDC keys on clear")
        void clearsMdc() {
            CorrelationContextHolder.set(new CorrelationContext("corr-1", "req-1", "203.0.113.9"));
            CorrelationContextHolder.clear();

            assertThat(MDC.get("correlationId")).isNull();
            assertThat(MDC.get("requestId")).isNull();
            assertThat(MDC.get("clientAddress")).isNull();
        }
    }

    @Nested
    @DisplayName("runWithContext")
    class RunWithContext {

        @Test
        @DisplayName("restores the outer context afterwards")
        void restoresOuter() {
            CorrelationContextHolder.set(CorrelationContext.of("outer"));
            var seen = new AtomicReference<String>();

            CorrelationContextHolder.runWithContext(
                    CorrelationContext.of("inner"),
                    () -> seen.set(CorrelationContextHolder.correlationId().orElse(null)));

            assertThat(seen.get()).isEqualTo("inner");
            assertThat(CorrelationContextHolder.correlationId()).contains("outer");
        }

        @Test
        @DisplayName("clears afterwards when nothing was set before")
        void clearsWhenNoOuter() {
            CorrelationContextHolder.runWithContext(
                    CorrelationContext.of("temp"),
                    () -> assertThat(CorrelationContextHolder.get()).isPresent());

            assertThat(CorrelationContextHolder.get()).isEmpty();
        }

        @Test
        @DisplayName("restores the outer context when the runnable throws")
        void restoresOnException() {
            CorrelationContextHolder.set(CorrelationContext.of("outer"));

            assertThatThrownBy(
                            () ->
                                    CorrelationContextHolder.runWithContext(
                                            CorrelationContext.of("inner"),
                                            () -> {
                                                throw new IllegalStateException("boom");
                                            }))
                    .isInstanceOf(IllegalStateException.class);

            assertThat(CorrelationContextHolder.correlationId()).contains("outer");
        }
    }

    @Test
    @DisplayName("does not leak context to other threads")
    void threadIsolation() throws InterruptedException {
        CorrelationContextHolder.set(CorrelationContext.of("main"));
        var otherHasContext = new AtomicReference<Boolean>();

        Thread other = new Thread(() -> otherHasContext.set(CorrelationContextHolder.get().isPresent()));
        other.start();
        other.join();

        assertThat(otherHasContext.get()).isFalse();
    }
}
