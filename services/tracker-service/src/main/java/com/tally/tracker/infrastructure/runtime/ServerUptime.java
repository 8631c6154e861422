package com.tally.tracker.infrastructure.runtime;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import org.springframework.stereotype.Component;

/** Tracks how long this service instance has been running. */
@Component
public class ServerUptime {

    private final Clock clock;
    private final Instant startedAt;

    public ServerUptime(Clock clock) {
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Duration uptime() {
        return Duration.between(startedAt, clock.instant());
    }

    /** Uptime in seconds with millisecond precision. */
    public double uptimeSeconds() {
        return uptime().toMillis() / 1000.0;
    }

    public String formatted() {
        return UptimeFormatter.format(uptimeSeconds());
    }
}
