package com.tally.tracker.api;

import com.tally.ledger.WindowStatistics;
import com.tally.tracker.api.dto.HealthResponse;
import com.tally.tracker.api.dto.StatsResponse;
import com.tally.tracker.config.TrackerServiceProperties;
import com.tally.tracker.domain.EventTrackingService;
import com.tally.tracker.infrastructure.runtime.ServerUptime;
import java.time.Clock;
import java.time.LocalDateTime;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Statistics and liveness endpoints. */
@RestController
@RequestMapping("/api/v1")
public class StatsController {

    static final String HEALTHY = "healthy";

    private final EventTrackingService trackingService;
    private final TrackerServiceProperties properties;
    private final ServerUptime uptime;
    private final Clock clock;

    public StatsController(
            EventTrackingService trackingService,
            TrackerServiceProperties properties,
            ServerUptime uptime,
            Clock clock) {
        this.trackingService = trackingService;
        this.properties = properties;
        this.uptime = uptime;
        this.clock = clock;
    }

    /**
     * Running total plus the number of events in the trailing {@code timeframe_hours}.
     *
     * <p>The window must lie within the configured bounds (0.1 to 168 hours by default), otherwise
     * the request fails with 400.
     */
    @GetMapping("/stats")
    public StatsResponse stats(
            @RequestParam(name = "timeframe_hours", required = false) Double timeframeHours) {
        double hours = properties.window().resolve(timeframeHours);
        WindowStatistics statistics = trackingService.statistics(hours);
        return new StatsResponse(
                uptime.uptimeSeconds(),
                uptime.formatted(),
                statistics.runningTotal(),
                statistics.evaluatedAt(),
                HEALTHY,
                statistics.countWithinWindow(),
                statistics.windowHours());
    }

    @GetMapping("/health")
    public HealthResponse health() {
        return new HealthResponse(HEALTHY, LocalDateTime.now(clock), uptime.uptimeSeconds());
    }
}
