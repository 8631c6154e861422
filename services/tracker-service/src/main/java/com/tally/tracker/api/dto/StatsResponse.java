package com.tally.tracker.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.LocalDateTime;

/**
 * Body of {@code GET /api/v1/stats}.
 *
 * @param uptimeSeconds seconds since the service started
 * @param uptimeFormatted uptime as {@code "1h 2m 3s"}
 * @param totalCount running total of event quantities
 * @param currentTime server local time the window was evaluated at
 * @param serverStatus always {@code "healthy"} when the service can answer
 * @param recentCount number of events inside the window
 * @param timeframeHours window size used
 */
public record StatsResponse(
        @JsonProperty("uptime_seconds") double uptimeSeconds,
        @JsonProperty("uptime_formatted") String uptimeFormatted,
        @JsonProperty("total_count") long totalCount,
        @JsonProperty("current_time") LocalDateTime currentTime,
        @JsonProperty("server_status") String serverStatus,
        @JsonProperty("n_recent") long recentCount,
        @JsonProperty("timeframe_hours") double timeframeHours) {}
