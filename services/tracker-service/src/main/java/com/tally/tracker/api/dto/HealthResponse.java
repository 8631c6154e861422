package com.tally.tracker.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.LocalDateTime;

/** Body of {@code GET /api/v1/health}. */
public record HealthResponse(
        @JsonProperty("status") String status,
        @JsonProperty("timestamp") LocalDateTime timestamp,
        @JsonProperty("uptime_seconds") double uptimeSeconds) {}
