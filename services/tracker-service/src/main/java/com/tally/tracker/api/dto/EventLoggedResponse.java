package com.tally.tracker.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Reply to an ingest call.
 *
 * @param success always true; failures are reported as problem details instead
 * @param totalCount running total after the event was appended
 * @param message human-readable confirmation
 */
public record EventLoggedResponse(
        @JsonProperty("success") boolean success,
        @JsonProperty("total_count") long totalCount,
        @JsonProperty("message") String message) {}
