package com.tally.tracker.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/** Body of {@code POST /api/v1/visit}. */
public record VisitRequest(
        @JsonProperty("user_id") @NotNull Long userId,
        @JsonProperty("page_url") @NotBlank String pageUrl) {}
