package com.tally.tracker.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;

/**
 * Body of {@code POST /api/v1/buy}. Quantity is range-checked by {@link com.tally.ledger.EventRecord},
 * which answers 422 rather than 400.
 */
public record BuyRequest(
        @JsonProperty("user_id") @NotNull Long userId,
        @JsonProperty("promotion_id") @NotNull Long promotionId,
        @JsonProperty("product_id") @NotNull Long productId,
        @JsonProperty("product_quantity") @NotNull Integer productQuantity) {}
