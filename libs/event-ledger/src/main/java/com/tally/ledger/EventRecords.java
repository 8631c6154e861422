package com.tally.ledger;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

/**
 * Factory methods for the two event shapes the tracker logs.
 *
 * <p>Keeps attribute naming in one place so producers and readers agree on the keys.
 */
public final class EventRecords {

    public static final String PAGE_URL = "page_url";
    public static final String PROMOTION_ID = "promotion_id";
    public static final String PRODUCT_ID = "product_id";

    private EventRecords() {
        // utility class
    }

    /** A page visit. Visits always count as a single unit. */
    public static EventRecord pageVisit(
            String subjectId, String pageUrl, String originAddress, LocalDateTime generatedAt) {
        Map<String, String> attributes = pageUrl == null ? Map.of() : Map.of(PAGE_URL, pageUrl);
        return new EventRecord(
                subjectId, EventKind.PAGE_VISIT, attributes, originAddress, 1, generatedAt);
    }

    /**
     * A product purchase.
     *
     * @throws InvalidQuantityException if {@code quantity} is below 1
     */
    public static EventRecord productPurchase(
            String subjectId,
            String promotionId,
            String productId,
            int quantity,
            String originAddress,
            LocalDateTime generatedAt) {
        var attributes = new HashMap<String, String>();
        if (promotionId != null) {
            attributes.put(PROMOTION_ID, promotionId);
        }
        if (productId != null) {
            attributes.put(PRODUCT_ID, productId);
        }
        return new EventRecord(
                subjectId,
                EventKind.PRODUCT_PURCHASE,
                attributes,
                originAddress,
                quantity,
                generatedAt);
    }
}
