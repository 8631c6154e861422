package com.tally.ledger;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.Objects;

/**
 * One logged occurrence of a business event.
 *
 * <p>Immutable. The generation timestamp is naive local time (no offset retained) and is fixed
 * when the producer builds the record, right before appending it.
 *
 * @param subjectId opaque identifier of the acting subject (usually a user id)
 * @param kind what happened
 * @param attributes domain attributes such as {@code page_url} or {@code product_id}
 * @param originAddress client address the event came from, {@value #UNKNOWN_ORIGIN} if unresolved
 * @param quantity units this event contributes to the running total, at least 1
 * @param generatedAt when the event was generated
 */
public record EventRecord(
        String subjectId,
        EventKind kind,
        Map<String, String> attributes,
        String originAddress,
        int quantity,
        LocalDateTime generatedAt) {

    /** Origin address used when the client address could not be determined. */
    public static final String UNKNOWN_ORIGIN = "unknown";

    public EventRecord {
        if (subjectId == null || subjectId.isBlank()) {
            throw new IllegalArgumentException("subjectId must not be null or blank");
        }
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(generatedAt, "generatedAt must not be null");
        if (quantity < 1) {
            throw new InvalidQuantityException(quantity);
        }
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
        if (originAddress == null || originAddress.isBlank()) {
            originAddress = UNKNOWN_ORIGIN;
        }
    }

    /** Returns the named attribute, or {@code null} when absent. */
    public String attribute(String name) {
        return attributes.get(name);
    }
}
