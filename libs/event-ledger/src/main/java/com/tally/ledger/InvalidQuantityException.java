package com.tally.ledger;

/**
 * Thrown when an event is built with a quantity below 1.
 *
 * <p>Raised by the {@link EventRecord} constructor, so a record carrying a non-positive quantity
 * never exists and can never be appended to a ledger.
 */
public class InvalidQuantityException extends IllegalArgumentException {

    private final int quantity;

    public InvalidQuantityException(int quantity) {
        super("quantity must be a positive integer, got " + quantity);
        this.quantity = quantity;
    }

    /** The rejected quantity. */
    public int quantity() {
        return quantity;
    }
}
