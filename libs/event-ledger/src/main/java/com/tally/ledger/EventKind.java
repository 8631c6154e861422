package com.tally.ledger;

/** The kinds of business event the ledger records. */
public enum EventKind {

    /** A user viewed a page. Always carries quantity 1. */
    PAGE_VISIT,

    /** A user bought a product, possibly several units at once. */
    PRODUCT_PURCHASE
}
