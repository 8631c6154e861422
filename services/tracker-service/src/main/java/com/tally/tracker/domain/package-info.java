/**
 * Tracking use cases: turning validated requests into ledger records and reading window
 * statistics back. Depends on the ledger library only; HTTP concerns stay in {@code api} and
 * {@code infrastructure}.
 */
package com.tally.tracker.domain;
