package com.tally.tracker.domain;

import java.time.LocalDateTime;

/**
 * Where and when a request was generated, as resolved from its headers.
 *
 * @param clientAddress resolved client address, or {@code "unknown"}
 * @param generatedAt request generation time, naive local
 */
public record RequestOrigin(String clientAddress, LocalDateTime generatedAt) {}
