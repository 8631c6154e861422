package com.tally.tracker.infrastructure.web;

import jakarta.servlet.http.HttpServletRequest;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Determines when a request was generated, as naive local time in the clock's zone.
 *
 * <p>Order of preference:
 *
 * <ol>
 *   <li>client timestamp headers ({@link #CLIENT_HEADERS}): ISO-8601 when the value contains
 *       {@code T} or {@code -}, otherwise Unix seconds or milliseconds
 *   <li>proxy timing headers ({@link #PROXY_HEADERS}): Unix seconds, milliseconds or microseconds,
 *       optionally prefixed with {@code t=}
 *   <li>the server's receive time
 * </ol>
 *
 * <p>Offsets in ISO values are dropped and the wall-clock part kept as-is. Values that fail to
 * parse are skipped and the next header is tried.
 */
@Component
public class RequestTimestampResolver {

    private static final Logger log = LoggerFactory.getLogger(RequestTimestampResolver.class);

    static final List<String> CLIENT_HEADERS =
            List.of("x-timestamp", "x-client-time", "x-request-time", "timestamp");

    static final List<String> PROXY_HEADERS =
            List.of("x-request-start", "x-queue-start", "x-request-received", "x-forwarded-start");

    private static final double MILLIS_THRESHOLD = 1e10;
    private static final double MICROS_THRESHOLD = 1e12;

    private final Clock clock;

    public RequestTimestampResolver(Clock clock) {
        this.clock = clock;
    }

    public LocalDateTime resolve(HttpServletRequest request) {
        LocalDateTime receivedAt = LocalDateTime.now(clock);

        for (String header : CLIENT_HEADERS) {
            Optional<LocalDateTime> parsed = parseClientValue(header, request.getHeader(header));
            if (parsed.isPresent()) {
                return parsed.get();
            }
        }
        for (String header : PROXY_HEADERS) {
            Optional<LocalDateTime> parsed = parseProxyValue(header, request.getHeader(header));
            if (parsed.isPresent()) {
                return parsed.get();
            }
        }
        return receivedAt;
    }

    Optional<LocalDateTime> parseClientValue(String header, String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        try {
            if (trimmed.indexOf('T') >= 0 || trimmed.indexOf('-') >= 0) {
                return Optional.of(parseIso(trimmed));
            }
            double epoch = Double.parseDouble(trimmed);
            if (epoch > MILLIS_THRESHOLD) {
                epoch = epoch / 1_000;
            }
            return Optional.of(fromEpochSeconds(epoch));
        } catch (DateTimeException | NumberFormatException e) {
            log.debug("Ignoring unparseable {} header '{}': {}", header, value, e.getMessage());
            return Optional.empty();
        }
    }

    Optional<LocalDateTime> parseProxyValue(String header, String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        if (trimmed.startsWith("t=")) {
            trimmed = trimmed.substring(2);
        }
        try {
            double epoch = Double.parseDouble(trimmed);
            if (epoch > MICROS_THRESHOLD) {
                epoch = epoch / 1_000_000;
            } else if (epoch > MILLIS_THRESHOLD) {
                epoch = epoch / 1_000;
            }
            return Optional.of(fromEpochSeconds(epoch));
        } catch (DateTimeException | NumberFormatException e) {
            log.debug("Ignoring unparseable {} header '{}': {}", header, value, e.getMessage());
            return Optional.empty();
        }
    }

    private static LocalDateTime parseIso(String value) {
        String normalized = value.endsWith("Z") || value.endsWith("z")
                ? value.substring(0, value.length() - 1) + "+00:00"
                : value;
        // a space may separate date and time
        if (normalized.length() > 10 && normalized.charAt(10) == ' ') {
            normalized = normalized.substring(0, 10) + 'T' + normalized.substring(11);
        }
        try {
            return OffsetDateTime.parse(normalized).toLocalDateTime();
        } catch (DateTimeParseException notOffset) {
            try {
                return LocalDateTime.parse(normalized);
            } catch (DateTimeParseException notLocal) {
                return LocalDate.parse(normalized).atStartOfDay();
            }
        }
    }

    private LocalDateTime fromEpochSeconds(double epochSeconds) {
        if (Double.isNaN(epochSeconds) || Double.isInfinite(epochSeconds)) {
            throw new DateTimeException("epoch value is not finite: " + epochSeconds);
        }
        long seconds = (long) Math.floor(epochSeconds);
        long nanos = Math.round((epochSeconds - seconds) * 1_000_000_000L);
        return LocalDateTime.ofInstant(Instant.ofEpochSecond(seconds, nanos), clock.getZone());
    }
}
