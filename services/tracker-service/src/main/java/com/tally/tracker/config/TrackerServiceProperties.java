package com.tally.tracker.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Type-safe configuration bound from {@code tally.service.*}.
 *
 * <pre>
 * tally:
 *   service:
 *     name: tracker-service
 *     environment: production
 *     window:
 *       min-hours: 0.1
 *       max-hours: 168
 *       default-hours: 1.0
 * </pre>
 *
 * @param name service name used in logs, metrics and the info endpoint. Required.
 * @param environment deployment environment, defaults to {@code development}
 * @param description human-readable description for the info endpoint
 * @param window bounds for the statistics time window
 */
@ConfigurationProperties(prefix = "tally.service")
@Validated
public record TrackerServiceProperties(
        @NotBlank String name, String environment, String description, Window window) {

    public TrackerServiceProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
        if (window == null) {
            window = new Window(0, 0, 0);
        }
    }

    /**
     * Accepted range and default for {@code timeframe_hours} on the statistics endpoint.
     *
     * @param minHours smallest accepted window, defaults to 0.1 (six minutes)
     * @param maxHours largest accepted window, defaults to 168 (one week)
     * @param defaultHours window used when the caller gives none, defaults to 1
     */
    public record Window(double minHours, double maxHours, double defaultHours) {

        public static final double DEFAULT_MIN_HOURS = 0.1;
        public static final double DEFAULT_MAX_HOURS = 168.0;
        public static final double DEFAULT_HOURS = 1.0;

        public Window {
            if (minHours <= 0) {
                minHours = DEFAULT_MIN_HOURS;
            }
            if (maxHours <= 0) {
                maxHours = DEFAULT_MAX_HOURS;
            }
            if (defaultHours <= 0) {
                defaultHours = DEFAULT_HOURS;
            }
            if (minHours > maxHours) {
                throw new IllegalArgumentException(
                        "window min-hours (" + minHours + ") exceeds max-hours (" + maxHours + ")");
            }
            if (defaultHours < minHours || defaultHours > maxHours) {
                throw new IllegalArgumentException(
                        "window default-hours (" + defaultHours + ") is outside ["
                                + minHours + ", " + maxHours + "]");
            }
        }

        /**
         * Returns {@code hours} if it lies within bounds, or the default when {@code hours} is null.
         *
         * @throws IllegalArgumentException if {@code hours} is outside [minHours, maxHours]
         */
        public double resolve(Double hours) {
            if (hours == null) {
                return defaultHours;
            }
            if (hours.isNaN() || hours < minHours || hours > maxHours) {
                throw new IllegalArgumentException(
                        "timeframe_hours must be between " + minHours + " and " + maxHours
                                + ", got " + hours);
            }
            return hours;
        }
    }
}
