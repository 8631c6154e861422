package com.tally.tracker.infrastructure.runtime;

/** Renders an uptime as {@code "1d 2h 3m 4s"}, dropping leading zero units. */
public final class UptimeFormatter {

    private UptimeFormatter() {
        // utility class
    }

    /**
     * Formats whole units of {@code uptimeSeconds}; the fractional part is truncated.
     *
     * <p>{@code 5 -> "5s"}, {@code 125 -> "2m 5s"}, {@code 3605 -> "1h 0m 5s"}, {@code 90061 ->
     * "1d 1h 1m 1s"}.
     */
    public static String format(double uptimeSeconds) {
        long total = (long) Math.max(0, Math.floor(uptimeSeconds));
        long days = total / 86_400;
        long hours = (total % 86_400) / 3_600;
        long minutes = (total % 3_600) / 60;
        long seconds = total % 60;

        if (days > 0) {
            return days + "d " + hours + "h " + minutes + "m " + seconds + "s";
        }
        if (hours > 0) {
            return hours + "h " + minutes + "m " + seconds + "s";
        }
        if (minutes > 0) {
            return minutes + "m " + seconds + "s";
        }
        return seconds + "s";
    }
}
