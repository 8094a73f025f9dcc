package io.kvcache.config;

import java.time.Duration;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses human-readable TTL strings into Duration objects.
 * Supports formats like "500ms", "10s", "5m", "2h", "7d", "1w".
 */
public final class TTLParser {

    private static final Pattern TTL_PATTERN = Pattern.compile("^(\\d+)(ms|[smhdw])$");

    private TTLParser() {
        // Utility class
    }

    /**
     * Parses a TTL string into a Duration.
     *
     * @param ttl the TTL string
     * @return the parsed Duration
     * @throws IllegalArgumentException if the format is invalid or the TTL is zero
     */
    public static Duration parse(String ttl) {
        if (ttl == null || ttl.isBlank()) {
            throw new IllegalArgumentException("TTL cannot be null or empty");
        }

        Matcher matcher = TTL_PATTERN.matcher(ttl.trim().toLowerCase());
        if (!matcher.matches()) {
            throw new IllegalArgumentException(
                "Invalid TTL format: " + ttl + ". Expected format: <number><unit> where unit is ms, s, m, h, d, or w"
            );
        }

        long value = Long.parseLong(matcher.group(1));
        if (value == 0) {
            throw new IllegalArgumentException("TTL must be positive: " + ttl);
        }

        return switch (matcher.group(2)) {
            case "ms" -> Duration.ofMillis(value);
            case "s" -> Duration.ofSeconds(value);
            case "m" -> Duration.ofMinutes(value);
            case "h" -> Duration.ofHours(value);
            case "d" -> Duration.ofDays(value);
            case "w" -> Duration.ofDays(value * 7);
            default -> throw new IllegalArgumentException("Unknown time unit: " + matcher.group(2));
        };
    }

    /**
     * Formats a Duration into the largest whole unit that represents it exactly.
     *
     * @param duration the Duration to format
     * @return the formatted TTL string
     */
    public static String format(Duration duration) {
        if (duration == null) {
            throw new IllegalArgumentException("Duration cannot be null");
        }

        long millis = duration.toMillis();
        if (millis % 1000 != 0) {
            return millis + "ms";
        }

        long seconds = millis / 1000;
        if (seconds % (7 * 24 * 60 * 60) == 0) {
            return (seconds / (7 * 24 * 60 * 60)) + "w";
        }
        if (seconds % (24 * 60 * 60) == 0) {
            return (seconds / (24 * 60 * 60)) + "d";
        }
        if (seconds % (60 * 60) == 0) {
            return (seconds / (60 * 60)) + "h";
        }
        if (seconds % 60 == 0) {
            return (seconds / 60) + "m";
        }
        return seconds + "s";
    }
}
