package com.rulesentinel.core.model;

import java.time.Duration;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses and formats Prometheus-style duration strings such as {@code 30s},
 * {@code 5m} or {@code 1h30m}.
 *
 * <p>
 * Units, largest first: {@code y} (365d), {@code w}, {@code d}, {@code h},
 * {@code m}, {@code s}, {@code ms}. Each unit may appear at most once and in
 * that order.
 * </p>
 *
 * @since 1.0.0
 */
public final class PromDuration {

    private static final Pattern FORMAT = Pattern.compile(
            "^((\\d+)y)?((\\d+)w)?((\\d+)d)?((\\d+)h)?((\\d+)m)?((\\d+)s)?((\\d+)ms)?$");

    private static final long[] UNIT_MILLIS = {
            365L * 24 * 3_600_000, 7L * 24 * 3_600_000, 24L * 3_600_000, 3_600_000L, 60_000L, 1_000L, 1L
    };
    private static final String[] UNIT_NAMES = { "y", "w", "d", "h", "m", "s", "ms" };

    private PromDuration() {
        // utility class
    }

    /**
     * Parse a duration string.
     *
     * @param value duration string; must not be {@code null}
     * @return the parsed duration
     * @throws IllegalArgumentException if the string is empty or malformed
     */
    public static Duration parse(String value) {
        Objects.requireNonNull(value, "Duration string must not be null");
        if (value.equals("0")) {
            return Duration.ZERO;
        }
        Matcher m = FORMAT.matcher(value);
        if (value.isEmpty() || !m.matches()) {
            throw new IllegalArgumentException("Not a valid duration string: \"" + value + "\"");
        }
        long millis = 0;
        for (int i = 0; i < UNIT_MILLIS.length; i++) {
            String group = m.group(2 * i + 2);
            if (group != null) {
                millis = Math.addExact(millis, Math.multiplyExact(Long.parseLong(group), UNIT_MILLIS[i]));
            }
        }
        return Duration.ofMillis(millis);
    }

    /**
     * Format a duration using the largest units first, e.g. {@code 1h30m}.
     *
     * @param duration non-negative duration
     * @return duration string; {@code 0s} for zero
     */
    public static String format(Duration duration) {
        long millis = duration.toMillis();
        if (millis == 0) {
            return "0s";
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < UNIT_MILLIS.length; i++) {
            long units = millis / UNIT_MILLIS[i];
            if (units > 0) {
                sb.append(units).append(UNIT_NAMES[i]);
                millis -= units * UNIT_MILLIS[i];
            }
        }
        return sb.toString();
    }
}
