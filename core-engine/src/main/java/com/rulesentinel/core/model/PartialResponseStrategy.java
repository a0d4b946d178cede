package com.rulesentinel.core.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * How partial query failures are treated for rules of a group.
 *
 * <p>
 * Every rule group resolves to exactly one strategy. Groups that do not
 * declare {@code partial_response_strategy} default to {@link #ABORT},
 * which is the recommended behaviour for alerting.
 * </p>
 *
 * @since 1.0.0
 */
public enum PartialResponseStrategy {

    /** Any partial failure fails the whole query. */
    ABORT,

    /** Partial results are accepted and the failure is reported as a warning. */
    WARN,

    /** Partial results are accepted and failures are ignored. */
    NONE;

    /** Strategy applied to groups without an explicit value. */
    public static final PartialResponseStrategy DEFAULT = ABORT;

    /**
     * Parse a strategy name, ignoring case.
     *
     * @param value strategy name, may be {@code null}
     * @return the matching strategy, or empty if {@code value} is not a known
     *         member
     */
    public static Optional<PartialResponseStrategy> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (PartialResponseStrategy s : values()) {
            if (s.name().equals(normalized)) {
                return Optional.of(s);
            }
        }
        return Optional.empty();
    }

    /**
     * @return comma-separated list of accepted values, for error messages
     */
    public static String possibleValues() {
        return Arrays.stream(values()).map(Enum::name).collect(Collectors.joining(","));
    }

    /**
     * @return lowercase name used as metric tag value and thread-name suffix
     */
    public String tagValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
