package com.rulesentinel.core.wire;

import java.util.Locale;

/**
 * Rule kinds a listing can be restricted to.
 *
 * @since 1.0.0
 */
public enum RuleType {
    ALL,
    ALERTING,
    RECORDING;

    /**
     * @param rule projected rule
     * @return whether a listing of this type includes {@code rule}
     */
    public boolean matches(RuleMessage rule) {
        return switch (this) {
            case ALL -> true;
            case ALERTING -> rule instanceof AlertingRuleMessage;
            case RECORDING -> rule instanceof RecordingRuleMessage;
        };
    }

    /**
     * Parse the query-parameter form used by the HTTP API: {@code alert},
     * {@code record}, or absent for all rules. Full enum names are accepted
     * too.
     *
     * @param value parameter value, may be {@code null}
     * @return the matching type
     * @throws IllegalArgumentException for any other value
     */
    public static RuleType fromParameter(String value) {
        if (value == null || value.isBlank()) {
            return ALL;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "alert", "alerting" -> ALERTING;
            case "record", "recording" -> RECORDING;
            case "all" -> ALL;
            default -> throw new IllegalArgumentException(
                    "Unknown rule type: '" + value + "'. Supported: alert, record");
        };
    }
}
