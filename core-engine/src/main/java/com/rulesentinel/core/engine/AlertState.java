package com.rulesentinel.core.engine;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * State of an alert instance, ordered by severity.
 *
 * @since 1.0.0
 */
public enum AlertState {
    INACTIVE,
    PENDING,
    FIRING;

    /**
     * @return lowercase form used on the wire, e.g. {@code firing}
     */
    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
