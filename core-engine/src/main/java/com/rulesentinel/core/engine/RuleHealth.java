package com.rulesentinel.core.engine;

/**
 * Outcome of a rule's most recent evaluation.
 *
 * @since 1.0.0
 */
public enum RuleHealth {

    /** Not evaluated yet. */
    UNKNOWN("unknown"),
    OK("ok"),
    ERR("err");

    private final String value;

    RuleHealth(String value) {
        this.value = value;
    }

    /**
     * @return lowercase wire value
     */
    public String value() {
        return value;
    }
}
