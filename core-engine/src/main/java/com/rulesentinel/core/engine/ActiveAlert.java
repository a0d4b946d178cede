package com.rulesentinel.core.engine;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * An alert instance produced by an {@link AlertingRule}. Immutable; the rule
 * replaces its instances on every evaluation.
 *
 * @since 1.0.0
 */
public final class ActiveAlert {

    private final Map<String, String> labels;
    private final Map<String, String> annotations;
    private final AlertState state;
    private final Instant activeAt;
    private final double value;

    public ActiveAlert(Map<String, String> labels, Map<String, String> annotations,
            AlertState state, Instant activeAt, double value) {
        this.labels = Collections.unmodifiableMap(new TreeMap<>(Objects.requireNonNull(labels, "labels")));
        this.annotations = Collections.unmodifiableMap(
                new TreeMap<>(Objects.requireNonNull(annotations, "annotations")));
        this.state = Objects.requireNonNull(state, "state must not be null");
        this.activeAt = Objects.requireNonNull(activeAt, "activeAt must not be null");
        this.value = value;
    }

    public Map<String, String> getLabels() {
        return labels;
    }

    public Map<String, String> getAnnotations() {
        return annotations;
    }

    public AlertState getState() {
        return state;
    }

    public Instant getActiveAt() {
        return activeAt;
    }

    public double getValue() {
        return value;
    }

    @Override
    public String toString() {
        return "ActiveAlert{" +
                "labels=" + labels +
                ", state=" + state +
                ", activeAt=" + activeAt +
                ", value=" + value +
                '}';
    }
}
