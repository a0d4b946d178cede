package com.rulesentinel.core.wire;

import com.rulesentinel.core.engine.AlertState;
import com.rulesentinel.core.model.PartialResponseStrategy;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Wire form of one active alert.
 *
 * <p>
 * {@code value} is carried as a string formatted by
 * {@link SampleValues#format(double)} so it survives any encoding without
 * loss of precision.
 * </p>
 *
 * @since 1.0.0
 */
public final class AlertInstanceMessage {

    private final PartialResponseStrategy partialResponseStrategy;
    private final Map<String, String> labels;
    private final Map<String, String> annotations;
    private final AlertState state;
    private final Instant activeAt;
    private final String value;

    public AlertInstanceMessage(PartialResponseStrategy partialResponseStrategy,
            Map<String, String> labels,
            Map<String, String> annotations,
            AlertState state,
            Instant activeAt,
            String value) {
        this.partialResponseStrategy = Objects.requireNonNull(partialResponseStrategy, "partialResponseStrategy");
        this.labels = Collections.unmodifiableMap(new TreeMap<>(labels));
        this.annotations = Collections.unmodifiableMap(new TreeMap<>(annotations));
        this.state = Objects.requireNonNull(state, "state");
        this.activeAt = activeAt;
        this.value = Objects.requireNonNull(value, "value");
    }

    public PartialResponseStrategy getPartialResponseStrategy() {
        return partialResponseStrategy;
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

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AlertInstanceMessage that))
            return false;
        return partialResponseStrategy == that.partialResponseStrategy
                && labels.equals(that.labels)
                && annotations.equals(that.annotations)
                && state == that.state
                && Objects.equals(activeAt, that.activeAt)
                && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(partialResponseStrategy, labels, annotations, state, activeAt, value);
    }

    @Override
    public String toString() {
        return "AlertInstanceMessage{" +
                "labels=" + labels +
                ", state=" + state +
                ", activeAt=" + activeAt +
                ", value='" + value + '\'' +
                '}';
    }
}
