package com.rulesentinel.core.engine;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * One element of an instant query result: a label set and its value.
 *
 * @since 1.0.0
 */
public final class Sample {

    private final Map<String, String> labels;
    private final double value;

    /**
     * @param labels series labels; must not be {@code null}
     * @param value  sample value
     */
    public Sample(Map<String, String> labels, double value) {
        Objects.requireNonNull(labels, "labels must not be null");
        this.labels = Collections.unmodifiableMap(new TreeMap<>(labels));
        this.value = value;
    }

    public Map<String, String> getLabels() {
        return labels;
    }

    public double getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Sample that))
            return false;
        return Double.compare(value, that.value) == 0 && labels.equals(that.labels);
    }

    @Override
    public int hashCode() {
        return Objects.hash(labels, value);
    }

    @Override
    public String toString() {
        return labels + " => " + value;
    }
}
