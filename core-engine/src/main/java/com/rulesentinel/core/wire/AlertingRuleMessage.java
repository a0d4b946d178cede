package com.rulesentinel.core.wire;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.rulesentinel.core.engine.AlertState;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Wire form of an alerting rule, including its active alerts.
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code name}, {@code query}, {@code state} and
 * {@code health} are required.
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({ "type", "state", "name", "query", "duration", "labels", "annotations", "alerts",
        "health", "lastError", "evaluationTime", "lastEvaluation" })
public final class AlertingRuleMessage implements RuleMessage {

    private final AlertState state;
    private final String name;
    private final String query;
    private final double duration;
    private final Map<String, String> labels;
    private final Map<String, String> annotations;
    private final List<AlertInstanceMessage> alerts;
    private final String health;
    private final String lastError;
    private final double evaluationTime;
    private final Instant lastEvaluation;

    private AlertingRuleMessage(Builder b) {
        this.state = Objects.requireNonNull(b.state, "state must not be null");
        this.name = Objects.requireNonNull(b.name, "name must not be null");
        this.query = Objects.requireNonNull(b.query, "query must not be null");
        this.duration = b.duration;
        this.labels = Collections.unmodifiableMap(new TreeMap<>(b.labels));
        this.annotations = Collections.unmodifiableMap(new TreeMap<>(b.annotations));
        this.alerts = List.copyOf(b.alerts);
        this.health = Objects.requireNonNull(b.health, "health must not be null");
        this.lastError = b.lastError != null ? b.lastError : "";
        this.evaluationTime = b.evaluationTime;
        this.lastEvaluation = b.lastEvaluation;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link AlertingRuleMessage}.
     */
    public static class Builder {
        private AlertState state;
        private String name;
        private String query;
        private double duration;
        private Map<String, String> labels = Map.of();
        private Map<String, String> annotations = Map.of();
        private List<AlertInstanceMessage> alerts = List.of();
        private String health;
        private String lastError;
        private double evaluationTime;
        private Instant lastEvaluation;

        public Builder state(AlertState state) {
            this.state = state;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder query(String query) {
            this.query = query;
            return this;
        }

        public Builder duration(double seconds) {
            this.duration = seconds;
            return this;
        }

        public Builder labels(Map<String, String> labels) {
            this.labels = labels;
            return this;
        }

        public Builder annotations(Map<String, String> annotations) {
            this.annotations = annotations;
            return this;
        }

        public Builder alerts(List<AlertInstanceMessage> alerts) {
            this.alerts = alerts;
            return this;
        }

        public Builder health(String health) {
            this.health = health;
            return this;
        }

        public Builder lastError(String lastError) {
            this.lastError = lastError;
            return this;
        }

        public Builder evaluationTime(double seconds) {
            this.evaluationTime = seconds;
            return this;
        }

        public Builder lastEvaluation(Instant lastEvaluation) {
            this.lastEvaluation = lastEvaluation;
            return this;
        }

        /**
         * @return a new {@link AlertingRuleMessage}
         * @throws NullPointerException if a required field is missing
         */
        public AlertingRuleMessage build() {
            return new AlertingRuleMessage(this);
        }
    }

    @Override
    public String getType() {
        return "alerting";
    }

    public AlertState getState() {
        return state;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String getQuery() {
        return query;
    }

    /**
     * @return the rule's hold duration in seconds
     */
    public double getDuration() {
        return duration;
    }

    @Override
    public Map<String, String> getLabels() {
        return labels;
    }

    public Map<String, String> getAnnotations() {
        return annotations;
    }

    public List<AlertInstanceMessage> getAlerts() {
        return alerts;
    }

    @Override
    public String getHealth() {
        return health;
    }

    @Override
    public String getLastError() {
        return lastError;
    }

    @Override
    public double getEvaluationTime() {
        return evaluationTime;
    }

    @Override
    public Instant getLastEvaluation() {
        return lastEvaluation;
    }

    @Override
    public String toString() {
        return "AlertingRuleMessage{" +
                "name='" + name + '\'' +
                ", state=" + state +
                ", alerts=" + alerts.size() +
                ", health='" + health + '\'' +
                '}';
    }
}
