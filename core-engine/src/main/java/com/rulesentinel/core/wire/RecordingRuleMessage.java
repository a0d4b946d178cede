package com.rulesentinel.core.wire;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Wire form of a recording rule.
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({ "type", "name", "query", "labels", "health", "lastError", "evaluationTime", "lastEvaluation" })
public final class RecordingRuleMessage implements RuleMessage {

    private final String name;
    private final String query;
    private final Map<String, String> labels;
    private final String health;
    private final String lastError;
    private final double evaluationTime;
    private final Instant lastEvaluation;

    public RecordingRuleMessage(String name, String query, Map<String, String> labels, String health,
            String lastError, double evaluationTime, Instant lastEvaluation) {
        this.name = Objects.requireNonNull(name, "name");
        this.query = Objects.requireNonNull(query, "query");
        this.labels = Collections.unmodifiableMap(new TreeMap<>(labels));
        this.health = Objects.requireNonNull(health, "health");
        this.lastError = lastError != null ? lastError : "";
        this.evaluationTime = evaluationTime;
        this.lastEvaluation = lastEvaluation;
    }

    @Override
    public String getType() {
        return "recording";
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String getQuery() {
        return query;
    }

    @Override
    public Map<String, String> getLabels() {
        return labels;
    }

    @Override
    public String getHealth() {
        return health;
    }

    @Override
    public String getLastError() {
        return lastError;
    }

    /**
     * @return duration of the last evaluation in seconds
     */
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
        return "RecordingRuleMessage{name='" + name + "', health='" + health + "'}";
    }
}
