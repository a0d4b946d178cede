package com.rulesentinel.core.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Health bookkeeping shared by alerting and recording rules.
 *
 * @since 1.0.0
 */
abstract class AbstractRule implements Rule {

    private static final Logger LOG = LoggerFactory.getLogger(AbstractRule.class);

    private final String name;
    private final String query;
    private final Map<String, String> labels;

    private volatile RuleHealth health = RuleHealth.UNKNOWN;
    private volatile String lastError;
    private volatile Duration evaluationDuration = Duration.ZERO;
    private volatile Instant evaluationTimestamp;

    AbstractRule(String name, String query, Map<String, String> labels) {
        this.name = Objects.requireNonNull(name, "Rule name must not be null");
        this.query = Objects.requireNonNull(query, "Rule query must not be null");
        this.labels = Collections.unmodifiableMap(new TreeMap<>(labels != null ? labels : Map.of()));
    }

    /**
     * Run the rule-specific part of an evaluation.
     *
     * @throws QueryException if the query fails or its result is unusable
     */
    protected abstract void doEvaluate(Instant time, QueryFunction queryFunction) throws QueryException;

    @Override
    public final void evaluate(Instant time, QueryFunction queryFunction) {
        long start = System.nanoTime();
        try {
            doEvaluate(time, queryFunction);
            health = RuleHealth.OK;
            lastError = null;
        } catch (QueryException | RuntimeException e) {
            LOG.warn("Evaluating rule [{}] failed: {}", name, e.getMessage());
            health = RuleHealth.ERR;
            lastError = e.getMessage() != null ? e.getMessage() : e.getClass().getName();
        } finally {
            evaluationDuration = Duration.ofNanos(System.nanoTime() - start);
            evaluationTimestamp = time;
        }
    }

    /**
     * Carry health fields over from the rule this one replaces.
     */
    void copyHealthFrom(AbstractRule other) {
        this.health = other.health;
        this.lastError = other.lastError;
        this.evaluationDuration = other.evaluationDuration;
        this.evaluationTimestamp = other.evaluationTimestamp;
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
    public RuleHealth getHealth() {
        return health;
    }

    @Override
    public Optional<String> getLastError() {
        return Optional.ofNullable(lastError);
    }

    @Override
    public Duration getEvaluationDuration() {
        return evaluationDuration;
    }

    @Override
    public Instant getEvaluationTimestamp() {
        return evaluationTimestamp;
    }
}
