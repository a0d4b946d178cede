package com.rulesentinel.core.engine;

import com.rulesentinel.core.model.PartialResponseStrategy;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A live group of rules owned by one {@link RuleEngine}.
 *
 * <p>
 * The strategy is fixed for the lifetime of the object. Moving a group to a
 * different strategy creates a new group in another engine while the old one
 * is dropped by its engine on the next reload.
 * </p>
 *
 * @since 1.0.0
 */
public class RuleGroup {

    private final String name;
    private final Path file;
    private final Duration interval;
    private final List<Rule> rules;
    private final PartialResponseStrategy strategy;

    private boolean retired;
    private volatile Instant lastEvaluation;
    private volatile Duration evaluationDuration = Duration.ZERO;

    /**
     * @param name     group name
     * @param file     file the group was loaded from
     * @param interval evaluation interval; must be positive
     * @param rules    rules in evaluation order
     * @param strategy partial response strategy of the owning engine
     * @throws IllegalArgumentException if {@code interval} is not positive
     */
    public RuleGroup(String name, Path file, Duration interval, List<Rule> rules,
            PartialResponseStrategy strategy) {
        this.name = Objects.requireNonNull(name, "Group name must not be null");
        this.file = Objects.requireNonNull(file, "Group file must not be null");
        this.interval = Objects.requireNonNull(interval, "Group interval must not be null");
        this.rules = List.copyOf(Objects.requireNonNull(rules, "Group rules must not be null"));
        this.strategy = Objects.requireNonNull(strategy, "Group strategy must not be null");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be > 0 for group '" + name + "', got: " + interval);
        }
    }

    /**
     * Identity used to match groups across reloads.
     *
     * @return file and name joined
     */
    public String key() {
        return file + ";" + name;
    }

    /**
     * Take over the state of rules in {@code previous} that are still present
     * with the same kind, name and query.
     *
     * @param previous group with the same {@link #key()} being replaced
     */
    void copyStateFrom(RuleGroup previous) {
        for (Rule rule : rules) {
            for (Rule old : previous.rules) {
                if (old.getClass() != rule.getClass()
                        || !old.getName().equals(rule.getName())
                        || !old.getQuery().equals(rule.getQuery())) {
                    continue;
                }
                if (rule instanceof AlertingRule alerting) {
                    alerting.copyStateFrom((AlertingRule) old);
                } else if (rule instanceof RecordingRule recording) {
                    recording.copyStateFrom((RecordingRule) old);
                }
                break;
            }
        }
        this.lastEvaluation = previous.lastEvaluation;
        this.evaluationDuration = previous.evaluationDuration;
    }

    /**
     * Stop evaluating this group. Blocks until an evaluation that holds the
     * group's monitor has finished, so the state read afterwards is final.
     */
    synchronized void retire() {
        retired = true;
    }

    synchronized boolean isRetired() {
        return retired;
    }

    void recordEvaluation(Instant time, Duration duration) {
        this.lastEvaluation = time;
        this.evaluationDuration = duration;
    }

    public String getName() {
        return name;
    }

    /**
     * @return the file this group was loaded from, as seen by the engine
     */
    public Path getFile() {
        return file;
    }

    public Duration getInterval() {
        return interval;
    }

    public List<Rule> getRules() {
        return rules;
    }

    public PartialResponseStrategy getStrategy() {
        return strategy;
    }

    public Instant getLastEvaluation() {
        return lastEvaluation;
    }

    public Duration getEvaluationDuration() {
        return evaluationDuration;
    }

    @Override
    public String toString() {
        return "RuleGroup{" +
                "name='" + name + '\'' +
                ", file=" + file +
                ", interval=" + interval +
                ", rules=" + rules.size() +
                ", strategy=" + strategy +
                '}';
    }
}
