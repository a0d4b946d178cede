package com.rulesentinel.core.engine;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Contract for live rules held by a {@link RuleEngine}.
 *
 * <p>
 * A rule is evaluated by its engine's scheduler thread while API readers
 * concurrently read its health and result fields, so implementations must
 * publish those fields safely.
 * </p>
 *
 * @since 1.0.0
 */
public interface Rule {

    String getName();

    /**
     * @return query text as configured
     */
    String getQuery();

    /**
     * @return labels added to the rule's output
     */
    Map<String, String> getLabels();

    RuleHealth getHealth();

    /**
     * @return message of the last evaluation error, empty if the last
     *         evaluation succeeded or none ran yet
     */
    Optional<String> getLastError();

    /**
     * @return wall time of the last evaluation, {@link Duration#ZERO} if none
     */
    Duration getEvaluationDuration();

    /**
     * @return timestamp of the last evaluation, or {@code null} if none
     */
    Instant getEvaluationTimestamp();

    /**
     * Evaluate the rule once. Failures are recorded on the rule, not thrown.
     *
     * @param time          evaluation timestamp
     * @param queryFunction query backend
     */
    void evaluate(Instant time, QueryFunction queryFunction);
}
