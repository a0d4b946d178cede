package com.rulesentinel.core.wire;

import com.rulesentinel.core.config.RuleFileIndex;
import com.rulesentinel.core.engine.ActiveAlert;
import com.rulesentinel.core.engine.AlertingRule;
import com.rulesentinel.core.engine.RecordingRule;
import com.rulesentinel.core.engine.Rule;
import com.rulesentinel.core.engine.RuleGroup;
import com.rulesentinel.core.model.PartialResponseStrategy;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Converts live engine state into wire messages.
 *
 * <p>
 * Projection only reads the live objects; it never blocks the engines that
 * own them.
 * </p>
 *
 * @since 1.0.0
 */
public final class RuleGroupProjector {

    private RuleGroupProjector() {
        // utility class
    }

    /**
     * Project a live group.
     *
     * @param group live group; must not be {@code null}
     * @param index file index used to recover the original rule file
     * @return projected group with every rule
     * @throws IllegalStateException if the group holds a rule that is neither
     *                               alerting nor recording
     */
    public static RuleGroupMessage project(RuleGroup group, RuleFileIndex index) {
        Objects.requireNonNull(group, "RuleGroup must not be null");
        Objects.requireNonNull(index, "RuleFileIndex must not be null");

        List<RuleMessage> rules = new ArrayList<>(group.getRules().size());
        for (Rule rule : group.getRules()) {
            rules.add(project(rule, group.getStrategy()));
        }
        return new RuleGroupMessage(
                group.getName(),
                index.originalFile(group.getFile()).toString(),
                seconds(group.getInterval()),
                group.getStrategy(),
                rules);
    }

    /**
     * Project a live rule.
     *
     * @param rule     live rule
     * @param strategy strategy of the owning group, stamped on active alerts
     * @return the rule's wire form
     * @throws IllegalStateException for unsupported rule implementations
     */
    public static RuleMessage project(Rule rule, PartialResponseStrategy strategy) {
        String lastError = rule.getLastError().orElse("");
        if (rule instanceof AlertingRule alerting) {
            return AlertingRuleMessage.builder()
                    .state(alerting.getState())
                    .name(alerting.getName())
                    .query(alerting.getQuery())
                    .duration(seconds(alerting.getHoldDuration()))
                    .labels(alerting.getLabels())
                    .annotations(alerting.getAnnotations())
                    .alerts(activeAlerts(alerting, strategy))
                    .health(alerting.getHealth().value())
                    .lastError(lastError)
                    .evaluationTime(seconds(alerting.getEvaluationDuration()))
                    .lastEvaluation(alerting.getEvaluationTimestamp())
                    .build();
        }
        if (rule instanceof RecordingRule recording) {
            return new RecordingRuleMessage(
                    recording.getName(),
                    recording.getQuery(),
                    recording.getLabels(),
                    recording.getHealth().value(),
                    lastError,
                    seconds(recording.getEvaluationDuration()),
                    recording.getEvaluationTimestamp());
        }
        throw new IllegalStateException(
                "rule \"" + rule.getName() + "\": unsupported type " + rule.getClass().getName());
    }

    /**
     * Project the active alerts of an alerting rule.
     *
     * @param rule     alerting rule
     * @param strategy strategy of the owning group
     * @return one message per active alert, in the rule's order
     */
    public static List<AlertInstanceMessage> activeAlerts(AlertingRule rule, PartialResponseStrategy strategy) {
        List<ActiveAlert> active = rule.getActiveAlerts();
        List<AlertInstanceMessage> out = new ArrayList<>(active.size());
        for (ActiveAlert alert : active) {
            out.add(new AlertInstanceMessage(
                    strategy,
                    alert.getLabels(),
                    alert.getAnnotations(),
                    alert.getState(),
                    alert.getActiveAt(),
                    SampleValues.format(alert.getValue())));
        }
        return out;
    }

    private static double seconds(Duration duration) {
        return duration.toNanos() / 1e9;
    }
}
