package com.rulesentinel.core.engine;

import com.rulesentinel.core.model.PartialResponseStrategy;
import com.rulesentinel.core.model.PromDuration;
import com.rulesentinel.core.model.RuleDefinition;
import com.rulesentinel.core.model.RuleGroupConfig;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Creates live {@link Rule}s and {@link RuleGroup}s from their file
 * definitions.
 *
 * @since 1.0.0
 */
public final class RuleFactory {

    private RuleFactory() {
        // utility class
    }

    /**
     * Create the live rule for a definition.
     *
     * @param definition validated rule definition; must not be {@code null}
     * @return an {@link AlertingRule} or a {@link RecordingRule}
     */
    public static Rule create(RuleDefinition definition) {
        Objects.requireNonNull(definition, "RuleDefinition must not be null");
        if (definition.isAlerting()) {
            Duration hold = definition.getForDuration() != null
                    ? PromDuration.parse(definition.getForDuration())
                    : Duration.ZERO;
            return new AlertingRule(definition.getAlert(), definition.getExpr(), hold,
                    definition.getLabels(), definition.getAnnotations());
        }
        return new RecordingRule(definition.getRecord(), definition.getExpr(), definition.getLabels());
    }

    /**
     * Create a live group.
     *
     * @param config          validated group definition
     * @param file            file the group was loaded from
     * @param defaultInterval interval used when the group declares none
     * @param strategy        strategy of the owning engine
     * @return new group with fresh rule state
     */
    public static RuleGroup createGroup(RuleGroupConfig config, Path file, Duration defaultInterval,
            PartialResponseStrategy strategy) {
        Objects.requireNonNull(config, "RuleGroupConfig must not be null");
        Duration interval = config.getInterval() != null
                ? PromDuration.parse(config.getInterval())
                : defaultInterval;
        List<Rule> rules = config.getRules().stream()
                .map(RuleFactory::create)
                .toList();
        return new RuleGroup(config.getName(), file, interval, rules, strategy);
    }
}
