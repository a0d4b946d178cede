package com.rulesentinel.core.engine;

import com.rulesentinel.core.model.PartialResponseStrategy;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Periodic evaluator of rule groups loaded from files.
 *
 * <p>
 * One engine serves exactly one {@link PartialResponseStrategy}. All methods
 * must be safe to call concurrently.
 * </p>
 *
 * @since 1.0.0
 */
public interface RuleEngine {

    /**
     * @return the strategy every group of this engine is tagged with
     */
    PartialResponseStrategy getStrategy();

    /**
     * Replace the loaded groups with the groups of {@code files}. On failure
     * the previously loaded groups stay active.
     *
     * @param interval default evaluation interval for groups without one
     * @param files    rule files, possibly empty
     * @throws com.rulesentinel.core.config.RuleConfigException if any file
     *                                                          cannot be loaded
     */
    void update(Duration interval, List<Path> files);

    /**
     * @return snapshot of the currently loaded groups
     */
    List<RuleGroup> ruleGroups();

    /**
     * @return snapshot of the alerting rules across loaded groups
     */
    List<AlertingRule> alertingRules();

    /**
     * Start periodic evaluation. Calling it on a running engine has no effect.
     */
    void run();

    /**
     * Stop periodic evaluation and wait for in-flight evaluations to finish.
     */
    void stop();
}
