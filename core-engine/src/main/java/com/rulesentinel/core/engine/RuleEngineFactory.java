package com.rulesentinel.core.engine;

import com.rulesentinel.core.model.PartialResponseStrategy;

/**
 * Creates the engine serving one strategy.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface RuleEngineFactory {

    RuleEngine create(PartialResponseStrategy strategy, QueryFunction queryFunction, EngineMetrics metrics);
}
