package com.rulesentinel.core.engine;

import com.rulesentinel.core.model.PartialResponseStrategy;

/**
 * Supplies the {@link QueryFunction} bound to each strategy's engine.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface QueryFunctionFactory {

    QueryFunction create(PartialResponseStrategy strategy);
}
