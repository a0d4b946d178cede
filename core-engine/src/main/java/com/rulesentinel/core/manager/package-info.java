/**
 * Orchestration of the per-strategy rule engines.
 *
 * <p>
 * {@link com.rulesentinel.core.manager.EnginePool} owns one engine per
 * strategy; {@link com.rulesentinel.core.manager.StrategyRuleManager}
 * reloads them from rule files and serves their combined state.
 * </p>
 *
 * @since 1.0.0
 */
package com.rulesentinel.core.manager;
