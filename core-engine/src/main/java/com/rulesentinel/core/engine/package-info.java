/**
 * Rule evaluation.
 *
 * <p>
 * {@link com.rulesentinel.core.engine.RuleEngine} is the contract the
 * orchestrator relies on; {@link com.rulesentinel.core.engine.ScheduledRuleEngine}
 * is the built-in implementation. Live state is held by
 * {@link com.rulesentinel.core.engine.RuleGroup},
 * {@link com.rulesentinel.core.engine.AlertingRule} and
 * {@link com.rulesentinel.core.engine.RecordingRule}; queries go through a
 * pluggable {@link com.rulesentinel.core.engine.QueryFunction}.
 * </p>
 *
 * @since 1.0.0
 */
package com.rulesentinel.core.engine;
