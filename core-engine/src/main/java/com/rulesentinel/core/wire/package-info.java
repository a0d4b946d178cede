/**
 * Wire format of rule listings.
 *
 * <p>
 * {@link com.rulesentinel.core.wire.RuleGroupProjector} turns live
 * {@link com.rulesentinel.core.engine.RuleGroup}s into
 * {@link com.rulesentinel.core.wire.RuleGroupMessage}s, which are handed one
 * at a time to a {@link com.rulesentinel.core.wire.RuleGroupSink}.
 * </p>
 *
 * @since 1.0.0
 */
package com.rulesentinel.core.wire;
