/**
 * Rule file model.
 *
 * <p>
 * Plain POJOs populated by SnakeYAML:
 * </p>
 * <ul>
 * <li>{@link com.rulesentinel.core.model.RuleGroupsConfig}: a rule file</li>
 * <li>{@link com.rulesentinel.core.model.RuleGroupConfig}: one group</li>
 * <li>{@link com.rulesentinel.core.model.RuleDefinition}: one alerting or
 * recording rule</li>
 * <li>{@link com.rulesentinel.core.model.PartialResponseStrategy}: per-group
 * consistency policy</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.rulesentinel.core.model;
