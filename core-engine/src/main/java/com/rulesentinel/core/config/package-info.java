/**
 * Rule file loading and per-strategy partitioning.
 *
 * <p>
 * {@link com.rulesentinel.core.config.RuleFilePartitioner} reads the
 * configured rule files with
 * {@link com.rulesentinel.core.config.RuleGroupFileLoader}, resolves each
 * group's strategy and writes one scratch file per (file, strategy) pair.
 * Errors are collected per file and surfaced together as a
 * {@link com.rulesentinel.core.config.RuleReloadException}.
 * </p>
 *
 * @since 1.0.0
 */
package com.rulesentinel.core.config;
