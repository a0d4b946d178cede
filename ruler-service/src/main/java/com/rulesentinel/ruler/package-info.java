/**
 * Ruler process: environment configuration, rule file discovery, the HTTP
 * query backend and the HTTP API.
 *
 * @since 1.0.0
 */
package com.rulesentinel.ruler;
