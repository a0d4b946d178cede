package com.rulesentinel.core.wire;

import java.time.Instant;
import java.util.Map;

/**
 * A projected rule: either {@link AlertingRuleMessage} or
 * {@link RecordingRuleMessage}.
 *
 * @since 1.0.0
 */
public interface RuleMessage {

    /**
     * @return {@code alerting} or {@code recording}
     */
    String getType();

    String getName();

    String getQuery();

    Map<String, String> getLabels();

    String getHealth();

    /**
     * @return last evaluation error, empty string if none
     */
    String getLastError();

    double getEvaluationTime();

    Instant getLastEvaluation();
}
