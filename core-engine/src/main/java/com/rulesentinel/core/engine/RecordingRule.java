package com.rulesentinel.core.engine;

import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Rule whose query result is recorded as a new series under the rule's name.
 *
 * <p>
 * Persisting the output is left to the query backend; this rule tracks
 * health and the size of the last result.
 * </p>
 *
 * @since 1.0.0
 */
public class RecordingRule extends AbstractRule {

    /** Label carrying the recorded series name. */
    public static final String METRIC_NAME_LABEL = "__name__";

    private volatile int lastSampleCount;

    public RecordingRule(String name, String query, Map<String, String> labels) {
        super(name, query, labels);
    }

    @Override
    protected void doEvaluate(Instant time, QueryFunction queryFunction) throws QueryException {
        List<Sample> samples = queryFunction.query(getQuery(), time);
        Set<Map<String, String>> seen = new HashSet<>();
        for (Sample sample : samples) {
            Map<String, String> seriesLabels = new TreeMap<>(sample.getLabels());
            seriesLabels.putAll(getLabels());
            seriesLabels.put(METRIC_NAME_LABEL, getName());
            if (!seen.add(seriesLabels)) {
                throw new QueryException("vector contains metrics with the same labelset after applying rule labels");
            }
        }
        lastSampleCount = samples.size();
    }

    /**
     * @return number of series produced by the last successful evaluation
     */
    public int getLastSampleCount() {
        return lastSampleCount;
    }

    void copyStateFrom(RecordingRule other) {
        copyHealthFrom(other);
        this.lastSampleCount = other.lastSampleCount;
    }

    @Override
    public String toString() {
        return "RecordingRule{name='" + getName() + "', query='" + getQuery() + "'}";
    }
}
