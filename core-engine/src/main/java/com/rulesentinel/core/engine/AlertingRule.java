package com.rulesentinel.core.engine;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Rule whose query result drives a set of alert instances.
 *
 * <h3>State</h3>
 * <p>
 * Every sample returned by the query becomes an alert keyed by its label set
 * (sample labels, then rule labels, then {@code alertname}). A new alert
 * starts {@link AlertState#PENDING} and becomes {@link AlertState#FIRING}
 * once it has been active for the rule's hold duration. Alerts whose sample
 * disappears are dropped.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertingRule extends AbstractRule {

    /** Label carrying the alert name on every instance. */
    public static final String ALERT_NAME_LABEL = "alertname";

    private final Duration holdDuration;
    private final Map<String, String> annotations;

    private volatile List<ActiveAlert> activeAlerts = List.of();

    public AlertingRule(String name, String query, Duration holdDuration,
            Map<String, String> labels, Map<String, String> annotations) {
        super(name, query, labels);
        this.holdDuration = Objects.requireNonNull(holdDuration, "holdDuration must not be null");
        this.annotations = Collections.unmodifiableMap(new TreeMap<>(annotations != null ? annotations : Map.of()));
    }

    @Override
    protected void doEvaluate(Instant time, QueryFunction queryFunction) throws QueryException {
        List<Sample> samples = queryFunction.query(getQuery(), time);

        Map<Map<String, String>, ActiveAlert> previous = new HashMap<>();
        for (ActiveAlert alert : activeAlerts) {
            previous.put(alert.getLabels(), alert);
        }

        Map<Map<String, String>, ActiveAlert> next = new HashMap<>();
        List<ActiveAlert> ordered = new ArrayList<>(samples.size());
        for (Sample sample : samples) {
            Map<String, String> alertLabels = new TreeMap<>(sample.getLabels());
            alertLabels.putAll(getLabels());
            alertLabels.put(ALERT_NAME_LABEL, getName());
            if (next.containsKey(alertLabels)) {
                throw new QueryException(
                        "vector contains metrics with the same labelset after applying alert labels");
            }

            ActiveAlert old = previous.get(alertLabels);
            Instant activeAt = old != null ? old.getActiveAt() : time;
            AlertState state = Duration.between(activeAt, time).compareTo(holdDuration) >= 0
                    ? AlertState.FIRING
                    : AlertState.PENDING;
            ActiveAlert alert = new ActiveAlert(alertLabels, annotations, state, activeAt, sample.getValue());
            next.put(alertLabels, alert);
            ordered.add(alert);
        }
        activeAlerts = Collections.unmodifiableList(ordered);
    }

    /**
     * @return the highest state across active alerts, {@link AlertState#INACTIVE}
     *         if there are none
     */
    public AlertState getState() {
        AlertState max = AlertState.INACTIVE;
        for (ActiveAlert alert : activeAlerts) {
            if (alert.getState().compareTo(max) > 0) {
                max = alert.getState();
            }
        }
        return max;
    }

    /**
     * @return snapshot of the current alert instances
     */
    public List<ActiveAlert> getActiveAlerts() {
        return activeAlerts;
    }

    /**
     * @return how long an alert must be active before it fires
     */
    public Duration getHoldDuration() {
        return holdDuration;
    }

    public Map<String, String> getAnnotations() {
        return annotations;
    }

    /**
     * Take over the alerts and health of the rule this one replaces on reload.
     */
    void copyStateFrom(AlertingRule other) {
        copyHealthFrom(other);
        this.activeAlerts = other.activeAlerts;
    }

    @Override
    public String toString() {
        return "AlertingRule{name='" + getName() + "', query='" + getQuery() + "', for=" + holdDuration + '}';
    }
}
