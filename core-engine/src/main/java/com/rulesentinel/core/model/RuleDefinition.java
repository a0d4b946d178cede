package com.rulesentinel.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A single alerting or recording rule as written in a rule file.
 *
 * <p>
 * The kind is decided by which name field is set:
 * </p>
 *
 * <pre>
 * - alert: HighErrorRate          # alerting rule
 *   expr: rate(errors[5m]) &gt; 1
 *   for: 10m
 *   labels: {severity: page}
 *   annotations: {summary: "Too many errors"}
 *
 * - record: job:errors:rate5m     # recording rule
 *   expr: sum by (job) (rate(errors[5m]))
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after deserialization.
 * </p>
 *
 * @since 1.0.0
 */
public class RuleDefinition {

    private String alert;
    private String record;
    private String expr;
    private String forDuration;
    private Map<String, String> labels = new LinkedHashMap<>();
    private Map<String, String> annotations = new LinkedHashMap<>();

    /**
     * Validate that exactly one of {@code alert}/{@code record} is set and that
     * the fields present are legal for that kind.
     *
     * @throws IllegalStateException if validation fails
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        boolean hasAlert = alert != null && !alert.isBlank();
        boolean hasRecord = record != null && !record.isBlank();

        if (hasAlert && hasRecord) {
            errors.add("only one of 'record' and 'alert' must be set");
        }
        if (!hasAlert && !hasRecord) {
            errors.add("one of 'record' or 'alert' must be set");
        }
        if (expr == null || expr.isBlank()) {
            errors.add("field 'expr' must be set in rule");
        }
        if (hasRecord) {
            if (!annotations.isEmpty()) {
                errors.add("invalid field 'annotations' in recording rule");
            }
            if (forDuration != null) {
                errors.add("invalid field 'for' in recording rule");
            }
        }
        if (forDuration != null) {
            try {
                PromDuration.parse(forDuration);
            } catch (IllegalArgumentException e) {
                errors.add("field 'for': " + e.getMessage());
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid rule '" + getName() + "': " + String.join("; ", errors));
        }
    }

    /**
     * @return {@code true} if this defines an alerting rule
     */
    public boolean isAlerting() {
        return alert != null && !alert.isBlank();
    }

    /**
     * @return the alert name for alerting rules, the record name otherwise
     */
    public String getName() {
        return isAlerting() ? alert : record;
    }

    /**
     * Representation written back to YAML, omitting unset fields.
     *
     * @return ordered map of the set fields
     */
    public Map<String, Object> toYamlMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        if (record != null) {
            out.put("record", record);
        }
        if (alert != null) {
            out.put("alert", alert);
        }
        out.put("expr", expr);
        if (forDuration != null) {
            out.put("for", forDuration);
        }
        if (!labels.isEmpty()) {
            out.put("labels", new LinkedHashMap<>(labels));
        }
        if (!annotations.isEmpty()) {
            out.put("annotations", new LinkedHashMap<>(annotations));
        }
        return out;
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getAlert() {
        return alert;
    }

    public void setAlert(String alert) {
        this.alert = alert;
    }

    public String getRecord() {
        return record;
    }

    public void setRecord(String record) {
        this.record = record;
    }

    public String getExpr() {
        return expr;
    }

    public void setExpr(String expr) {
        this.expr = expr;
    }

    /**
     * @return the raw {@code for} duration string, or {@code null}
     */
    public String getForDuration() {
        return forDuration;
    }

    public void setForDuration(String forDuration) {
        this.forDuration = forDuration;
    }

    public Map<String, String> getLabels() {
        return Collections.unmodifiableMap(labels);
    }

    /**
     * Set labels. Scalar values are stringified since YAML may type them.
     *
     * @param labels label map, may be {@code null}
     */
    public void setLabels(Map<String, ?> labels) {
        this.labels = stringify(labels);
    }

    public Map<String, String> getAnnotations() {
        return Collections.unmodifiableMap(annotations);
    }

    public void setAnnotations(Map<String, ?> annotations) {
        this.annotations = stringify(annotations);
    }

    private static Map<String, String> stringify(Map<String, ?> in) {
        Map<String, String> out = new LinkedHashMap<>();
        if (in != null) {
            in.forEach((k, v) -> out.put(String.valueOf(k), v == null ? "" : String.valueOf(v)));
        }
        return out;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RuleDefinition that))
            return false;
        return Objects.equals(alert, that.alert)
                && Objects.equals(record, that.record)
                && Objects.equals(expr, that.expr)
                && Objects.equals(forDuration, that.forDuration)
                && Objects.equals(labels, that.labels)
                && Objects.equals(annotations, that.annotations);
    }

    @Override
    public int hashCode() {
        return Objects.hash(alert, record, expr, forDuration, labels, annotations);
    }

    @Override
    public String toString() {
        return "RuleDefinition{" +
                (isAlerting() ? "alert='" + alert : "record='" + record) + '\'' +
                ", expr='" + expr + '\'' +
                '}';
    }
}
