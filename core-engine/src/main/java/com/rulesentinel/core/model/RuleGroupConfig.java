package com.rulesentinel.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One named rule group as written in a rule file.
 *
 * <p>
 * {@code partial_response_strategy} is kept as the raw string read from the
 * file; {@link com.rulesentinel.core.config.RuleFilePartitioner} resolves it
 * to a {@link PartialResponseStrategy} and strips it before handing the group
 * to an engine.
 * </p>
 *
 * @since 1.0.0
 */
public class RuleGroupConfig {

    private String name;
    private String interval;
    private List<RuleDefinition> rules = new ArrayList<>();
    private String partialResponseStrategy;

    /**
     * Validate the group and every rule in it, collecting all problems.
     *
     * @throws IllegalStateException if the group or any rule is invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        if (name == null || name.isBlank()) {
            errors.add("group name must not be empty");
        }
        if (interval != null) {
            try {
                PromDuration.parse(interval);
            } catch (IllegalArgumentException e) {
                errors.add("group '" + name + "' interval: " + e.getMessage());
            }
        }
        for (int i = 0; i < rules.size(); i++) {
            RuleDefinition rule = Objects.requireNonNull(rules.get(i),
                    "Rule at index " + i + " of group '" + name + "' is null");
            try {
                rule.validate();
            } catch (IllegalStateException e) {
                errors.add("group '" + name + "', rule " + (i + 1) + ": " + e.getMessage());
            }
        }
        if (!errors.isEmpty()) {
            throw new IllegalStateException(String.join("\n  - ", errors));
        }
    }

    /**
     * Representation written back to YAML, without the strategy field.
     *
     * @return ordered map of the group's fields
     */
    public Map<String, Object> toYamlMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("name", name);
        if (interval != null) {
            out.put("interval", interval);
        }
        List<Map<String, Object>> ruleMaps = new ArrayList<>(rules.size());
        for (RuleDefinition rule : rules) {
            ruleMaps.add(rule.toYamlMap());
        }
        out.put("rules", ruleMaps);
        return out;
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getInterval() {
        return interval;
    }

    public void setInterval(String interval) {
        this.interval = interval;
    }

    public List<RuleDefinition> getRules() {
        return Collections.unmodifiableList(rules);
    }

    public void setRules(List<RuleDefinition> rules) {
        this.rules = rules != null ? new ArrayList<>(rules) : new ArrayList<>();
    }

    /**
     * @return raw strategy string as written, or {@code null} if absent
     */
    public String getPartialResponseStrategy() {
        return partialResponseStrategy;
    }

    public void setPartialResponseStrategy(String partialResponseStrategy) {
        this.partialResponseStrategy = partialResponseStrategy;
    }

    @Override
    public String toString() {
        return "RuleGroupConfig{" +
                "name='" + name + '\'' +
                ", interval='" + interval + '\'' +
                ", rules=" + rules.size() +
                ", partialResponseStrategy='" + partialResponseStrategy + '\'' +
                '}';
    }
}
