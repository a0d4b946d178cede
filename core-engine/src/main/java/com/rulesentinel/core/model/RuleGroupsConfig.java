package com.rulesentinel.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Top-level POJO for a rule file.
 *
 * <pre>
 * groups:
 *   - name: example
 *     interval: 30s
 *     partial_response_strategy: warn
 *     rules:
 *       - alert: InstanceDown
 *         expr: up == 0
 *         for: 5m
 * </pre>
 *
 * @since 1.0.0
 */
public class RuleGroupsConfig {

    private List<RuleGroupConfig> groups = new ArrayList<>();

    /**
     * Convenience factory for a document holding the given groups.
     *
     * @param groups groups in file order
     * @return new document
     */
    public static RuleGroupsConfig of(List<RuleGroupConfig> groups) {
        RuleGroupsConfig config = new RuleGroupsConfig();
        config.setGroups(groups);
        return config;
    }

    /**
     * Validate every group and reject duplicate group names.
     *
     * @throws IllegalStateException if the document is invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (RuleGroupConfig group : groups) {
            if (group == null) {
                errors.add("group entry must not be empty");
                continue;
            }
            if (group.getName() != null && !seen.add(group.getName())) {
                errors.add("groupname: \"" + group.getName() + "\" is repeated in the same file");
            }
            try {
                group.validate();
            } catch (IllegalStateException e) {
                errors.add(e.getMessage());
            }
        }
        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Rule groups validation failed:\n  - " + String.join("\n  - ", errors));
        }
    }

    /**
     * Representation written back to YAML.
     *
     * @return map with a single {@code groups} entry
     */
    public Map<String, Object> toYamlMap() {
        List<Map<String, Object>> out = new ArrayList<>(groups.size());
        for (RuleGroupConfig group : groups) {
            out.add(group.toYamlMap());
        }
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("groups", out);
        return root;
    }

    public List<RuleGroupConfig> getGroups() {
        return Collections.unmodifiableList(groups);
    }

    public void setGroups(List<RuleGroupConfig> groups) {
        this.groups = groups != null ? new ArrayList<>(groups) : new ArrayList<>();
    }

    @Override
    public String toString() {
        return "RuleGroupsConfig{groups=" + groups + '}';
    }
}
