package com.rulesentinel.core.wire;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.rulesentinel.core.model.PartialResponseStrategy;

import java.util.List;
import java.util.Objects;

/**
 * Wire form of a rule group.
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({ "name", "file", "interval", "partialResponseStrategy", "rules" })
public final class RuleGroupMessage {

    private final String name;
    private final String file;
    private final double interval;
    private final PartialResponseStrategy partialResponseStrategy;
    private final List<RuleMessage> rules;

    public RuleGroupMessage(String name, String file, double interval,
            PartialResponseStrategy partialResponseStrategy, List<RuleMessage> rules) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.file = Objects.requireNonNull(file, "file must not be null");
        this.interval = interval;
        this.partialResponseStrategy = Objects.requireNonNull(partialResponseStrategy,
                "partialResponseStrategy must not be null");
        this.rules = List.copyOf(rules);
    }

    /**
     * Same group restricted to the rules matching {@code type}. Name, file,
     * interval and strategy are unchanged, and a group left without rules is
     * still returned.
     *
     * @param type rule kind to keep
     * @return this instance for {@link RuleType#ALL}, a filtered copy otherwise
     */
    public RuleGroupMessage filter(RuleType type) {
        if (type == RuleType.ALL) {
            return this;
        }
        List<RuleMessage> kept = rules.stream().filter(type::matches).toList();
        return new RuleGroupMessage(name, file, interval, partialResponseStrategy, kept);
    }

    public String getName() {
        return name;
    }

    /**
     * @return the user-facing rule file the group was defined in
     */
    public String getFile() {
        return file;
    }

    /**
     * @return evaluation interval in seconds
     */
    public double getInterval() {
        return interval;
    }

    public PartialResponseStrategy getPartialResponseStrategy() {
        return partialResponseStrategy;
    }

    public List<RuleMessage> getRules() {
        return rules;
    }

    @Override
    public String toString() {
        return "RuleGroupMessage{" +
                "name='" + name + '\'' +
                ", file='" + file + '\'' +
                ", interval=" + interval +
                ", partialResponseStrategy=" + partialResponseStrategy +
                ", rules=" + rules.size() +
                '}';
    }
}
