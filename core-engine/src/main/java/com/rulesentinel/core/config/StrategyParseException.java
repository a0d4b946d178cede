package com.rulesentinel.core.config;

import com.rulesentinel.core.model.PartialResponseStrategy;

import java.nio.file.Path;

/**
 * A group declared a {@code partial_response_strategy} that is not a known
 * {@link PartialResponseStrategy}.
 *
 * @since 1.0.0
 */
public class StrategyParseException extends RuleConfigException {

    private static final long serialVersionUID = 1L;

    private final String invalidValue;

    public StrategyParseException(Path file, String invalidValue) {
        super(file, "failed to unmarshal 'partial_response_strategy'. Possible values are "
                + PartialResponseStrategy.possibleValues() + ". Got: " + invalidValue);
        this.invalidValue = invalidValue;
    }

    /**
     * @return the strategy string as written in the file
     */
    public String getInvalidValue() {
        return invalidValue;
    }
}
