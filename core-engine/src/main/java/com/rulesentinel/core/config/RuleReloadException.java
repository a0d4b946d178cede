package com.rulesentinel.core.config;

import java.util.List;

/**
 * Aggregate of every recoverable error raised during one reload cycle.
 *
 * <p>
 * Thrown after everything that could be applied has been applied, so the
 * caller observes partial success: strategies that are not mentioned in
 * {@link #getCauses()} were reloaded.
 * </p>
 *
 * @since 1.0.0
 */
public class RuleReloadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final transient List<Exception> causes;

    /**
     * @param causes collected errors; must not be empty
     * @throws IllegalArgumentException if {@code causes} is empty
     */
    public RuleReloadException(List<? extends Exception> causes) {
        super(buildMessage(causes));
        this.causes = List.copyOf(causes);
        this.causes.forEach(this::addSuppressed);
    }

    /**
     * @return the collected errors in the order they occurred
     */
    public List<Exception> getCauses() {
        return causes;
    }

    private static String buildMessage(List<? extends Exception> causes) {
        if (causes.isEmpty()) {
            throw new IllegalArgumentException("RuleReloadException requires at least one cause");
        }
        if (causes.size() == 1) {
            return causes.get(0).getMessage();
        }
        StringBuilder sb = new StringBuilder()
                .append(causes.size()).append(" errors occurred:");
        for (Exception e : causes) {
            sb.append("\n  - ").append(e.getMessage());
        }
        return sb.toString();
    }
}
