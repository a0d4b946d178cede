package com.rulesentinel.core.engine;

/**
 * A rule query could not be executed.
 *
 * @since 1.0.0
 */
public class QueryException extends Exception {

    private static final long serialVersionUID = 1L;

    public QueryException(String message) {
        super(message);
    }

    public QueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
