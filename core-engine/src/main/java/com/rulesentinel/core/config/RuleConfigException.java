package com.rulesentinel.core.config;

import java.nio.file.Path;

/**
 * A rule file could not be read, parsed, validated or written.
 *
 * @since 1.0.0
 */
public class RuleConfigException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final transient Path file;

    public RuleConfigException(Path file, String message) {
        super(file + ": " + message);
        this.file = file;
    }

    public RuleConfigException(Path file, String message, Throwable cause) {
        super(file + ": " + message, cause);
        this.file = file;
    }

    /**
     * @return the offending file
     */
    public Path getFile() {
        return file;
    }
}
