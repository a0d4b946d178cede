package com.rulesentinel.ruler;

import com.rulesentinel.core.model.PromDuration;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Typed, immutable configuration of the ruler process.
 *
 * <p>
 * Values are resolved from environment variables with defaults, so the
 * process is configured entirely through its deployment environment.
 * </p>
 *
 * <h3>Variables</h3>
 * <ul>
 * <li>{@code RULE_FILES}: comma-separated rule file globs</li>
 * <li>{@code DATA_DIR}: working directory (default {@code data})</li>
 * <li>{@code EVAL_INTERVAL}: default group interval (default {@code 1m})</li>
 * <li>{@code HTTP_PORT}: API port (default {@code 10902})</li>
 * <li>{@code QUERY_URL}: base URL of the query API (default
 * {@code http://localhost:9090})</li>
 * <li>{@code QUERY_TIMEOUT}: per-query timeout (default {@code 2m})</li>
 * </ul>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder} for
 * tests. The builder validates inputs at {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class RulerConfig {

    private final List<String> ruleFiles;
    private final Path dataDir;
    private final Duration evalInterval;
    private final int httpPort;
    private final URI queryUrl;
    private final Duration queryTimeout;

    private RulerConfig(Builder b) {
        this.ruleFiles = List.copyOf(b.ruleFiles);
        this.dataDir = b.dataDir;
        this.evalInterval = b.evalInterval;
        this.httpPort = b.httpPort;
        this.queryUrl = b.queryUrl;
        this.queryTimeout = b.queryTimeout;
    }

    // ---------------------------------------------------------------
    // Factory: resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link RulerConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if a value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static RulerConfig fromEnvironment() {
        return fromLookup(System::getenv);
    }

    /**
     * Build a {@link RulerConfig} from an arbitrary variable lookup.
     *
     * @param lookup variable name to value, {@code null} when unset
     * @return fully populated configuration
     */
    static RulerConfig fromLookup(EnvLookup lookup) {
        try {
            return new Builder()
                    .ruleFiles(splitList(env(lookup, "RULE_FILES", "")))
                    .dataDir(Path.of(env(lookup, "DATA_DIR", "data")))
                    .evalInterval(parseDurationEnv(lookup, "EVAL_INTERVAL", "1m"))
                    .httpPort(Integer.parseInt(env(lookup, "HTTP_PORT", "10902")))
                    .queryUrl(parseUriEnv(lookup, "QUERY_URL", "http://localhost:9090"))
                    .queryTimeout(parseDurationEnv(lookup, "QUERY_TIMEOUT", "2m"))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public List<String> getRuleFiles() {
        return ruleFiles;
    }

    public Path getDataDir() {
        return dataDir;
    }

    public Duration getEvalInterval() {
        return evalInterval;
    }

    public int getHttpPort() {
        return httpPort;
    }

    public URI getQueryUrl() {
        return queryUrl;
    }

    public Duration getQueryTimeout() {
        return queryTimeout;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link RulerConfig}.
     *
     * <p>
     * {@link #build()} checks that durations are positive, the port is in
     * [0, 65535] (0 binds an ephemeral port) and the query URL is absolute.
     * </p>
     */
    public static class Builder {
        private List<String> ruleFiles = List.of();
        private Path dataDir = Path.of("data");
        private Duration evalInterval = Duration.ofMinutes(1);
        private int httpPort = 10902;
        private URI queryUrl = URI.create("http://localhost:9090");
        private Duration queryTimeout = Duration.ofMinutes(2);

        public Builder ruleFiles(List<String> v) {
            this.ruleFiles = v;
            return this;
        }

        public Builder dataDir(Path v) {
            this.dataDir = v;
            return this;
        }

        public Builder evalInterval(Duration v) {
            this.evalInterval = v;
            return this;
        }

        public Builder httpPort(int v) {
            this.httpPort = v;
            return this;
        }

        public Builder queryUrl(URI v) {
            this.queryUrl = v;
            return this;
        }

        public Builder queryTimeout(Duration v) {
            this.queryTimeout = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link RulerConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public RulerConfig build() {
            Objects.requireNonNull(ruleFiles, "ruleFiles required");
            Objects.requireNonNull(dataDir, "dataDir required");
            Objects.requireNonNull(queryUrl, "queryUrl required");
            requirePositive(evalInterval, "evalInterval");
            requirePositive(queryTimeout, "queryTimeout");

            if (httpPort < 0 || httpPort > 65_535) {
                throw new IllegalArgumentException("httpPort must be in [0, 65535], got: " + httpPort);
            }
            if (!queryUrl.isAbsolute()) {
                throw new IllegalArgumentException("queryUrl must be absolute, got: " + queryUrl);
            }
            return new RulerConfig(this);
        }

        private static void requirePositive(Duration value, String name) {
            if (value == null || value.isZero() || value.isNegative()) {
                throw new IllegalArgumentException(name + " must be > 0, got: " + value);
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    /**
     * Source of configuration variables.
     */
    @FunctionalInterface
    interface EnvLookup {
        String get(String name);
    }

    private static String env(EnvLookup lookup, String name, String defaultValue) {
        String value = lookup.get(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    private static Duration parseDurationEnv(EnvLookup lookup, String name, String defaultValue) {
        String value = env(lookup, name, defaultValue);
        try {
            return PromDuration.parse(value);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Failed to parse " + name + ": " + e.getMessage(), e);
        }
    }

    private static URI parseUriEnv(EnvLookup lookup, String name, String defaultValue) {
        String value = env(lookup, name, defaultValue);
        try {
            return URI.create(value);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Failed to parse " + name + ": " + e.getMessage(), e);
        }
    }

    private static List<String> splitList(String value) {
        List<String> out = new ArrayList<>();
        Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .forEach(out::add);
        return out;
    }

    @Override
    public String toString() {
        return "RulerConfig{" +
                "ruleFiles=" + ruleFiles +
                ", dataDir=" + dataDir +
                ", evalInterval=" + PromDuration.format(evalInterval) +
                ", httpPort=" + httpPort +
                ", queryUrl=" + queryUrl +
                ", queryTimeout=" + PromDuration.format(queryTimeout) +
                '}';
    }
}
