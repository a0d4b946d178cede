package com.rulesentinel.ruler;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link RulerConfig}.
 */
class RulerConfigTest {

    @Test
    @DisplayName("Should apply defaults when no variable is set")
    void shouldApplyDefaults() {
        RulerConfig config = RulerConfig.fromLookup(name -> null);

        assertThat(config.getRuleFiles()).isEmpty();
        assertThat(config.getDataDir()).isEqualTo(Path.of("data"));
        assertThat(config.getEvalInterval()).isEqualTo(Duration.ofMinutes(1));
        assertThat(config.getHttpPort()).isEqualTo(10902);
        assertThat(config.getQueryUrl()).isEqualTo(URI.create("http://localhost:9090"));
        assertThat(config.getQueryTimeout()).isEqualTo(Duration.ofMinutes(2));
    }

    @Test
    @DisplayName("Should read every variable")
    void shouldReadVariables() {
        Map<String, String> env = Map.of(
                "RULE_FILES", "/etc/rules/*.yaml, /opt/extra.yml ,",
                "DATA_DIR", "/var/ruler",
                "EVAL_INTERVAL", "30s",
                "HTTP_PORT", "8080",
                "QUERY_URL", "http://query:10902",
                "QUERY_TIMEOUT", "1m30s");

        RulerConfig config = RulerConfig.fromLookup(env::get);

        assertThat(config.getRuleFiles()).containsExactly("/etc/rules/*.yaml", "/opt/extra.yml");
        assertThat(config.getDataDir()).isEqualTo(Path.of("/var/ruler"));
        assertThat(config.getEvalInterval()).isEqualTo(Duration.ofSeconds(30));
        assertThat(config.getHttpPort()).isEqualTo(8080);
        assertThat(config.getQueryUrl()).isEqualTo(URI.create("http://query:10902"));
        assertThat(config.getQueryTimeout()).isEqualTo(Duration.ofSeconds(90));
    }

    @Test
    @DisplayName("Should report unparsable variables")
    void shouldReportUnparsableValues() {
        assertThatThrownBy(() -> RulerConfig.fromLookup(Map.of("HTTP_PORT", "http")::get))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> RulerConfig.fromLookup(Map.of("EVAL_INTERVAL", "soon")::get))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("EVAL_INTERVAL");
    }

    @Test
    @DisplayName("Should validate values in the builder")
    void shouldValidateInBuilder() {
        assertThatThrownBy(() -> new RulerConfig.Builder().httpPort(70_000).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("httpPort");
        assertThatThrownBy(() -> new RulerConfig.Builder().evalInterval(Duration.ZERO).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("evalInterval");
        assertThatThrownBy(() -> new RulerConfig.Builder().queryUrl(URI.create("relative/path")).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("queryUrl");

        RulerConfig config = new RulerConfig.Builder().ruleFiles(List.of("a.yaml")).build();
        assertThat(config.getRuleFiles()).containsExactly("a.yaml");
    }
}
