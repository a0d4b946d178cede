package com.rulesentinel.ruler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rulesentinel.core.config.RuleReloadException;
import com.rulesentinel.core.config.RuleConfigException;
import com.rulesentinel.core.engine.EngineMetrics;
import com.rulesentinel.core.engine.QueryFunction;
import com.rulesentinel.core.engine.Sample;
import com.rulesentinel.core.engine.ScheduledRuleEngine;
import com.rulesentinel.core.manager.EnginePool;
import com.rulesentinel.core.manager.StrategyRuleManager;
import com.rulesentinel.core.model.PartialResponseStrategy;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link RulerHttpServer}.
 */
class RulerHttpServerTest {

    private static final String RULES = ""
            + "groups:\n"
            + "  - name: warned-alerts\n"
            + "    partial_response_strategy: warn\n"
            + "    rules:\n"
            + "      - alert: Down\n"
            + "        expr: up == 0\n"
            + "  - name: records\n"
            + "    rules:\n"
            + "      - record: up:sum\n"
            + "        expr: sum(up)\n";

    @TempDir
    Path tempDir;

    private final ObjectMapper mapper = RulerApplication.objectMapper();
    private final HttpClient client = HttpClient.newHttpClient();
    private final AtomicInteger reloads = new AtomicInteger();
    private final AtomicReference<RuntimeException> reloadFailure = new AtomicReference<>();

    private StrategyRuleManager manager;
    private ScheduledRuleEngine warnEngine;
    private RulerHttpServer server;
    private Path rulesFile;

    @BeforeEach
    void setUp() throws IOException {
        rulesFile = Files.writeString(tempDir.resolve("rules.yaml"), RULES);
        PrometheusMeterRegistry registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        QueryFunction query = (q, t) -> List.of(new Sample(Map.of("instance", "a"), 0));
        EnginePool pool = EnginePool.forAllStrategies(
                (strategy, fn, metrics) -> {
                    ScheduledRuleEngine engine = new ScheduledRuleEngine(strategy, fn, metrics);
                    if (strategy == PartialResponseStrategy.WARN) {
                        warnEngine = engine;
                    }
                    return engine;
                },
                strategy -> query,
                registry);
        manager = new StrategyRuleManager(tempDir.resolve("data"), pool);
        manager.update(Duration.ofMinutes(1), List.of(rulesFile));

        server = new RulerHttpServer(manager, mapper, registry, () -> {
            reloads.incrementAndGet();
            RuntimeException failure = reloadFailure.get();
            if (failure != null) {
                throw failure;
            }
        });
        server.start(0);
    }

    @AfterEach
    void tearDown() {
        server.stop();
        manager.stop();
    }

    private HttpResponse<String> get(String path) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(uri(path)).GET().build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(uri(path)).POST(HttpRequest.BodyPublishers.noBody()).build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private URI uri(String path) {
        return URI.create("http://localhost:" + server.getPort() + path);
    }

    @Test
    @DisplayName("Should list every rule group")
    void shouldListRules() throws Exception {
        HttpResponse<String> response = get("/api/v1/rules");

        assertThat(response.statusCode()).isEqualTo(200);
        JsonNode root = mapper.readTree(response.body());
        assertThat(root.path("status").asText()).isEqualTo("success");
        JsonNode groups = root.path("data").path("groups");
        assertThat(groups).hasSize(2);
        for (JsonNode group : groups) {
            assertThat(group.path("file").asText()).isEqualTo(rulesFile.toString());
            assertThat(group.path("interval").asDouble()).isEqualTo(60.0);
            assertThat(group.path("rules")).hasSize(1);
        }
    }

    @Test
    @DisplayName("Should filter rule groups by type and keep empty groups")
    void shouldFilterRules() throws Exception {
        JsonNode groups = mapper.readTree(get("/api/v1/rules?type=alert").body()).path("data").path("groups");

        assertThat(groups).hasSize(2);
        int alerting = 0;
        for (JsonNode group : groups) {
            for (JsonNode rule : group.path("rules")) {
                assertThat(rule.path("type").asText()).isEqualTo("alerting");
                alerting++;
            }
        }
        assertThat(alerting).isEqualTo(1);
    }

    @Test
    @DisplayName("Should reject unknown rule types")
    void shouldRejectUnknownType() throws Exception {
        HttpResponse<String> response = get("/api/v1/rules?type=bogus");

        assertThat(response.statusCode()).isEqualTo(400);
        assertThat(mapper.readTree(response.body()).path("status").asText()).isEqualTo("error");
    }

    @Test
    @DisplayName("Should list active alerts with their strategy")
    void shouldListAlerts() throws Exception {
        warnEngine.evaluate(Instant.parse("2024-01-01T00:00:00Z"));

        JsonNode alerts = mapper.readTree(get("/api/v1/alerts").body()).path("data").path("alerts");

        assertThat(alerts).hasSize(1);
        JsonNode alert = alerts.get(0);
        assertThat(alert.path("partialResponseStrategy").asText()).isEqualTo("WARN");
        assertThat(alert.path("state").asText()).isEqualTo("firing");
        assertThat(alert.path("activeAt").asText()).isEqualTo("2024-01-01T00:00:00Z");
        assertThat(alert.path("value").asText()).isEqualTo("0e+00");
        assertThat(alert.path("labels").path("alertname").asText()).isEqualTo("Down");
    }

    @Test
    @DisplayName("Should run the reload action and report its failure")
    void shouldReload() throws Exception {
        assertThat(post("/-/reload").statusCode()).isEqualTo(200);
        assertThat(reloads.get()).isEqualTo(1);

        reloadFailure.set(new RuleReloadException(List.of(
                new RuleConfigException(rulesFile, "broken"))));
        HttpResponse<String> failed = post("/-/reload");

        assertThat(failed.statusCode()).isEqualTo(500);
        assertThat(mapper.readTree(failed.body()).path("error").asText()).contains("broken");
        assertThat(get("/-/reload").statusCode()).isEqualTo(405);
    }

    @Test
    @DisplayName("Should answer health, readiness and metrics endpoints")
    void shouldServeHealthEndpoints() throws Exception {
        assertThat(get("/health").body()).isEqualTo("{\"status\":\"UP\"}");
        assertThat(get("/readiness").statusCode()).isEqualTo(200);

        warnEngine.evaluate(Instant.now());
        HttpResponse<String> metrics = get("/metrics");
        assertThat(metrics.statusCode()).isEqualTo(200);
        assertThat(metrics.body()).contains("ruler_rule_evaluations_total{strategy=\"warn\"");
        assertThat(metrics.body()).contains(EngineMetrics.STRATEGY_TAG);
    }
}
