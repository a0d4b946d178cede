package com.rulesentinel.ruler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.rulesentinel.core.config.RuleReloadException;
import com.rulesentinel.core.engine.ScheduledRuleEngine;
import com.rulesentinel.core.manager.EnginePool;
import com.rulesentinel.core.manager.StrategyRuleManager;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Main entry point of the ruler process.
 *
 * <h3>Startup</h3>
 * <pre>
 *   RulerConfig (environment)
 *     → EnginePool (one ScheduledRuleEngine per strategy)
 *     → StrategyRuleManager.update (initial rule load)
 *     → run engines
 *     → RulerHttpServer
 * </pre>
 *
 * <p>
 * A failed initial load is logged and the process keeps serving whatever
 * loaded; {@code POST /-/reload} retries.
 * </p>
 *
 * @since 1.0.0
 */
public final class RulerApplication {

    private static final Logger LOG = LoggerFactory.getLogger(RulerApplication.class);

    private final RulerConfig config;
    private final StrategyRuleManager manager;

    RulerApplication(RulerConfig config, StrategyRuleManager manager) {
        this.config = Objects.requireNonNull(config, "RulerConfig must not be null");
        this.manager = Objects.requireNonNull(manager, "StrategyRuleManager must not be null");
    }

    public static void main(String[] args) throws IOException {
        // 1. Load configuration
        RulerConfig config = RulerConfig.fromEnvironment();
        LOG.info("Starting ruler with config: {}", config);

        // 2. Build engines and manager
        ObjectMapper mapper = objectMapper();
        PrometheusMeterRegistry registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        EnginePool pool = EnginePool.forAllStrategies(
                ScheduledRuleEngine::new, HttpQueryFunction.factory(config, mapper), registry);
        StrategyRuleManager manager = new StrategyRuleManager(config.getDataDir(), pool);
        RulerApplication app = new RulerApplication(config, manager);

        // 3. Initial load, then start evaluating
        try {
            app.reload();
        } catch (IOException | RuleReloadException e) {
            LOG.error("Initial rule load failed: {}", e.getMessage());
        }
        manager.run();

        // 4. HTTP API with shutdown hook
        RulerHttpServer server = new RulerHttpServer(manager, mapper, registry, app::reload);
        server.start(config.getHttpPort());
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            server.stop();
            manager.stop();
        }, "ruler-shutdown"));
    }

    /**
     * Resolve the configured rule file patterns and reload every engine.
     *
     * @throws IOException         if the patterns cannot be resolved
     * @throws RuleReloadException if any file or strategy failed to load
     */
    void reload() throws IOException {
        List<Path> files = RuleFileResolver.resolve(config.getRuleFiles());
        LOG.info("Reloading {} rule file(s)", files.size());
        manager.update(config.getEvalInterval(), files);
    }

    /**
     * @return the JSON mapper used for API responses and query results
     */
    static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        return mapper;
    }
}
