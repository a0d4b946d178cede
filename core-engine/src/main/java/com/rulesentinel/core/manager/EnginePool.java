package com.rulesentinel.core.manager;

import com.rulesentinel.core.engine.EngineMetrics;
import com.rulesentinel.core.engine.QueryFunctionFactory;
import com.rulesentinel.core.engine.RuleEngine;
import com.rulesentinel.core.engine.RuleEngineFactory;
import com.rulesentinel.core.model.PartialResponseStrategy;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Fixed set of {@link RuleEngine}s, one per {@link PartialResponseStrategy}.
 *
 * <p>
 * Engines are created once at construction and live as long as the pool.
 * Each receives the query function bound to its strategy and its own
 * strategy-tagged meters.
 * </p>
 *
 * @since 1.0.0
 */
public class EnginePool {

    private static final Logger LOG = LoggerFactory.getLogger(EnginePool.class);

    private final Map<PartialResponseStrategy, RuleEngine> engines;

    /**
     * Create a pool holding one engine for every strategy.
     *
     * @param engineFactory creates each engine
     * @param queryFactory  supplies each engine's query function
     * @param registry      registry the engines' meters are bound to
     * @return the pool
     */
    public static EnginePool forAllStrategies(RuleEngineFactory engineFactory,
            QueryFunctionFactory queryFactory, MeterRegistry registry) {
        return new EnginePool(EnumSet.allOf(PartialResponseStrategy.class), engineFactory, queryFactory, registry);
    }

    /**
     * @param strategies    strategies to create an engine for; must not be empty
     * @param engineFactory creates each engine
     * @param queryFactory  supplies each engine's query function
     * @param registry      registry the engines' meters are bound to
     */
    public EnginePool(Set<PartialResponseStrategy> strategies, RuleEngineFactory engineFactory,
            QueryFunctionFactory queryFactory, MeterRegistry registry) {
        Objects.requireNonNull(strategies, "strategies must not be null");
        Objects.requireNonNull(engineFactory, "RuleEngineFactory must not be null");
        Objects.requireNonNull(queryFactory, "QueryFunctionFactory must not be null");
        Objects.requireNonNull(registry, "MeterRegistry must not be null");
        if (strategies.isEmpty()) {
            throw new IllegalArgumentException("at least one strategy is required");
        }

        Map<PartialResponseStrategy, RuleEngine> created = new EnumMap<>(PartialResponseStrategy.class);
        for (PartialResponseStrategy strategy : strategies) {
            RuleEngine engine = engineFactory.create(
                    strategy, queryFactory.create(strategy), new EngineMetrics(registry, strategy));
            if (engine == null || engine.getStrategy() != strategy) {
                throw new IllegalStateException("engine factory returned no engine for strategy " + strategy);
            }
            created.put(strategy, engine);
        }
        this.engines = Collections.unmodifiableMap(created);
        LOG.info("Created rule engines for strategies {}", engines.keySet());
    }

    /**
     * @param strategy partial response strategy
     * @return whether the pool holds an engine for it
     */
    public boolean hasEngine(PartialResponseStrategy strategy) {
        return engines.containsKey(strategy);
    }

    /**
     * Push a file list into the engine of {@code strategy}.
     *
     * @param strategy strategy whose engine is updated
     * @param interval default evaluation interval
     * @param files    scratch files for that strategy, possibly empty
     * @throws IllegalStateException if the pool has no engine for
     *                               {@code strategy}
     * @throws com.rulesentinel.core.config.RuleConfigException if the engine
     *                                                          rejects a file
     */
    public void update(PartialResponseStrategy strategy, Duration interval, List<Path> files) {
        RuleEngine engine = engines.get(strategy);
        if (engine == null) {
            throw new IllegalStateException("no engine found for strategy " + strategy);
        }
        engine.update(interval, files);
    }

    /**
     * @param strategy partial response strategy
     * @return the engine, or {@code null} if the pool has none for it
     */
    public RuleEngine engine(PartialResponseStrategy strategy) {
        return engines.get(strategy);
    }

    /**
     * @return engines in strategy declaration order
     */
    public Collection<RuleEngine> engines() {
        return engines.values();
    }

    /**
     * @return strategies served by this pool
     */
    public Set<PartialResponseStrategy> strategies() {
        return engines.keySet();
    }

    /**
     * Start every engine.
     */
    public void run() {
        engines.values().forEach(RuleEngine::run);
    }

    /**
     * Stop every engine. Returns once all of them have quiesced.
     */
    public void stop() {
        for (RuleEngine engine : engines.values()) {
            try {
                engine.stop();
            } catch (RuntimeException e) {
                LOG.error("[{}] Failed to stop rule engine", engine.getStrategy(), e);
            }
        }
    }
}
