package com.rulesentinel.core.engine;

import com.rulesentinel.core.model.PartialResponseStrategy;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer meters of one engine, tagged with its strategy so evaluation
 * health can be told apart per strategy.
 *
 * <h3>Exposed Metrics</h3>
 * <ul>
 * <li>{@code ruler.rule.evaluations} – counter of rule evaluations</li>
 * <li>{@code ruler.rule.evaluation.failures} – counter of failed
 * evaluations</li>
 * <li>{@code ruler.group.duration} – timer of whole-group evaluations</li>
 * <li>{@code ruler.group.rules} – gauge of loaded rules</li>
 * </ul>
 */
public class EngineMetrics {

    /** Tag key carrying the lowercase strategy name. */
    public static final String STRATEGY_TAG = "strategy";

    private final Counter evaluations;
    private final Counter evaluationFailures;
    private final Timer groupDuration;
    private final AtomicInteger loadedRules = new AtomicInteger();

    public EngineMetrics(MeterRegistry registry, PartialResponseStrategy strategy) {
        Tags tags = Tags.of(STRATEGY_TAG, strategy.tagValue());

        this.evaluations = Counter.builder("ruler.rule.evaluations")
                .description("Number of rule evaluations")
                .tags(tags)
                .register(registry);
        this.evaluationFailures = Counter.builder("ruler.rule.evaluation.failures")
                .description("Number of failed rule evaluations")
                .tags(tags)
                .register(registry);
        this.groupDuration = Timer.builder("ruler.group.duration")
                .description("Time taken to evaluate a rule group")
                .tags(tags)
                .register(registry);
        Gauge.builder("ruler.group.rules", loadedRules, AtomicInteger::get)
                .description("Number of loaded rules")
                .tags(tags)
                .register(registry);
    }

    public void incrementEvaluations() {
        evaluations.increment();
    }

    public void incrementEvaluationFailures() {
        evaluationFailures.increment();
    }

    public void recordGroupDuration(Duration duration) {
        groupDuration.record(duration);
    }

    public void setLoadedRules(int count) {
        loadedRules.set(count);
    }
}
