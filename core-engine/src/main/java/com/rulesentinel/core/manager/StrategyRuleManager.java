package com.rulesentinel.core.manager;

import com.rulesentinel.core.config.PartitionResult;
import com.rulesentinel.core.config.RuleFileIndex;
import com.rulesentinel.core.config.RuleFilePartitioner;
import com.rulesentinel.core.config.RuleReloadException;
import com.rulesentinel.core.engine.AlertingRule;
import com.rulesentinel.core.engine.RuleEngine;
import com.rulesentinel.core.engine.RuleGroup;
import com.rulesentinel.core.model.PartialResponseStrategy;
import com.rulesentinel.core.wire.AlertInstanceMessage;
import com.rulesentinel.core.wire.RuleGroupMessage;
import com.rulesentinel.core.wire.RuleGroupProjector;
import com.rulesentinel.core.wire.RuleGroupSink;
import com.rulesentinel.core.wire.RuleType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Stream;

/**
 * Runs one rule engine per partial response strategy and serves their
 * combined state.
 *
 * <h3>Reload</h3>
 * <p>
 * {@link #update} partitions the rule files by strategy, pushes every
 * strategy's file list (possibly empty) into its engine and then publishes the
 * new {@link RuleFileIndex}. While engines are being pushed, a staged index
 * resolving both the previous and the new scratch files is in place, so every
 * listed group reports the rule file it came from. Errors do not stop the cycle: strategies that
 * reloaded cleanly are applied, failed strategies keep serving their previous
 * files, and every error is reported together in one
 * {@link RuleReloadException}.
 * </p>
 *
 * <h3>Locking</h3>
 * <p>
 * Readers take the read lock only to pick up the current index together with
 * the engines' group lists; a reload takes the write lock only to publish the
 * staged and then the final index. Engine updates happen outside the lock. Concurrent reloads are serialized so the scratch directory is
 * never rebuilt by two of them at once.
 * </p>
 *
 * @since 1.0.0
 */
public class StrategyRuleManager {

    private static final Logger LOG = LoggerFactory.getLogger(StrategyRuleManager.class);

    private final RuleFilePartitioner partitioner;
    private final EnginePool pool;

    private final ReentrantLock reloadLock = new ReentrantLock();
    private final ReentrantReadWriteLock indexLock = new ReentrantReadWriteLock();
    private RuleFileIndex index = RuleFileIndex.EMPTY;

    /**
     * @param dataDir directory holding the scratch directory
     * @param pool    engines to drive
     */
    public StrategyRuleManager(Path dataDir, EnginePool pool) {
        this(new RuleFilePartitioner(dataDir), pool);
    }

    public StrategyRuleManager(RuleFilePartitioner partitioner, EnginePool pool) {
        this.partitioner = Objects.requireNonNull(partitioner, "RuleFilePartitioner must not be null");
        this.pool = Objects.requireNonNull(pool, "EnginePool must not be null");
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    /**
     * Start evaluation in every engine.
     */
    public void run() {
        pool.run();
    }

    /**
     * Stop every engine and wait for in-flight evaluations.
     */
    public void stop() {
        pool.stop();
    }

    // ---------------------------------------------------------------
    // Reload
    // ---------------------------------------------------------------

    /**
     * Reload every engine from the given rule files.
     *
     * @param evalInterval default evaluation interval for groups without one
     * @param files        rule files; relative paths are made absolute
     * @throws RuleReloadException if anything failed; every strategy not named
     *                             in the causes was reloaded
     */
    public void update(Duration evalInterval, List<Path> files) {
        Objects.requireNonNull(evalInterval, "evalInterval must not be null");
        Objects.requireNonNull(files, "files must not be null");

        List<Path> absolute = new ArrayList<>(files.size());
        for (Path file : files) {
            absolute.add(file.toAbsolutePath());
        }

        reloadLock.lock();
        try {
            PartitionResult partition = partitioner.partition(absolute);
            List<Exception> errors = new ArrayList<>(partition.errors());

            RuleFileIndex previous = currentIndex();
            RuleFileIndex staged = previous;
            for (PartialResponseStrategy strategy : PartialResponseStrategy.values()) {
                if (pool.hasEngine(strategy)) {
                    staged = staged.withAddedEntries(strategy,
                            originals(partition.files(strategy), partition.originalFiles()));
                }
            }
            publish(staged);

            RuleFileIndex next = previous;
            for (PartialResponseStrategy strategy : PartialResponseStrategy.values()) {
                List<Path> strategyFiles = partition.files(strategy);
                if (!pool.hasEngine(strategy)) {
                    if (!strategyFiles.isEmpty()) {
                        errors.add(new IllegalStateException("no engine found for strategy " + strategy));
                    }
                    continue;
                }
                try {
                    pool.update(strategy, evalInterval, strategyFiles);
                } catch (RuntimeException e) {
                    LOG.warn("[{}] Reloading rule engine failed, keeping previous rules: {}",
                            strategy, e.getMessage());
                    errors.add(new IllegalStateException("strategy " + strategy + ": " + e.getMessage(), e));
                    continue;
                }
                next = next.withStrategy(strategy, originals(strategyFiles, partition.originalFiles()));
            }

            publish(next);

            if (!errors.isEmpty()) {
                throw new RuleReloadException(errors);
            }
            LOG.info("Reloaded {} rule file(s) into {} scratch file(s)", files.size(), next.size());
        } finally {
            reloadLock.unlock();
        }
    }

    /**
     * @return the index published by the last reload
     */
    public RuleFileIndex fileIndex() {
        return currentIndex();
    }

    // ---------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------

    /**
     * Lazily projected groups of every engine, filtered by rule kind.
     *
     * <p>
     * The set of groups is fixed when this method is called; each group is
     * projected only when the stream reaches it.
     * </p>
     *
     * @param type rule kind to keep
     * @return stream of projected groups, empty-rule groups included
     */
    public Stream<RuleGroupMessage> ruleGroupStream(RuleType type) {
        Objects.requireNonNull(type, "RuleType must not be null");
        RuleFileIndex snapshot;
        List<RuleGroup> groups = new ArrayList<>();
        indexLock.readLock().lock();
        try {
            snapshot = index;
            for (RuleEngine engine : pool.engines()) {
                groups.addAll(engine.ruleGroups());
            }
        } finally {
            indexLock.readLock().unlock();
        }
        return groups.stream()
                .map(group -> RuleGroupProjector.project(group, snapshot))
                .map(message -> message.filter(type));
    }

    /**
     * Stream every group to {@code sink}, one at a time.
     *
     * @param type rule kind to keep
     * @param sink receiver of the groups
     * @throws IOException           if the sink fails; no further group is sent
     * @throws CancellationException if the sink reports cancellation
     */
    public void rules(RuleType type, RuleGroupSink sink) throws IOException {
        Objects.requireNonNull(sink, "RuleGroupSink must not be null");
        try (Stream<RuleGroupMessage> stream = ruleGroupStream(type)) {
            Iterator<RuleGroupMessage> it = stream.iterator();
            while (true) {
                if (sink.isCancelled()) {
                    throw new CancellationException("rule listing cancelled");
                }
                if (!it.hasNext()) {
                    return;
                }
                sink.send(it.next());
            }
        }
    }

    /**
     * @return every group, projected
     */
    public List<RuleGroupMessage> ruleGroups() {
        return ruleGroupStream(RuleType.ALL).toList();
    }

    /**
     * @return active alerts of every alerting rule across strategies
     */
    public List<AlertInstanceMessage> activeAlerts() {
        List<AlertInstanceMessage> out = new ArrayList<>();
        for (RuleEngine engine : pool.engines()) {
            for (AlertingRule rule : engine.alertingRules()) {
                out.addAll(RuleGroupProjector.activeAlerts(rule, engine.getStrategy()));
            }
        }
        return Collections.unmodifiableList(out);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private RuleFileIndex currentIndex() {
        indexLock.readLock().lock();
        try {
            return index;
        } finally {
            indexLock.readLock().unlock();
        }
    }

    private void publish(RuleFileIndex next) {
        indexLock.writeLock().lock();
        try {
            index = next;
        } finally {
            indexLock.writeLock().unlock();
        }
    }

    private static Map<Path, Path> originals(List<Path> scratchFiles, Map<Path, Path> originalFiles) {
        Map<Path, Path> entries = new LinkedHashMap<>();
        for (Path scratch : scratchFiles) {
            entries.put(scratch, originalFiles.getOrDefault(scratch, scratch));
        }
        return entries;
    }
}
