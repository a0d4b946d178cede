package com.rulesentinel.core.manager;

import com.rulesentinel.core.config.RuleFilePartitioner;
import com.rulesentinel.core.config.RuleReloadException;
import com.rulesentinel.core.config.StrategyParseException;
import com.rulesentinel.core.engine.QueryFunction;
import com.rulesentinel.core.engine.Sample;
import com.rulesentinel.core.engine.ScheduledRuleEngine;
import com.rulesentinel.core.model.PartialResponseStrategy;
import com.rulesentinel.core.wire.AlertInstanceMessage;
import com.rulesentinel.core.wire.AlertingRuleMessage;
import com.rulesentinel.core.wire.RecordingRuleMessage;
import com.rulesentinel.core.wire.RuleGroupMessage;
import com.rulesentinel.core.wire.RuleGroupSink;
import com.rulesentinel.core.wire.RuleType;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link StrategyRuleManager}.
 */
class StrategyRuleManagerTest {

    private static final Duration INTERVAL = Duration.ofMinutes(1);
    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private static final String MIXED_FILE = ""
            + "groups:\n"
            + "  - name: warned-alerts\n"
            + "    partial_response_strategy: WARN\n"
            + "    rules:\n"
            + "      - alert: Down\n"
            + "        expr: up == 0\n"
            + "  - name: aborting-records\n"
            + "    rules:\n"
            + "      - record: up:sum\n"
            + "        expr: sum(up)\n";

    @TempDir
    Path tempDir;

    private Path dataDir;
    private Path rulesDir;
    private final Map<PartialResponseStrategy, ScheduledRuleEngine> engines =
            new EnumMap<>(PartialResponseStrategy.class);
    private StrategyRuleManager manager;

    @BeforeEach
    void setUp() throws IOException {
        dataDir = tempDir.resolve("data");
        rulesDir = Files.createDirectories(tempDir.resolve("rules"));
        QueryFunction query = (q, t) -> List.of(new Sample(Map.of("instance", "a"), 0));
        EnginePool pool = EnginePool.forAllStrategies(
                (strategy, fn, metrics) -> {
                    ScheduledRuleEngine engine = new ScheduledRuleEngine(strategy, fn, metrics);
                    engines.put(strategy, engine);
                    return engine;
                },
                strategy -> query,
                new SimpleMeterRegistry());
        manager = new StrategyRuleManager(dataDir, pool);
    }

    @AfterEach
    void tearDown() {
        manager.stop();
    }

    private Path write(String name, String content) throws IOException {
        return Files.writeString(rulesDir.resolve(name), content);
    }

    private static RuleGroupMessage group(List<RuleGroupMessage> groups, String name) {
        return groups.stream()
                .filter(g -> g.getName().equals(name))
                .findFirst()
                .orElseThrow(() -> new AssertionError("no group " + name + " in " + groups));
    }

    @Test
    @DisplayName("Should route groups of one file to the engines of their strategies")
    void shouldRouteGroupsByStrategy() throws IOException {
        Path file = write("mixed.yaml", MIXED_FILE);

        manager.update(INTERVAL, List.of(file));

        List<RuleGroupMessage> groups = manager.ruleGroups();
        assertThat(groups).hasSize(2);

        RuleGroupMessage warned = group(groups, "warned-alerts");
        assertThat(warned.getPartialResponseStrategy()).isEqualTo(PartialResponseStrategy.WARN);
        assertThat(warned.getFile()).isEqualTo(file.toString());
        assertThat(warned.getInterval()).isEqualTo(60.0);
        assertThat(warned.getRules()).singleElement().isInstanceOf(AlertingRuleMessage.class);

        RuleGroupMessage aborting = group(groups, "aborting-records");
        assertThat(aborting.getPartialResponseStrategy()).isEqualTo(PartialResponseStrategy.ABORT);
        assertThat(aborting.getFile()).isEqualTo(file.toString());
        assertThat(aborting.getRules()).singleElement().isInstanceOf(RecordingRuleMessage.class);

        assertThat(engines.get(PartialResponseStrategy.WARN).ruleGroups()).hasSize(1);
        assertThat(engines.get(PartialResponseStrategy.ABORT).ruleGroups()).hasSize(1);
        assertThat(engines.get(PartialResponseStrategy.NONE).ruleGroups()).isEmpty();
    }

    @Test
    @DisplayName("Should list a warned alerting file and an untagged recording file as two groups")
    void shouldListGroupsFromSeparateFiles() throws IOException {
        Path alerts = write("alerts.yaml", ""
                + "groups:\n"
                + "  - name: warned-alerts\n"
                + "    partial_response_strategy: warn\n"
                + "    rules:\n"
                + "      - alert: Down\n"
                + "        expr: up == 0\n");
        Path records = write("records.yaml", ""
                + "groups:\n"
                + "  - name: plain-records\n"
                + "    rules:\n"
                + "      - record: up:sum\n"
                + "        expr: sum(up)\n");

        manager.update(INTERVAL, List.of(alerts, records));

        List<RuleGroupMessage> all = manager.ruleGroupStream(RuleType.ALL).toList();
        assertThat(all).hasSize(2);
        RuleGroupMessage warned = group(all, "warned-alerts");
        assertThat(warned.getPartialResponseStrategy()).isEqualTo(PartialResponseStrategy.WARN);
        assertThat(warned.getFile()).isEqualTo(alerts.toString());
        assertThat(warned.getRules()).singleElement().isInstanceOf(AlertingRuleMessage.class);
        RuleGroupMessage plain = group(all, "plain-records");
        assertThat(plain.getPartialResponseStrategy()).isEqualTo(PartialResponseStrategy.ABORT);
        assertThat(plain.getFile()).isEqualTo(records.toString());
        assertThat(plain.getRules()).singleElement().isInstanceOf(RecordingRuleMessage.class);

        List<RuleGroupMessage> recording = manager.ruleGroupStream(RuleType.RECORDING).toList();
        assertThat(recording).hasSize(2);
        assertThat(group(recording, "warned-alerts").getRules()).isEmpty();
        assertThat(group(recording, "plain-records").getRules()).hasSize(1);
    }

    @Test
    @DisplayName("Should report each group's own rule file while reloads run concurrently")
    void shouldListConsistentFilesDuringReloads() throws Exception {
        List<Path> first = List.of(
                write("first-warn.yaml", singleGroup("first-warn", "warn")),
                write("first-abort.yaml", singleGroup("first-abort", null)));
        List<Path> second = List.of(
                write("second-warn.yaml", singleGroup("second-warn", "warn")),
                write("second-none.yaml", singleGroup("second-none", "none")));
        manager.update(INTERVAL, first);

        ConcurrentLinkedQueue<String> mismatches = new ConcurrentLinkedQueue<>();
        AtomicBoolean reloading = new AtomicBoolean(true);
        CountDownLatch readersStarted = new CountDownLatch(2);
        ExecutorService executor = Executors.newFixedThreadPool(3);
        try {
            Runnable reader = () -> {
                readersStarted.countDown();
                while (reloading.get()) {
                    List<RuleGroupMessage> listed = new ArrayList<>();
                    try {
                        manager.rules(RuleType.ALL, listed::add);
                    } catch (IOException e) {
                        mismatches.add("listing failed: " + e);
                    }
                    for (RuleGroupMessage g : listed) {
                        String expected = rulesDir.resolve(g.getName() + ".yaml").toString();
                        if (!expected.equals(g.getFile())) {
                            mismatches.add(g.getName() + " -> " + g.getFile());
                        }
                    }
                }
            };
            Future<?> reader1 = executor.submit(reader);
            Future<?> reader2 = executor.submit(reader);
            Future<?> reloader = executor.submit(() -> {
                try {
                    readersStarted.await(5, TimeUnit.SECONDS);
                    for (int i = 0; i < 50; i++) {
                        manager.update(INTERVAL, i % 2 == 0 ? second : first);
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    reloading.set(false);
                }
            });

            reloader.get(30, TimeUnit.SECONDS);
            reader1.get(5, TimeUnit.SECONDS);
            reader2.get(5, TimeUnit.SECONDS);
        } finally {
            reloading.set(false);
            executor.shutdownNow();
        }

        assertThat(mismatches).isEmpty();
        assertThat(manager.ruleGroups()).extracting(RuleGroupMessage::getName)
                .containsExactlyInAnyOrder("first-warn", "first-abort");
    }

    private static String singleGroup(String name, String strategy) {
        return "groups:\n"
                + "  - name: " + name + "\n"
                + (strategy != null ? "    partial_response_strategy: " + strategy + "\n" : "")
                + "    rules:\n"
                + "      - record: " + name.replace('-', '_') + ":up\n"
                + "        expr: sum(up)\n";
    }

    @Test
    @DisplayName("Should filter by rule type and still emit groups left empty")
    void shouldFilterAndKeepEmptyGroups() throws IOException {
        manager.update(INTERVAL, List.of(write("mixed.yaml", MIXED_FILE)));

        List<RuleGroupMessage> alerts = manager.ruleGroupStream(RuleType.ALERTING).toList();
        List<RuleGroupMessage> records = manager.ruleGroupStream(RuleType.RECORDING).toList();

        assertThat(alerts).hasSize(2);
        assertThat(group(alerts, "warned-alerts").getRules()).hasSize(1);
        assertThat(group(alerts, "aborting-records").getRules()).isEmpty();
        assertThat(group(alerts, "aborting-records").getPartialResponseStrategy())
                .isEqualTo(PartialResponseStrategy.ABORT);

        assertThat(records).hasSize(2);
        assertThat(group(records, "warned-alerts").getRules()).isEmpty();
        assertThat(group(records, "aborting-records").getRules())
                .allSatisfy(r -> assertThat(r).isInstanceOf(RecordingRuleMessage.class));

        int total = manager.ruleGroups().stream().mapToInt(g -> g.getRules().size()).sum();
        int split = alerts.stream().mapToInt(g -> g.getRules().size()).sum()
                + records.stream().mapToInt(g -> g.getRules().size()).sum();
        assertThat(split).isEqualTo(total);
    }

    @Test
    @DisplayName("Should report a bad strategy and still load the other files")
    void shouldReportBadStrategy() throws IOException {
        Path bad = write("bad.yaml", ""
                + "groups:\n"
                + "  - name: broken\n"
                + "    partial_response_strategy: bogus\n"
                + "    rules: []\n");
        Path good = write("good.yaml", MIXED_FILE);

        assertThatThrownBy(() -> manager.update(INTERVAL, List.of(bad, good)))
                .isInstanceOfSatisfying(RuleReloadException.class, e -> {
                    assertThat(e.getCauses()).singleElement().isInstanceOf(StrategyParseException.class);
                    assertThat(e.getMessage()).contains(bad.toString()).contains("bogus");
                });

        assertThat(manager.ruleGroups()).extracting(RuleGroupMessage::getName)
                .containsExactlyInAnyOrder("warned-alerts", "aborting-records");
    }

    @Test
    @DisplayName("Should drop every group on an empty reload")
    void shouldClearOnEmptyReload() throws IOException {
        manager.update(INTERVAL, List.of(write("mixed.yaml", MIXED_FILE)));

        manager.update(INTERVAL, List.of());

        assertThat(manager.ruleGroups()).isEmpty();
        assertThat(manager.fileIndex().size()).isZero();
    }

    @Test
    @DisplayName("Should move a group to another engine when its strategy changes")
    void shouldMoveGroupOnStrategyChange() throws IOException {
        Path file = write("a.yaml", "groups:\n  - name: g\n    rules: []\n");
        manager.update(INTERVAL, List.of(file));
        assertThat(manager.ruleGroups()).singleElement()
                .satisfies(g -> assertThat(g.getPartialResponseStrategy()).isEqualTo(PartialResponseStrategy.ABORT));

        write("a.yaml", "groups:\n  - name: g\n    partial_response_strategy: none\n    rules: []\n");
        manager.update(INTERVAL, List.of(file));

        assertThat(manager.ruleGroups()).singleElement()
                .satisfies(g -> assertThat(g.getPartialResponseStrategy()).isEqualTo(PartialResponseStrategy.NONE));
        assertThat(engines.get(PartialResponseStrategy.ABORT).ruleGroups()).isEmpty();
    }

    @Test
    @DisplayName("Should stream groups one at a time and stop on sink failure")
    void shouldAbortOnSinkFailure() throws IOException {
        manager.update(INTERVAL, List.of(write("mixed.yaml", MIXED_FILE)));
        List<RuleGroupMessage> sent = new ArrayList<>();

        RuleGroupSink failing = group -> {
            sent.add(group);
            throw new IOException("client went away");
        };

        assertThatThrownBy(() -> manager.rules(RuleType.ALL, failing))
                .isInstanceOf(IOException.class)
                .hasMessage("client went away");
        assertThat(sent).hasSize(1);
    }

    @Test
    @DisplayName("Should stop streaming once the sink is cancelled")
    void shouldStopOnCancellation() throws IOException {
        manager.update(INTERVAL, List.of(write("mixed.yaml", MIXED_FILE)));
        List<RuleGroupMessage> sent = new ArrayList<>();

        RuleGroupSink cancelling = new RuleGroupSink() {
            @Override
            public void send(RuleGroupMessage group) {
                sent.add(group);
            }

            @Override
            public boolean isCancelled() {
                return !sent.isEmpty();
            }
        };

        assertThatThrownBy(() -> manager.rules(RuleType.ALL, cancelling))
                .isInstanceOf(CancellationException.class);
        assertThat(sent).hasSize(1);
    }

    @Test
    @DisplayName("Should stream every group to a cooperative sink")
    void shouldStreamAllGroups() throws IOException {
        manager.update(INTERVAL, List.of(write("mixed.yaml", MIXED_FILE)));
        List<RuleGroupMessage> sent = new ArrayList<>();

        manager.rules(RuleType.ALL, sent::add);

        assertThat(sent).hasSize(2);
    }

    @Test
    @DisplayName("Should stamp active alerts with the strategy of their engine")
    void shouldListActiveAlerts() throws IOException {
        manager.update(INTERVAL, List.of(write("mixed.yaml", MIXED_FILE)));
        engines.get(PartialResponseStrategy.WARN).evaluate(T0);

        List<AlertInstanceMessage> alerts = manager.activeAlerts();

        assertThat(alerts).singleElement().satisfies(alert -> {
            assertThat(alert.getPartialResponseStrategy()).isEqualTo(PartialResponseStrategy.WARN);
            assertThat(alert.getLabels()).containsEntry("alertname", "Down");
            assertThat(alert.getValue()).isEqualTo("0e+00");
        });
    }

    @Test
    @DisplayName("Should produce the same scratch files for the same input")
    void shouldNameScratchFilesStably() throws IOException {
        Path file = write("mixed.yaml", MIXED_FILE);

        manager.update(INTERVAL, List.of(file));
        List<Path> first = manager.fileIndex().activeFiles(PartialResponseStrategy.WARN);
        manager.update(INTERVAL, List.of(file));

        assertThat(manager.fileIndex().activeFiles(PartialResponseStrategy.WARN)).isEqualTo(first);
        assertThat(first).singleElement().satisfies(p -> assertThat(p.getFileName().toString())
                .isEqualTo(RuleFilePartitioner.scratchFileName(file, PartialResponseStrategy.WARN)));
    }

    // ---------------------------------------------------------------
    // Error paths with recording engines
    // ---------------------------------------------------------------

    private StrategyRuleManager managerWith(Map<PartialResponseStrategy, RecordingEngine> recorders,
            EnumSet<PartialResponseStrategy> strategies, Path dir) {
        EnginePool pool = new EnginePool(strategies,
                (strategy, fn, metrics) -> {
                    RecordingEngine engine = new RecordingEngine(strategy);
                    recorders.put(strategy, engine);
                    return engine;
                },
                strategy -> (q, t) -> List.of(),
                new SimpleMeterRegistry());
        return new StrategyRuleManager(dir, pool);
    }

    @Test
    @DisplayName("Should update every engine, passing empty lists to strategies without files")
    void shouldUpdateEveryEngine() throws IOException {
        Map<PartialResponseStrategy, RecordingEngine> recorders = new EnumMap<>(PartialResponseStrategy.class);
        StrategyRuleManager recording = managerWith(recorders,
                EnumSet.allOf(PartialResponseStrategy.class), dataDir);

        recording.update(INTERVAL, List.of(write("mixed.yaml", MIXED_FILE)));

        assertThat(recorders.get(PartialResponseStrategy.WARN).updates).singleElement()
                .satisfies(files -> assertThat(files).hasSize(1));
        assertThat(recorders.get(PartialResponseStrategy.ABORT).updates).singleElement()
                .satisfies(files -> assertThat(files).hasSize(1));
        assertThat(recorders.get(PartialResponseStrategy.NONE).updates).containsExactly(List.of());
    }

    @Test
    @DisplayName("Should report strategies without an engine and apply the others")
    void shouldReportMissingEngine() throws IOException {
        Map<PartialResponseStrategy, RecordingEngine> recorders = new EnumMap<>(PartialResponseStrategy.class);
        StrategyRuleManager abortOnly = managerWith(recorders, EnumSet.of(PartialResponseStrategy.ABORT), dataDir);

        assertThatThrownBy(() -> abortOnly.update(INTERVAL, List.of(write("mixed.yaml", MIXED_FILE))))
                .isInstanceOf(RuleReloadException.class)
                .hasMessageContaining("no engine found for strategy WARN");

        assertThat(recorders.get(PartialResponseStrategy.ABORT).updates).hasSize(1);
        assertThat(abortOnly.fileIndex().activeFiles(PartialResponseStrategy.ABORT)).hasSize(1);
        assertThat(abortOnly.fileIndex().activeFiles(PartialResponseStrategy.WARN)).isEmpty();
    }

    @Test
    @DisplayName("Should keep the previous files of a strategy whose engine rejected the update")
    void shouldKeepIndexOfFailedStrategy() throws IOException {
        Map<PartialResponseStrategy, RecordingEngine> recorders = new EnumMap<>(PartialResponseStrategy.class);
        StrategyRuleManager recording = managerWith(recorders,
                EnumSet.allOf(PartialResponseStrategy.class), dataDir);
        Path file = write("mixed.yaml", MIXED_FILE);
        recording.update(INTERVAL, List.of(file));
        List<Path> warnFiles = recording.fileIndex().activeFiles(PartialResponseStrategy.WARN);

        recorders.get(PartialResponseStrategy.WARN).failWith = new IllegalStateException("engine broke");

        assertThatThrownBy(() -> recording.update(INTERVAL, List.of()))
                .isInstanceOfSatisfying(RuleReloadException.class, e ->
                        assertThat(e.getCauses()).singleElement().satisfies(cause ->
                                assertThat(cause).hasMessage("strategy WARN: engine broke")));

        assertThat(recording.fileIndex().activeFiles(PartialResponseStrategy.WARN)).isEqualTo(warnFiles);
        assertThat(recording.fileIndex().activeFiles(PartialResponseStrategy.ABORT)).isEmpty();
        assertThat(recording.fileIndex().originalFile(warnFiles.get(0))).isEqualTo(file);
    }

    @Test
    @DisplayName("Should abort before touching any engine when the scratch directory fails")
    void shouldAbortOnScratchDirFailure() throws IOException {
        Map<PartialResponseStrategy, RecordingEngine> recorders = new EnumMap<>(PartialResponseStrategy.class);
        Path blocker = Files.writeString(tempDir.resolve("blocker"), "file");
        StrategyRuleManager broken = managerWith(recorders, EnumSet.allOf(PartialResponseStrategy.class), blocker);

        assertThatThrownBy(() -> broken.update(INTERVAL, List.of(write("mixed.yaml", MIXED_FILE))))
                .isInstanceOf(RuleReloadException.class);

        assertThat(recorders.values()).allSatisfy(engine -> assertThat(engine.updates).isEmpty());
        assertThat(broken.fileIndex().size()).isZero();
    }
}
