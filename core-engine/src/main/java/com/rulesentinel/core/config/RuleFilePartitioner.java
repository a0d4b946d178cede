package com.rulesentinel.core.config;

import com.rulesentinel.core.model.PartialResponseStrategy;
import com.rulesentinel.core.model.RuleGroupConfig;
import com.rulesentinel.core.model.RuleGroupsConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Splits rule files by {@code partial_response_strategy}.
 *
 * <p>
 * Every group of every input file is assigned its resolved strategy. Groups
 * of one file that share a strategy are written, in their original order and
 * without the strategy field, to one scratch file named
 * </p>
 *
 * <pre>
 * &lt;base name&gt;.&lt;sha256 of full path&gt;.&lt;STRATEGY&gt;
 * </pre>
 *
 * <p>
 * so two files with the same base name never collide and the same
 * (file, strategy) pair always maps to the same scratch file.
 * </p>
 *
 * <h3>Failures</h3>
 * <p>
 * A file that cannot be read, parsed or written is recorded in
 * {@link PartitionResult#errors()} and the remaining files are still
 * processed. Only a failure to rebuild the scratch directory itself aborts
 * the call.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Not thread-safe: the scratch directory is rebuilt on every call, so calls
 * must be serialized by the owner.
 * </p>
 *
 * @since 1.0.0
 */
public class RuleFilePartitioner {

    private static final Logger LOG = LoggerFactory.getLogger(RuleFilePartitioner.class);

    /** Name of the scratch directory below the data directory. */
    public static final String SCRATCH_DIR_NAME = ".tmp-rules";

    private final Path scratchDir;

    /**
     * @param dataDir working directory; the scratch directory is created below
     *                it; must not be {@code null}
     */
    public RuleFilePartitioner(Path dataDir) {
        Objects.requireNonNull(dataDir, "Data directory must not be null");
        this.scratchDir = dataDir.resolve(SCRATCH_DIR_NAME);
    }

    public Path getScratchDir() {
        return scratchDir;
    }

    /**
     * Partition the given rule files into per-strategy scratch files.
     *
     * @param files rule files in evaluation order; must not be {@code null}
     * @return written files, their origin, and every per-file error
     * @throws RuleReloadException if the scratch directory cannot be rebuilt
     */
    public PartitionResult partition(List<Path> files) {
        Objects.requireNonNull(files, "Rule files must not be null");
        resetScratchDir();

        Map<PartialResponseStrategy, List<Path>> filesByStrategy = new EnumMap<>(PartialResponseStrategy.class);
        Map<Path, Path> originalFiles = new HashMap<>();
        List<Exception> errors = new ArrayList<>();

        for (Path file : files) {
            Map<PartialResponseStrategy, List<RuleGroupConfig>> groupsByStrategy;
            try {
                groupsByStrategy = groupByStrategy(file, RuleGroupFileLoader.load(file));
            } catch (RuleConfigException e) {
                LOG.warn("Skipping rule file {}: {}", file, e.getMessage());
                errors.add(e);
                continue;
            }

            groupsByStrategy.forEach((strategy, groups) -> {
                Path scratchFile = scratchDir.resolve(scratchFileName(file, strategy));
                try {
                    Files.writeString(scratchFile, RuleGroupFileLoader.dump(RuleGroupsConfig.of(groups)),
                            StandardCharsets.UTF_8);
                } catch (IOException e) {
                    errors.add(new RuleConfigException(scratchFile, "failed to write rule groups", e));
                    return;
                }
                filesByStrategy.computeIfAbsent(strategy, s -> new ArrayList<>()).add(scratchFile);
                originalFiles.put(scratchFile, file);
            });
        }

        PartitionResult result = new PartitionResult(filesByStrategy, originalFiles, errors);
        LOG.debug("Partitioned {} rule file(s): {}", files.size(), result);
        return result;
    }

    /**
     * Deterministic scratch file name for a (file, strategy) pair.
     *
     * @param file     original rule file
     * @param strategy resolved strategy
     * @return file name, without directory
     */
    public static String scratchFileName(Path file, PartialResponseStrategy strategy) {
        Path fileName = file.getFileName();
        String base = fileName != null ? fileName.toString() : file.toString();
        return base + "." + sha256Hex(file.toString()) + "." + strategy.name();
    }

    /**
     * Resolve a group's strategy string.
     *
     * @param file  file the group came from, used in the error
     * @param value raw strategy string, may be {@code null} or empty
     * @return resolved strategy; {@link PartialResponseStrategy#DEFAULT} if
     *         absent
     * @throws StrategyParseException if {@code value} is not a known strategy
     */
    public static PartialResponseStrategy resolveStrategy(Path file, String value) {
        if (value == null || value.isEmpty()) {
            return PartialResponseStrategy.DEFAULT;
        }
        return PartialResponseStrategy.parse(value)
                .orElseThrow(() -> new StrategyParseException(file, value));
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static Map<PartialResponseStrategy, List<RuleGroupConfig>> groupByStrategy(
            Path file, RuleGroupsConfig config) {
        Map<PartialResponseStrategy, List<RuleGroupConfig>> out = new EnumMap<>(PartialResponseStrategy.class);
        for (RuleGroupConfig group : config.getGroups()) {
            PartialResponseStrategy strategy = resolveStrategy(file, group.getPartialResponseStrategy());
            out.computeIfAbsent(strategy, s -> new ArrayList<>()).add(group);
        }
        return out;
    }

    private void resetScratchDir() {
        try {
            if (Files.exists(scratchDir)) {
                try (Stream<Path> paths = Files.walk(scratchDir)) {
                    for (Path p : paths.sorted(Comparator.reverseOrder()).toList()) {
                        Files.delete(p);
                    }
                }
            }
            Files.createDirectories(scratchDir);
        } catch (IOException e) {
            throw new RuleReloadException(List.of(
                    new RuleConfigException(scratchDir, "failed to recreate scratch directory", e)));
        }
    }

    private static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
