package com.rulesentinel.core.config;

import com.rulesentinel.core.model.PartialResponseStrategy;

import java.nio.file.Path;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of partitioning a set of rule files: what was written, where it
 * came from, and what failed.
 *
 * @since 1.0.0
 */
public final class PartitionResult {

    private final Map<PartialResponseStrategy, List<Path>> filesByStrategy;
    private final Map<Path, Path> originalFiles;
    private final List<Exception> errors;

    PartitionResult(Map<PartialResponseStrategy, List<Path>> filesByStrategy,
            Map<Path, Path> originalFiles,
            List<Exception> errors) {
        Map<PartialResponseStrategy, List<Path>> copy = new EnumMap<>(PartialResponseStrategy.class);
        filesByStrategy.forEach((s, files) -> copy.put(s, List.copyOf(files)));
        this.filesByStrategy = Collections.unmodifiableMap(copy);
        this.originalFiles = Map.copyOf(originalFiles);
        this.errors = List.copyOf(errors);
    }

    /**
     * @param strategy partial response strategy
     * @return scratch files holding the groups of that strategy, in input order;
     *         empty if none
     */
    public List<Path> files(PartialResponseStrategy strategy) {
        return filesByStrategy.getOrDefault(strategy, List.of());
    }

    /**
     * @return unmodifiable view of scratch files per strategy; strategies
     *         without groups are absent
     */
    public Map<PartialResponseStrategy, List<Path>> filesByStrategy() {
        return filesByStrategy;
    }

    /**
     * @return mapping from scratch file to the rule file it was generated from
     */
    public Map<Path, Path> originalFiles() {
        return originalFiles;
    }

    /**
     * @return per-file errors, empty if every file was partitioned
     */
    public List<Exception> errors() {
        return errors;
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    @Override
    public String toString() {
        return "PartitionResult{" +
                "filesByStrategy=" + filesByStrategy +
                ", errors=" + errors.size() +
                '}';
    }
}
