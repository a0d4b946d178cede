package com.rulesentinel.core.config;

import com.rulesentinel.core.model.PartialResponseStrategy;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable mapping from generated scratch files to the rule files they were
 * generated from, kept per strategy.
 *
 * <p>
 * Instances are never mutated; {@link #withStrategy} returns a copy. Owners
 * publish a new instance by swapping a single reference, so a reader holding
 * an instance always sees one consistent generation.
 * </p>
 *
 * @since 1.0.0
 */
public final class RuleFileIndex {

    /** Index with no entries. */
    public static final RuleFileIndex EMPTY = new RuleFileIndex(new EnumMap<>(PartialResponseStrategy.class));

    private final Map<PartialResponseStrategy, Map<Path, Path>> byStrategy;
    private final Map<Path, Path> originals;

    private RuleFileIndex(Map<PartialResponseStrategy, Map<Path, Path>> byStrategy) {
        this.byStrategy = byStrategy;
        Map<Path, Path> all = new HashMap<>();
        byStrategy.values().forEach(all::putAll);
        this.originals = Collections.unmodifiableMap(all);
    }

    /**
     * Copy of this index with the entries of one strategy replaced.
     *
     * @param strategy strategy whose entries are replaced
     * @param entries  scratch file to original file, in active file order
     * @return new index
     */
    public RuleFileIndex withStrategy(PartialResponseStrategy strategy, Map<Path, Path> entries) {
        Objects.requireNonNull(strategy, "strategy must not be null");
        Map<PartialResponseStrategy, Map<Path, Path>> copy = new EnumMap<>(PartialResponseStrategy.class);
        copy.putAll(byStrategy);
        if (entries == null || entries.isEmpty()) {
            copy.remove(strategy);
        } else {
            copy.put(strategy, Collections.unmodifiableMap(new LinkedHashMap<>(entries)));
        }
        return new RuleFileIndex(copy);
    }

    /**
     * Copy of this index with entries added to those of one strategy. Entries
     * for the same scratch file are overwritten.
     *
     * @param strategy strategy to add entries to
     * @param entries  scratch file to original file
     * @return new index
     */
    public RuleFileIndex withAddedEntries(PartialResponseStrategy strategy, Map<Path, Path> entries) {
        Objects.requireNonNull(strategy, "strategy must not be null");
        Map<Path, Path> merged = new LinkedHashMap<>(entries(strategy));
        merged.putAll(entries);
        return withStrategy(strategy, merged);
    }

    /**
     * Original rule file for a scratch file.
     *
     * @param scratchFile generated file
     * @return the original file, or {@code scratchFile} itself if unknown
     */
    public Path originalFile(Path scratchFile) {
        return originals.getOrDefault(scratchFile, scratchFile);
    }

    /**
     * @param strategy partial response strategy
     * @return the strategy's entries; empty if none
     */
    public Map<Path, Path> entries(PartialResponseStrategy strategy) {
        return byStrategy.getOrDefault(strategy, Map.of());
    }

    /**
     * @param strategy partial response strategy
     * @return scratch files currently loaded for that strategy, in load order
     */
    public List<Path> activeFiles(PartialResponseStrategy strategy) {
        return Collections.unmodifiableList(new ArrayList<>(entries(strategy).keySet()));
    }

    /**
     * @return total number of scratch files across strategies
     */
    public int size() {
        return originals.size();
    }

    @Override
    public String toString() {
        return "RuleFileIndex" + byStrategy;
    }
}
