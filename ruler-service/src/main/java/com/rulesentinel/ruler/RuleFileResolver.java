package com.rulesentinel.ruler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Expands rule file patterns into concrete files.
 *
 * <p>
 * Each pattern is a path whose last element may be a glob
 * ({@code rules/*.yaml}); directories above it are taken literally. Patterns
 * that match nothing contribute nothing.
 * </p>
 *
 * @since 1.0.0
 */
public final class RuleFileResolver {

    private static final Logger LOG = LoggerFactory.getLogger(RuleFileResolver.class);

    private RuleFileResolver() {
        // utility class
    }

    /**
     * Resolve every pattern.
     *
     * @param patterns file patterns; must not be {@code null}
     * @return matching regular files as absolute paths, sorted and without
     *         duplicates
     * @throws IOException                             if a directory cannot be
     *                                                 listed
     * @throws java.util.regex.PatternSyntaxException if a glob is malformed
     */
    public static List<Path> resolve(List<String> patterns) throws IOException {
        Objects.requireNonNull(patterns, "patterns must not be null");
        TreeSet<Path> files = new TreeSet<>();
        for (String pattern : patterns) {
            List<Path> matched = resolve(pattern);
            if (matched.isEmpty()) {
                LOG.warn("Rule file pattern {} matched no files", pattern);
            }
            files.addAll(matched);
        }
        return List.copyOf(files);
    }

    /**
     * Resolve a single pattern.
     *
     * @param pattern file pattern
     * @return matching regular files as absolute, normalized paths
     * @throws IOException if the directory cannot be listed
     */
    public static List<Path> resolve(String pattern) throws IOException {
        Path path = Path.of(pattern).toAbsolutePath().normalize();
        Path fileName = path.getFileName();
        Path dir = path.getParent();
        List<Path> out = new ArrayList<>();
        if (fileName == null || dir == null) {
            return out;
        }
        if (!isGlob(fileName.toString())) {
            if (Files.isRegularFile(path)) {
                out.add(path);
            }
            return out;
        }
        if (!Files.isDirectory(dir)) {
            return out;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, fileName.toString())) {
            for (Path entry : stream) {
                if (Files.isRegularFile(entry)) {
                    out.add(entry);
                }
            }
        }
        out.sort(null);
        return out;
    }

    private static boolean isGlob(String name) {
        for (char c : name.toCharArray()) {
            if (c == '*' || c == '?' || c == '[' || c == '{') {
                return true;
            }
        }
        return false;
    }
}
