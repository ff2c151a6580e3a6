package com.example.dedupscanner;

import java.nio.file.FileSystem;
import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.List;

/**
 * Glob-based exclusion rules. Paths are matched relative to the working directory, and
 * patterns without a separator also match the bare file name. Matching never touches the
 * filesystem.
 */
public final class ExclusionFilter {
    public static final ExclusionFilter NONE = new ExclusionFilter(List.of());

    private final List<Rule> rules;
    private final Path workingDirectory;

    public ExclusionFilter(List<String> patterns) {
        this(patterns, Path.of("").toAbsolutePath());
    }

    ExclusionFilter(List<String> patterns, Path workingDirectory) {
        FileSystem fileSystem = FileSystems.getDefault();
        List<Rule> compiled = new ArrayList<>();
        for (String pattern : patterns) {
            if (pattern == null || pattern.isBlank()) {
                continue;
            }
            compiled.add(new Rule(fileSystem.getPathMatcher("glob:" + pattern), !pattern.contains("/")));
        }
        this.rules = List.copyOf(compiled);
        this.workingDirectory = workingDirectory.toAbsolutePath().normalize();
    }

    public boolean isExcluded(Path path) {
        if (rules.isEmpty()) {
            return false;
        }
        Path absolute = path.toAbsolutePath().normalize();
        Path relative = relativize(absolute);
        Path fileName = absolute.getFileName();
        for (Rule rule : rules) {
            if (rule.matcher().matches(relative) || rule.matcher().matches(absolute)) {
                return true;
            }
            if (rule.matchesFileName() && fileName != null && rule.matcher().matches(fileName)) {
                return true;
            }
        }
        return false;
    }

    private Path relativize(Path absolute) {
        try {
            return workingDirectory.relativize(absolute);
        } catch (IllegalArgumentException ex) {
            // different root, e.g. another drive
            return absolute;
        }
    }

    private record Rule(PathMatcher matcher, boolean matchesFileName) {
    }
}
