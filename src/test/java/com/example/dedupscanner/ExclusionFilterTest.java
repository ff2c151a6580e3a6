package com.example.dedupscanner;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExclusionFilterTest {
    private final Path workingDirectory = Path.of("/data/work").toAbsolutePath();

    @Test
    void namePatternsMatchAtAnyDepth() {
        ExclusionFilter filter = new ExclusionFilter(List.of("*.tmp", "node_modules"), workingDirectory);

        assertTrue(filter.isExcluded(workingDirectory.resolve("a.tmp")));
        assertTrue(filter.isExcluded(workingDirectory.resolve("deep/nested/b.tmp")));
        assertTrue(filter.isExcluded(workingDirectory.resolve("project/node_modules")));
        assertFalse(filter.isExcluded(workingDirectory.resolve("a.txt")));
    }

    @Test
    void pathPatternsMatchRelativeToWorkingDirectory() {
        ExclusionFilter filter = new ExclusionFilter(List.of("build/**"), workingDirectory);

        assertTrue(filter.isExcluded(workingDirectory.resolve("build/classes/App.class")));
        assertFalse(filter.isExcluded(workingDirectory.resolve("src/build/App.class")));
    }

    @Test
    void noPatternsExcludeNothing() {
        assertFalse(ExclusionFilter.NONE.isExcluded(workingDirectory.resolve("anything")));
        assertFalse(new ExclusionFilter(List.of(" "), workingDirectory).isExcluded(workingDirectory.resolve("x")));
    }
}
