package com.example.dedupscanner;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Immutable runtime settings for one scan.
 */
public record ScanConfig(
        Path root,
        boolean recursive,
        List<String> excludePatterns,
        Optional<Path> indexPath,
        boolean resume,
        int threadCount,
        int progressFlushInterval
) {
    public ScanConfig {
        excludePatterns = List.copyOf(excludePatterns);
        if (threadCount < 1) {
            throw new IllegalArgumentException("threadCount must be positive: " + threadCount);
        }
        if (progressFlushInterval < 1) {
            throw new IllegalArgumentException("progressFlushInterval must be positive: " + progressFlushInterval);
        }
    }
}
