package com.example.dedupscanner.metadata;

import java.time.Instant;

/**
 * Persisted lifecycle record of one scan. {@code endTime} is {@code null} while the
 * scan is running or when the process died before completing it.
 */
public record ScanSession(
        long id,
        String baseDirectory,
        Instant startTime,
        Instant endTime,
        long filesScanned,
        long groupsFound
) {
    public boolean isComplete() {
        return endTime != null;
    }
}
