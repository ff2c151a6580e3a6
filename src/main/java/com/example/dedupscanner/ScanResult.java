package com.example.dedupscanner;

import com.example.dedupscanner.metadata.DuplicateGroup;
import com.example.dedupscanner.metadata.FailedFileRecord;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * What a scan hands back to its caller. {@code indexPath} and {@code sessionId} are present
 * only for index-backed scans; {@code complete} is false when the walk was stopped early.
 */
public record ScanResult(
        List<DuplicateGroup> groups,
        long filesScanned,
        List<FailedFileRecord> failures,
        boolean complete,
        Optional<Path> indexPath,
        Optional<Long> sessionId
) {
}
