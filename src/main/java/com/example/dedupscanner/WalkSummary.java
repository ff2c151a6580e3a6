package com.example.dedupscanner;

import com.example.dedupscanner.metadata.FailedFileRecord;

import java.util.List;

/**
 * Outcome of one directory walk.
 */
public record WalkSummary(
        long filesEmitted,
        List<FailedFileRecord> failures,
        boolean stoppedEarly
) {
}
