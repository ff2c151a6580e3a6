package com.example.dedupscanner.metadata;

/**
 * A file or directory that could not be read during a scan.
 */
public record FailedFileRecord(
        String path,
        String error
) {
}
