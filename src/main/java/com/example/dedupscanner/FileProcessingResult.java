package com.example.dedupscanner;

import com.example.dedupscanner.metadata.FailedFileRecord;
import com.example.dedupscanner.metadata.FileRecord;

import java.nio.file.Path;

/**
 * Queue item passed from the hashing workers to the record consumer. Exactly one of
 * {@link #record()} and {@link #failure()} is set, except for the end-of-walk marker.
 */
final class FileProcessingResult {
    static final FileProcessingResult END_OF_WALK = new FileProcessingResult(null, null);

    private final FileRecord record;
    private final FailedFileRecord failure;

    private FileProcessingResult(FileRecord record, FailedFileRecord failure) {
        this.record = record;
        this.failure = failure;
    }

    static FileProcessingResult hashed(FileRecord record) {
        return new FileProcessingResult(record, null);
    }

    static FileProcessingResult failed(Path path, Exception cause) {
        return new FileProcessingResult(null, new FailedFileRecord(path.toString(), String.valueOf(cause.getMessage())));
    }

    boolean isHashed() {
        return record != null;
    }

    FileRecord record() {
        return record;
    }

    FailedFileRecord failure() {
        return failure;
    }
}
