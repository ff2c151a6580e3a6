package com.example.dedupscanner;

import com.example.dedupscanner.metadata.FileRecord;

import java.io.IOException;

/**
 * Receives collected records, always from a single thread.
 */
@FunctionalInterface
public interface RecordSink {
    void accept(FileRecord record) throws IOException;
}
