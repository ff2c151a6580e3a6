package com.example.dedupscanner.index;

import com.example.dedupscanner.metadata.FileRecord;

/**
 * A {@link FileRecord} together with the row that stores it.
 */
public record IndexedFile(
        long id,
        long scanId,
        String groupId,
        FileRecord record
) {
}
