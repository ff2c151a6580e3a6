package com.example.dedupscanner.metadata;

import java.util.List;

/**
 * Files sharing one full content digest. Always holds at least two members.
 */
public record DuplicateGroup(
        String fullHash,
        long size,
        List<FileRecord> files
) {
    public DuplicateGroup {
        if (files == null || files.size() < 2) {
            throw new IllegalArgumentException("A duplicate group needs at least two files.");
        }
        files = List.copyOf(files);
    }

    public int fileCount() {
        return files.size();
    }

    /**
     * Bytes that would be freed by keeping a single copy.
     */
    public long reclaimableBytes() {
        return size * (files.size() - 1L);
    }
}
