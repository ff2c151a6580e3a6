package com.example.dedupscanner;

/**
 * Early-stop rule for a directory walk. A walk stopped this way leaves its index session
 * incomplete, ready to be resumed.
 */
@FunctionalInterface
public interface ProcessingLimiter {
    ProcessingLimiter NO_LIMIT = filesQueued -> false;

    /**
     * Checked after each file is queued for hashing.
     */
    boolean shouldStop(long filesQueued);

    static ProcessingLimiter afterFiles(long maxFiles) {
        if (maxFiles < 1) {
            throw new IllegalArgumentException("maxFiles must be positive: " + maxFiles);
        }
        return filesQueued -> filesQueued >= maxFiles;
    }
}
