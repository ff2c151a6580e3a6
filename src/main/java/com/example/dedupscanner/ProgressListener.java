package com.example.dedupscanner;

/**
 * Receives every progress increment of a scan. Implementations decide how often to display it.
 */
@FunctionalInterface
public interface ProgressListener {
    void onProgress(long filesScanned, long groupsFound, ScanPhase phase);

    /**
     * Listener that ignores all updates.
     */
    ProgressListener NONE = (filesScanned, groupsFound, phase) -> {
    };
}
