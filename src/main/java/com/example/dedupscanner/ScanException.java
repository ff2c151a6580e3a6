package com.example.dedupscanner;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Raised when a directory cannot be listed. Only fatal when it is the scan root.
 */
public class ScanException extends IOException {
    private final Path directory;

    public ScanException(Path directory, IOException cause) {
        super("Failed to scan directory " + directory + ": " + cause.getMessage(), cause);
        this.directory = directory;
    }

    public Path directory() {
        return directory;
    }
}
