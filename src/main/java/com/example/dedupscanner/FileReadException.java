package com.example.dedupscanner;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Raised when a single file cannot be stat'ed or hashed. The scan skips the file and continues.
 */
public class FileReadException extends IOException {
    private final Path path;

    public FileReadException(Path path, IOException cause) {
        super("Failed to read " + path + ": " + cause.getMessage(), cause);
        this.path = path;
    }

    public Path path() {
        return path;
    }
}
