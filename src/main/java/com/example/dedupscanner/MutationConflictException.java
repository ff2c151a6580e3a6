package com.example.dedupscanner;

import java.io.IOException;
import java.nio.file.Path;

/**
 * A delete or rename could not be applied because the filesystem no longer matches the
 * request: the source is gone or the rename target is taken. The index is left untouched.
 */
public class MutationConflictException extends IOException {
    private final Path path;

    public MutationConflictException(Path path, String message) {
        super(message);
        this.path = path;
    }

    public MutationConflictException(Path path, String message, IOException cause) {
        super(message, cause);
        this.path = path;
    }

    public Path path() {
        return path;
    }
}
