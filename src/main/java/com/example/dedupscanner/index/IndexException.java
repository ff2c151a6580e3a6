package com.example.dedupscanner.index;

import java.io.IOException;

/**
 * The scan index is missing, corrupt or could not be written.
 */
public class IndexException extends IOException {
    public IndexException(String message) {
        super(message);
    }

    public IndexException(String message, Throwable cause) {
        super(message, cause);
    }
}
