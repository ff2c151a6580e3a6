package com.example.dedupscanner.console;

/**
 * Request and response bodies of the console API.
 */
public final class ConsoleMessages {
    private ConsoleMessages() {
    }

    public record DeleteRequest(String filePath) {
    }

    public record RenameRequest(String oldPath, String newName) {
    }

    public record ShutdownRequest(boolean deleteIndex) {
    }

    public record MutationResponse(boolean success, String message, String newPath) {
    }

    public record ErrorResponse(String error, String details) {
    }
}
