package com.example.dedupscanner.console;

/**
 * Stops the web console once the current response has been written.
 */
@FunctionalInterface
public interface ConsoleShutdown {
    void requestShutdown();
}
