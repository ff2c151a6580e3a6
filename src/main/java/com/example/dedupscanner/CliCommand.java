package com.example.dedupscanner;

import java.util.Arrays;

public enum CliCommand {
    SCAN("scan"),
    SERVE("serve"),
    SHUTDOWN("shutdown"),
    GENERATE_TEST("generate-test");

    private final String name;

    CliCommand(String name) {
        this.name = name;
    }

    public String commandName() {
        return name;
    }

    public static CliCommand fromName(String name) {
        return Arrays.stream(values())
                .filter(command -> command.name.equals(name))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown command: " + name
                        + " (expected scan, serve, shutdown or generate-test)"));
    }
}
