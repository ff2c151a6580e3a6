package com.example.dedupscanner;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigLoaderTest {
    @TempDir
    Path dir;

    @Test
    void loadsAllFields() throws Exception {
        Path file = Files.writeString(dir.resolve("config.json"), """
                {
                  "root": "/srv/media",
                  "recursive": true,
                  "excludePatterns": ["*.tmp", "", "*.tmp", "thumbs/**"],
                  "indexPath": "/srv/media.db",
                  "threadCount": 3,
                  "progressFlushInterval": 50,
                  "unknownSetting": "ignored"
                }
                """);

        ScanConfig config = new ConfigLoader().load(file);

        assertEquals(Path.of("/srv/media"), config.root());
        assertTrue(config.recursive());
        assertEquals(List.of("*.tmp", "thumbs/**"), config.excludePatterns());
        assertEquals(Path.of("/srv/media.db"), config.indexPath().orElseThrow());
        assertEquals(3, config.threadCount());
        assertEquals(50, config.progressFlushInterval());
        assertFalse(config.resume());
    }

    @Test
    void missingFieldsFallBackToDefaults() throws Exception {
        Path file = Files.writeString(dir.resolve("config.json"), "{}");

        ScanConfig config = new ConfigLoader().load(file);
        ScanConfig defaults = new ConfigLoader().defaults();

        assertEquals(defaults, config);
        assertEquals(Path.of("."), config.root());
        assertTrue(config.indexPath().isEmpty());
        assertTrue(config.threadCount() >= 1);
        assertEquals(1000, config.progressFlushInterval());
    }

    @Test
    void malformedJsonFails() throws Exception {
        Path file = Files.writeString(dir.resolve("config.json"), "{ not json");

        assertThrows(java.io.IOException.class, () -> new ConfigLoader().load(file));
    }
}
