package com.example.dedupscanner;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads scan defaults from an optional JSON file. Command-line flags are applied on top by
 * {@link CliOptions#toScanConfig(ScanConfig)}.
 */
public class ConfigLoader {
    static final int DEFAULT_PROGRESS_FLUSH_INTERVAL = 1000;

    private final ObjectMapper mapper;

    public ConfigLoader() {
        mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public ScanConfig load(Path path) throws IOException {
        RawConfig raw = mapper.readValue(path.toFile(), RawConfig.class);

        Path root = Path.of(optionalString(raw.root, "."));
        boolean recursive = raw.recursive != null && raw.recursive;
        List<String> excludePatterns = cleanPatterns(raw.excludePatterns);
        Optional<Path> indexPath = Optional.ofNullable(raw.indexPath)
                .filter(value -> !value.isBlank())
                .map(Path::of);
        int threadCount = raw.threadCount != null && raw.threadCount > 0
                ? raw.threadCount
                : defaultThreadCount();
        int flushInterval = raw.progressFlushInterval != null && raw.progressFlushInterval > 0
                ? raw.progressFlushInterval
                : DEFAULT_PROGRESS_FLUSH_INTERVAL;

        return new ScanConfig(root, recursive, excludePatterns, indexPath, false, threadCount, flushInterval);
    }

    /**
     * Settings used when no config file is given.
     */
    public ScanConfig defaults() {
        return new ScanConfig(
                Path.of("."),
                false,
                List.of(),
                Optional.empty(),
                false,
                defaultThreadCount(),
                DEFAULT_PROGRESS_FLUSH_INTERVAL
        );
    }

    private static int defaultThreadCount() {
        return Math.max(1, Runtime.getRuntime().availableProcessors());
    }

    private List<String> cleanPatterns(List<String> patterns) {
        List<String> cleaned = new ArrayList<>();
        if (patterns != null) {
            for (String pattern : patterns) {
                if (pattern == null || pattern.isBlank() || cleaned.contains(pattern)) {
                    continue;
                }
                cleaned.add(pattern);
            }
        }
        return List.copyOf(cleaned);
    }

    private String optionalString(String value, String fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        return value;
    }

    private static class RawConfig {
        public String root;
        public Boolean recursive;
        public List<String> excludePatterns;
        public String indexPath;
        public Integer threadCount;
        public Integer progressFlushInterval;
    }
}
