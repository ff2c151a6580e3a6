package com.example.dedupscanner;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Parsed command line. Unset optional values stay {@code null} so that a config file can
 * supply them.
 */
public class CliOptions {
    public static final int DEFAULT_PORT = 8080;

    public CliCommand command = CliCommand.SCAN;

    // scan / generate-test target directory, serve index file
    public String target;

    // scan
    public boolean recursive = false;
    public boolean web = true;
    public String indexPath;
    public boolean resume = false;
    public List<String> excludePatterns = new ArrayList<>();
    public Integer threadCount;
    public String configFile;

    // serve / shutdown
    public int port = DEFAULT_PORT;
    public Long sessionId;
    public boolean deleteIndex = false;

    // generate-test
    public int count = 20;
    public int duplicates = 2;

    public boolean helpRequested = false;

    /**
     * Applies the scan flags on top of {@code base}, the defaults or a loaded config file.
     */
    public ScanConfig toScanConfig(ScanConfig base) {
        List<String> patterns = new ArrayList<>(base.excludePatterns());
        for (String pattern : excludePatterns) {
            if (!patterns.contains(pattern)) {
                patterns.add(pattern);
            }
        }
        Path root = target != null ? Path.of(target) : base.root();
        Optional<Path> index = indexPath != null ? Optional.of(Path.of(indexPath)) : base.indexPath();
        return new ScanConfig(
                root,
                recursive || base.recursive(),
                patterns,
                index,
                resume,
                threadCount != null ? threadCount : base.threadCount(),
                base.progressFlushInterval()
        );
    }
}
