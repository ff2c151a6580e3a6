package com.example.dedupscanner;

import com.example.dedupscanner.console.ConsoleServer;
import com.example.dedupscanner.console.ManagementConsole;
import com.example.dedupscanner.console.ShutdownClient;
import com.example.dedupscanner.index.ScanIndex;
import com.example.dedupscanner.metadata.ScanSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

public final class App {
    private static final Logger LOGGER = LoggerFactory.getLogger(App.class);

    private App() {
    }

    public static void main(String[] args) {
        CliOptions options;
        try {
            options = new CommandLineParser().parse(args);
        } catch (IllegalArgumentException ex) {
            LOGGER.error(ex.getMessage());
            System.err.println(CommandLineParser.usage());
            System.exit(1);
            return;
        }
        if (options.helpRequested) {
            System.out.println(CommandLineParser.usage());
            return;
        }

        try {
            switch (options.command) {
                case SCAN:
                    scan(options);
                    break;
                case SERVE:
                    serve(options);
                    break;
                case SHUTDOWN:
                    new ShutdownClient().shutdown(options.port, options.deleteIndex);
                    LOGGER.info("Shutdown requested for the console on port {}", options.port);
                    break;
                case GENERATE_TEST:
                    new TestFileGenerator().generate(Path.of(options.target), options.count, options.duplicates);
                    break;
                default:
                    throw new IllegalArgumentException("Unsupported command: " + options.command);
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            LOGGER.error("Interrupted", ex);
            System.exit(1);
        } catch (Exception ex) {
            LOGGER.error("{}: {}", options.command.commandName(), ex.getMessage(), ex);
            System.exit(1);
        }
        // No exit on success: a started console keeps the JVM alive until it is shut down.
    }

    private static void scan(CliOptions options) throws Exception {
        ScanConfig config = resolveScanConfig(options, new ConfigLoader());
        LOGGER.info("Scanning {}{}", config.root().toAbsolutePath().normalize(), config.recursive() ? " recursively" : "");
        ScanResult result = new DuplicateScanEngine(config, new ThrottledProgressPrinter()).scan();
        if (!result.failures().isEmpty()) {
            LOGGER.warn("{} files or directories could not be read", result.failures().size());
        }

        if (!options.web) {
            System.out.println(ConsoleReport.render(result.groups()));
            return;
        }
        Path indexPath = result.indexPath().orElseThrow();
        long sessionId = result.sessionId().orElseThrow();
        startConsole(ScanIndex.openExisting(indexPath), sessionId, options.port);
        LOGGER.info("Index stored at {}", indexPath);
    }

    /**
     * Merges the config file (or defaults) with the flags. Web mode always gets an index,
     * generated inside the root when none is configured.
     *
     * @throws IllegalArgumentException if resuming without a configured index
     */
    static ScanConfig resolveScanConfig(CliOptions options, ConfigLoader loader) throws IOException {
        ScanConfig base = options.configFile != null ? loader.load(Path.of(options.configFile)) : loader.defaults();
        ScanConfig config = options.toScanConfig(base);
        // Checked before a generated index is substituted.
        if (config.resume() && config.indexPath().isEmpty()) {
            throw new IllegalArgumentException("--incomplete requires an index file (--index or indexPath in the config)");
        }
        if (options.web && config.indexPath().isEmpty()) {
            config = withIndex(config, ScanIndex.defaultPath(config.root()));
        }
        return config;
    }

    private static void serve(CliOptions options) throws Exception {
        Path indexPath = Path.of(options.target);
        ScanIndex index = ScanIndex.openExisting(indexPath);
        Optional<ScanSession> session = options.sessionId != null
                ? index.getScanInfo(options.sessionId)
                : index.latestSession();
        if (session.isEmpty()) {
            index.close();
            throw new IllegalArgumentException("Invalid or corrupted index file: " + indexPath);
        }
        ScanSession info = session.get();
        LOGGER.info("Serving scan session {} of {} ({} files, {} groups{})",
                info.id(), info.baseDirectory(), info.filesScanned(), info.groupsFound(),
                info.isComplete() ? "" : ", incomplete");
        startConsole(index, info.id(), options.port);
    }

    private static void startConsole(ScanIndex index, long sessionId, int port) {
        ConsoleServer.start(new ManagementConsole(index, sessionId), port);
    }

    private static ScanConfig withIndex(ScanConfig config, Path indexPath) {
        return new ScanConfig(
                config.root(),
                config.recursive(),
                config.excludePatterns(),
                Optional.of(indexPath),
                config.resume(),
                config.threadCount(),
                config.progressFlushInterval()
        );
    }
}
