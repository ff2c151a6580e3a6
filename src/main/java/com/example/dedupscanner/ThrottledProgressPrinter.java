package com.example.dedupscanner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.LongSupplier;

/**
 * Logs scan progress at most once per interval. The engine reports every increment; this is
 * where the display rate is limited.
 */
public final class ThrottledProgressPrinter implements ProgressListener {
    private static final Logger LOGGER = LoggerFactory.getLogger(ThrottledProgressPrinter.class);
    private static final long DEFAULT_INTERVAL_MILLIS = 1000;

    private final long intervalMillis;
    private final LongSupplier clock;
    private final long startedAt;
    private long lastPrinted;
    private long printed;

    public ThrottledProgressPrinter() {
        this(DEFAULT_INTERVAL_MILLIS, System::currentTimeMillis);
    }

    ThrottledProgressPrinter(long intervalMillis, LongSupplier clock) {
        this.intervalMillis = intervalMillis;
        this.clock = clock;
        this.startedAt = clock.getAsLong();
        this.lastPrinted = startedAt;
    }

    @Override
    public synchronized void onProgress(long filesScanned, long groupsFound, ScanPhase phase) {
        long now = clock.getAsLong();
        if (now - lastPrinted <= intervalMillis) {
            return;
        }
        lastPrinted = now;
        printed++;
        LOGGER.info("[{}] Processed {} files, found {} groups ({})",
                phase.label(), filesScanned, groupsFound, formatElapsed(Duration.ofMillis(now - startedAt)));
    }

    synchronized long printedCount() {
        return printed;
    }

    static String formatElapsed(Duration elapsed) {
        long hours = elapsed.toHours();
        int minutes = elapsed.toMinutesPart();
        int seconds = elapsed.toSecondsPart();
        if (hours > 0) {
            return hours + "h " + minutes + "m " + seconds + "s";
        }
        if (minutes > 0) {
            return minutes + "m " + seconds + "s";
        }
        return seconds + "." + (elapsed.toMillisPart() / 100) + "s";
    }
}
