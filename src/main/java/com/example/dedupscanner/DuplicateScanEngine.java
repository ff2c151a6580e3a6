package com.example.dedupscanner;

import com.example.dedupscanner.index.IndexedFile;
import com.example.dedupscanner.index.ScanIndex;
import com.example.dedupscanner.metadata.DuplicateGroup;
import com.example.dedupscanner.metadata.FileRecord;
import com.example.dedupscanner.metadata.ScanSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Orchestrates a scan: directory walk, staged classification and, when an index path is
 * configured, persistence of every record and group assignment.
 */
public final class DuplicateScanEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(DuplicateScanEngine.class);

    private final ScanConfig config;
    private final ProgressListener progress;
    private final ContentHasher hasher;
    private final ProcessingLimiter limiter;

    public DuplicateScanEngine(ScanConfig config, ProgressListener progress) {
        this(config, progress, new ContentHasher(), ProcessingLimiter.NO_LIMIT);
    }

    DuplicateScanEngine(ScanConfig config, ProgressListener progress, ContentHasher hasher, ProcessingLimiter limiter) {
        this.config = config;
        this.progress = progress;
        this.hasher = hasher;
        this.limiter = limiter;
    }

    public ScanResult scan() throws IOException, InterruptedException {
        Path root = config.root().toAbsolutePath().normalize();
        if (config.indexPath().isEmpty()) {
            return scanInMemory(root);
        }
        try (ScanIndex index = ScanIndex.open(config.indexPath().get())) {
            return scanIndexed(root, index);
        }
    }

    private ScanResult scanInMemory(Path root) throws IOException, InterruptedException {
        List<FileRecord> records = new ArrayList<>();
        WalkSummary walk = newCollector().walk(root, config.recursive(), records::add);
        if (walk.stoppedEarly()) {
            LOGGER.info("Scan stopped after {} files.", records.size());
            return new ScanResult(List.of(), records.size(), walk.failures(), false, Optional.empty(), Optional.empty());
        }
        List<DuplicateGroup> groups = new DuplicateClassifier(hasher, progress).classify(records);
        LOGGER.info("Scan of {} completed: {} files, {} duplicate groups.", root, records.size(), groups.size());
        return new ScanResult(groups, records.size(), walk.failures(), true, Optional.empty(), Optional.empty());
    }

    private ScanResult scanIndexed(Path root, ScanIndex index) throws IOException, InterruptedException {
        List<FileRecord> records = new ArrayList<>();
        Map<String, Long> rowIds = new HashMap<>();
        Set<Path> skip = new HashSet<>(ScanIndex.storageFiles(index.path()));

        long scanId = resumeOrStart(index, root, records, rowIds, skip);
        long resumed = records.size();

        // The sink runs on the collector's consumer thread; nothing else touches these
        // collections until walk() has joined it.
        WalkSummary walk = newCollector().walk(root, config.recursive(), skip, resumed, record -> {
            long rowId = index.addFile(scanId, record);
            rowIds.put(record.path(), rowId);
            records.add(record);
            if (records.size() % config.progressFlushInterval() == 0) {
                index.updateProgress(scanId, records.size(), 0);
            }
        });
        index.updateProgress(scanId, records.size(), 0);

        if (walk.stoppedEarly()) {
            LOGGER.info("Scan session {} paused after {} files; resume it with the same index.", scanId, records.size());
            return new ScanResult(List.of(), records.size(), walk.failures(), false,
                    Optional.of(index.path()), Optional.of(scanId));
        }

        List<DuplicateGroup> groups = new DuplicateClassifier(hasher, progress).classify(records);
        for (DuplicateGroup group : groups) {
            for (FileRecord member : group.files()) {
                index.updateFileHash(rowIds.get(member.path()), member.fullHash(), group.fullHash());
            }
        }
        index.updateProgress(scanId, records.size(), groups.size());
        index.completeScan(scanId);
        LOGGER.info("Scan session {} of {} completed: {} files, {} duplicate groups.",
                scanId, root, records.size(), groups.size());
        return new ScanResult(groups, records.size(), walk.failures(), true,
                Optional.of(index.path()), Optional.of(scanId));
    }

    /**
     * Reopens the newest incomplete session for {@code root} when resuming, loading its rows so
     * that their paths are not walked or inserted again. Otherwise starts a new session.
     */
    private long resumeOrStart(ScanIndex index,
                               Path root,
                               List<FileRecord> records,
                               Map<String, Long> rowIds,
                               Set<Path> skip) throws IOException {
        if (config.resume()) {
            Optional<ScanSession> incomplete = index.findIncompleteSession(root.toString());
            if (incomplete.isPresent()) {
                long scanId = incomplete.get().id();
                for (IndexedFile file : index.getFiles(scanId)) {
                    records.add(file.record());
                    rowIds.put(file.record().path(), file.id());
                    skip.add(Path.of(file.record().path()));
                }
                LOGGER.info("Resuming scan session {} with {} files already indexed.", scanId, records.size());
                return scanId;
            }
            LOGGER.info("No incomplete scan of {} in {}; starting a new session.", root, index.path());
        }
        return index.startScan(root.toString());
    }

    private MetadataCollector newCollector() {
        return new MetadataCollector(
                hasher,
                new ExclusionFilter(config.excludePatterns()),
                config.threadCount(),
                limiter,
                progress
        );
    }
}
