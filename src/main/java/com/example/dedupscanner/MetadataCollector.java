package com.example.dedupscanner;

import com.example.dedupscanner.metadata.FailedFileRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Walks a directory tree and streams one {@link com.example.dedupscanner.metadata.FileRecord}
 * per accepted regular file.
 *
 * <p>Quick digests are computed on a worker pool. Every result, successful or not, goes
 * through one queue to a single consumer thread, which is the only caller of the
 * {@link RecordSink} and of the {@link ProgressListener}.
 */
public final class MetadataCollector {
    private static final Logger LOGGER = LoggerFactory.getLogger(MetadataCollector.class);

    private final FileRecordExtractor extractor;
    private final ExclusionFilter exclusions;
    private final int threadCount;
    private final ProcessingLimiter limiter;
    private final ProgressListener progress;

    public MetadataCollector(ContentHasher hasher, ExclusionFilter exclusions, int threadCount) {
        this(hasher, exclusions, threadCount, ProcessingLimiter.NO_LIMIT, ProgressListener.NONE);
    }

    public MetadataCollector(ContentHasher hasher,
                             ExclusionFilter exclusions,
                             int threadCount,
                             ProcessingLimiter limiter,
                             ProgressListener progress) {
        this.extractor = new FileRecordExtractor(hasher);
        this.exclusions = exclusions;
        this.threadCount = Math.max(1, threadCount);
        this.limiter = limiter;
        this.progress = progress;
    }

    public WalkSummary walk(Path root, boolean recursive, RecordSink sink) throws IOException, InterruptedException {
        return walk(root, recursive, Set.of(), 0, sink);
    }

    /**
     * Walks {@code root}, skipping excluded entries and any path in {@code skip}. Progress
     * counts start at {@code alreadyScanned} so that a resumed scan reports its running total.
     *
     * @throws ScanException if the root itself cannot be read or listed
     * @throws IOException   the first failure raised by the sink
     */
    public WalkSummary walk(Path root, boolean recursive, Set<Path> skip, long alreadyScanned, RecordSink sink)
            throws IOException, InterruptedException {
        Path start = root.toAbsolutePath().normalize();
        BasicFileAttributes rootAttributes;
        try {
            rootAttributes = Files.readAttributes(start, BasicFileAttributes.class);
        } catch (IOException ex) {
            throw new ScanException(start, ex);
        }
        if (!rootAttributes.isDirectory()) {
            throw new ScanException(start, new NotDirectoryException(start.toString()));
        }

        BlockingQueue<FileProcessingResult> resultQueue = new LinkedBlockingQueue<>();
        RecordConsumer recordConsumer = new RecordConsumer(resultQueue, sink, alreadyScanned);
        Thread consumer = new Thread(recordConsumer, "record-consumer");
        consumer.start();

        ExecutorService hashExecutor = Executors.newFixedThreadPool(threadCount);
        Deque<Path> pending = new ArrayDeque<>();
        pending.addLast(start);
        long submitted = 0;
        boolean stopRequested = false;
        ScanException rootFailure = null;

        try {
            while (!pending.isEmpty() && !stopRequested && !recordConsumer.hasFailed()) {
                Path current = pending.removeFirst();
                try (DirectoryStream<Path> stream = Files.newDirectoryStream(current)) {
                    for (Path entry : stream) {
                        // Exclusion and resume checks come before any stat or read of the entry.
                        if (exclusions.isExcluded(entry) || skip.contains(entry)) {
                            LOGGER.debug("Skipping {}", entry);
                            continue;
                        }
                        BasicFileAttributes attrs;
                        try {
                            attrs = Files.readAttributes(entry, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
                        } catch (IOException ex) {
                            LOGGER.warn("Failed to read attributes for {}", entry, ex);
                            resultQueue.add(FileProcessingResult.failed(entry, ex));
                            continue;
                        }
                        if (attrs.isDirectory()) {
                            if (recursive) {
                                pending.addLast(entry);
                            }
                        } else if (attrs.isRegularFile()) {
                            submitFileTask(hashExecutor, resultQueue, entry, attrs);
                            submitted++;
                            if (limiter.shouldStop(submitted)) {
                                LOGGER.info("Stopping early after {} files.", submitted);
                                stopRequested = true;
                                break;
                            }
                        }
                    }
                } catch (IOException ex) {
                    rootFailure = listingFailed(start, current, ex, resultQueue);
                } catch (DirectoryIteratorException ex) {
                    rootFailure = listingFailed(start, current, ex.getCause(), resultQueue);
                }
                if (rootFailure != null) {
                    break;
                }
            }
        } finally {
            // Drain the worker pool before stopping the consumer so no result is lost.
            hashExecutor.shutdown();
            try {
                hashExecutor.awaitTermination(1, TimeUnit.HOURS);
            } catch (InterruptedException ex) {
                LOGGER.warn("Walk of {} interrupted, cancelling pending hashes", start);
                hashExecutor.shutdownNow();
                throw ex;
            } finally {
                resultQueue.add(FileProcessingResult.END_OF_WALK);
                consumer.join();
            }
        }

        if (rootFailure != null) {
            throw rootFailure;
        }
        if (recordConsumer.failure() != null) {
            throw recordConsumer.failure();
        }
        return new WalkSummary(recordConsumer.emitted(), List.copyOf(recordConsumer.failures()), stopRequested);
    }

    private void submitFileTask(ExecutorService executor,
                                BlockingQueue<FileProcessingResult> queue,
                                Path file,
                                BasicFileAttributes attributes) {
        executor.submit(() -> {
            try {
                queue.add(FileProcessingResult.hashed(extractor.extract(file, attributes)));
            } catch (FileReadException ex) {
                LOGGER.warn("Failed to hash {}", file, ex);
                queue.add(FileProcessingResult.failed(file, ex));
            } catch (RuntimeException ex) {
                LOGGER.error("Unexpected failure while hashing {}", file, ex);
                queue.add(FileProcessingResult.failed(file, ex));
            }
        });
    }

    /**
     * Returns the exception to raise when the root is unreadable; any other directory is
     * recorded as a failure and its subtree skipped.
     */
    private ScanException listingFailed(Path start,
                                        Path directory,
                                        IOException cause,
                                        BlockingQueue<FileProcessingResult> queue) {
        if (directory.equals(start)) {
            return new ScanException(start, cause);
        }
        LOGGER.warn("Failed to list directory {}, skipping its subtree", directory, cause);
        queue.add(FileProcessingResult.failed(directory, cause));
        return null;
    }

    private final class RecordConsumer implements Runnable {
        private final BlockingQueue<FileProcessingResult> queue;
        private final RecordSink sink;
        private final long baseline;
        private final List<FailedFileRecord> failures = new ArrayList<>();
        private volatile IOException failure;
        private long emitted;

        RecordConsumer(BlockingQueue<FileProcessingResult> queue, RecordSink sink, long baseline) {
            this.queue = queue;
            this.sink = sink;
            this.baseline = baseline;
        }

        @Override
        public void run() {
            try {
                while (true) {
                    FileProcessingResult result = queue.take();
                    if (result == FileProcessingResult.END_OF_WALK) {
                        return;
                    }
                    if (!result.isHashed()) {
                        failures.add(result.failure());
                        continue;
                    }
                    if (failure != null) {
                        continue;
                    }
                    try {
                        sink.accept(result.record());
                        emitted++;
                        progress.onProgress(baseline + emitted, 0, ScanPhase.SCANNING);
                    } catch (IOException ex) {
                        LOGGER.error("Failed to store record for {}", result.record().path(), ex);
                        failure = ex;
                    }
                }
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                LOGGER.error("Record consumer stopped unexpectedly", ex);
            }
        }

        boolean hasFailed() {
            return failure != null;
        }

        IOException failure() {
            return failure;
        }

        long emitted() {
            return emitted;
        }

        List<FailedFileRecord> failures() {
            return failures;
        }
    }
}
