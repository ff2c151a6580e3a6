package com.example.dedupscanner;

import com.example.dedupscanner.index.IndexedFile;
import com.example.dedupscanner.index.ScanIndex;
import com.example.dedupscanner.metadata.DuplicateGroup;
import com.example.dedupscanner.metadata.FileRecord;
import com.example.dedupscanner.metadata.ScanSession;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DuplicateScanEngineTest {
    @TempDir
    Path root;

    @TempDir
    Path indexDir;

    @Test
    void findsCopiesAndIgnoresUniqueFiles() throws Exception {
        Files.writeString(root.resolve("one.txt"), "identical");
        Files.writeString(root.resolve("two.txt"), "identical");
        Files.writeString(root.resolve("three.txt"), "identical");
        Files.writeString(root.resolve("unique.txt"), "something else");

        ScanResult result = new DuplicateScanEngine(config(false, List.of(), Optional.empty(), false), ProgressListener.NONE).scan();

        assertTrue(result.complete());
        assertEquals(4, result.filesScanned());
        assertEquals(1, result.groups().size());
        assertEquals(Set.of("one.txt", "two.txt", "three.txt"), names(result.groups().get(0)));
        assertTrue(result.indexPath().isEmpty());
    }

    @Test
    void sameSizeDifferentContentIsNotADuplicate() throws Exception {
        Files.writeString(root.resolve("a.txt"), "abcd");
        Files.writeString(root.resolve("b.txt"), "wxyz");

        ScanResult result = new DuplicateScanEngine(config(false, List.of(), Optional.empty(), false), ProgressListener.NONE).scan();

        assertTrue(result.groups().isEmpty());
    }

    @Test
    void nestedCopiesNeedTheRecursiveFlag() throws Exception {
        Files.writeString(root.resolve("top.txt"), "copy");
        Path nested = Files.createDirectories(root.resolve("deep/er"));
        Files.writeString(nested.resolve("bottom.txt"), "copy");

        ScanResult flat = new DuplicateScanEngine(config(false, List.of(), Optional.empty(), false), ProgressListener.NONE).scan();
        ScanResult deep = new DuplicateScanEngine(config(true, List.of(), Optional.empty(), false), ProgressListener.NONE).scan();

        assertTrue(flat.groups().isEmpty());
        assertEquals(1, deep.groups().size());
        assertEquals(Set.of("top.txt", "bottom.txt"), names(deep.groups().get(0)));
    }

    @Test
    void excludedFilesDoNotTakePart() throws Exception {
        Files.writeString(root.resolve("keep.txt"), "copy");
        Files.writeString(root.resolve("cache.tmp"), "copy");

        ScanResult result = new DuplicateScanEngine(config(false, List.of("*.tmp"), Optional.empty(), false), ProgressListener.NONE).scan();

        assertEquals(1, result.filesScanned());
        assertTrue(result.groups().isEmpty());
    }

    @Test
    void emptyDirectoryHasNoGroups() throws Exception {
        Path indexPath = indexDir.resolve("empty.db");

        ScanResult memory = new DuplicateScanEngine(config(true, List.of(), Optional.empty(), false), ProgressListener.NONE).scan();
        ScanResult indexed = new DuplicateScanEngine(config(true, List.of(), Optional.of(indexPath), false), ProgressListener.NONE).scan();

        assertTrue(memory.groups().isEmpty());
        assertEquals(0, memory.filesScanned());
        assertTrue(indexed.groups().isEmpty());
        assertTrue(indexed.complete());
        try (ScanIndex index = ScanIndex.openExisting(indexPath)) {
            long sessionId = indexed.sessionId().orElseThrow();
            assertTrue(index.getDuplicateGroups(sessionId).isEmpty());
            assertTrue(index.getScanInfo(sessionId).orElseThrow().isComplete());
        }
    }

    @Test
    void largeIdenticalFilesNeedOneFullDigestEach() throws Exception {
        byte[] content = new byte[5 * 1024 * 1024];
        new Random(5).nextBytes(content);
        Files.write(root.resolve("big-1.bin"), content);
        Files.write(root.resolve("big-2.bin"), content);
        MetadataCollectorTest.CountingHasher hasher = new MetadataCollectorTest.CountingHasher();

        ScanResult result = new DuplicateScanEngine(config(false, List.of(), Optional.empty(), false),
                ProgressListener.NONE, hasher, ProcessingLimiter.NO_LIMIT).scan();

        assertEquals(1, result.groups().size());
        DuplicateGroup group = result.groups().get(0);
        assertEquals(content.length, group.size());
        assertEquals(Set.of("big-1.bin", "big-2.bin"), names(group));
        assertEquals(2, hasher.quickPaths.size());
        assertEquals(2, hasher.fullPaths.size());
        assertEquals(HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(content)), group.fullHash());
    }

    @Test
    void repeatedScansGiveTheSameGroups() throws Exception {
        writeFixture();
        ScanConfig config = config(true, List.of(), Optional.empty(), false);

        List<DuplicateGroup> first = new DuplicateScanEngine(config, ProgressListener.NONE).scan().groups();
        List<DuplicateGroup> second = new DuplicateScanEngine(config, ProgressListener.NONE).scan().groups();

        assertEquals(signature(first), signature(second));
    }

    @Test
    void indexedScanMatchesInMemoryScan() throws Exception {
        writeFixture();
        Path indexPath = indexDir.resolve("scan.db");

        ScanResult memory = new DuplicateScanEngine(config(true, List.of(), Optional.empty(), false), ProgressListener.NONE).scan();
        ScanResult indexed = new DuplicateScanEngine(config(true, List.of(), Optional.of(indexPath), false), ProgressListener.NONE).scan();

        assertEquals(signature(memory.groups()), signature(indexed.groups()));
        try (ScanIndex index = ScanIndex.openExisting(indexPath)) {
            long sessionId = indexed.sessionId().orElseThrow();
            assertEquals(signature(memory.groups()), signature(index.getDuplicateGroups(sessionId)));
            ScanSession session = index.getScanInfo(sessionId).orElseThrow();
            assertTrue(session.isComplete());
            assertEquals(memory.filesScanned(), session.filesScanned());
            assertEquals(memory.groups().size(), session.groupsFound());
        }
    }

    @Test
    void indexInsideTheScannedDirectoryIsSkipped() throws Exception {
        Files.writeString(root.resolve("a.txt"), "copy");
        Files.writeString(root.resolve("b.txt"), "copy");
        Path indexPath = root.resolve("scan.db");

        ScanResult first = new DuplicateScanEngine(config(false, List.of(), Optional.of(indexPath), false), ProgressListener.NONE).scan();
        ScanResult second = new DuplicateScanEngine(config(false, List.of(), Optional.of(indexPath), false), ProgressListener.NONE).scan();

        assertEquals(2, first.filesScanned());
        assertEquals(2, second.filesScanned());
        try (ScanIndex index = ScanIndex.openExisting(indexPath)) {
            for (IndexedFile file : index.getFiles(second.sessionId().orElseThrow())) {
                assertFalse(file.record().path().endsWith("scan.db"));
            }
        }
    }

    @Test
    void resumedScanDoesNotInsertPathsTwice() throws Exception {
        for (int i = 0; i < 5; i++) {
            Files.writeString(root.resolve("file" + i + ".txt"), i % 2 == 0 ? "even" : "odd " + i);
        }
        Path indexPath = indexDir.resolve("resume.db");

        ScanResult paused = new DuplicateScanEngine(config(false, List.of(), Optional.of(indexPath), false),
                ProgressListener.NONE, new ContentHasher(), ProcessingLimiter.afterFiles(2)).scan();
        assertFalse(paused.complete());
        assertEquals(2, paused.filesScanned());

        ScanResult resumed = new DuplicateScanEngine(config(false, List.of(), Optional.of(indexPath), true),
                ProgressListener.NONE, new ContentHasher(), ProcessingLimiter.NO_LIMIT).scan();

        assertTrue(resumed.complete());
        assertEquals(paused.sessionId(), resumed.sessionId());
        assertEquals(5, resumed.filesScanned());
        assertEquals(1, resumed.groups().size());
        assertEquals(Set.of("file0.txt", "file2.txt", "file4.txt"), names(resumed.groups().get(0)));
        try (ScanIndex index = ScanIndex.openExisting(indexPath)) {
            List<IndexedFile> rows = index.getFiles(resumed.sessionId().orElseThrow());
            assertEquals(5, rows.size());
            assertEquals(5, rows.stream().map(file -> file.record().path()).distinct().count());
            assertTrue(index.getScanInfo(resumed.sessionId().orElseThrow()).orElseThrow().isComplete());
        }
    }

    @Test
    void resumeWithoutIncompleteSessionStartsANewOne() throws Exception {
        Files.writeString(root.resolve("a.txt"), "copy");
        Files.writeString(root.resolve("b.txt"), "copy");
        Path indexPath = indexDir.resolve("fresh.db");

        ScanResult first = new DuplicateScanEngine(config(false, List.of(), Optional.of(indexPath), false), ProgressListener.NONE).scan();
        ScanResult second = new DuplicateScanEngine(config(false, List.of(), Optional.of(indexPath), true), ProgressListener.NONE).scan();

        assertTrue(second.sessionId().orElseThrow() > first.sessionId().orElseThrow());
        assertEquals(2, second.filesScanned());
    }

    private void writeFixture() throws Exception {
        Files.writeString(root.resolve("report.pdf"), "quarterly report body");
        Files.writeString(root.resolve("photo.jpg"), "pixels");
        Path docs = Files.createDirectory(root.resolve("documents"));
        Files.writeString(docs.resolve("report-copy.pdf"), "quarterly report body");
        Files.writeString(docs.resolve("photo-copy.jpg"), "pixels");
        Files.writeString(docs.resolve("notes.txt"), "just notes");
        Path photos = Files.createDirectory(root.resolve("photos"));
        Files.writeString(photos.resolve("photo-again.jpg"), "pixels");
        Files.writeString(photos.resolve("empty-1"), "");
        Files.writeString(photos.resolve("empty-2"), "");
    }

    private ScanConfig config(boolean recursive, List<String> excludes, Optional<Path> indexPath, boolean resume) {
        return new ScanConfig(root, recursive, excludes, indexPath, resume, 2, 2);
    }

    private static Set<String> names(DuplicateGroup group) {
        return group.files().stream().map(FileRecord::name).collect(Collectors.toSet());
    }

    private static List<String> signature(List<DuplicateGroup> groups) {
        return groups.stream()
                .map(group -> group.fullHash() + ":" + group.size() + ":"
                        + group.files().stream().map(FileRecord::path).sorted().collect(Collectors.joining(",")))
                .toList();
    }
}
