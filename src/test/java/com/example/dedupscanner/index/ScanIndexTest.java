package com.example.dedupscanner.index;

import com.example.dedupscanner.metadata.DuplicateGroup;
import com.example.dedupscanner.metadata.FileRecord;
import com.example.dedupscanner.metadata.ScanSession;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScanIndexTest {
    @TempDir
    Path dir;

    @Test
    void sessionLifecycle() throws Exception {
        try (ScanIndex index = ScanIndex.open(dir.resolve("index.db"))) {
            long scanId = index.startScan("/data");
            ScanSession started = index.getScanInfo(scanId).orElseThrow();
            assertEquals("/data", started.baseDirectory());
            assertFalse(started.isComplete());
            assertEquals(started, index.findIncompleteSession("/data").orElseThrow());

            index.updateProgress(scanId, 42, 3);
            index.completeScan(scanId);

            ScanSession completed = index.getScanInfo(scanId).orElseThrow();
            assertTrue(completed.isComplete());
            assertEquals(42, completed.filesScanned());
            assertEquals(3, completed.groupsFound());
            assertTrue(index.findIncompleteSession("/data").isEmpty());
            assertEquals(scanId, index.latestSession().orElseThrow().id());
            assertTrue(index.getScanInfo(scanId + 100).isEmpty());
        }
    }

    @Test
    void addingTheSamePathTwiceKeepsBothRows() throws Exception {
        try (ScanIndex index = ScanIndex.open(dir.resolve("index.db"))) {
            long scanId = index.startScan("/data");
            long first = index.addFile(scanId, record("/data/a.txt", 10, "q1", null));
            long second = index.addFile(scanId, record("/data/a.txt", 10, "q1", null));

            assertTrue(second > first);
            List<IndexedFile> rows = index.getFiles(scanId);
            assertEquals(2, rows.size());
            assertNull(rows.get(0).groupId());
            assertNull(rows.get(0).record().fullHash());
            assertEquals("a.txt", rows.get(0).record().name());
        }
    }

    @Test
    void groupsComeBackOrderedBySize() throws Exception {
        try (ScanIndex index = ScanIndex.open(dir.resolve("index.db"))) {
            long scanId = index.startScan("/data");
            long small1 = index.addFile(scanId, record("/data/s1", 5, "qs", null));
            long big1 = index.addFile(scanId, record("/data/b1", 500, "qb", null));
            long small2 = index.addFile(scanId, record("/data/s2", 5, "qs", null));
            long big2 = index.addFile(scanId, record("/data/b2", 500, "qb", null));
            index.addFile(scanId, record("/data/lonely", 7, "ql", null));
            index.updateFileHash(small1, "fs", "fs");
            index.updateFileHash(small2, "fs", "fs");
            index.updateFileHash(big1, "fb", "fb");
            index.updateFileHash(big2, "fb", "fb");

            List<DuplicateGroup> groups = index.getDuplicateGroups(scanId);

            assertEquals(2, groups.size());
            assertEquals("fb", groups.get(0).fullHash());
            assertEquals(500, groups.get(0).size());
            assertEquals(List.of("/data/b1", "/data/b2"), paths(groups.get(0)));
            assertEquals(List.of("/data/s1", "/data/s2"), paths(groups.get(1)));
            assertEquals("fs", groups.get(1).files().get(0).fullHash());
        }
    }

    @Test
    void deletingOneOfTwoMembersRemovesTheGroup() throws Exception {
        try (ScanIndex index = ScanIndex.open(dir.resolve("index.db"))) {
            long scanId = index.startScan("/data");
            index.addFile(scanId, record("/data/a", 3, "q", "f"));
            index.addFile(scanId, record("/data/b", 3, "q", "f"));
            assertEquals(1, index.getDuplicateGroups(scanId).size());

            assertEquals(1, index.deleteFile("/data/a"));

            assertTrue(index.getDuplicateGroups(scanId).isEmpty());
            assertFalse(index.containsPath(scanId, "/data/a"));
            assertTrue(index.containsPath(scanId, "/data/b"));
            assertEquals(0, index.deleteFile("/data/a"));
        }
    }

    @Test
    void renameKeepsHashesAndGroup() throws Exception {
        try (ScanIndex index = ScanIndex.open(dir.resolve("index.db"))) {
            long scanId = index.startScan("/data");
            index.addFile(scanId, record("/data/a", 3, "q", "f"));
            index.addFile(scanId, record("/data/b", 3, "q", "f"));

            assertEquals(1, index.updateFilePath("/data/a", "/data/renamed"));

            DuplicateGroup group = index.getDuplicateGroups(scanId).get(0);
            assertEquals(List.of("/data/renamed", "/data/b"), paths(group));
            FileRecord renamed = group.files().get(0);
            assertEquals("renamed", renamed.name());
            assertEquals("q", renamed.quickHash());
            assertEquals("f", renamed.fullHash());
        }
    }

    @Test
    void rowsSurviveReopening() throws Exception {
        Path file = dir.resolve("index.db");
        long scanId;
        try (ScanIndex index = ScanIndex.open(file)) {
            scanId = index.startScan("/data");
            index.addFile(scanId, record("/data/a", 3, "q", "f"));
            index.addFile(scanId, record("/data/b", 3, "q", "f"));
        }

        try (ScanIndex reopened = ScanIndex.openExisting(file)) {
            assertEquals(2, reopened.getFiles(scanId).size());
            assertEquals(1, reopened.getDuplicateGroups(scanId).size());
        }
    }

    @Test
    void sessionsAreKeptApart() throws Exception {
        try (ScanIndex index = ScanIndex.open(dir.resolve("index.db"))) {
            long first = index.startScan("/one");
            long second = index.startScan("/two");
            index.addFile(first, record("/one/a", 3, "q", null));

            assertEquals(1, index.getFiles(first).size());
            assertTrue(index.getFiles(second).isEmpty());
            assertFalse(index.containsPath(second, "/one/a"));
        }
    }

    @Test
    void missingIndexIsReported() {
        assertThrows(IndexException.class, () -> ScanIndex.openExisting(dir.resolve("absent.db")));
    }

    @Test
    void corruptIndexIsReported() throws Exception {
        Path corrupt = Files.writeString(dir.resolve("corrupt.db"), "not a database ".repeat(400));

        assertThrows(IndexException.class, () -> ScanIndex.openExisting(corrupt));
    }

    @Test
    void storageFilesIncludeSqliteSideFiles() {
        Path file = dir.resolve("index.db");

        List<Path> storage = ScanIndex.storageFiles(file);

        assertEquals(4, storage.size());
        assertEquals(file.toAbsolutePath().normalize(), storage.get(0));
        assertTrue(storage.contains(file.toAbsolutePath().normalize().resolveSibling("index.db-journal")));
    }

    @Test
    void defaultPathIsAHiddenFileInTheBaseDirectory() {
        Path generated = ScanIndex.defaultPath(dir);

        assertEquals(dir.toAbsolutePath().normalize(), generated.getParent());
        assertTrue(generated.getFileName().toString().matches("\\.dedup-scanner\\.[0-9a-f]{8}\\.db"));
    }

    private static FileRecord record(String path, long size, String quickHash, String fullHash) {
        String name = Path.of(path).getFileName().toString();
        Instant now = Instant.ofEpochMilli(1_700_000_000_000L);
        return new FileRecord(path, name, size, now, now, quickHash, fullHash);
    }

    private static List<String> paths(DuplicateGroup group) {
        return group.files().stream().map(FileRecord::path).toList();
    }
}
