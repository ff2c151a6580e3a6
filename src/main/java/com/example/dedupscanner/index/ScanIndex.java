package com.example.dedupscanner.index;

import com.example.dedupscanner.metadata.DuplicateGroup;
import com.example.dedupscanner.metadata.FileRecord;
import com.example.dedupscanner.metadata.ScanSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * SQLite ledger of scan sessions and their file rows.
 *
 * <p>One writer per file. Methods are synchronized so the management console can share the
 * connection between request threads. File inserts and hash updates stay in the open
 * transaction until the next progress update, session transition or mutation commits them;
 * a crash loses at most that uncommitted tail.
 */
public final class ScanIndex implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(ScanIndex.class);
    private static final String INDEX_FILE_PREFIX = ".dedup-scanner.";
    private static final SecureRandom RANDOM = new SecureRandom();

    private static final List<String> SCHEMA = List.of(
            """
            CREATE TABLE IF NOT EXISTS scan_info (
              id INTEGER PRIMARY KEY,
              base_directory TEXT NOT NULL,
              start_time INTEGER NOT NULL,
              end_time INTEGER,
              files_scanned INTEGER DEFAULT 0,
              groups_found INTEGER DEFAULT 0
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS files (
              id INTEGER PRIMARY KEY,
              scan_id INTEGER,
              path TEXT NOT NULL,
              size INTEGER NOT NULL,
              created INTEGER NOT NULL,
              modified INTEGER NOT NULL,
              quick_hash TEXT NOT NULL,
              full_hash TEXT,
              group_id TEXT,
              FOREIGN KEY(scan_id) REFERENCES scan_info(id)
            )
            """,
            "CREATE INDEX IF NOT EXISTS idx_files_group_id ON files(group_id)",
            "CREATE INDEX IF NOT EXISTS idx_files_scan_id ON files(scan_id)",
            "CREATE INDEX IF NOT EXISTS idx_files_path ON files(path)"
    );

    private static final String FILE_COLUMNS =
            "id, scan_id, path, size, created, modified, quick_hash, full_hash, group_id";
    private static final String SESSION_COLUMNS =
            "id, base_directory, start_time, end_time, files_scanned, groups_found";

    private final Path path;
    private final Connection connection;
    private final PreparedStatement insertFile;
    private final PreparedStatement updateHash;

    private ScanIndex(Path path, Connection connection) throws SQLException {
        this.path = path;
        this.connection = connection;
        this.insertFile = connection.prepareStatement("""
                INSERT INTO files(scan_id, path, size, created, modified, quick_hash, full_hash, group_id)
                VALUES(?,?,?,?,?,?,?,?)
                """, Statement.RETURN_GENERATED_KEYS);
        this.updateHash = connection.prepareStatement("UPDATE files SET full_hash = ?, group_id = ? WHERE id = ?");
    }

    /**
     * Opens the index at {@code path}, creating the file and schema when missing.
     */
    public static ScanIndex open(Path path) throws IndexException {
        Path absolute = path.toAbsolutePath().normalize();
        Connection connection = null;
        try {
            Path parent = absolute.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            connection = DriverManager.getConnection("jdbc:sqlite:" + absolute);
            try (Statement st = connection.createStatement()) {
                st.execute("PRAGMA busy_timeout=5000");
                for (String sql : SCHEMA) {
                    st.execute(sql);
                }
            }
            connection.setAutoCommit(false);
            LOGGER.debug("Opened scan index {}", absolute);
            return new ScanIndex(absolute, connection);
        } catch (SQLException | IOException ex) {
            closeQuietly(connection, ex);
            throw new IndexException("Failed to open scan index " + absolute + ": " + ex.getMessage(), ex);
        }
    }

    /**
     * Opens an index written by an earlier run. Unlike {@link #open(Path)} this never creates a file.
     */
    public static ScanIndex openExisting(Path path) throws IndexException {
        if (!Files.isRegularFile(path)) {
            throw new IndexException("Index file not found: " + path);
        }
        return open(path);
    }

    /**
     * Generates a fresh index location inside {@code baseDirectory}.
     */
    public static Path defaultPath(Path baseDirectory) {
        byte[] bytes = new byte[4];
        RANDOM.nextBytes(bytes);
        StringBuilder hex = new StringBuilder();
        for (byte b : bytes) {
            hex.append(String.format("%02x", b));
        }
        return baseDirectory.toAbsolutePath().normalize().resolve(INDEX_FILE_PREFIX + hex + ".db");
    }

    /**
     * The index file plus the side files SQLite may create next to it.
     */
    public static List<Path> storageFiles(Path indexPath) {
        Path absolute = indexPath.toAbsolutePath().normalize();
        String name = absolute.getFileName().toString();
        return List.of(
                absolute,
                absolute.resolveSibling(name + "-journal"),
                absolute.resolveSibling(name + "-wal"),
                absolute.resolveSibling(name + "-shm")
        );
    }

    public Path path() {
        return path;
    }

    public synchronized long startScan(String baseDirectory) throws IndexException {
        try (PreparedStatement ps = connection.prepareStatement(
                "INSERT INTO scan_info(base_directory, start_time) VALUES(?, ?)",
                Statement.RETURN_GENERATED_KEYS)) {
            ps.setString(1, baseDirectory);
            ps.setLong(2, System.currentTimeMillis());
            ps.executeUpdate();
            long id = generatedKey(ps);
            connection.commit();
            LOGGER.info("Started scan session {} for {}", id, baseDirectory);
            return id;
        } catch (SQLException ex) {
            throw failure("start scan", ex);
        }
    }

    /**
     * Records the running counters and commits every pending row.
     */
    public synchronized void updateProgress(long scanId, long filesScanned, long groupsFound) throws IndexException {
        try (PreparedStatement ps = connection.prepareStatement(
                "UPDATE scan_info SET files_scanned = ?, groups_found = ? WHERE id = ?")) {
            ps.setLong(1, filesScanned);
            ps.setLong(2, groupsFound);
            ps.setLong(3, scanId);
            ps.executeUpdate();
            connection.commit();
        } catch (SQLException ex) {
            throw failure("update progress", ex);
        }
    }

    public synchronized void completeScan(long scanId) throws IndexException {
        try (PreparedStatement ps = connection.prepareStatement("UPDATE scan_info SET end_time = ? WHERE id = ?")) {
            ps.setLong(1, System.currentTimeMillis());
            ps.setLong(2, scanId);
            ps.executeUpdate();
            connection.commit();
        } catch (SQLException ex) {
            throw failure("complete scan", ex);
        }
    }

    /**
     * Appends a row for {@code record}. Paths are not unique: adding the same path twice
     * creates two rows.
     *
     * @return the row id, used later by {@link #updateFileHash(long, String, String)}
     */
    public synchronized long addFile(long scanId, FileRecord record) throws IndexException {
        try {
            insertFile.setLong(1, scanId);
            insertFile.setString(2, record.path());
            insertFile.setLong(3, record.size());
            insertFile.setLong(4, toMillis(record.created()));
            insertFile.setLong(5, toMillis(record.modified()));
            insertFile.setString(6, record.quickHash());
            setNullableString(insertFile, 7, record.fullHash());
            setNullableString(insertFile, 8, record.fullHash());
            insertFile.executeUpdate();
            return generatedKey(insertFile);
        } catch (SQLException ex) {
            throw failure("add " + record.path(), ex);
        }
    }

    public synchronized void updateFileHash(long fileId, String fullHash, String groupId) throws IndexException {
        try {
            updateHash.setString(1, fullHash);
            setNullableString(updateHash, 2, groupId);
            updateHash.setLong(3, fileId);
            updateHash.executeUpdate();
        } catch (SQLException ex) {
            throw failure("update hash of row " + fileId, ex);
        }
    }

    public synchronized Optional<ScanSession> getScanInfo(long scanId) throws IndexException {
        return querySession("SELECT " + SESSION_COLUMNS + " FROM scan_info WHERE id = ?", scanId);
    }

    public synchronized Optional<ScanSession> latestSession() throws IndexException {
        try (PreparedStatement ps = connection.prepareStatement(
                "SELECT " + SESSION_COLUMNS + " FROM scan_info ORDER BY id DESC LIMIT 1");
             ResultSet rs = ps.executeQuery()) {
            return rs.next() ? Optional.of(readSession(rs)) : Optional.empty();
        } catch (SQLException ex) {
            throw failure("read latest session", ex);
        }
    }

    /**
     * Newest session for {@code baseDirectory} that never reached completion.
     */
    public synchronized Optional<ScanSession> findIncompleteSession(String baseDirectory) throws IndexException {
        try (PreparedStatement ps = connection.prepareStatement(
                "SELECT " + SESSION_COLUMNS + " FROM scan_info"
                        + " WHERE base_directory = ? AND end_time IS NULL ORDER BY id DESC LIMIT 1")) {
            ps.setString(1, baseDirectory);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(readSession(rs)) : Optional.empty();
            }
        } catch (SQLException ex) {
            throw failure("find incomplete session", ex);
        }
    }

    /**
     * All rows of a session in insertion order.
     */
    public synchronized List<IndexedFile> getFiles(long scanId) throws IndexException {
        try (PreparedStatement ps = connection.prepareStatement(
                "SELECT " + FILE_COLUMNS + " FROM files WHERE scan_id = ? ORDER BY id")) {
            ps.setLong(1, scanId);
            return readFiles(ps);
        } catch (SQLException ex) {
            throw failure("read files", ex);
        }
    }

    public synchronized boolean containsPath(long scanId, String filePath) throws IndexException {
        try (PreparedStatement ps = connection.prepareStatement(
                "SELECT 1 FROM files WHERE scan_id = ? AND path = ? LIMIT 1")) {
            ps.setLong(1, scanId);
            ps.setString(2, filePath);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException ex) {
            throw failure("look up " + filePath, ex);
        }
    }

    /**
     * Groups of the session that still have at least two rows, ordered like the in-memory
     * classifier: descending size of the first member, then by first insertion.
     */
    public synchronized List<DuplicateGroup> getDuplicateGroups(long scanId) throws IndexException {
        List<IndexedFile> grouped;
        try (PreparedStatement ps = connection.prepareStatement(
                "SELECT " + FILE_COLUMNS + " FROM files WHERE scan_id = ? AND group_id IS NOT NULL ORDER BY id")) {
            ps.setLong(1, scanId);
            grouped = readFiles(ps);
        } catch (SQLException ex) {
            throw failure("read duplicate groups", ex);
        }

        Map<String, List<FileRecord>> byGroup = new LinkedHashMap<>();
        for (IndexedFile file : grouped) {
            byGroup.computeIfAbsent(file.groupId(), ignored -> new ArrayList<>()).add(file.record());
        }
        List<DuplicateGroup> groups = new ArrayList<>();
        for (Map.Entry<String, List<FileRecord>> entry : byGroup.entrySet()) {
            List<FileRecord> members = entry.getValue();
            if (members.size() < 2) {
                continue;
            }
            groups.add(new DuplicateGroup(entry.getKey(), members.get(0).size(), members));
        }
        // LinkedHashMap keeps first-insertion order, the stable sort keeps it for equal sizes.
        groups.sort(Comparator.comparingLong(DuplicateGroup::size).reversed());
        return groups;
    }

    /**
     * Removes every row for {@code filePath}. Group membership of the remaining rows is not
     * recomputed.
     *
     * @return number of rows removed
     */
    public synchronized int deleteFile(String filePath) throws IndexException {
        try (PreparedStatement ps = connection.prepareStatement("DELETE FROM files WHERE path = ?")) {
            ps.setString(1, filePath);
            int removed = ps.executeUpdate();
            connection.commit();
            return removed;
        } catch (SQLException ex) {
            throw failure("delete " + filePath, ex);
        }
    }

    /**
     * Points rows at a renamed file. Hashes, size and group stay as they are.
     *
     * @return number of rows updated
     */
    public synchronized int updateFilePath(String oldPath, String newPath) throws IndexException {
        try (PreparedStatement ps = connection.prepareStatement("UPDATE files SET path = ? WHERE path = ?")) {
            ps.setString(1, newPath);
            ps.setString(2, oldPath);
            int updated = ps.executeUpdate();
            connection.commit();
            return updated;
        } catch (SQLException ex) {
            throw failure("rename " + oldPath, ex);
        }
    }

    @Override
    public synchronized void close() throws IndexException {
        try {
            if (connection.isClosed()) {
                return;
            }
            connection.commit();
            insertFile.close();
            updateHash.close();
            connection.close();
            LOGGER.debug("Closed scan index {}", path);
        } catch (SQLException ex) {
            throw failure("close", ex);
        }
    }

    private Optional<ScanSession> querySession(String sql, long id) throws IndexException {
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            ps.setLong(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(readSession(rs)) : Optional.empty();
            }
        } catch (SQLException ex) {
            throw failure("read session " + id, ex);
        }
    }

    private static ScanSession readSession(ResultSet rs) throws SQLException {
        long endTime = rs.getLong("end_time");
        Instant end = rs.wasNull() ? null : Instant.ofEpochMilli(endTime);
        return new ScanSession(
                rs.getLong("id"),
                rs.getString("base_directory"),
                Instant.ofEpochMilli(rs.getLong("start_time")),
                end,
                rs.getLong("files_scanned"),
                rs.getLong("groups_found")
        );
    }

    private static List<IndexedFile> readFiles(PreparedStatement ps) throws SQLException {
        List<IndexedFile> files = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                String filePath = rs.getString("path");
                Path fileName = Path.of(filePath).getFileName();
                FileRecord record = new FileRecord(
                        filePath,
                        fileName == null ? filePath : fileName.toString(),
                        rs.getLong("size"),
                        Instant.ofEpochMilli(rs.getLong("created")),
                        Instant.ofEpochMilli(rs.getLong("modified")),
                        rs.getString("quick_hash"),
                        rs.getString("full_hash")
                );
                files.add(new IndexedFile(rs.getLong("id"), rs.getLong("scan_id"), rs.getString("group_id"), record));
            }
        }
        return files;
    }

    private static long generatedKey(PreparedStatement ps) throws SQLException {
        try (ResultSet rs = ps.getGeneratedKeys()) {
            if (!rs.next()) {
                throw new SQLException("No generated key returned");
            }
            return rs.getLong(1);
        }
    }

    private static void setNullableString(PreparedStatement ps, int index, String value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.VARCHAR);
        } else {
            ps.setString(index, value);
        }
    }

    private static long toMillis(Instant instant) {
        return instant == null ? 0L : instant.toEpochMilli();
    }

    private IndexException failure(String action, SQLException ex) {
        return new IndexException("Scan index " + path + ": failed to " + action + ": " + ex.getMessage(), ex);
    }

    private static void closeQuietly(Connection connection, Exception primary) {
        if (connection == null) {
            return;
        }
        try {
            connection.close();
        } catch (SQLException ex) {
            primary.addSuppressed(ex);
        }
    }
}
