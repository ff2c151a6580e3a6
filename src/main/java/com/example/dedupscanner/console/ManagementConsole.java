package com.example.dedupscanner.console;

import com.example.dedupscanner.MutationConflictException;
import com.example.dedupscanner.index.IndexException;
import com.example.dedupscanner.index.ScanIndex;
import com.example.dedupscanner.metadata.DuplicateGroup;
import com.example.dedupscanner.metadata.ScanSession;
import org.apache.tika.Tika;
import org.apache.tika.mime.MediaType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;

/**
 * Inspection and mutation of one indexed scan session.
 *
 * <p>Every mutation changes the filesystem first and the index only after that succeeded.
 * Nothing is cached here: each read goes back to the index, which stays the only mutable
 * store.
 */
public class ManagementConsole {
    private static final Logger LOGGER = LoggerFactory.getLogger(ManagementConsole.class);
    private static final List<String> INLINE_TYPES = List.of("text/", "image/", "video/", "audio/", "application/pdf");

    private final ScanIndex index;
    private final long sessionId;
    private final Tika tika;

    public ManagementConsole(ScanIndex index, long sessionId) {
        this(index, sessionId, new Tika());
    }

    public ManagementConsole(ScanIndex index, long sessionId, Tika tika) {
        this.index = index;
        this.sessionId = sessionId;
        this.tika = tika;
    }

    public long sessionId() {
        return sessionId;
    }

    /**
     * Current groups of the session. Rows removed by deletes are gone from the index, so a
     * group left with a single file is no longer returned.
     */
    public List<DuplicateGroup> duplicateGroups() throws IndexException {
        List<DuplicateGroup> groups = index.getDuplicateGroups(sessionId);
        return groups.stream().filter(group -> group.fileCount() >= 2).toList();
    }

    public ScanSession scanInfo() throws IndexException {
        return index.getScanInfo(sessionId)
                .orElseThrow(() -> new IndexException("Scan session " + sessionId + " not found in " + index.path()));
    }

    public void delete(String filePath) throws IOException {
        Path path = trackedPath(filePath);
        if (!Files.exists(path, LinkOption.NOFOLLOW_LINKS)) {
            throw new MutationConflictException(path, "File no longer exists: " + path);
        }
        try {
            Files.delete(path);
        } catch (NoSuchFileException ex) {
            throw new MutationConflictException(path, "File no longer exists: " + path, ex);
        }
        index.deleteFile(filePath);
        LOGGER.info("Deleted {}", path);
    }

    /**
     * Renames a file within its directory.
     *
     * @return the new absolute path
     */
    public String rename(String oldPath, String newName) throws IOException {
        validateName(newName);
        Path source = trackedPath(oldPath);
        if (!Files.exists(source, LinkOption.NOFOLLOW_LINKS)) {
            throw new MutationConflictException(source, "File no longer exists: " + source);
        }
        Path target = source.resolveSibling(newName);
        if (Files.exists(target, LinkOption.NOFOLLOW_LINKS)) {
            throw new MutationConflictException(target, "A file with that name already exists: " + target);
        }
        try {
            Files.move(source, target);
        } catch (FileAlreadyExistsException ex) {
            throw new MutationConflictException(target, "A file with that name already exists: " + target, ex);
        } catch (NoSuchFileException ex) {
            throw new MutationConflictException(source, "File no longer exists: " + source, ex);
        }
        String newPath = target.toString();
        index.updateFilePath(oldPath, newPath);
        LOGGER.info("Renamed {} to {}", source, target);
        return newPath;
    }

    public DownloadableFile download(String filePath) throws IOException {
        Path path = trackedPath(filePath);
        if (!Files.isRegularFile(path, LinkOption.NOFOLLOW_LINKS)) {
            throw new MutationConflictException(path, "File no longer exists: " + path);
        }
        String mediaType = detectMediaType(path);
        boolean inline = INLINE_TYPES.stream().anyMatch(mediaType::startsWith);
        return new DownloadableFile(path, mediaType, inline);
    }

    /**
     * Closes the index and, when asked, deletes the index file.
     */
    public void shutdown(boolean deleteIndex) {
        try {
            index.close();
        } catch (IndexException ex) {
            LOGGER.warn("Failed to close index {}", index.path(), ex);
        }
        if (!deleteIndex) {
            return;
        }
        for (Path file : ScanIndex.storageFiles(index.path())) {
            try {
                Files.deleteIfExists(file);
            } catch (IOException ex) {
                LOGGER.warn("Failed to delete index file {}", file, ex);
            }
        }
        LOGGER.info("Deleted index {}", index.path());
    }

    private Path trackedPath(String filePath) throws IndexException {
        if (filePath == null || filePath.isBlank()) {
            throw new IllegalArgumentException("A file path is required");
        }
        if (!index.containsPath(sessionId, filePath)) {
            throw new IllegalArgumentException("Not part of scan session " + sessionId + ": " + filePath);
        }
        return Path.of(filePath);
    }

    private static void validateName(String newName) {
        if (newName == null || newName.isBlank()
                || newName.contains("/") || newName.contains(File.separator)
                || newName.equals(".") || newName.equals("..")) {
            throw new IllegalArgumentException("Invalid new filename: " + newName);
        }
    }

    private String detectMediaType(Path path) {
        try {
            MediaType mediaType = MediaType.parse(tika.detect(path));
            return mediaType == null ? "application/octet-stream" : mediaType.toString();
        } catch (IOException ex) {
            LOGGER.debug("Media type detection failed for {}", path, ex);
            return "application/octet-stream";
        }
    }
}
