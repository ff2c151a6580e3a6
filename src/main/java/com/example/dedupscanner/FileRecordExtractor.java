package com.example.dedupscanner;

import com.example.dedupscanner.metadata.FileRecord;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;

public class FileRecordExtractor {
    private final ContentHasher hasher;

    public FileRecordExtractor(ContentHasher hasher) {
        this.hasher = hasher;
    }

    public FileRecord extract(Path path) throws FileReadException {
        BasicFileAttributes attributes;
        try {
            attributes = Files.readAttributes(path, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
        } catch (IOException ex) {
            throw new FileReadException(path, ex);
        }
        return extract(path, attributes);
    }

    /**
     * Builds a record from attributes the caller already read, computing only the quick digest.
     */
    public FileRecord extract(Path path, BasicFileAttributes attributes) throws FileReadException {
        Path absolute = path.toAbsolutePath();
        return new FileRecord(
                absolute.toString(),
                absolute.getFileName().toString(),
                attributes.size(),
                attributes.creationTime().toInstant(),
                attributes.lastModifiedTime().toInstant(),
                hasher.quickDigest(absolute),
                null
        );
    }
}
