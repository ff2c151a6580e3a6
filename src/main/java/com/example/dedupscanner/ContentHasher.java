package com.example.dedupscanner;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Streams file content through SHA-256. Memory use is one read buffer per call,
 * whatever the file size.
 */
public class ContentHasher {
    public static final int QUICK_HASH_BYTES = 64 * 1024;
    private static final int BUFFER_SIZE = 8192;

    /**
     * Digest of the first {@value #QUICK_HASH_BYTES} bytes, or of the whole file when it is smaller.
     */
    public String quickDigest(Path path) throws FileReadException {
        return digest(path, QUICK_HASH_BYTES);
    }

    /**
     * Digest of the entire file content.
     */
    public String fullDigest(Path path) throws FileReadException {
        return digest(path, Long.MAX_VALUE);
    }

    private String digest(Path path, long limit) throws FileReadException {
        MessageDigest digest = newDigest();
        try (InputStream inputStream = Files.newInputStream(path)) {
            byte[] buffer = new byte[BUFFER_SIZE];
            long remaining = limit;
            int read;
            while (remaining > 0
                    && (read = inputStream.read(buffer, 0, (int) Math.min(buffer.length, remaining))) != -1) {
                digest.update(buffer, 0, read);
                remaining -= read;
            }
        } catch (IOException ex) {
            throw new FileReadException(path, ex);
        }
        return toHex(digest.digest());
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String toHex(byte[] hash) {
        StringBuilder builder = new StringBuilder(hash.length * 2);
        for (byte b : hash) {
            builder.append(String.format("%02x", b));
        }
        return builder.toString();
    }
}
