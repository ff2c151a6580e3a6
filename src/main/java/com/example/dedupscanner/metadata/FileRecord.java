package com.example.dedupscanner.metadata;

import java.time.Instant;

/**
 * One regular file discovered by a scan.
 *
 * <p>{@code quickHash} is the SHA-256 of the first 64 KiB and is always present.
 * {@code fullHash} covers the whole content and stays {@code null} until the file
 * survives the size and quick-hash buckets.
 */
public record FileRecord(
        String path,
        String name,
        long size,
        Instant created,
        Instant modified,
        String quickHash,
        String fullHash
) {
    public FileRecord withFullHash(String digest) {
        return new FileRecord(path, name, size, created, modified, quickHash, digest);
    }
}
