package com.example.dedupscanner.console;

import java.nio.file.Path;

/**
 * A tracked file ready to be streamed, with its detected media type.
 */
public record DownloadableFile(
        Path path,
        String mediaType,
        boolean inline
) {
}
