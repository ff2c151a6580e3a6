package com.example.dedupscanner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Writes random files with a known number of copies each, for trying out the scanner.
 */
public final class TestFileGenerator {
    private static final Logger LOGGER = LoggerFactory.getLogger(TestFileGenerator.class);
    private static final int MIN_SIZE = 1024;
    private static final int MAX_EXTRA_SIZE = 1024 * 1024;
    private static final List<String> SUBDIRECTORIES = List.of("documents", "photos", "downloads");
    private static final LocalDate FIRST_DATE = LocalDate.of(2023, 1, 1);
    private static final LocalDate LAST_DATE = LocalDate.of(2024, 12, 31);

    private static final List<FileType> FILE_TYPES = List.of(
            new FileType(".txt", "document_"),
            new FileType(".pdf", "report_"),
            new FileType(".jpg", "IMG_"),
            new FileType(".png", "DSC_"),
            new FileType(".doc", "backup_"),
            new FileType(".pdf", "meeting_notes_"),
            new FileType(".png", "screenshot_"),
            new FileType(".jpg", "vacation_photo_")
    );

    private final Random random;

    public TestFileGenerator() {
        this(new Random());
    }

    public TestFileGenerator(Random random) {
        this.random = random;
    }

    /**
     * Creates {@code count} distinct contents, each written {@code duplicatesPerFile} times. The
     * first copy goes to {@code baseDir}, the others to random subdirectories.
     *
     * @return every file written
     */
    public List<Path> generate(Path baseDir, int count, int duplicatesPerFile) throws IOException {
        if (count < 1) {
            throw new IllegalArgumentException("Count must be greater than 0");
        }
        if (duplicatesPerFile < 1) {
            throw new IllegalArgumentException("Duplicates must be greater than 0");
        }
        Files.createDirectories(baseDir);
        List<Path> subdirectories = new ArrayList<>();
        for (String name : SUBDIRECTORIES) {
            subdirectories.add(Files.createDirectories(baseDir.resolve(name)));
        }

        List<Path> written = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            byte[] content = new byte[MIN_SIZE + random.nextInt(MAX_EXTRA_SIZE)];
            random.nextBytes(content);
            FileType type = FILE_TYPES.get(random.nextInt(FILE_TYPES.size()));
            for (int copy = 0; copy < duplicatesPerFile; copy++) {
                Path directory = copy == 0
                        ? baseDir
                        : subdirectories.get(random.nextInt(subdirectories.size()));
                Path file = uniqueName(directory, type);
                Files.write(file, content);
                written.add(file);
                LOGGER.debug("Created: {}", file);
            }
        }
        LOGGER.info("Generated {} files ({} contents x {} copies) in {}", written.size(), count, duplicatesPerFile, baseDir);
        return written;
    }

    private Path uniqueName(Path directory, FileType type) {
        long days = LAST_DATE.toEpochDay() - FIRST_DATE.toEpochDay();
        while (true) {
            LocalDate date = FIRST_DATE.plusDays(random.nextInt((int) days + 1));
            String name = String.format("%s%s_%03d%s", type.prefix(), date, random.nextInt(1000), type.extension());
            Path candidate = directory.resolve(name);
            if (!Files.exists(candidate)) {
                return candidate;
            }
        }
    }

    private record FileType(String extension, String prefix) {
    }
}
