package com.example.dedupscanner;

import com.example.dedupscanner.metadata.DuplicateGroup;
import com.example.dedupscanner.metadata.FileRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Groups byte-identical files with a size, quick-hash, full-hash funnel. Full digests are only
 * computed for files that share both size and quick hash with at least one other file.
 *
 * <p>Group members keep the order of the input list. Groups are ordered by descending size of
 * their first member, ties by the position of that member in the input.
 */
public final class DuplicateClassifier {
    private static final Logger LOGGER = LoggerFactory.getLogger(DuplicateClassifier.class);

    private final ContentHasher hasher;
    private final ProgressListener progress;

    public DuplicateClassifier(ContentHasher hasher) {
        this(hasher, ProgressListener.NONE);
    }

    public DuplicateClassifier(ContentHasher hasher, ProgressListener progress) {
        this.hasher = hasher;
        this.progress = progress;
    }

    public List<DuplicateGroup> classify(List<FileRecord> records) {
        Map<Long, List<Candidate>> bySize = new LinkedHashMap<>();
        for (int i = 0; i < records.size(); i++) {
            FileRecord record = records.get(i);
            bySize.computeIfAbsent(record.size(), ignored -> new ArrayList<>()).add(new Candidate(i, record));
        }

        List<RankedGroup> found = new ArrayList<>();
        long filesScanned = records.size();
        for (List<Candidate> sizeBucket : bySize.values()) {
            if (sizeBucket.size() < 2) {
                continue;
            }
            Map<String, List<Candidate>> byQuickHash = new LinkedHashMap<>();
            for (Candidate candidate : sizeBucket) {
                byQuickHash.computeIfAbsent(candidate.record().quickHash(), ignored -> new ArrayList<>()).add(candidate);
            }
            for (List<Candidate> quickBucket : byQuickHash.values()) {
                if (quickBucket.size() < 2) {
                    continue;
                }
                resolveFullHashes(quickBucket, found, filesScanned);
            }
        }

        found.sort(Comparator.comparingLong((RankedGroup ranked) -> ranked.group().size()).reversed()
                .thenComparingInt(RankedGroup::firstIndex));
        List<DuplicateGroup> groups = new ArrayList<>(found.size());
        for (RankedGroup ranked : found) {
            groups.add(ranked.group());
        }
        LOGGER.debug("Classified {} files into {} duplicate groups", records.size(), groups.size());
        return groups;
    }

    private void resolveFullHashes(List<Candidate> quickBucket, List<RankedGroup> found, long filesScanned) {
        Map<String, List<Candidate>> byFullHash = new LinkedHashMap<>();
        for (Candidate candidate : quickBucket) {
            String fullHash;
            try {
                fullHash = hasher.fullDigest(Path.of(candidate.record().path()));
            } catch (FileReadException ex) {
                LOGGER.warn("Dropping {} from classification", candidate.record().path(), ex);
                continue;
            }
            byFullHash.computeIfAbsent(fullHash, ignored -> new ArrayList<>())
                    .add(new Candidate(candidate.index(), candidate.record().withFullHash(fullHash)));
            progress.onProgress(filesScanned, found.size(), ScanPhase.HASHING);
        }
        for (Map.Entry<String, List<Candidate>> entry : byFullHash.entrySet()) {
            List<Candidate> members = entry.getValue();
            if (members.size() < 2) {
                continue;
            }
            List<FileRecord> files = new ArrayList<>(members.size());
            for (Candidate member : members) {
                files.add(member.record());
            }
            found.add(new RankedGroup(members.get(0).index(), new DuplicateGroup(entry.getKey(), files.get(0).size(), files)));
        }
    }

    private record Candidate(int index, FileRecord record) {
    }

    private record RankedGroup(int firstIndex, DuplicateGroup group) {
    }
}
