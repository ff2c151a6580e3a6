package com.example.dedupscanner;

import com.example.dedupscanner.metadata.DuplicateGroup;
import com.example.dedupscanner.metadata.FileRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Plain-text summary and table of duplicate groups for the {@code --no-web} mode.
 */
public final class ConsoleReport {
    private static final String[] UNITS = {"B", "KB", "MB", "GB", "TB"};
    private static final String[] HEADERS = {"Group", "Size", "Hash", "Files"};

    private ConsoleReport() {
    }

    public static String render(List<DuplicateGroup> groups) {
        if (groups.isEmpty()) {
            return System.lineSeparator() + "No duplicate files found" + System.lineSeparator();
        }
        long totalFiles = 0;
        long totalBytes = 0;
        long reclaimable = 0;
        for (DuplicateGroup group : groups) {
            totalFiles += group.fileCount();
            totalBytes += group.size() * group.fileCount();
            reclaimable += group.reclaimableBytes();
        }

        StringBuilder out = new StringBuilder();
        String nl = System.lineSeparator();
        out.append(nl).append("Summary:").append(nl);
        out.append("==========================================").append(nl);
        out.append("Total duplicate groups: ").append(groups.size()).append(nl);
        out.append("Total duplicate files: ").append(totalFiles).append(nl);
        out.append("Total size: ").append(formatSize(totalBytes)).append(nl);
        out.append("Potential space savings: ").append(formatSize(reclaimable)).append(nl);
        out.append("==========================================").append(nl).append(nl);

        List<String[]> rows = new ArrayList<>();
        for (int i = 0; i < groups.size(); i++) {
            DuplicateGroup group = groups.get(i);
            List<String> files = new ArrayList<>();
            for (FileRecord file : group.files()) {
                files.add(file.path());
            }
            rows.add(new String[]{
                    "Group " + (i + 1),
                    formatSize(group.size()),
                    group.fullHash().substring(0, Math.min(8, group.fullHash().length())),
                    String.join("\n", files)
            });
        }
        appendTable(out, rows);
        return out.toString();
    }

    /**
     * Formats a byte count with two decimals on a 1024 base, e.g. {@code 1048576 -> "1.00 MB"}.
     */
    public static String formatSize(long bytes) {
        double size = bytes;
        int unit = 0;
        while (size >= 1024 && unit < UNITS.length - 1) {
            size /= 1024;
            unit++;
        }
        return String.format(Locale.ROOT, "%.2f %s", size, UNITS[unit]);
    }

    private static void appendTable(StringBuilder out, List<String[]> rows) {
        int[] widths = new int[HEADERS.length];
        for (int c = 0; c < HEADERS.length; c++) {
            widths[c] = HEADERS[c].length();
        }
        for (String[] row : rows) {
            for (int c = 0; c < row.length; c++) {
                for (String line : row[c].split("\n")) {
                    widths[c] = Math.max(widths[c], line.length());
                }
            }
        }
        String separator = separator(widths);
        out.append(separator);
        appendRow(out, HEADERS, widths);
        out.append(separator);
        for (String[] row : rows) {
            appendRow(out, row, widths);
            out.append(separator);
        }
    }

    private static void appendRow(StringBuilder out, String[] cells, int[] widths) {
        String[][] lines = new String[cells.length][];
        int height = 1;
        for (int c = 0; c < cells.length; c++) {
            lines[c] = cells[c].split("\n");
            height = Math.max(height, lines[c].length);
        }
        for (int l = 0; l < height; l++) {
            out.append('|');
            for (int c = 0; c < cells.length; c++) {
                String text = l < lines[c].length ? lines[c][l] : "";
                out.append(' ').append(text).append(" ".repeat(widths[c] - text.length())).append(" |");
            }
            out.append(System.lineSeparator());
        }
    }

    private static String separator(int[] widths) {
        StringBuilder line = new StringBuilder("+");
        for (int width : widths) {
            line.append("-".repeat(width + 2)).append('+');
        }
        return line.append(System.lineSeparator()).toString();
    }
}
