package com.openforge.helium.workspace;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Builds the fs_context prompt variable from the directory the user is in.
 *
 * Immediate children only, each directory with its recursive file count and
 * size, sorted by size descending:
 *
 *   Directory: /home/me/project (12 files, 48.0 KB)
 *   [DIR]  src/ (10 files, 40.0 KB)
 *   [FILE] README.md (8.0 KB)
 *
 * Never throws; an unreadable path yields a one-line explanation instead.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@EnableConfigurationProperties(WorkspaceProperties.class)
public class DirectorySummarizer {

    private final WorkspaceProperties properties;

    public String summarize(String currentPath) {
        Path root;
        try {
            root = Path.of(currentPath).toAbsolutePath().normalize();
        } catch (InvalidPathException e) {
            return "Directory not available: " + currentPath;
        }
        if (!Files.exists(root)) {
            return "Directory not found: " + root;
        }
        if (!Files.isDirectory(root)) {
            return "Not a directory: " + root;
        }

        ScanBudget budget = new ScanBudget(properties.maxScannedFiles());
        List<Entry> entries = new ArrayList<>();
        try (Stream<Path> children = Files.list(root)) {
            for (Path child : (Iterable<Path>) children::iterator) {
                entries.add(describe(child, budget));
            }
        } catch (IOException e) {
            log.warn("[Workspace] Failed to list {}: {}", root, e.getMessage());
            return "Failed to scan directory: " + e.getMessage();
        }

        entries.sort(Comparator.comparingLong(Entry::size).reversed().thenComparing(Entry::name));
        long totalSize  = entries.stream().mapToLong(Entry::size).sum();
        long totalFiles = entries.stream().mapToLong(Entry::fileCount).sum();

        StringBuilder sb = new StringBuilder();
        sb.append("Directory: ").append(root)
          .append(" (").append(totalFiles).append(" files, ").append(formatSize(totalSize)).append(')');
        if (budget.exhausted) {
            sb.append(" [partial: stopped after ").append(budget.limit).append(" files]");
        }
        if (entries.isEmpty()) {
            sb.append("\n(empty)");
        }
        int shown = Math.min(entries.size(), properties.maxEntries());
        for (Entry entry : entries.subList(0, shown)) {
            sb.append('\n');
            if (entry.directory()) {
                sb.append("[DIR]  ").append(entry.name()).append("/ (")
                  .append(entry.fileCount()).append(" files, ").append(formatSize(entry.size())).append(')');
            } else {
                sb.append("[FILE] ").append(entry.name()).append(" (").append(formatSize(entry.size())).append(')');
            }
        }
        if (entries.size() > shown) {
            sb.append("\n... and ").append(entries.size() - shown).append(" more entries");
        }
        log.debug("[Workspace] Summarized {}: {} entries, {} files", root, entries.size(), totalFiles);
        return sb.toString();
    }

    private Entry describe(Path child, ScanBudget budget) {
        String name = child.getFileName().toString();
        if (!Files.isDirectory(child, LinkOption.NOFOLLOW_LINKS)) {
            try {
                budget.visit();
                return new Entry(name, false, Files.size(child), 1);
            } catch (IOException e) {
                return new Entry(name, false, 0, 1);
            }
        }
        long[] totals = new long[2];
        if (!budget.exhausted) {
            try {
                Files.walkFileTree(child, new SimpleFileVisitor<>() {
                    @Override
                    public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                        if (!budget.visit()) {
                            return FileVisitResult.TERMINATE;
                        }
                        if (attrs.isRegularFile()) {
                            totals[0] += attrs.size();
                            totals[1]++;
                        }
                        return FileVisitResult.CONTINUE;
                    }

                    @Override
                    public FileVisitResult visitFileFailed(Path file, IOException e) {
                        log.debug("[Workspace] Skipping {}: {}", file, e.getMessage());
                        return FileVisitResult.CONTINUE;
                    }
                });
            } catch (IOException e) {
                log.debug("[Workspace] Could not walk {}: {}", child, e.getMessage());
            }
        }
        return new Entry(name, true, totals[0], totals[1]);
    }

    static String formatSize(long bytes) {
        if (bytes < 1024) return bytes + " B";
        if (bytes < 1024 * 1024) return String.format(Locale.ROOT, "%.1f KB", bytes / 1024.0);
        if (bytes < 1024L * 1024 * 1024) return String.format(Locale.ROOT, "%.1f MB", bytes / (1024.0 * 1024));
        return String.format(Locale.ROOT, "%.1f GB", bytes / (1024.0 * 1024 * 1024));
    }

    private record Entry(String name, boolean directory, long size, long fileCount) {}

    private static final class ScanBudget {
        final int limit;
        int visited;
        boolean exhausted;

        ScanBudget(int limit) {
            this.limit = limit;
        }

        /** Counts one file; false (and nothing counted) once the limit is spent. */
        boolean visit() {
            if (visited >= limit) {
                exhausted = true;
                return false;
            }
            visited++;
            return true;
        }
    }
}
