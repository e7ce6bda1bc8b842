package io.github.cogscore.scan;

import io.github.cogscore.complexity.CognitiveComplexity;
import io.github.cogscore.complexity.FileCostResult;
import io.github.cogscore.complexity.FileOrFolderCost;
import io.github.cogscore.complexity.FolderCostResult;
import io.github.cogscore.complexity.UnexpectedNodeException;
import io.github.cogscore.syntax.SyntaxTreeException;
import io.github.cogscore.syntax.SyntaxTreeProvider;
import io.github.cogscore.util.ExecutorServiceUtil;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Scores a single source file, or every supported source file below a folder.
 *
 * <p>Files in a folder are scored concurrently; each file's scoring is independent. Results are assembled in sorted
 * name order so the output does not depend on scheduling. Hidden entries and {@code node_modules} are skipped, and
 * folders without any scored file are left out.
 */
public final class ComplexityScanner {
    private static final Logger logger = LogManager.getLogger(ComplexityScanner.class);

    private static final Set<String> SKIPPED_DIRECTORIES = Set.of("node_modules");

    private final SyntaxTreeProvider provider;
    private final ScanOptions options;

    public ComplexityScanner(SyntaxTreeProvider provider, ScanOptions options) {
        this.provider = provider;
        this.options = options;
    }

    /**
     * Scores {@code path}. A single file that fails to score fails the whole call; inside a folder, failing files are
     * logged and reported in {@link ScanReport#failures()} instead.
     */
    public ScanReport scan(Path path) throws IOException, SyntaxTreeException, UnexpectedNodeException {
        var name = displayName(path);
        if (Files.isDirectory(path)) {
            return scanFolder(path, name);
        }
        if (!Files.isRegularFile(path)) {
            throw new NoSuchFileException(path.toString());
        }
        FileOrFolderCost result = scoreFile(path);
        return new ScanReport(name, options.pruneZero() ? result.withoutZeroScores() : result, List.of());
    }

    public FileCostResult scoreFile(Path file) throws IOException, SyntaxTreeException, UnexpectedNodeException {
        logger.debug("Scoring {}", file);
        var tree = provider.parse(file);
        var result = CognitiveComplexity.calcFileCost(tree);
        logger.debug("{} scored {}", file, result.score());
        return result;
    }

    public boolean isSupported(Path file) {
        var fileName = file.getFileName();
        if (fileName == null) {
            return false;
        }
        var name = fileName.toString();
        int lastDot = name.lastIndexOf('.');
        if (lastDot <= 0 || lastDot == name.length() - 1) {
            return false;
        }
        return provider.supportedExtensions().contains(name.substring(lastDot + 1).toLowerCase(Locale.ROOT));
    }

    private ScanReport scanFolder(Path folder, String name) throws IOException {
        var files = collectSourceFiles(folder);
        logger.debug("Found {} source files under {}", files.size(), folder);

        var failures = new ArrayList<ScanFailure>();
        var root = new FolderBuilder();
        var executor = ExecutorServiceUtil.newFixedThreadExecutor(
                Math.max(1, Math.min(options.threads(), files.size())), "cogscore-scan-");
        try {
            Map<Path, Future<FileCostResult>> pending = new LinkedHashMap<>();
            for (var file : files) {
                pending.put(file, executor.submit(() -> scoreFile(file)));
            }
            for (var entry : pending.entrySet()) {
                var file = entry.getKey();
                try {
                    root.add(folder.relativize(file), entry.getValue().get());
                } catch (ExecutionException e) {
                    var cause = e.getCause() == null ? e : e.getCause();
                    logger.error("Failed to score {}: {}", file, cause.getMessage());
                    failures.add(new ScanFailure(file, String.valueOf(cause.getMessage())));
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            var interrupted = new InterruptedIOException("Interrupted while scoring " + folder);
            interrupted.initCause(e);
            throw interrupted;
        } finally {
            executor.shutdownNow();
        }

        FileOrFolderCost result = root.build();
        return new ScanReport(name, options.pruneZero() ? result.withoutZeroScores() : result, failures);
    }

    private List<Path> collectSourceFiles(Path folder) throws IOException {
        var files = new ArrayList<Path>();
        Files.walkFileTree(folder, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (!dir.equals(folder) && isSkipped(dir)) {
                    logger.trace("Skipping directory {}", dir);
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (attrs.isRegularFile() && !isSkipped(file) && isSupported(file)) {
                    files.add(file);
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
                logger.warn("Cannot read {}: {}", file, exc.getMessage());
                return FileVisitResult.CONTINUE;
            }
        });
        files.sort(null);
        return files;
    }

    private static boolean isSkipped(Path entry) {
        var fileName = entry.getFileName();
        if (fileName == null) {
            return false;
        }
        var name = fileName.toString();
        return name.startsWith(".") || SKIPPED_DIRECTORIES.contains(name);
    }

    static String displayName(Path path) {
        var fileName = path.toAbsolutePath().normalize().getFileName();
        return fileName == null ? path.toString() : fileName.toString();
    }

    /** Mutable folder tree filled in as file results arrive. */
    private static final class FolderBuilder {
        private final Map<String, FolderBuilder> folders = new TreeMap<>();
        private final Map<String, FileCostResult> files = new TreeMap<>();

        void add(Path relative, FileCostResult result) {
            if (relative.getNameCount() == 1) {
                files.put(relative.toString(), result);
            } else {
                folders.computeIfAbsent(relative.getName(0).toString(), k -> new FolderBuilder())
                        .add(relative.subpath(1, relative.getNameCount()), result);
            }
        }

        FolderCostResult build() {
            var entries = new TreeMap<String, FileOrFolderCost>();
            folders.forEach((name, folder) -> entries.put(name, folder.build()));
            entries.putAll(files);
            return new FolderCostResult(entries);
        }
    }
}
