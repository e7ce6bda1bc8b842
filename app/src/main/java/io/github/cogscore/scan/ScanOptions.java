package io.github.cogscore.scan;

import io.github.cogscore.analyzer.TypescriptSyntaxTreeProvider;

/**
 * Settings for one scan.
 *
 * @param threads number of files scored concurrently in a folder scan
 * @param maxTreeDepth syntax trees nested deeper than this are rejected
 * @param pruneZero drop zero-score entries from the results
 */
public record ScanOptions(int threads, int maxTreeDepth, boolean pruneZero) {

    public ScanOptions {
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be >= 1: " + threads);
        }
        if (maxTreeDepth < 1) {
            throw new IllegalArgumentException("maxTreeDepth must be >= 1: " + maxTreeDepth);
        }
    }

    public static ScanOptions defaults() {
        return new ScanOptions(
                Runtime.getRuntime().availableProcessors(), TypescriptSyntaxTreeProvider.DEFAULT_MAX_TREE_DEPTH, false);
    }
}
