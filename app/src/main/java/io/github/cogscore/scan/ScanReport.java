package io.github.cogscore.scan;

import io.github.cogscore.complexity.FileOrFolderCost;
import java.util.List;

/**
 * Outcome of scanning one path.
 *
 * @param name file or folder name the results are reported under
 * @param result scores for everything that could be scored
 * @param failures files left out of {@code result}
 */
public record ScanReport(String name, FileOrFolderCost result, List<ScanFailure> failures) {

    public ScanReport {
        failures = List.copyOf(failures);
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
