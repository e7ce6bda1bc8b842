package io.github.cogscore.complexity;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Results for the entries of a folder, keyed by entry name and kept in the order they were added. */
public final class FolderCostResult implements FileOrFolderCost {
    private final Map<String, FileOrFolderCost> entries;

    public FolderCostResult(Map<String, ? extends FileOrFolderCost> entries) {
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    @JsonValue
    public Map<String, FileOrFolderCost> entries() {
        return entries;
    }

    @Override
    public int score() {
        return entries.values().stream().mapToInt(FileOrFolderCost::score).sum();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    @Override
    public FolderCostResult withoutZeroScores() {
        var pruned = new LinkedHashMap<String, FileOrFolderCost>();
        entries.forEach((name, entry) -> pruned.put(name, entry.withoutZeroScores()));
        return new FolderCostResult(pruned);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof FolderCostResult other && entries.equals(other.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "FolderCostResult" + entries;
    }
}
