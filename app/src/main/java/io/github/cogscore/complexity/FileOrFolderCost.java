package io.github.cogscore.complexity;

/** Result for one path handed to the scanner: either a single file or a folder of results. */
public sealed interface FileOrFolderCost permits FileCostResult, FolderCostResult {

    /** Total score of everything this result covers. */
    int score();

    /** Copy without any zero-score entries below the file level. */
    FileOrFolderCost withoutZeroScores();
}
