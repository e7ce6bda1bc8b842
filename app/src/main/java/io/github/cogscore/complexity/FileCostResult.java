package io.github.cogscore.complexity;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.List;

/** Aggregate result for a whole source file. The file itself carries no label; its children do. */
@JsonPropertyOrder({"score", "inner"})
public record FileCostResult(int score, @JsonInclude(JsonInclude.Include.NON_EMPTY) List<CostResult> inner)
        implements FileOrFolderCost {

    public FileCostResult {
        inner = List.copyOf(inner);
    }

    @Override
    public FileCostResult withoutZeroScores() {
        return new FileCostResult(score, CostResult.pruneZeroScores(inner));
    }
}
