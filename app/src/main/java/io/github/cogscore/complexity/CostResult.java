package io.github.cogscore.complexity;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.github.cogscore.syntax.SyntaxNode;
import java.util.List;

/**
 * Score of one syntax node and of everything scored beneath it.
 *
 * @param name the literal source text of the node
 * @param score the node's local contribution plus the scores of {@code inner}
 * @param line zero-based line the node starts on
 * @param column zero-based column the node starts at
 * @param inner results for the children that were scored, in source order
 */
@JsonPropertyOrder({"name", "score", "line", "column", "inner"})
public record CostResult(
        String name,
        int score,
        int line,
        int column,
        @JsonInclude(JsonInclude.Include.NON_EMPTY) List<CostResult> inner) {

    public CostResult {
        if (score < 0) {
            throw new IllegalArgumentException("score must not be negative: " + score);
        }
        inner = List.copyOf(inner);
    }

    static CostResult of(SyntaxNode node, int score, List<CostResult> inner) {
        var position = node.position();
        return new CostResult(node.text(), score, position.line(), position.column(), inner);
    }

    /** Copy of this result without inner results that score 0. */
    public CostResult withoutZeroScores() {
        return new CostResult(name, score, line, column, pruneZeroScores(inner));
    }

    static List<CostResult> pruneZeroScores(List<CostResult> results) {
        return results.stream()
                .filter(r -> r.score() > 0)
                .map(CostResult::withoutZeroScores)
                .toList();
    }
}
