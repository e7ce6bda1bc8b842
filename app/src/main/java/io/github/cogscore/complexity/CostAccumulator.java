package io.github.cogscore.complexity;

import io.github.cogscore.syntax.SyntaxNode;
import java.util.ArrayList;
import java.util.List;

/** Running score and child results of the node currently being evaluated. */
final class CostAccumulator {
    private final NodeCostEvaluator evaluator;
    private final List<CostResult> inner = new ArrayList<>();
    private int score;

    CostAccumulator(NodeCostEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    /** Scores {@code node} at {@code depth} and adds it to this node's results. */
    void include(SyntaxNode node, int depth) throws UnexpectedNodeException {
        var result = evaluator.evaluate(node, depth);
        inner.add(result);
        score += result.score();
    }

    void includeAll(List<? extends SyntaxNode> nodes, int depth) throws UnexpectedNodeException {
        for (var node : nodes) {
            include(node, depth);
        }
    }

    void add(int cost) {
        score += cost;
    }

    int score() {
        return score;
    }

    List<CostResult> inner() {
        return inner;
    }
}
