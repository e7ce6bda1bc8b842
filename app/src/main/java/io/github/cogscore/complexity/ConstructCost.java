package io.github.cogscore.complexity;

import io.github.cogscore.syntax.SyntaxNode;

/**
 * Scoring rule for the children of one kind of construct. Implementations decide which children are scored and at
 * which depth; the construct's own intrinsic and nesting cost is charged by {@link NodeCostEvaluator} beforehand.
 */
@FunctionalInterface
interface ConstructCost {

    void accumulate(SyntaxNode node, int depth, CostAccumulator cost) throws UnexpectedNodeException;

    /** Every child at the same depth. */
    ConstructCost SAME_DEPTH = (node, depth, cost) -> cost.includeAll(node.children(), depth);

    /** Every child one level deeper. Catch clauses have no condition/body asymmetry. */
    ConstructCost NESTED = (node, depth, cost) -> cost.includeAll(node.children(), depth + 1);
}
