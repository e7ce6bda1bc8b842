package io.github.cogscore.complexity;

import io.github.cogscore.syntax.SyntaxNode;

/**
 * {@code for (init; condition; update) body}, {@code for (x in y) body}, {@code for [await] (x of y) body}.
 *
 * <p>Whatever sits between the parentheses is scored piecewise at the current depth, which covers every head shape
 * including the elided parts of {@code for (;;)}. The first direct {@code )} child closes the head because nested
 * parentheses always belong to a sub-expression.
 */
final class ForLikeStatementCost implements ConstructCost {

    @Override
    public void accumulate(SyntaxNode node, int depth, CostAccumulator cost) throws UnexpectedNodeException {
        var children = new ChildCursor(node);
        children.expectToken("for");
        children.skipToken("await");
        children.expectToken("(");
        while (true) {
            var child = children.next("')' closing the loop head");
            if (child.isToken(")")) {
                break;
            }
            cost.include(child, depth);
        }
        cost.include(children.next("loop body"), depth + 1);
        children.expectEnd();
    }
}
