package io.github.cogscore.complexity;

import io.github.cogscore.syntax.SyntaxNode;

/** {@code do body while (condition);}. Only the body is nested. */
final class DoStatementCost implements ConstructCost {

    @Override
    public void accumulate(SyntaxNode node, int depth, CostAccumulator cost) throws UnexpectedNodeException {
        var children = new ChildCursor(node);
        children.expectToken("do");
        cost.include(children.next("loop body"), depth + 1);
        children.expectToken("while");
        children.expectToken("(");
        cost.include(children.next("loop condition"), depth);
        children.expectToken(")");
        children.skipToken(";");
        children.expectEnd();
    }
}
