package io.github.cogscore.complexity;

import io.github.cogscore.syntax.SyntaxNode;

final class WhileStatementCost implements ConstructCost {

    @Override
    public void accumulate(SyntaxNode node, int depth, CostAccumulator cost) throws UnexpectedNodeException {
        var children = new ChildCursor(node);
        children.expectToken("while");
        children.expectToken("(");
        cost.include(children.next("loop condition"), depth);
        children.expectToken(")");
        cost.include(children.next("loop body"), depth + 1);
        children.expectEnd();
    }
}
