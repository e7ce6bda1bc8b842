package io.github.cogscore.complexity;

import io.github.cogscore.syntax.SyntaxNode;

/** {@code switch (value) { ... }}. The case block is nested as one unit; case labels add nothing. */
final class SwitchStatementCost implements ConstructCost {

    @Override
    public void accumulate(SyntaxNode node, int depth, CostAccumulator cost) throws UnexpectedNodeException {
        var children = new ChildCursor(node);
        children.expectToken("switch");
        children.expectToken("(");
        cost.include(children.next("switch value"), depth);
        children.expectToken(")");
        cost.include(children.next("case block"), depth + 1);
        children.expectEnd();
    }
}
