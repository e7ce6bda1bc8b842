package io.github.cogscore.complexity;

import io.github.cogscore.syntax.SyntaxNode;

/** {@code if (condition) then [else otherwise]}. Both branches are nested; {@code else if} nests again. */
final class IfStatementCost implements ConstructCost {

    @Override
    public void accumulate(SyntaxNode node, int depth, CostAccumulator cost) throws UnexpectedNodeException {
        var children = new ChildCursor(node);
        children.expectToken("if");
        children.expectToken("(");
        cost.include(children.next("if condition"), depth);
        children.expectToken(")");
        cost.include(children.next("then branch"), depth + 1);
        if (children.hasNext()) {
            children.expectToken("else");
            cost.include(children.next("else branch"), depth + 1);
        }
        children.expectEnd();
    }
}
