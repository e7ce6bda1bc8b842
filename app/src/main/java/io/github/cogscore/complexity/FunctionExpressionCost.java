package io.github.cogscore.complexity;

import io.github.cogscore.syntax.NodeKind;
import io.github.cogscore.syntax.SyntaxNode;

/** {@code function [name](params) { body }} used as a value. Its body is always nested. */
final class FunctionExpressionCost implements ConstructCost {

    @Override
    public void accumulate(SyntaxNode node, int depth, CostAccumulator cost) throws UnexpectedNodeException {
        var children = node.children();
        if (children.isEmpty()) {
            throw new UnexpectedNodeException(node, "function expression body");
        }
        var body = children.get(children.size() - 1);
        if (body.kind() != NodeKind.BLOCK) {
            throw new UnexpectedNodeException(body, "block body of function expression");
        }
        cost.includeAll(children.subList(0, children.size() - 1), depth);
        cost.include(body, depth + 1);
    }
}
