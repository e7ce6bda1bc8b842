package io.github.cogscore.complexity;

import io.github.cogscore.syntax.SyntaxNode;

/**
 * {@code [async] (params) [: type] => body} or {@code x => body}. Everything ahead of {@code =>} is the signature and
 * stays at the current depth.
 */
final class ArrowFunctionCost implements ConstructCost {

    @Override
    public void accumulate(SyntaxNode node, int depth, CostAccumulator cost) throws UnexpectedNodeException {
        var children = new ChildCursor(node);
        while (true) {
            var child = children.next("'=>' of arrow function");
            if (child.isToken("=>")) {
                break;
            }
            cost.include(child, depth);
        }
        cost.include(children.next("arrow function body"), TopLevelClassifier.bodyDepth(node, depth));
        children.expectEnd();
    }
}
