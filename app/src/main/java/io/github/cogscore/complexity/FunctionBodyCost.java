package io.github.cogscore.complexity;

import io.github.cogscore.syntax.NodeKind;
import io.github.cogscore.syntax.SyntaxNode;

/**
 * Function declarations and method declarations: modifiers, name, parameters and return type at the current depth,
 * then the block body, nested only if the declaration itself is inside another function.
 */
final class FunctionBodyCost implements ConstructCost {

    @Override
    public void accumulate(SyntaxNode node, int depth, CostAccumulator cost) throws UnexpectedNodeException {
        var children = new ChildCursor(node);
        while (true) {
            var child = children.next("function body");
            if (child.kind() == NodeKind.BLOCK) {
                cost.include(child, TopLevelClassifier.bodyDepth(node, depth));
                break;
            }
            cost.include(child, depth);
        }
        // trailing punctuation, if the grammar attaches any
        while (children.hasNext()) {
            cost.include(children.next("trailing token"), depth);
        }
    }
}
