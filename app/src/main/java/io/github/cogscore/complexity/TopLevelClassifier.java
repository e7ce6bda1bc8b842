package io.github.cogscore.complexity;

import io.github.cogscore.syntax.NodeKind;
import io.github.cogscore.syntax.SyntaxNode;

/**
 * Decides whether a function-like node lives outside every other function body. Blocks, statements, classes and
 * expressions in between are transparent: a function declared inside an {@code if} at file level is still top-level,
 * while a callback inside a method is not.
 */
public final class TopLevelClassifier {

    private TopLevelClassifier() {}

    public static boolean isTopLevel(SyntaxNode node) {
        var parent = node.parent();
        if (parent == null || parent.kind() == NodeKind.SOURCE_FILE) {
            return true;
        }
        for (var ancestor = parent; ancestor != null; ancestor = ancestor.parent()) {
            if (ancestor.kind().isFunctionLike()) {
                return false;
            }
        }
        return true;
    }

    /** Depth for the body of {@code function}: unchanged when top-level, one deeper when nested. */
    static int bodyDepth(SyntaxNode function, int depth) {
        return isTopLevel(function) ? depth : depth + 1;
    }
}
