package io.github.cogscore.complexity;

import io.github.cogscore.syntax.SyntaxNode;
import java.util.ArrayList;
import java.util.List;

/**
 * {@code condition ? then : else}. The "then" run is nested one level deeper; the "else" run is not, so a chain of
 * ternaries in else position does not compound.
 */
final class ConditionalExpressionCost implements ConstructCost {

    @Override
    public void accumulate(SyntaxNode node, int depth, CostAccumulator cost) throws UnexpectedNodeException {
        List<SyntaxNode> run = new ArrayList<>();
        boolean seenQuestion = false;
        boolean seenColon = false;

        for (var child : node.children()) {
            if (!seenQuestion && child.isToken("?")) {
                cost.includeAll(run, depth);
                run = new ArrayList<>();
                seenQuestion = true;
            } else if (seenQuestion && !seenColon && child.isToken(":")) {
                cost.includeAll(run, depth + 1);
                run = new ArrayList<>();
                seenColon = true;
            } else {
                run.add(child);
            }
        }

        if (!seenQuestion) {
            throw new UnexpectedNodeException(node, "'?' in conditional expression");
        }
        if (!seenColon) {
            throw new UnexpectedNodeException(node, "':' in conditional expression");
        }
        cost.includeAll(run, depth);
    }
}
