package io.github.cogscore.complexity;

import io.github.cogscore.syntax.NodeKind;
import io.github.cogscore.syntax.SyntaxNode;

/**
 * Scores a node and its subtree at a given nesting depth.
 *
 * <p>Two rules apply to every node before its children are looked at: constructs with an intrinsic cost add 1, and
 * constructs with a nesting increment add the current depth. The node's children are then handed to the
 * {@link ConstructCost} registered for its kind.
 *
 * <p>Instances hold no traversal state and may be shared between threads.
 */
public final class NodeCostEvaluator {
    private final ConstructCost conditionalExpression = new ConditionalExpressionCost();
    private final ConstructCost ifStatement = new IfStatementCost();
    private final ConstructCost switchStatement = new SwitchStatementCost();
    private final ConstructCost whileStatement = new WhileStatementCost();
    private final ConstructCost doStatement = new DoStatementCost();
    private final ConstructCost forLikeStatement = new ForLikeStatementCost();
    private final ConstructCost arrowFunction = new ArrowFunctionCost();
    private final ConstructCost functionBody = new FunctionBodyCost();
    private final ConstructCost functionExpression = new FunctionExpressionCost();

    public CostResult evaluate(SyntaxNode node, int depth) throws UnexpectedNodeException {
        if (depth < 0) {
            throw new IllegalArgumentException("depth must not be negative: " + depth);
        }
        var cost = new CostAccumulator(this);
        cost.add(localCost(node, depth));
        constructCostFor(node.kind()).accumulate(node, depth, cost);
        return CostResult.of(node, cost.score(), cost.inner());
    }

    /** The cost {@code node} adds by itself at {@code depth}, ignoring its children. */
    public static int localCost(SyntaxNode node, int depth) {
        var kind = node.kind();
        int cost = 0;
        if (kind.hasIntrinsicCost() || isJumpToLabel(node)) {
            cost += 1;
        }
        if (depth > 0 && kind.hasNestingIncrement()) {
            cost += depth;
        }
        return cost;
    }

    /** {@code break label;} or {@code continue label;}. */
    static boolean isJumpToLabel(SyntaxNode node) {
        if (!node.kind().isJumpStatement()) {
            return false;
        }
        for (var child : node.children()) {
            if (child.kind() == NodeKind.IDENTIFIER) {
                return true;
            }
        }
        return false;
    }

    private ConstructCost constructCostFor(NodeKind kind) {
        return switch (kind) {
            case CONDITIONAL_EXPRESSION -> conditionalExpression;
            case IF -> ifStatement;
            case SWITCH -> switchStatement;
            case WHILE -> whileStatement;
            case DO -> doStatement;
            case FOR, FOR_IN, FOR_OF -> forLikeStatement;
            case ARROW_FUNCTION -> arrowFunction;
            case FUNCTION_DECLARATION, METHOD_DECLARATION -> functionBody;
            case FUNCTION_EXPRESSION -> functionExpression;
            case CATCH_CLAUSE -> ConstructCost.NESTED;
            case SOURCE_FILE, BLOCK, IDENTIFIER, BREAK, CONTINUE, TOKEN, OTHER -> ConstructCost.SAME_DEPTH;
        };
    }
}
