package io.github.cogscore.complexity;

import io.github.cogscore.syntax.NodeKind;
import io.github.cogscore.syntax.SyntaxNode;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Entry point for scoring whole files. */
public final class CognitiveComplexity {
    private static final Logger logger = LogManager.getLogger(CognitiveComplexity.class);

    private static final NodeCostEvaluator EVALUATOR = new NodeCostEvaluator();

    private CognitiveComplexity() {}

    /**
     * Scores every top-level child of {@code file} at depth 0.
     *
     * @param file a {@link NodeKind#SOURCE_FILE} root
     * @throws UnexpectedNodeException if a construct in the file does not have the shape its rule expects
     */
    public static FileCostResult calcFileCost(SyntaxNode file) throws UnexpectedNodeException {
        if (file.kind() != NodeKind.SOURCE_FILE) {
            throw new IllegalArgumentException("Expected a SOURCE_FILE root but got " + file.kind());
        }
        var cost = new CostAccumulator(EVALUATOR);
        cost.includeAll(file.children(), 0);
        logger.trace("File scored {} across {} top-level nodes", cost.score(), file.children().size());
        return new FileCostResult(cost.score(), cost.inner());
    }

    /** Scores a single node, as it would be scored at {@code depth} inside a file. */
    public static CostResult calcNodeCost(SyntaxNode node, int depth) throws UnexpectedNodeException {
        return EVALUATOR.evaluate(node, depth);
    }
}
