package io.github.cogscore.syntax;

/**
 * Closed set of node kinds the complexity rules distinguish. Everything a grammar produces that is not listed here is
 * either a {@link #TOKEN} (keywords, punctuation, operators) or {@link #OTHER}.
 */
public enum NodeKind {
    SOURCE_FILE(false, false, false),
    BLOCK(false, false, false),
    IDENTIFIER(false, false, false),

    CATCH_CLAUSE(true, false, false),
    CONDITIONAL_EXPRESSION(true, true, false),
    FOR(true, true, false),
    FOR_IN(true, true, false),
    FOR_OF(true, true, false),
    IF(true, true, false),
    SWITCH(true, true, false),
    WHILE(true, true, false),
    DO(false, false, false),

    ARROW_FUNCTION(false, false, true),
    FUNCTION_DECLARATION(false, false, true),
    FUNCTION_EXPRESSION(false, false, true),
    METHOD_DECLARATION(false, false, true),

    // intrinsic cost only when a label is named, see isJumpStatement()
    BREAK(false, false, false),
    CONTINUE(false, false, false),

    TOKEN(false, false, false),
    OTHER(false, false, false);

    private final boolean intrinsicCost;
    private final boolean nestingIncrement;
    private final boolean functionLike;

    NodeKind(boolean intrinsicCost, boolean nestingIncrement, boolean functionLike) {
        this.intrinsicCost = intrinsicCost;
        this.nestingIncrement = nestingIncrement;
        this.functionLike = functionLike;
    }

    /** Whether the construct costs +1 simply for being present. */
    public boolean hasIntrinsicCost() {
        return intrinsicCost;
    }

    /** Whether the construct additionally costs the nesting depth it appears at. */
    public boolean hasNestingIncrement() {
        return nestingIncrement;
    }

    /** Whether the construct owns a function body. */
    public boolean isFunctionLike() {
        return functionLike;
    }

    public boolean isJumpStatement() {
        return this == BREAK || this == CONTINUE;
    }
}
