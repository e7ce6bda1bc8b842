package io.github.cogscore.analyzer;

/**
 * Tree-sitter TypeScript node type names the syntax tree provider maps or reshapes.
 */
public final class TypeScriptNodeTypes {

    // ===== STRUCTURE =====
    public static final String PROGRAM = "program";
    public static final String STATEMENT_BLOCK = "statement_block";
    public static final String COMMENT = "comment";
    /** Tree-sitter error recovery node */
    public static final String ERROR = "ERROR";

    // ===== IDENTIFIERS =====
    public static final String IDENTIFIER = "identifier";
    /** Label of a labeled statement, break or continue */
    public static final String STATEMENT_IDENTIFIER = "statement_identifier";

    // ===== BRANCHING =====
    public static final String IF_STATEMENT = "if_statement";
    public static final String ELSE_CLAUSE = "else_clause";
    public static final String SWITCH_STATEMENT = "switch_statement";
    public static final String TERNARY_EXPRESSION = "ternary_expression";
    public static final String PARENTHESIZED_EXPRESSION = "parenthesized_expression";
    public static final String CATCH_CLAUSE = "catch_clause";

    // ===== LOOPS =====
    public static final String FOR_STATEMENT = "for_statement";
    /** Both {@code for (x in y)} and {@code for (x of y)}; the operator token tells them apart */
    public static final String FOR_IN_STATEMENT = "for_in_statement";
    public static final String WHILE_STATEMENT = "while_statement";
    public static final String DO_STATEMENT = "do_statement";

    // ===== JUMPS =====
    public static final String BREAK_STATEMENT = "break_statement";
    public static final String CONTINUE_STATEMENT = "continue_statement";

    // ===== FUNCTION-LIKE =====
    public static final String ARROW_FUNCTION = "arrow_function";
    public static final String FUNCTION_DECLARATION = "function_declaration";
    public static final String GENERATOR_FUNCTION_DECLARATION = "generator_function_declaration";
    public static final String FUNCTION_EXPRESSION = "function_expression";
    /** Function expressions in grammar releases before function_expression existed */
    public static final String FUNCTION = "function";
    public static final String GENERATOR_FUNCTION = "generator_function";
    public static final String METHOD_DEFINITION = "method_definition";

    // ===== TOKENS =====
    public static final String OF_KEYWORD = "of";

    private TypeScriptNodeTypes() {}
}
