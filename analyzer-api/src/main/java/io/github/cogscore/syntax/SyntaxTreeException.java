package io.github.cogscore.syntax;

/**
 * Thrown when a source file cannot be turned into a syntax tree the scoring rules can safely walk.
 */
public class SyntaxTreeException extends Exception {
    private final String sourceName;
    private final String operation;

    public SyntaxTreeException(String message, String sourceName, String operation) {
        super(message);
        this.sourceName = sourceName;
        this.operation = operation;
    }

    public SyntaxTreeException(String message, Throwable cause, String sourceName, String operation) {
        super(message, cause);
        this.sourceName = sourceName;
        this.operation = operation;
    }

    public String getSourceName() {
        return sourceName;
    }

    public String getOperation() {
        return operation;
    }

    @Override
    public String getMessage() {
        return String.format("Syntax tree %s failed for %s: %s", operation, sourceName, super.getMessage());
    }
}
