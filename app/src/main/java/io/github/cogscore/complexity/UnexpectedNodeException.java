package io.github.cogscore.complexity;

import io.github.cogscore.syntax.NodeKind;
import io.github.cogscore.syntax.SourcePosition;
import io.github.cogscore.syntax.SyntaxNode;

/**
 * Thrown when a construct's children do not have the shape its scoring rule consumes, which means the syntax tree
 * came from a grammar variant the rules do not know. Scoring is deterministic, so retrying cannot help.
 */
public class UnexpectedNodeException extends Exception {
    private static final int MAX_SNIPPET_LENGTH = 60;

    private final NodeKind kind;
    private final String text;
    private final SourcePosition position;
    private final String expected;

    public UnexpectedNodeException(SyntaxNode node, String expected) {
        super("Unexpected node");
        this.kind = node.kind();
        this.text = node.text();
        this.position = node.position();
        this.expected = expected;
    }

    public NodeKind getKind() {
        return kind;
    }

    public String getText() {
        return text;
    }

    public SourcePosition getPosition() {
        return position;
    }

    /** The grammatical role that should have been at this position. */
    public String getExpected() {
        return expected;
    }

    @Override
    public String getMessage() {
        return String.format(
                "%s: found %s `%s` at %s, expected %s", super.getMessage(), kind, snippet(text), position, expected);
    }

    private static String snippet(String text) {
        var singleLine = text.replaceAll("\\s+", " ").strip();
        return singleLine.length() <= MAX_SNIPPET_LENGTH
                ? singleLine
                : singleLine.substring(0, MAX_SNIPPET_LENGTH) + "...";
    }
}
