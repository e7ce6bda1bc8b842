package io.github.cogscore.syntax;

/**
 * Zero-based start position of a node. The column counts characters, not bytes.
 */
public record SourcePosition(int line, int column) {
    public static final SourcePosition START = new SourcePosition(0, 0);

    public SourcePosition {
        if (line < 0 || column < 0) {
            throw new IllegalArgumentException("Negative source position: " + line + ":" + column);
        }
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
