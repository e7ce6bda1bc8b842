package io.github.cogscore.syntax;

import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * A node of a concrete syntax tree. Unlike an abstract syntax tree, keywords and punctuation are kept as
 * {@link NodeKind#TOKEN} children, and the order of {@link #children()} follows the source text exactly.
 */
public interface SyntaxNode {

    NodeKind kind();

    /** Ordered, immutable children, syntactic tokens included. */
    List<? extends SyntaxNode> children();

    /** The literal source text this node spans. */
    String text();

    SourcePosition position();

    /**
     * The enclosing node, or {@code null} for the root. This is a lookup aid only: implementations never hand out a
     * way to mutate the parent through it.
     */
    @Nullable
    SyntaxNode parent();

    /** True if this node is the token spelled {@code token}, e.g. {@code "("} or {@code "else"}. */
    default boolean isToken(String token) {
        return kind() == NodeKind.TOKEN && token.equals(text());
    }

    default boolean isRoot() {
        return parent() == null;
    }
}
