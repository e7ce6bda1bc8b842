package io.github.cogscore.syntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * Immutable {@link SyntaxNode}. Trees are assembled bottom-up with {@link Builder}s and materialized top-down by
 * {@link Builder#build()}, which is the only point where parent links are assigned.
 */
public final class SyntaxTreeNode implements SyntaxNode {
    private final NodeKind kind;
    private final String text;
    private final SourcePosition position;

    @Nullable
    private final SyntaxTreeNode parent;

    private final List<SyntaxTreeNode> children;

    private SyntaxTreeNode(Builder builder, @Nullable SyntaxTreeNode parent) {
        this.kind = builder.kind;
        this.text = builder.text;
        this.position = builder.position;
        this.parent = parent;
        var built = new ArrayList<SyntaxTreeNode>(builder.children.size());
        for (var child : builder.children) {
            built.add(new SyntaxTreeNode(child, this));
        }
        this.children = Collections.unmodifiableList(built);
    }

    public static Builder builder(NodeKind kind, String text, SourcePosition position) {
        return new Builder(kind, text, position);
    }

    public static Builder builder(NodeKind kind, String text) {
        return new Builder(kind, text, SourcePosition.START);
    }

    /** A leaf token such as {@code "if"} or {@code ")"}. */
    public static Builder token(String token) {
        return new Builder(NodeKind.TOKEN, token, SourcePosition.START);
    }

    @Override
    public NodeKind kind() {
        return kind;
    }

    @Override
    public List<SyntaxTreeNode> children() {
        return children;
    }

    @Override
    public String text() {
        return text;
    }

    @Override
    public SourcePosition position() {
        return position;
    }

    @Override
    public @Nullable SyntaxTreeNode parent() {
        return parent;
    }

    @Override
    public String toString() {
        return kind + "@" + position;
    }

    /** Mutable description of a node and its subtree. Not thread-safe. */
    public static final class Builder {
        private final NodeKind kind;
        private final String text;
        private final SourcePosition position;
        private final List<Builder> children = new ArrayList<>();

        private Builder(NodeKind kind, String text, SourcePosition position) {
            this.kind = kind;
            this.text = text;
            this.position = position;
        }

        public Builder child(Builder child) {
            children.add(child);
            return this;
        }

        public Builder children(List<Builder> more) {
            children.addAll(more);
            return this;
        }

        /** Materializes this builder as a root node. */
        public SyntaxTreeNode build() {
            return new SyntaxTreeNode(this, null);
        }
    }
}
