package io.github.cogscore.complexity;

import io.github.cogscore.syntax.SyntaxNode;
import java.util.List;
import java.util.Locale;

/** Positional reader over a node's children. Every failed expectation is an {@link UnexpectedNodeException}. */
final class ChildCursor {
    private final SyntaxNode owner;
    private final List<? extends SyntaxNode> children;
    private int index;

    ChildCursor(SyntaxNode owner) {
        this.owner = owner;
        this.children = owner.children();
    }

    boolean hasNext() {
        return index < children.size();
    }

    /** Returns the next child, which should play {@code role}. */
    SyntaxNode next(String role) throws UnexpectedNodeException {
        if (!hasNext()) {
            throw new UnexpectedNodeException(owner, role + " (children ended early)");
        }
        return children.get(index++);
    }

    void expectToken(String token) throws UnexpectedNodeException {
        var child = next("'" + token + "'");
        if (!child.isToken(token)) {
            throw new UnexpectedNodeException(child, "'" + token + "' in " + describeOwner());
        }
    }

    /** Consumes the next child only if it is {@code token}. */
    boolean skipToken(String token) {
        if (hasNext() && children.get(index).isToken(token)) {
            index++;
            return true;
        }
        return false;
    }

    void expectEnd() throws UnexpectedNodeException {
        if (hasNext()) {
            throw new UnexpectedNodeException(children.get(index), "end of " + describeOwner());
        }
    }

    private String describeOwner() {
        return owner.kind().name().toLowerCase(Locale.ROOT).replace('_', ' ');
    }
}
