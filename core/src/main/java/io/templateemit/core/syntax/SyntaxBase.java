package io.templateemit.core.syntax;

import java.util.List;
import java.util.Objects;

/**
 * Base type of every node in a validated source syntax tree.
 *
 * <p>Nodes are immutable and compared by identity: two structurally equal nodes at different
 * positions are different nodes, which is what symbol lookups and loop scoping rely on.
 */
public abstract class SyntaxBase {

    private final TextSpan span;

    protected SyntaxBase(TextSpan span) {
        this.span = Objects.requireNonNull(span, "span must not be null");
    }

    /** Source location of this node. */
    public final TextSpan span() {
        return span;
    }

    /** Node kind name used in diagnostics. */
    public String kind() {
        return getClass().getSimpleName();
    }

    /** Direct children in source order. */
    public abstract List<SyntaxBase> children();

    @Override
    public String toString() {
        return kind() + span;
    }
}
