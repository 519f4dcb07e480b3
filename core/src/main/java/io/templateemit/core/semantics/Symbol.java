package io.templateemit.core.semantics;

import io.templateemit.core.syntax.SyntaxBase;
import java.util.Objects;

/**
 * A named entity resolved by the semantic model. Symbols are compared by identity.
 */
public abstract class Symbol {

    private final String name;

    protected Symbol(String name) {
        this.name = Objects.requireNonNull(name, "name must not be null");
    }

    public final String name() {
        return name;
    }

    /** The declaring node, or {@code null} for built-in symbols. */
    public abstract SyntaxBase declaringSyntax();

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + name + ")";
    }
}
