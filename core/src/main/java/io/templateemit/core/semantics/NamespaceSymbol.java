package io.templateemit.core.semantics;

import io.templateemit.core.syntax.SyntaxBase;

/** A built-in function namespace such as {@code sys} or {@code az}. */
public final class NamespaceSymbol extends Symbol {

    public NamespaceSymbol(String name) {
        super(name);
    }

    @Override
    public SyntaxBase declaringSyntax() {
        return null;
    }
}
