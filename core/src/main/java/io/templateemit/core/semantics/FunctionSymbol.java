package io.templateemit.core.semantics;

import io.templateemit.core.syntax.SyntaxBase;

/** A built-in function. */
public final class FunctionSymbol extends Symbol {

    public FunctionSymbol(String name) {
        super(name);
    }

    @Override
    public SyntaxBase declaringSyntax() {
        return null;
    }
}
