package io.templateemit.core.semantics;

import io.templateemit.core.syntax.SyntaxBase;
import io.templateemit.core.syntax.VariableDeclarationSyntax;
import java.util.Objects;

public final class VariableSymbol extends Symbol {

    private final VariableDeclarationSyntax declaringSyntax;

    public VariableSymbol(VariableDeclarationSyntax declaringSyntax) {
        super(declaringSyntax.name());
        this.declaringSyntax = Objects.requireNonNull(declaringSyntax);
    }

    @Override
    public VariableDeclarationSyntax declaringSyntax() {
        return declaringSyntax;
    }

    /** The bound value expression. */
    public SyntaxBase value() {
        return declaringSyntax.value();
    }
}
