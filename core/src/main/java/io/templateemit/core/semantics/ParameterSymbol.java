package io.templateemit.core.semantics;

import io.templateemit.core.syntax.ParameterDeclarationSyntax;
import java.util.Objects;

public final class ParameterSymbol extends Symbol {

    private final ParameterDeclarationSyntax declaringSyntax;

    public ParameterSymbol(ParameterDeclarationSyntax declaringSyntax) {
        super(declaringSyntax.name());
        this.declaringSyntax = Objects.requireNonNull(declaringSyntax);
    }

    @Override
    public ParameterDeclarationSyntax declaringSyntax() {
        return declaringSyntax;
    }
}
