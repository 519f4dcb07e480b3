package io.templateemit.core.semantics;

import io.templateemit.core.syntax.OutputDeclarationSyntax;
import java.util.Objects;

public final class OutputSymbol extends Symbol {

    private final OutputDeclarationSyntax declaringSyntax;

    public OutputSymbol(OutputDeclarationSyntax declaringSyntax) {
        super(declaringSyntax.name());
        this.declaringSyntax = Objects.requireNonNull(declaringSyntax);
    }

    @Override
    public OutputDeclarationSyntax declaringSyntax() {
        return declaringSyntax;
    }
}
