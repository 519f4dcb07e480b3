package io.templateemit.core.semantics;

import io.templateemit.core.syntax.ResourceDeclarationSyntax;
import java.util.Objects;

public final class ResourceSymbol extends Symbol {

    private final ResourceDeclarationSyntax declaringSyntax;

    public ResourceSymbol(ResourceDeclarationSyntax declaringSyntax) {
        super(declaringSyntax.name());
        this.declaringSyntax = Objects.requireNonNull(declaringSyntax);
    }

    @Override
    public ResourceDeclarationSyntax declaringSyntax() {
        return declaringSyntax;
    }

    public boolean isCollection() {
        return declaringSyntax.isCollection();
    }
}
