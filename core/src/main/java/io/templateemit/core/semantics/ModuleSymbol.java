package io.templateemit.core.semantics;

import io.templateemit.core.syntax.ModuleDeclarationSyntax;
import java.util.Objects;

public final class ModuleSymbol extends Symbol {

    private final ModuleDeclarationSyntax declaringSyntax;

    public ModuleSymbol(ModuleDeclarationSyntax declaringSyntax) {
        super(declaringSyntax.name());
        this.declaringSyntax = Objects.requireNonNull(declaringSyntax);
    }

    @Override
    public ModuleDeclarationSyntax declaringSyntax() {
        return declaringSyntax;
    }

    public boolean isCollection() {
        return declaringSyntax.isCollection();
    }
}
