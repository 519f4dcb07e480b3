package io.templateemit.core.semantics;

import io.templateemit.core.syntax.LocalVariableSyntax;
import java.util.Objects;

/** A loop item or index variable. */
public final class LocalVariableSymbol extends Symbol {

    private final LocalVariableSyntax declaringSyntax;
    private final LocalVariableKind localKind;

    public LocalVariableSymbol(LocalVariableSyntax declaringSyntax, LocalVariableKind localKind) {
        super(declaringSyntax.name());
        this.declaringSyntax = Objects.requireNonNull(declaringSyntax);
        this.localKind = Objects.requireNonNull(localKind);
    }

    @Override
    public LocalVariableSyntax declaringSyntax() {
        return declaringSyntax;
    }

    public LocalVariableKind localKind() {
        return localKind;
    }
}
