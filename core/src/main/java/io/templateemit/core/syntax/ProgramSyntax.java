package io.templateemit.core.syntax;

import java.util.List;
import java.util.Objects;

/** Root of a source file: its declarations in source order. */
public final class ProgramSyntax extends SyntaxBase {

    private final List<DeclarationSyntax> declarations;

    public ProgramSyntax(TextSpan span, List<DeclarationSyntax> declarations) {
        super(span);
        this.declarations = List.copyOf(Objects.requireNonNull(declarations, "declarations must not be null"));
    }

    public List<DeclarationSyntax> declarations() {
        return declarations;
    }

    @Override
    public List<SyntaxBase> children() {
        return List.copyOf(declarations);
    }
}
