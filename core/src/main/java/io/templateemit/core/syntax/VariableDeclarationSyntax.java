package io.templateemit.core.syntax;

import java.util.List;
import java.util.Objects;

public final class VariableDeclarationSyntax extends DeclarationSyntax {

    private final SyntaxBase value;

    public VariableDeclarationSyntax(TextSpan span, String name, SyntaxBase value) {
        super(span, name);
        this.value = Objects.requireNonNull(value, "value must not be null");
    }

    public SyntaxBase value() {
        return value;
    }

    @Override
    public List<SyntaxBase> children() {
        return List.of(value);
    }
}
