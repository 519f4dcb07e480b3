package io.templateemit.core.syntax;

import java.util.List;
import java.util.Objects;

public final class OutputDeclarationSyntax extends DeclarationSyntax {

    private final String type;
    private final SyntaxBase value;

    public OutputDeclarationSyntax(TextSpan span, String name, String type, SyntaxBase value) {
        super(span, name);
        this.type = type;
        this.value = Objects.requireNonNull(value, "value must not be null");
    }

    public String type() {
        return type;
    }

    public SyntaxBase value() {
        return value;
    }

    @Override
    public List<SyntaxBase> children() {
        return List.of(value);
    }
}
