package io.templateemit.core.syntax;

import java.util.List;

public final class ParameterDeclarationSyntax extends DeclarationSyntax {

    private final String type;
    private final SyntaxBase defaultValue;

    public ParameterDeclarationSyntax(TextSpan span, String name, String type, SyntaxBase defaultValue) {
        super(span, name);
        this.type = type;
        this.defaultValue = defaultValue;
    }

    public String type() {
        return type;
    }

    /** The default value, or {@code null}. */
    public SyntaxBase defaultValue() {
        return defaultValue;
    }

    @Override
    public List<SyntaxBase> children() {
        return defaultValue != null ? List.of(defaultValue) : List.of();
    }
}
