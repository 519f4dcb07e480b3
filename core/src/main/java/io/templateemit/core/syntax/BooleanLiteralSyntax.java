package io.templateemit.core.syntax;

import java.util.List;

public final class BooleanLiteralSyntax extends SyntaxBase {

    private final boolean value;

    public BooleanLiteralSyntax(TextSpan span, boolean value) {
        super(span);
        this.value = value;
    }

    public boolean value() {
        return value;
    }

    @Override
    public List<SyntaxBase> children() {
        return List.of();
    }
}
