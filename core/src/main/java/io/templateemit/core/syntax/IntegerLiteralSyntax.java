package io.templateemit.core.syntax;

import java.util.List;

public final class IntegerLiteralSyntax extends SyntaxBase {

    private final long value;

    public IntegerLiteralSyntax(TextSpan span, long value) {
        super(span);
        this.value = value;
    }

    public long value() {
        return value;
    }

    @Override
    public List<SyntaxBase> children() {
        return List.of();
    }
}
