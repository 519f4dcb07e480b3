package io.templateemit.core.syntax;

import java.util.List;

public final class NullLiteralSyntax extends SyntaxBase {

    public NullLiteralSyntax(TextSpan span) {
        super(span);
    }

    @Override
    public List<SyntaxBase> children() {
        return List.of();
    }
}
