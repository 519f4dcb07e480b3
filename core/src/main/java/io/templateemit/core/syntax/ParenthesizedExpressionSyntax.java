package io.templateemit.core.syntax;

import java.util.List;
import java.util.Objects;

public final class ParenthesizedExpressionSyntax extends SyntaxBase {

    private final SyntaxBase expression;

    public ParenthesizedExpressionSyntax(TextSpan span, SyntaxBase expression) {
        super(span);
        this.expression = Objects.requireNonNull(expression, "expression must not be null");
    }

    public SyntaxBase expression() {
        return expression;
    }

    @Override
    public List<SyntaxBase> children() {
        return List.of(expression);
    }
}
