package io.templateemit.core.syntax;

import java.util.List;
import java.util.Objects;

public final class UnaryOperationSyntax extends SyntaxBase {

    private final UnaryOperator operator;
    private final SyntaxBase expression;

    public UnaryOperationSyntax(TextSpan span, UnaryOperator operator, SyntaxBase expression) {
        super(span);
        this.operator = Objects.requireNonNull(operator, "operator must not be null");
        this.expression = Objects.requireNonNull(expression, "expression must not be null");
    }

    public UnaryOperator operator() {
        return operator;
    }

    public SyntaxBase expression() {
        return expression;
    }

    @Override
    public List<SyntaxBase> children() {
        return List.of(expression);
    }
}
