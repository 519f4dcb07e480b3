package io.templateemit.core.syntax;

import java.util.List;
import java.util.Objects;

public final class TernaryOperationSyntax extends SyntaxBase {

    private final SyntaxBase condition;
    private final SyntaxBase trueExpression;
    private final SyntaxBase falseExpression;

    public TernaryOperationSyntax(
            TextSpan span, SyntaxBase condition, SyntaxBase trueExpression, SyntaxBase falseExpression) {
        super(span);
        this.condition = Objects.requireNonNull(condition, "condition must not be null");
        this.trueExpression = Objects.requireNonNull(trueExpression, "trueExpression must not be null");
        this.falseExpression = Objects.requireNonNull(falseExpression, "falseExpression must not be null");
    }

    public SyntaxBase condition() {
        return condition;
    }

    public SyntaxBase trueExpression() {
        return trueExpression;
    }

    public SyntaxBase falseExpression() {
        return falseExpression;
    }

    @Override
    public List<SyntaxBase> children() {
        return List.of(condition, trueExpression, falseExpression);
    }
}
