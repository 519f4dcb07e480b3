package io.templateemit.core.syntax;

import java.util.List;
import java.util.Objects;

public final class BinaryOperationSyntax extends SyntaxBase {

    private final SyntaxBase left;
    private final BinaryOperator operator;
    private final SyntaxBase right;

    public BinaryOperationSyntax(TextSpan span, SyntaxBase left, BinaryOperator operator, SyntaxBase right) {
        super(span);
        this.left = Objects.requireNonNull(left, "left must not be null");
        this.operator = Objects.requireNonNull(operator, "operator must not be null");
        this.right = Objects.requireNonNull(right, "right must not be null");
    }

    public SyntaxBase left() {
        return left;
    }

    public BinaryOperator operator() {
        return operator;
    }

    public SyntaxBase right() {
        return right;
    }

    @Override
    public List<SyntaxBase> children() {
        return List.of(left, right);
    }
}
