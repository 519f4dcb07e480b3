package io.templateemit.core.syntax;

import java.util.List;
import java.util.Objects;

public final class ArrayAccessSyntax extends SyntaxBase {

    private final SyntaxBase baseExpression;
    private final SyntaxBase indexExpression;

    public ArrayAccessSyntax(TextSpan span, SyntaxBase baseExpression, SyntaxBase indexExpression) {
        super(span);
        this.baseExpression = Objects.requireNonNull(baseExpression, "baseExpression must not be null");
        this.indexExpression = Objects.requireNonNull(indexExpression, "indexExpression must not be null");
    }

    public SyntaxBase baseExpression() {
        return baseExpression;
    }

    public SyntaxBase indexExpression() {
        return indexExpression;
    }

    @Override
    public List<SyntaxBase> children() {
        return List.of(baseExpression, indexExpression);
    }
}
