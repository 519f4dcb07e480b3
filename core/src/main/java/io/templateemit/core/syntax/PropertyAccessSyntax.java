package io.templateemit.core.syntax;

import java.util.List;
import java.util.Objects;

public final class PropertyAccessSyntax extends SyntaxBase {

    private final SyntaxBase baseExpression;
    private final String propertyName;

    public PropertyAccessSyntax(TextSpan span, SyntaxBase baseExpression, String propertyName) {
        super(span);
        this.baseExpression = Objects.requireNonNull(baseExpression, "baseExpression must not be null");
        this.propertyName = Objects.requireNonNull(propertyName, "propertyName must not be null");
    }

    public SyntaxBase baseExpression() {
        return baseExpression;
    }

    public String propertyName() {
        return propertyName;
    }

    @Override
    public List<SyntaxBase> children() {
        return List.of(baseExpression);
    }
}
