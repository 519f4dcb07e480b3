package io.templateemit.core.syntax;

import java.util.List;
import java.util.Objects;

/** Access to a nested child resource by symbolic name, {@code parent::child}. */
public final class ResourceAccessSyntax extends SyntaxBase {

    private final SyntaxBase baseExpression;
    private final String resourceName;

    public ResourceAccessSyntax(TextSpan span, SyntaxBase baseExpression, String resourceName) {
        super(span);
        this.baseExpression = Objects.requireNonNull(baseExpression, "baseExpression must not be null");
        this.resourceName = Objects.requireNonNull(resourceName, "resourceName must not be null");
    }

    public SyntaxBase baseExpression() {
        return baseExpression;
    }

    public String resourceName() {
        return resourceName;
    }

    @Override
    public List<SyntaxBase> children() {
        return List.of(baseExpression);
    }
}
