package io.templateemit.core.semantics;

import io.templateemit.core.syntax.SyntaxBase;
import java.util.Objects;

/**
 * Scope of a resource plus any explicit scope expressions supplied in source. Each expression is
 * {@code null} when the scope is the deployment's own.
 */
public record ResourceScopeData(
        ResourceScope scope,
        SyntaxBase subscriptionIdExpression,
        SyntaxBase resourceGroupExpression,
        SyntaxBase managementGroupExpression) {

    public ResourceScopeData {
        Objects.requireNonNull(scope, "scope must not be null");
    }

    /** Scope data with no explicit expressions. */
    public static ResourceScopeData of(ResourceScope scope) {
        return new ResourceScopeData(scope, null, null, null);
    }
}
