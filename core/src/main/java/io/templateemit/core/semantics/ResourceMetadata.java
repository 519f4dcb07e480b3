package io.templateemit.core.semantics;

import io.templateemit.core.syntax.SyntaxBase;
import java.util.Objects;

/**
 * Read-only metadata for a declared resource.
 *
 * @param symbol the declaring symbol
 * @param typeReference resource type and version
 * @param nameSyntax the expression bound to the resource's {@code name} property
 * @param parent the parent resource for nested children, or {@code null}
 * @param scopeData the scope the resource is deployed at
 */
public record ResourceMetadata(
        ResourceSymbol symbol,
        ResourceTypeReference typeReference,
        SyntaxBase nameSyntax,
        ResourceMetadata parent,
        ResourceScopeData scopeData) {

    public ResourceMetadata {
        Objects.requireNonNull(symbol, "symbol must not be null");
        Objects.requireNonNull(typeReference, "typeReference must not be null");
        Objects.requireNonNull(nameSyntax, "nameSyntax must not be null");
        Objects.requireNonNull(scopeData, "scopeData must not be null");
    }

    public boolean isCollection() {
        return symbol.isCollection();
    }
}
