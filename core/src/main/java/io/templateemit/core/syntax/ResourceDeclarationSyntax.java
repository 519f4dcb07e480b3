package io.templateemit.core.syntax;

import java.util.List;
import java.util.Objects;

/**
 * A {@code resource name 'type@version' = value} declaration. The value is an object body, or a
 * loop over an object body for resource collections.
 */
public final class ResourceDeclarationSyntax extends DeclarationSyntax {

    private final String type;
    private final SyntaxBase value;

    public ResourceDeclarationSyntax(TextSpan span, String name, String type, SyntaxBase value) {
        super(span, name);
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.value = Objects.requireNonNull(value, "value must not be null");
    }

    /** The declared type string, e.g. {@code Microsoft.KeyVault/vaults@2019-09-01}. */
    public String type() {
        return type;
    }

    public SyntaxBase value() {
        return value;
    }

    /** True when the declaration is a loop. */
    public boolean isCollection() {
        return value instanceof ForSyntax;
    }

    /** The object body, or {@code null}. */
    public ObjectSyntax tryGetBody() {
        return unwrapBody(value);
    }

    @Override
    public List<SyntaxBase> children() {
        return List.of(value);
    }
}
