package io.templateemit.core.syntax;

import java.util.Objects;

/** Top-level named declaration of a program. */
public abstract class DeclarationSyntax extends SyntaxBase {

    private final String name;

    protected DeclarationSyntax(TextSpan span, String name) {
        super(span);
        this.name = Objects.requireNonNull(name, "name must not be null");
    }

    /** The declared symbolic name. */
    public String name() {
        return name;
    }

    /**
     * Returns the object body of a resource or module declaration, unwrapping a loop when the
     * declaration is a collection. Returns {@code null} when the body is not an object.
     */
    protected static ObjectSyntax unwrapBody(SyntaxBase value) {
        if (value instanceof ObjectSyntax object) {
            return object;
        }
        if (value instanceof ForSyntax loop && loop.body() instanceof ObjectSyntax object) {
            return object;
        }
        return null;
    }
}
