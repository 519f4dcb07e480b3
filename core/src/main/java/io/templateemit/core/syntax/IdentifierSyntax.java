package io.templateemit.core.syntax;

import java.util.List;
import java.util.Objects;

/** A bare identifier, used as an object property key. */
public final class IdentifierSyntax extends SyntaxBase {

    private final String name;

    public IdentifierSyntax(TextSpan span, String name) {
        super(span);
        this.name = Objects.requireNonNull(name, "name must not be null");
    }

    public String name() {
        return name;
    }

    @Override
    public List<SyntaxBase> children() {
        return List.of();
    }
}
