package io.templateemit.core.syntax;

import java.util.List;
import java.util.Objects;

/** Declaration of a loop item or index variable. */
public final class LocalVariableSyntax extends SyntaxBase {

    private final String name;

    public LocalVariableSyntax(TextSpan span, String name) {
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
