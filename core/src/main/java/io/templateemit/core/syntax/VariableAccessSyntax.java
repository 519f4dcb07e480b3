package io.templateemit.core.syntax;

import java.util.List;
import java.util.Objects;

/** A reference to any named symbol: parameter, variable, resource, module or loop local. */
public final class VariableAccessSyntax extends SyntaxBase {

    private final String name;

    public VariableAccessSyntax(TextSpan span, String name) {
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
