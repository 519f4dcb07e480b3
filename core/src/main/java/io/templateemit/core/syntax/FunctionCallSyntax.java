package io.templateemit.core.syntax;

import java.util.List;
import java.util.Objects;

public final class FunctionCallSyntax extends SyntaxBase {

    private final String name;
    private final List<SyntaxBase> arguments;

    public FunctionCallSyntax(TextSpan span, String name, List<SyntaxBase> arguments) {
        super(span);
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.arguments = List.copyOf(Objects.requireNonNull(arguments, "arguments must not be null"));
    }

    public String name() {
        return name;
    }

    public List<SyntaxBase> arguments() {
        return arguments;
    }

    @Override
    public List<SyntaxBase> children() {
        return arguments;
    }
}
