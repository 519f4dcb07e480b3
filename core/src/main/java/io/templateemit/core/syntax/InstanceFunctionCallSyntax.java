package io.templateemit.core.syntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/** A call on a base expression, e.g. {@code vault.getSecret('name')} or {@code az.resourceGroup()}. */
public final class InstanceFunctionCallSyntax extends SyntaxBase {

    private final SyntaxBase baseExpression;
    private final String name;
    private final List<SyntaxBase> arguments;

    public InstanceFunctionCallSyntax(TextSpan span, SyntaxBase baseExpression, String name, List<SyntaxBase> arguments) {
        super(span);
        this.baseExpression = Objects.requireNonNull(baseExpression, "baseExpression must not be null");
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.arguments = List.copyOf(Objects.requireNonNull(arguments, "arguments must not be null"));
    }

    public SyntaxBase baseExpression() {
        return baseExpression;
    }

    public String name() {
        return name;
    }

    public List<SyntaxBase> arguments() {
        return arguments;
    }

    @Override
    public List<SyntaxBase> children() {
        List<SyntaxBase> children = new ArrayList<>(arguments.size() + 1);
        children.add(baseExpression);
        children.addAll(arguments);
        return Collections.unmodifiableList(children);
    }
}
