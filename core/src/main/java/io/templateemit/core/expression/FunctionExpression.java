package io.templateemit.core.expression;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A function call such as {@code parameters('name')}, followed by zero or more accessors. A string
 * token accessor serializes as {@code .name} (or {@code ['some name']}), any other accessor as
 * {@code [expression]}.
 */
public record FunctionExpression(String name, List<TargetExpression> parameters, List<TargetExpression> properties)
        implements TargetExpression {

    public FunctionExpression {
        Objects.requireNonNull(name, "name must not be null");
        parameters = List.copyOf(Objects.requireNonNull(parameters, "parameters must not be null"));
        properties = List.copyOf(Objects.requireNonNull(properties, "properties must not be null"));
    }

    /** A call with no accessors. */
    public static FunctionExpression of(String name, TargetExpression... parameters) {
        return new FunctionExpression(name, Arrays.asList(parameters), List.of());
    }

    /** A call with no accessors. */
    public static FunctionExpression of(String name, List<TargetExpression> parameters) {
        return new FunctionExpression(name, parameters, List.of());
    }

    /** Returns a copy with {@code additional} appended after the existing accessors. */
    public FunctionExpression appendProperties(TargetExpression... additional) {
        List<TargetExpression> combined = new ArrayList<>(properties.size() + additional.length);
        combined.addAll(properties);
        combined.addAll(Arrays.asList(additional));
        return new FunctionExpression(name, parameters, combined);
    }
}
