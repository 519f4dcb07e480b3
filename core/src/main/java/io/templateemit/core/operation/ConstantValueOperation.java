package io.templateemit.core.operation;

import java.util.Objects;

/**
 * A boolean or integer literal, or a plain string property key.
 *
 * @param value a {@link Boolean}, {@link Long} or {@link String}
 */
public record ConstantValueOperation(Object value) implements Operation {

    public ConstantValueOperation {
        Objects.requireNonNull(value, "value must not be null");
        if (!(value instanceof Boolean) && !(value instanceof Long) && !(value instanceof String)) {
            throw new IllegalArgumentException(
                    "constant must be Boolean, Long or String, got " + value.getClass().getSimpleName());
        }
    }

    public static ConstantValueOperation of(boolean value) {
        return new ConstantValueOperation(value);
    }

    public static ConstantValueOperation of(long value) {
        return new ConstantValueOperation(value);
    }

    public static ConstantValueOperation of(String value) {
        return new ConstantValueOperation(value);
    }
}
