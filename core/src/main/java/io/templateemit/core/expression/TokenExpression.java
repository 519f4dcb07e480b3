package io.templateemit.core.expression;

import java.util.Objects;

/**
 * A literal string or integer. Booleans and null have no literal form in the target language and
 * are expressed as {@code true()}, {@code false()} and {@code null()} calls instead.
 */
public record TokenExpression(Object value) implements TargetExpression {

    public TokenExpression {
        Objects.requireNonNull(value, "value must not be null");
        if (!(value instanceof String) && !(value instanceof Long)) {
            throw new IllegalArgumentException(
                    "token value must be a String or Long, got " + value.getClass().getSimpleName());
        }
    }

    public static TokenExpression of(String value) {
        return new TokenExpression(value);
    }

    public static TokenExpression of(long value) {
        return new TokenExpression(value);
    }

    public boolean isString() {
        return value instanceof String;
    }

    public boolean isInteger() {
        return value instanceof Long;
    }

    /** The string value; only valid when {@link #isString()}. */
    public String stringValue() {
        return (String) value;
    }

    /** The integer value; only valid when {@link #isInteger()}. */
    public long longValue() {
        return (Long) value;
    }
}
