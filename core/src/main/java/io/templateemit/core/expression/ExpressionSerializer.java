package io.templateemit.core.expression;

import java.util.regex.Pattern;

/**
 * Serializes {@link TargetExpression} trees to their bracketed text form.
 *
 * <p>Rules:
 *
 * <ul>
 *   <li>An expression is wrapped in outer square brackets: {@code [concat('a', parameters('b'))]}.
 *   <li>A top-level string token is written as the plain string, not as a quoted literal. If that
 *       string starts with {@code [} the bracket is doubled so the engine does not read it as an
 *       expression.
 *   <li>Nested string tokens are single-quoted with embedded quotes doubled.
 *   <li>Accessors whose token is a simple identifier use dot notation, all others use brackets.
 * </ul>
 *
 * <p>Stateless and thread-safe.
 */
public final class ExpressionSerializer {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private ExpressionSerializer() {}

    /** Serializes a complete property value or property name. */
    public static String serialize(TargetExpression expression) {
        if (expression instanceof TokenExpression token && token.isString()) {
            return escapeLiteral(token.stringValue());
        }
        StringBuilder builder = new StringBuilder("[");
        writeExpression(expression, builder);
        return builder.append(']').toString();
    }

    /** Serializes without outer brackets, as the expression would appear nested in another. */
    public static String serializeInner(TargetExpression expression) {
        StringBuilder builder = new StringBuilder();
        writeExpression(expression, builder);
        return builder.toString();
    }

    /** Doubles a leading {@code [} so the value is read back as a literal. */
    public static String escapeLiteral(String value) {
        return value.startsWith("[") ? "[" + value : value;
    }

    private static void writeExpression(TargetExpression expression, StringBuilder builder) {
        if (expression instanceof TokenExpression token) {
            writeToken(token, builder);
        } else if (expression instanceof FunctionExpression function) {
            writeFunction(function, builder);
        }
    }

    private static void writeToken(TokenExpression token, StringBuilder builder) {
        if (token.isInteger()) {
            builder.append(token.longValue());
            return;
        }
        builder.append('\'').append(token.stringValue().replace("'", "''")).append('\'');
    }

    private static void writeFunction(FunctionExpression function, StringBuilder builder) {
        builder.append(function.name()).append('(');
        for (int i = 0; i < function.parameters().size(); i++) {
            if (i > 0) {
                builder.append(", ");
            }
            writeExpression(function.parameters().get(i), builder);
        }
        builder.append(')');

        for (TargetExpression property : function.properties()) {
            if (property instanceof TokenExpression token
                    && token.isString()
                    && IDENTIFIER.matcher(token.stringValue()).matches()) {
                builder.append('.').append(token.stringValue());
            } else {
                builder.append('[');
                writeExpression(property, builder);
                builder.append(']');
            }
        }
    }
}
