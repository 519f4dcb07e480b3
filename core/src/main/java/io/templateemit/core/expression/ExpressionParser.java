package io.templateemit.core.expression;

import io.templateemit.core.error.ExpressionParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Parses serialized template values back into {@link TargetExpression} trees. The inverse of
 * {@link ExpressionSerializer}: a value starting with {@code [[} is a literal with one bracket
 * removed, a value enclosed in {@code [...]} is an expression, anything else is a literal.
 *
 * <p>Not thread-safe per instance; use the static {@link #parse(String)} entry point.
 */
public final class ExpressionParser {

    private final String text;
    private int position;

    private ExpressionParser(String text, int start) {
        this.text = text;
        this.position = start;
    }

    /**
     * Parses a template value.
     *
     * @param value a property value or property name as written to the document
     * @return a string token for literals, otherwise the parsed expression
     * @throws ExpressionParseException if the bracketed expression is malformed
     */
    public static TargetExpression parse(String value) {
        Objects.requireNonNull(value, "value must not be null");
        if (value.startsWith("[[")) {
            return TokenExpression.of(value.substring(1));
        }
        if (!isExpression(value)) {
            return TokenExpression.of(value);
        }
        ExpressionParser parser = new ExpressionParser(value.substring(0, value.length() - 1), 1);
        TargetExpression expression = parser.parseExpression();
        parser.skipWhitespace();
        if (parser.position != parser.text.length()) {
            throw new ExpressionParseException("Unexpected trailing input in expression: " + value, parser.position);
        }
        return expression;
    }

    /** True when the value is an expression rather than a literal. */
    public static boolean isExpression(String value) {
        return value.length() >= 2 && value.startsWith("[") && !value.startsWith("[[") && value.endsWith("]");
    }

    private TargetExpression parseExpression() {
        skipWhitespace();
        if (position >= text.length()) {
            throw new ExpressionParseException("Unexpected end of expression", position);
        }
        char c = text.charAt(position);
        if (c == '\'') {
            return TokenExpression.of(parseString());
        }
        if (c == '-' || Character.isDigit(c)) {
            return TokenExpression.of(parseInteger());
        }
        if (Character.isLetter(c) || c == '_') {
            return parseFunction();
        }
        throw new ExpressionParseException("Unexpected character '" + c + "'", position);
    }

    private FunctionExpression parseFunction() {
        String name = parseIdentifier();
        skipWhitespace();
        expect('(');
        List<TargetExpression> parameters = new ArrayList<>();
        skipWhitespace();
        if (peek() != ')') {
            parameters.add(parseExpression());
            skipWhitespace();
            while (peek() == ',') {
                position++;
                parameters.add(parseExpression());
                skipWhitespace();
            }
        }
        expect(')');

        List<TargetExpression> properties = new ArrayList<>();
        while (true) {
            char next = peek();
            if (next == '.') {
                position++;
                properties.add(TokenExpression.of(parseIdentifier()));
            } else if (next == '[') {
                position++;
                properties.add(parseExpression());
                skipWhitespace();
                expect(']');
            } else {
                break;
            }
        }
        return new FunctionExpression(name, parameters, properties);
    }

    private String parseIdentifier() {
        int start = position;
        while (position < text.length()
                && (Character.isLetterOrDigit(text.charAt(position)) || text.charAt(position) == '_')) {
            position++;
        }
        if (start == position) {
            throw new ExpressionParseException("Expected identifier", position);
        }
        return text.substring(start, position);
    }

    private String parseString() {
        expect('\'');
        StringBuilder builder = new StringBuilder();
        while (true) {
            if (position >= text.length()) {
                throw new ExpressionParseException("Unterminated string literal", position);
            }
            char c = text.charAt(position++);
            if (c == '\'') {
                if (position < text.length() && text.charAt(position) == '\'') {
                    builder.append('\'');
                    position++;
                } else {
                    return builder.toString();
                }
            } else {
                builder.append(c);
            }
        }
    }

    private long parseInteger() {
        int start = position;
        if (text.charAt(position) == '-') {
            position++;
        }
        while (position < text.length() && Character.isDigit(text.charAt(position))) {
            position++;
        }
        try {
            return Long.parseLong(text.substring(start, position));
        } catch (NumberFormatException e) {
            throw new ExpressionParseException("Invalid integer literal: " + text.substring(start, position), start);
        }
    }

    private void expect(char expected) {
        if (peek() != expected) {
            throw new ExpressionParseException("Expected '" + expected + "'", position);
        }
        position++;
    }

    private char peek() {
        return position < text.length() ? text.charAt(position) : '\0';
    }

    private void skipWhitespace() {
        while (position < text.length() && Character.isWhitespace(text.charAt(position))) {
            position++;
        }
    }
}
