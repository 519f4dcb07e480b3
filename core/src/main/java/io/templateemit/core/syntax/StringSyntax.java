package io.templateemit.core.syntax;

import java.util.List;
import java.util.Objects;

/**
 * A string literal, optionally interpolated. The literal text is split into segments around the
 * interpolated expressions, so {@code 'a${x}b'} has segments {@code ["a", "b"]} and one
 * expression. A plain literal has one segment and no expressions.
 */
public final class StringSyntax extends SyntaxBase {

    private final List<String> segmentValues;
    private final List<SyntaxBase> expressions;

    public StringSyntax(TextSpan span, List<String> segmentValues, List<SyntaxBase> expressions) {
        super(span);
        this.segmentValues = List.copyOf(Objects.requireNonNull(segmentValues, "segmentValues must not be null"));
        this.expressions = List.copyOf(Objects.requireNonNull(expressions, "expressions must not be null"));
        if (this.segmentValues.size() != this.expressions.size() + 1) {
            throw new IllegalArgumentException("expected " + (this.expressions.size() + 1) + " segments but got "
                    + this.segmentValues.size());
        }
    }

    public List<String> segmentValues() {
        return segmentValues;
    }

    public List<SyntaxBase> expressions() {
        return expressions;
    }

    /** True when the string contains at least one {@code ${...}} expression. */
    public boolean isInterpolated() {
        return !expressions.isEmpty();
    }

    /** Returns the literal value, or {@code null} for an interpolated string. */
    public String tryGetLiteralValue() {
        return isInterpolated() ? null : segmentValues.get(0);
    }

    @Override
    public List<SyntaxBase> children() {
        return expressions;
    }
}
