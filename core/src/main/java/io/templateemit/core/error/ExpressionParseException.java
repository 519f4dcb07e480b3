package io.templateemit.core.error;

import io.templateemit.core.syntax.TextSpan;

/** Thrown when bracketed expression text cannot be parsed back into an expression tree. */
public final class ExpressionParseException extends TemplateEmitException {

    private static final long serialVersionUID = 1L;

    private final int position;

    public ExpressionParseException(String message, int position) {
        super(message, TextSpan.NIL, Category.INTERNAL_CONSISTENCY);
        this.position = position;
    }

    /** Zero-based character offset at which parsing failed. */
    public int position() {
        return position;
    }
}
