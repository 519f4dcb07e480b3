package io.templateemit.core.error;

import io.templateemit.core.syntax.TextSpan;

/**
 * Thrown when a syntax node or operation reaches a code path that cannot represent it. Indicates a
 * compiler defect (the semantic stage should have rejected the input), not a user error.
 */
public final class UnsupportedConstructException extends TemplateEmitException {

    private static final long serialVersionUID = 1L;

    private final String kind;

    public UnsupportedConstructException(String message, String kind, TextSpan span) {
        super(message, span, Category.INTERNAL_CONSISTENCY);
        this.kind = kind;
    }

    /** Kind name of the node that could not be emitted. */
    public String kind() {
        return kind;
    }
}
