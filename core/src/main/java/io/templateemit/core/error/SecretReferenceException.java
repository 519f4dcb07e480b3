package io.templateemit.core.error;

import io.templateemit.core.syntax.TextSpan;

/** Thrown when a module parameter's secret accessor does not target a key vault resource. */
public final class SecretReferenceException extends TemplateEmitException {

    private static final long serialVersionUID = 1L;

    public SecretReferenceException(String message, TextSpan span) {
        super(message, span, Category.INTERNAL_CONSISTENCY);
    }
}
