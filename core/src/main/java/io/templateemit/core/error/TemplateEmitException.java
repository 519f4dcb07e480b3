package io.templateemit.core.error;

import io.templateemit.core.syntax.TextSpan;

/**
 * Abstract base for all template emission failures. Never thrown directly; use the concrete
 * subclasses. Every emission failure is fatal: the caller turns it into a diagnostic and discards
 * whatever was written so far.
 */
public abstract class TemplateEmitException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Broad classification of the failure. */
    public enum Category {
        /** An upstream validation gap: the emitter was handed something it should never see. */
        INTERNAL_CONSISTENCY,
        /** A cross-scope symbolic reference whose loop index could not be determined. */
        INDEX_CONTEXT
    }

    private final transient TextSpan span;
    private final Category category;

    protected TemplateEmitException(String message, TextSpan span, Category category) {
        super(message);
        this.span = span != null ? span : TextSpan.NIL;
        this.category = category;
    }

    protected TemplateEmitException(String message, Throwable cause, TextSpan span, Category category) {
        super(message, cause);
        this.span = span != null ? span : TextSpan.NIL;
        this.category = category;
    }

    /** Source location of the offending node, {@link TextSpan#NIL} when unknown. */
    public TextSpan span() {
        return span;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The failure category. */
    public Category category() {
        return category;
    }
}
