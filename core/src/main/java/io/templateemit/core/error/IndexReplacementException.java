package io.templateemit.core.error;

import io.templateemit.core.syntax.TextSpan;

/**
 * Thrown when a reference to a resource or module declared inside a loop is emitted from a
 * context where no single loop index can stand in for the declaring loop's locals.
 */
public final class IndexReplacementException extends TemplateEmitException {

    private static final long serialVersionUID = 1L;

    private final int inaccessibleLoopCount;

    public IndexReplacementException(String message, int inaccessibleLoopCount, TextSpan span) {
        super(message, span, Category.INDEX_CONTEXT);
        this.inaccessibleLoopCount = inaccessibleLoopCount;
    }

    /** Number of distinct enclosing loops whose locals were out of scope at the reference. */
    public int inaccessibleLoopCount() {
        return inaccessibleLoopCount;
    }
}
