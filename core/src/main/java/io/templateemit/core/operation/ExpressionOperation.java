package io.templateemit.core.operation;

import io.templateemit.core.syntax.SyntaxBase;
import java.util.Objects;

/**
 * A source expression with no native document form (operators, interpolation, calls, accessors).
 * Conversion is deferred to emission time so the active conversion context decides how loop
 * locals are indexed.
 */
public record ExpressionOperation(SyntaxBase syntax) implements Operation {

    public ExpressionOperation {
        Objects.requireNonNull(syntax, "syntax must not be null");
    }
}
