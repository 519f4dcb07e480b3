package io.templateemit.core.operation;

import io.templateemit.core.syntax.ForSyntax;
import java.util.Objects;

/**
 * One unexpanded loop. Only valid as an object property value or as the operation handed straight
 * to copy-object emission.
 *
 * @param expression the sequence being iterated
 * @param itemVariable name of the item local
 * @param indexVariable name of the index local, or {@code null}
 * @param body the per-iteration value
 * @param syntax the source loop, used to resolve the loop's copy index
 */
public record ForLoopOperation(
        Operation expression, String itemVariable, String indexVariable, Operation body, ForSyntax syntax)
        implements Operation {

    public ForLoopOperation {
        Objects.requireNonNull(expression, "expression must not be null");
        Objects.requireNonNull(itemVariable, "itemVariable must not be null");
        Objects.requireNonNull(body, "body must not be null");
        Objects.requireNonNull(syntax, "syntax must not be null");
        if (body instanceof ForLoopOperation) {
            throw new IllegalArgumentException("a loop body must not itself be a loop");
        }
    }
}
