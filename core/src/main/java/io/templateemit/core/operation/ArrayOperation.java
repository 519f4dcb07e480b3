package io.templateemit.core.operation;

import java.util.List;
import java.util.Objects;

/** An array literal. Items are never loops. */
public record ArrayOperation(List<Operation> items) implements Operation {

    public ArrayOperation {
        items = List.copyOf(Objects.requireNonNull(items, "items must not be null"));
        for (Operation item : items) {
            if (item instanceof ForLoopOperation) {
                throw new IllegalArgumentException("array items must not be loops");
            }
        }
    }
}
