package io.templateemit.core.operation;

import java.util.Objects;

/**
 * One property of an {@link ObjectOperation}. The key is a string {@link ConstantValueOperation}
 * for plain keys and any other operation for computed keys.
 */
public record ObjectPropertyOperation(Operation key, Operation value) {

    public ObjectPropertyOperation {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(value, "value must not be null");
    }

    /** The literal key text, or {@code null} for computed keys. */
    public String tryGetKeyText() {
        return key instanceof ConstantValueOperation constant && constant.value() instanceof String text
                ? text
                : null;
    }
}
