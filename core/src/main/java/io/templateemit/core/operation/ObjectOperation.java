package io.templateemit.core.operation;

import java.util.List;
import java.util.Objects;

/** An object literal, properties in source order. */
public record ObjectOperation(List<ObjectPropertyOperation> properties) implements Operation {

    public ObjectOperation {
        properties = List.copyOf(Objects.requireNonNull(properties, "properties must not be null"));
    }
}
