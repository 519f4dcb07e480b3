package io.templateemit.core.syntax;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

public final class ObjectSyntax extends SyntaxBase {

    private final List<ObjectPropertySyntax> properties;

    public ObjectSyntax(TextSpan span, List<ObjectPropertySyntax> properties) {
        super(span);
        this.properties = List.copyOf(Objects.requireNonNull(properties, "properties must not be null"));
    }

    public List<ObjectPropertySyntax> properties() {
        return properties;
    }

    /** Finds the first property whose literal key equals {@code name}. */
    public Optional<ObjectPropertySyntax> tryGetProperty(String name) {
        return properties.stream()
                .filter(p -> name.equals(p.tryGetKeyText()))
                .findFirst();
    }

    @Override
    public List<SyntaxBase> children() {
        return List.copyOf(properties);
    }
}
