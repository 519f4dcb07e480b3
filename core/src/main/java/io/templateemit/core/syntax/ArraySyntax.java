package io.templateemit.core.syntax;

import java.util.List;
import java.util.Objects;

public final class ArraySyntax extends SyntaxBase {

    private final List<SyntaxBase> items;

    public ArraySyntax(TextSpan span, List<SyntaxBase> items) {
        super(span);
        this.items = List.copyOf(Objects.requireNonNull(items, "items must not be null"));
    }

    public List<SyntaxBase> items() {
        return items;
    }

    @Override
    public List<SyntaxBase> children() {
        return items;
    }
}
