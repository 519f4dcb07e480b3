package io.templateemit.core.syntax;

import java.util.List;
import java.util.Objects;

/** A {@code module name 'path' = value} declaration, optionally a loop. */
public final class ModuleDeclarationSyntax extends DeclarationSyntax {

    private final String path;
    private final SyntaxBase value;

    public ModuleDeclarationSyntax(TextSpan span, String name, String path, SyntaxBase value) {
        super(span, name);
        this.path = Objects.requireNonNull(path, "path must not be null");
        this.value = Objects.requireNonNull(value, "value must not be null");
    }

    public String path() {
        return path;
    }

    public SyntaxBase value() {
        return value;
    }

    public boolean isCollection() {
        return value instanceof ForSyntax;
    }

    /** The object body, or {@code null}. */
    public ObjectSyntax tryGetBody() {
        return unwrapBody(value);
    }

    @Override
    public List<SyntaxBase> children() {
        return List.of(value);
    }
}
