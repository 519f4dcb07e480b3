package io.templateemit.core.syntax;

import java.util.List;
import java.util.Objects;

/** A single {@code key: value} entry of an object literal. */
public final class ObjectPropertySyntax extends SyntaxBase {

    private final SyntaxBase key;
    private final SyntaxBase value;

    public ObjectPropertySyntax(TextSpan span, SyntaxBase key, SyntaxBase value) {
        super(span);
        this.key = Objects.requireNonNull(key, "key must not be null");
        this.value = Objects.requireNonNull(value, "value must not be null");
    }

    public SyntaxBase key() {
        return key;
    }

    public SyntaxBase value() {
        return value;
    }

    /**
     * Returns the key text when the key is an identifier or a non-interpolated string, {@code null}
     * for computed keys.
     */
    public String tryGetKeyText() {
        if (key instanceof IdentifierSyntax identifier) {
            return identifier.name();
        }
        if (key instanceof StringSyntax string) {
            return string.tryGetLiteralValue();
        }
        return null;
    }

    @Override
    public List<SyntaxBase> children() {
        return List.of(key, value);
    }
}
