package io.templateemit.core.syntax;

/** Stateless helpers over syntax nodes. */
public final class SyntaxHelper {

    private SyntaxHelper() {}

    /**
     * Result of {@link #unwrapArrayAccess(SyntaxBase)}.
     *
     * @param baseSyntax the expression being indexed, or the input itself
     * @param indexExpression the index, or {@code null} when the input was not an array access
     */
    public record ArrayAccessParts(SyntaxBase baseSyntax, SyntaxBase indexExpression) {}

    /** Splits a single level of {@code base[index]} access. */
    public static ArrayAccessParts unwrapArrayAccess(SyntaxBase syntax) {
        if (syntax instanceof ArrayAccessSyntax arrayAccess) {
            return new ArrayAccessParts(arrayAccess.baseExpression(), arrayAccess.indexExpression());
        }
        return new ArrayAccessParts(syntax, null);
    }
}
