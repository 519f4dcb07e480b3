package io.templateemit.core.syntax;

/**
 * Character range of a syntax node in its source file.
 *
 * @param position zero-based offset of the first character
 * @param length number of characters covered
 */
public record TextSpan(int position, int length) {

    /** Span used for synthesized nodes that have no source location. */
    public static final TextSpan NIL = new TextSpan(0, 0);

    public TextSpan {
        if (position < 0 || length < 0) {
            throw new IllegalArgumentException("position and length must be non-negative");
        }
    }

    @Override
    public String toString() {
        return "[" + position + ".." + (position + length) + "]";
    }
}
