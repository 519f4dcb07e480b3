package io.templateemit.core.syntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A {@code [for item in expression: body]} or {@code [for (item, index) in expression: body]}
 * loop. The index variable is {@code null} when the loop does not declare one.
 */
public final class ForSyntax extends SyntaxBase {

    private final SyntaxBase expression;
    private final LocalVariableSyntax itemVariable;
    private final LocalVariableSyntax indexVariable;
    private final SyntaxBase body;

    public ForSyntax(
            TextSpan span,
            LocalVariableSyntax itemVariable,
            LocalVariableSyntax indexVariable,
            SyntaxBase expression,
            SyntaxBase body) {
        super(span);
        this.itemVariable = Objects.requireNonNull(itemVariable, "itemVariable must not be null");
        this.indexVariable = indexVariable;
        this.expression = Objects.requireNonNull(expression, "expression must not be null");
        this.body = Objects.requireNonNull(body, "body must not be null");
    }

    public SyntaxBase expression() {
        return expression;
    }

    public LocalVariableSyntax itemVariable() {
        return itemVariable;
    }

    /** The index variable, or {@code null}. */
    public LocalVariableSyntax indexVariable() {
        return indexVariable;
    }

    public SyntaxBase body() {
        return body;
    }

    @Override
    public List<SyntaxBase> children() {
        List<SyntaxBase> children = new ArrayList<>(4);
        children.add(itemVariable);
        if (indexVariable != null) {
            children.add(indexVariable);
        }
        children.add(expression);
        children.add(body);
        return Collections.unmodifiableList(children);
    }
}
