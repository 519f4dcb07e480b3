package io.templateemit.core.syntax;

public enum BinaryOperator {
    LOGICAL_OR("||"),
    LOGICAL_AND("&&"),
    EQUALS("=="),
    NOT_EQUALS("!="),
    EQUALS_INSENSITIVE("=~"),
    NOT_EQUALS_INSENSITIVE("!~"),
    LESS_THAN("<"),
    LESS_THAN_OR_EQUAL("<="),
    GREATER_THAN(">"),
    GREATER_THAN_OR_EQUAL(">="),
    ADD("+"),
    SUBTRACT("-"),
    MULTIPLY("*"),
    DIVIDE("/"),
    MODULO("%"),
    COALESCE("??");

    private final String text;

    BinaryOperator(String text) {
        this.text = text;
    }

    public String text() {
        return text;
    }
}
