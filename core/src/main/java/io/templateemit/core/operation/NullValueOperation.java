package io.templateemit.core.operation;

public record NullValueOperation() implements Operation {

    public static final NullValueOperation INSTANCE = new NullValueOperation();
}
