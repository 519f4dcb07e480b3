package io.templateemit.core.semantics;

/** Role of a loop-declared local. */
public enum LocalVariableKind {
    ITEM,
    INDEX
}
