package io.templateemit.core.operation;

/**
 * Intermediate form of a value about to be written to the template. Structural values (constants,
 * null, objects, arrays and loops) are lowered to dedicated variants so the emitter can write them
 * as native document values; everything else stays an {@link ExpressionOperation} and is converted
 * to a bracketed expression at emission time.
 *
 * <p>Immutable once built.
 */
public sealed interface Operation
        permits ConstantValueOperation,
                NullValueOperation,
                ObjectOperation,
                ArrayOperation,
                ForLoopOperation,
                ExpressionOperation {}
