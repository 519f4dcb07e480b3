package io.templateemit.core.engine;

import io.templateemit.core.expression.TargetExpression;
import io.templateemit.core.semantics.LocalVariableSymbol;
import io.templateemit.core.syntax.ForSyntax;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Immutable index context under which expressions are converted.
 *
 * <p>{@code localReplacements} maps loop locals that are out of scope at the emission site to the
 * expression standing in for them. {@code copyIndexOverrides} forces the copy index name used for
 * the locals of specific loops. Both maps are keyed by identity.
 */
public final class ConversionContext {

    /** No replacements and no overrides. */
    public static final ConversionContext EMPTY = new ConversionContext(new IdentityHashMap<>(), new IdentityHashMap<>());

    private final Map<LocalVariableSymbol, TargetExpression> localReplacements;
    private final Map<ForSyntax, String> copyIndexOverrides;

    private ConversionContext(
            IdentityHashMap<LocalVariableSymbol, TargetExpression> localReplacements,
            IdentityHashMap<ForSyntax, String> copyIndexOverrides) {
        this.localReplacements = Collections.unmodifiableMap(localReplacements);
        this.copyIndexOverrides = Collections.unmodifiableMap(copyIndexOverrides);
    }

    /** Replacement for an out-of-scope local, or {@code null}. */
    public TargetExpression replacementFor(LocalVariableSymbol local) {
        return localReplacements.get(local);
    }

    /** Forced copy index name for a loop, or {@code null}. */
    public String copyIndexOverrideFor(ForSyntax loop) {
        return copyIndexOverrides.get(loop);
    }

    /** Returns a context with the given replacements added (later entries win). */
    public ConversionContext withReplacements(Map<LocalVariableSymbol, TargetExpression> replacements) {
        IdentityHashMap<LocalVariableSymbol, TargetExpression> merged = new IdentityHashMap<>(localReplacements);
        merged.putAll(replacements);
        return new ConversionContext(merged, new IdentityHashMap<>(copyIndexOverrides));
    }

    /** Returns a context in which the locals of {@code loop} index with {@code copyIndexName}. */
    public ConversionContext withCopyIndexOverride(ForSyntax loop, String copyIndexName) {
        IdentityHashMap<ForSyntax, String> overrides = new IdentityHashMap<>(copyIndexOverrides);
        overrides.put(loop, copyIndexName);
        return new ConversionContext(new IdentityHashMap<>(localReplacements), overrides);
    }
}
