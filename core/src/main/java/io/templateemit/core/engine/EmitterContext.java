package io.templateemit.core.engine;

import io.templateemit.core.config.EmitterSettings;
import io.templateemit.core.semantics.SemanticModel;
import io.templateemit.core.semantics.VariableSymbol;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Objects;
import java.util.Set;

/**
 * Read-only inputs for one compilation pass: the bound semantic model, the variables an earlier
 * pass decided to inline, and the emission settings. Never mutated by the emitter; safe to share
 * between independent emission runs.
 */
public record EmitterContext(SemanticModel semanticModel, Set<VariableSymbol> variablesToInline, EmitterSettings settings) {

    public EmitterContext {
        Objects.requireNonNull(semanticModel, "semanticModel must not be null");
        Objects.requireNonNull(settings, "settings must not be null");
        Set<VariableSymbol> copy = Collections.newSetFromMap(new IdentityHashMap<>());
        if (variablesToInline != null) {
            copy.addAll(variablesToInline);
        }
        variablesToInline = Collections.unmodifiableSet(copy);
    }

    /** A context with no inlined variables and default settings. */
    public static EmitterContext of(SemanticModel semanticModel) {
        return new EmitterContext(semanticModel, Set.of(), EmitterSettings.DEFAULT);
    }

    public boolean isInlined(VariableSymbol variable) {
        return variablesToInline.contains(variable);
    }
}
