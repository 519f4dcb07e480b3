package io.templateemit.core.semantics;

import io.templateemit.core.syntax.SyntaxBase;
import java.util.Optional;

/**
 * Read-only view of a bound compilation unit. Owned by the caller and scoped to one compilation;
 * implementations may be shared between emission runs but are never mutated by the emitter.
 */
public interface SemanticModel {

    /** Resolves the symbol a node refers to or declares. */
    Optional<Symbol> getSymbolInfo(SyntaxBase syntax);

    /** The parent of a node, empty for the program root. */
    Optional<SyntaxBase> getParent(SyntaxBase syntax);

    /**
     * Resolves resource metadata for a resource reference ({@code VariableAccessSyntax} or
     * {@code ResourceAccessSyntax}) or a resource declaration. Empty for anything else.
     */
    Optional<ResourceMetadata> tryLookupResource(SyntaxBase syntax);

    /** Deployment scope of the compiled file; used for module deployment ids. */
    ResourceScope targetScope();
}
