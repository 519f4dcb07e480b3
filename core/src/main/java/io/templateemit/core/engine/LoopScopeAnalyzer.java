package io.templateemit.core.engine;

import io.templateemit.core.error.UnsupportedConstructException;
import io.templateemit.core.semantics.LocalVariableSymbol;
import io.templateemit.core.semantics.SemanticModel;
import io.templateemit.core.semantics.Symbol;
import io.templateemit.core.syntax.ForSyntax;
import io.templateemit.core.syntax.SyntaxBase;
import io.templateemit.core.syntax.VariableAccessSyntax;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Answers loop-scoping questions over the syntax tree: which loop declares a local, and which
 * locals an expression loses access to when it is emitted somewhere else.
 */
final class LoopScopeAnalyzer {

    private final SemanticModel semanticModel;

    LoopScopeAnalyzer(SemanticModel semanticModel) {
        this.semanticModel = semanticModel;
    }

    /** The loop declaring {@code local}. */
    ForSyntax getEnclosingLoop(LocalVariableSymbol local) {
        SyntaxBase declaration = local.declaringSyntax();
        return semanticModel
                .getParent(declaration)
                .filter(ForSyntax.class::isInstance)
                .map(ForSyntax.class::cast)
                .orElseThrow(() -> new UnsupportedConstructException(
                        "Local variable '" + local.name() + "' is not declared by a loop",
                        declaration.kind(),
                        declaration.span()));
    }

    /**
     * Returns the loop locals referenced by {@code expression} that would be out of scope if the
     * expression were emitted at {@code newContext}. Locals declared by loops nested inside the
     * expression itself stay accessible.
     */
    List<LocalVariableSymbol> getInaccessibleLocalsAfterMove(SyntaxBase expression, SyntaxBase newContext) {
        Set<LocalVariableSymbol> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        List<LocalVariableSymbol> inaccessible = new ArrayList<>();

        Deque<SyntaxBase> pending = new ArrayDeque<>();
        pending.push(expression);
        while (!pending.isEmpty()) {
            SyntaxBase current = pending.pop();
            if (current instanceof VariableAccessSyntax access) {
                Optional<Symbol> symbol = semanticModel.getSymbolInfo(access);
                if (symbol.isPresent() && symbol.get() instanceof LocalVariableSymbol local && seen.add(local)) {
                    ForSyntax loop = getEnclosingLoop(local);
                    if (!isAncestorOrSelf(loop, newContext) && !isAncestorOrSelf(expression, loop)) {
                        inaccessible.add(local);
                    }
                }
            }
            List<SyntaxBase> children = current.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                pending.push(children.get(i));
            }
        }
        return inaccessible;
    }

    /** Distinct declaring loops of the given locals, in first-seen order. */
    List<ForSyntax> getDeclaringLoops(List<LocalVariableSymbol> locals) {
        Set<ForSyntax> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        List<ForSyntax> loops = new ArrayList<>();
        for (LocalVariableSymbol local : locals) {
            ForSyntax loop = getEnclosingLoop(local);
            if (seen.add(loop)) {
                loops.add(loop);
            }
        }
        return loops;
    }

    private boolean isAncestorOrSelf(SyntaxBase ancestor, SyntaxBase node) {
        SyntaxBase current = node;
        while (current != null) {
            if (current == ancestor) {
                return true;
            }
            current = semanticModel.getParent(current).orElse(null);
        }
        return false;
    }
}
