package de.upb.sse.jsweep.plan;

import de.upb.sse.jsweep.analysis.Category;
import de.upb.sse.jsweep.analysis.CleanupAnalysis;
import de.upb.sse.jsweep.analysis.SymbolClassifier;
import de.upb.sse.jsweep.model.Symbol;
import de.upb.sse.jsweep.model.SymbolId;
import de.upb.sse.jsweep.model.SymbolKind;
import de.upb.sse.jsweep.model.SymbolModifier;

import java.util.*;
import java.util.logging.Logger;

/**
 * Turns analysis findings into a {@link RemovalBatch}.
 *
 * The planner re-checks the exclusions that must hold for anything that gets deleted, whatever
 * the earlier stages decided: no interface methods, no overrides, no annotated, public or static
 * fields, no controller classes, and no symbol filed under a category of another kind.
 */
public class RemovalPlanner {
    private static final Logger logger = Logger.getLogger(RemovalPlanner.class.getName());

    private final SymbolClassifier classifier;

    public RemovalPlanner(SymbolClassifier classifier) {
        this.classifier = classifier;
    }

    public RemovalBatch plan(CleanupAnalysis analysis) {
        return plan(analysis.getCandidates());
    }

    public RemovalBatch plan(Map<Category, List<Symbol>> candidates) {
        Set<SymbolId> planned = new HashSet<>();
        Map<Category, List<Symbol>> batch = new EnumMap<>(Category.class);
        for (Category category : Category.values()) {
            List<Symbol> symbols = candidates.get(category);
            if (symbols == null) continue;
            List<Symbol> accepted = new ArrayList<>();
            for (Symbol symbol : symbols) {
                if (!planned.add(symbol.getId())) continue;
                String reason = exclusionReason(category, symbol);
                if (reason != null) {
                    logger.warning("Not planning " + symbol.getDisplayName() + ": " + reason);
                    continue;
                }
                accepted.add(symbol);
            }
            if (!accepted.isEmpty()) batch.put(category, accepted);
        }
        return new RemovalBatch(batch);
    }

    /** Why {@code symbol} must not be removed under {@code category}, or null if it may be. */
    String exclusionReason(Category category, Symbol symbol) {
        if (symbol.getKind() != category.getKind()) return "is a " + symbol.getKind() + ", not a " + category.getKind();
        if (symbol.getKind() == SymbolKind.METHOD) {
            if (symbol.isInterfaceMember()) return "declared in an interface";
            if (symbol.isOverriding()) return "overrides a supertype method";
        } else if (symbol.getKind() == SymbolKind.FIELD) {
            if (!symbol.getAnnotations().isEmpty()) return "annotated";
            if (symbol.is(SymbolModifier.PUBLIC)) return "public";
            if (symbol.is(SymbolModifier.STATIC)) return "static";
        } else if (symbol.getKind() == SymbolKind.CLASS) {
            if (classifier.isControllerClass(symbol)) return "controller class";
        }
        return null;
    }
}
