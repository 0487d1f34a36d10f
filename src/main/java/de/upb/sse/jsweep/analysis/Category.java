package de.upb.sse.jsweep.analysis;

import de.upb.sse.jsweep.model.SymbolKind;

/**
 * Removal categories, declared in the order a batch is applied.
 */
public enum Category {
    UNUSED_IMPORT(SymbolKind.IMPORT, "unused imports"),
    UNUSED_FIELD(SymbolKind.FIELD, "unused fields"),
    UNUSED_CLASS(SymbolKind.CLASS, "empty classes"),
    DEPRECATED_METHOD(SymbolKind.METHOD, "unused deprecated methods"),
    TRANSITIVE_METHOD(SymbolKind.METHOD, "transitively unused methods");

    private final SymbolKind kind;
    private final String label;

    Category(SymbolKind kind, String label) {
        this.kind = kind;
        this.label = label;
    }

    /** The only symbol kind this category may hold. */
    public SymbolKind getKind() {
        return kind;
    }

    public String getLabel() {
        return label;
    }
}
