package de.upb.sse.jsweep.exceptions;

import de.upb.sse.jsweep.model.SymbolId;
import lombok.Getter;

/**
 * A symbol targeted for deletion no longer exists in the current snapshot, usually because an
 * enclosing element was deleted earlier in the same pass.
 */
public class StaleSymbolException extends Exception {
    @Getter private final SymbolId symbolId;

    public StaleSymbolException(SymbolId symbolId) {
        super("Symbol is no longer valid: " + symbolId.getQualifiedName());
        this.symbolId = symbolId;
    }
}
