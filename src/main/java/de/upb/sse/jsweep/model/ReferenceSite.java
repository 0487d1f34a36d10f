package de.upb.sse.jsweep.model;

import lombok.Value;

import java.nio.file.Path;

/**
 * One usage of a symbol. {@code referencingMethod} is the nearest enclosing indexed method,
 * {@code referencingField} the field whose initializer contains the usage; both may be null.
 */
@Value
public class ReferenceSite {
    SymbolId target;
    Path file;
    int line;
    int column;
    SymbolId referencingMethod;
    SymbolId referencingField;

    /** True if the usage sits inside the body (or initializer) of {@code symbol} itself. */
    public boolean isSelfReference(SymbolId symbol) {
        return symbol.equals(referencingMethod) || symbol.equals(referencingField);
    }

    public String location() {
        return file.getFileName() + ":" + line + ":" + column;
    }
}
