package de.upb.sse.jsweep.model;

import lombok.NonNull;
import lombok.Value;

import java.nio.file.Path;

/**
 * Identity of a declared symbol that survives re-reads of the code model: kind, declaring file and
 * qualified name. Never holds a pointer into a syntax tree.
 */
@Value
public class SymbolId {
    @NonNull SymbolKind kind;
    @NonNull Path file;
    @NonNull String qualifiedName;

    public static SymbolId of(SymbolKind kind, Path file, String qualifiedName) {
        return new SymbolId(kind, file.toAbsolutePath().normalize(), qualifiedName);
    }

    @Override
    public String toString() {
        return kind + " " + qualifiedName + " (" + file.getFileName() + ")";
    }
}
