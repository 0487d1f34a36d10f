package de.upb.sse.jsweep.model;

import lombok.Value;

import java.nio.file.Path;
import java.util.List;

/** Declared symbols of one source file, in declaration order. */
@Value
public class FileSymbols {
    Path file;
    List<Symbol> classes;
    List<Symbol> methods;
    List<Symbol> fields;
    List<Symbol> imports;

    public static FileSymbols empty(Path file) {
        return new FileSymbols(file, List.of(), List.of(), List.of(), List.of());
    }
}
