package de.upb.sse.jsweep.model.javaparser;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import de.upb.sse.jsweep.model.FileSymbols;
import de.upb.sse.jsweep.model.Symbol;
import de.upb.sse.jsweep.model.SymbolId;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Symbols of one snapshot and the syntax nodes they were read from. Node pointers never leave the
 * snapshot they belong to.
 */
final class SymbolTable {
    private final Map<Path, CompilationUnit> units;
    private final Map<SymbolId, Symbol> symbols = new LinkedHashMap<>();
    private final Map<SymbolId, Node> nodes = new HashMap<>();
    private final Map<Node, SymbolId> ids = new IdentityHashMap<>();
    private final Map<Path, FileSymbols> files = new LinkedHashMap<>();
    // "owner.Fqn#name" -> methods
    private final Map<String, List<Symbol>> methodsByOwnerAndName = new HashMap<>();

    SymbolTable(Map<Path, CompilationUnit> units) {
        this.units = units;
    }

    void add(Symbol symbol, Node node) {
        symbols.put(symbol.getId(), symbol);
        nodes.put(symbol.getId(), node);
        ids.put(node, symbol.getId());
        if (symbol.getKind() == de.upb.sse.jsweep.model.SymbolKind.METHOD) {
            methodsByOwnerAndName.computeIfAbsent(symbol.getContainingClass() + "#" + symbol.getSimpleName(), k -> new ArrayList<>()).add(symbol);
        }
    }

    void putFile(FileSymbols fileSymbols) {
        files.put(fileSymbols.getFile(), fileSymbols);
    }

    Map<Path, CompilationUnit> getUnits() {
        return units;
    }

    Symbol get(SymbolId id) {
        return symbols.get(id);
    }

    Node nodeOf(SymbolId id) {
        return nodes.get(id);
    }

    /** Identity of the symbol declared by exactly this node, or null. */
    SymbolId idOf(Node node) {
        return ids.get(node);
    }

    FileSymbols fileSymbols(Path file) {
        FileSymbols fs = files.get(file);
        return fs == null ? FileSymbols.empty(file) : fs;
    }

    List<Symbol> methods(String ownerFqn, String name) {
        return methodsByOwnerAndName.getOrDefault(ownerFqn + "#" + name, Collections.emptyList());
    }
}
