package de.upb.sse.jsweep.model;

import de.upb.sse.jsweep.exceptions.MutationException;
import de.upb.sse.jsweep.exceptions.StaleSymbolException;

import java.nio.file.Path;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Snapshot of an {@link InMemoryProject}. References from members that no longer exist in the
 * project are gone, as if their bodies had been deleted with them.
 */
public class InMemoryCodeModel implements CodeModel {
    private final InMemoryProject project;
    private final CleanupScope scope;
    private final Map<SymbolId, Symbol> symbols;
    private final Set<SymbolId> deleted = new LinkedHashSet<>();
    private int deleteCalls;

    InMemoryCodeModel(InMemoryProject project, CleanupScope scope) {
        this.project = project;
        this.scope = scope;
        this.symbols = new LinkedHashMap<>(project.symbols);
    }

    @Override
    public CleanupScope getScope() {
        return scope;
    }

    @Override
    public List<Path> listFiles() {
        return symbols.values().stream()
                .map(Symbol::getDeclaringFile)
                .filter(scope::isCandidate)
                .distinct()
                .sorted()
                .collect(Collectors.toList());
    }

    @Override
    public FileSymbols getSymbols(Path file) {
        List<Symbol> classes = new ArrayList<>();
        List<Symbol> methods = new ArrayList<>();
        List<Symbol> fields = new ArrayList<>();
        List<Symbol> imports = new ArrayList<>();
        for (Symbol symbol : symbols.values()) {
            if (!symbol.getDeclaringFile().equals(file)) continue;
            switch (symbol.getKind()) {
                case CLASS: classes.add(symbol); break;
                case METHOD: methods.add(symbol); break;
                case FIELD: fields.add(symbol); break;
                case IMPORT: imports.add(symbol); break;
                default: break;
            }
        }
        return new FileSymbols(file, classes, methods, fields, imports);
    }

    @Override
    public List<ReferenceSite> findReferences(Symbol symbol) {
        List<ReferenceSite> sites = new ArrayList<>();
        for (ReferenceSite site : project.references) {
            if (!site.getTarget().equals(symbol.getId())) continue;
            if (site.getReferencingMethod() != null && !symbols.containsKey(site.getReferencingMethod())) continue;
            sites.add(site);
        }
        return sites;
    }

    @Override
    public List<CallSite> getCallSites(Symbol method) {
        return project.calls.getOrDefault(method.getId(), Collections.emptyList());
    }

    @Override
    public Optional<Symbol> resolveCallTarget(CallSite callSite) {
        if (callSite.getTarget() == null) return Optional.empty();
        return find(callSite.getTarget());
    }

    @Override
    public Optional<Symbol> find(SymbolId id) {
        return Optional.ofNullable(symbols.get(id));
    }

    @Override
    public boolean isValid(Symbol symbol) {
        if (!symbols.containsKey(symbol.getId()) || deleted.contains(symbol.getId())) return false;
        return symbol.getContainingClass() == null || deleted.stream()
                .noneMatch(id -> id.getKind() == SymbolKind.CLASS && id.getQualifiedName().equals(symbol.getContainingClass()));
    }

    @Override
    public void delete(Symbol symbol) throws StaleSymbolException, MutationException {
        deleteCalls++;
        if (!isValid(symbol)) throw new StaleSymbolException(symbol.getId());
        if (project.crashingDeletes.contains(symbol.getId())) throw new IllegalStateException("broken tree");
        if (project.failingDeletes.contains(symbol.getId())) throw new MutationException("cannot remove " + symbol.getSimpleName());
        deleted.add(symbol.getId());
        if (symbol.getKind() == SymbolKind.CLASS) {
            for (Symbol member : symbols.values()) {
                if (symbol.getQualifiedName().equals(member.getContainingClass())) deleted.add(member.getId());
            }
        }
    }

    @Override
    public Set<Path> commit() throws MutationException {
        if (project.failCommit) throw new MutationException("disk full");
        Set<Path> files = new TreeSet<>();
        for (SymbolId id : deleted) files.add(id.getFile());
        project.commit(deleted);
        deleted.clear();
        return files;
    }

    public int getDeleteCalls() {
        return deleteCalls;
    }
}
