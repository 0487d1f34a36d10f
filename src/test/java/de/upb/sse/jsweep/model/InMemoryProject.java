package de.upb.sse.jsweep.model;

import de.upb.sse.jsweep.exceptions.ModelReadException;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.*;

/**
 * Project held in memory for engine tests. Every {@link #read} hands out a new
 * {@link InMemoryCodeModel}; deletions only become visible to later reads after a commit.
 */
public class InMemoryProject implements CodeModelProvider {
    public static final Path ROOT = Paths.get("/project").toAbsolutePath().normalize();

    final Map<SymbolId, Symbol> symbols = new LinkedHashMap<>();
    final List<ReferenceSite> references = new ArrayList<>();
    final Map<SymbolId, List<CallSite>> calls = new LinkedHashMap<>();

    final Set<SymbolId> failingDeletes = new HashSet<>();
    final Set<SymbolId> crashingDeletes = new HashSet<>();
    boolean failCommit;
    private int failReadNumber = -1;
    private int reads;
    private int commits;

    public static Path file(String name) {
        return ROOT.resolve("src").resolve(name);
    }

    public CleanupScope scope() {
        return CleanupScope.ofRoot(ROOT);
    }

    public InMemoryProject add(Symbol... added) {
        for (Symbol symbol : added) symbols.put(symbol.getId(), symbol);
        return this;
    }

    /** A usage of {@code target} from inside {@code from}, or from no indexed member when null. */
    public InMemoryProject reference(Symbol target, Symbol from) {
        references.add(new ReferenceSite(target.getId(), target.getDeclaringFile(), 1, 1,
                from == null ? null : from.getId(), null));
        return this;
    }

    /** A resolved call: a call site in {@code caller} and a usage of {@code callee}. */
    public InMemoryProject call(Symbol caller, Symbol callee) {
        calls.computeIfAbsent(caller.getId(), k -> new ArrayList<>())
                .add(new CallSite(caller.getId(), caller.getDeclaringFile(), 1, 1, callee.getSimpleName(), callee.getParameterCount(), callee.getId()));
        return reference(callee, caller);
    }

    /** A call site in {@code caller} whose target could not be resolved. */
    public InMemoryProject unresolvedCall(Symbol caller, String name) {
        calls.computeIfAbsent(caller.getId(), k -> new ArrayList<>())
                .add(new CallSite(caller.getId(), caller.getDeclaringFile(), 1, 1, name, 0, null));
        return this;
    }

    public InMemoryProject failDeleteOf(Symbol symbol) {
        failingDeletes.add(symbol.getId());
        return this;
    }

    public InMemoryProject crashDeleteOf(Symbol symbol) {
        crashingDeletes.add(symbol.getId());
        return this;
    }

    public InMemoryProject failCommit() {
        failCommit = true;
        return this;
    }

    /** The n-th read (1-based) throws a {@link ModelReadException}. */
    public InMemoryProject failRead(int n) {
        failReadNumber = n;
        return this;
    }

    public boolean contains(Symbol symbol) {
        return symbols.containsKey(symbol.getId());
    }

    public int getReads() {
        return reads;
    }

    public int getCommits() {
        return commits;
    }

    @Override
    public InMemoryCodeModel read(CleanupScope scope) {
        reads++;
        if (reads == failReadNumber) throw new ModelReadException("read " + reads + " failed");
        return new InMemoryCodeModel(this, scope);
    }

    void commit(Set<SymbolId> deleted) {
        commits++;
        for (SymbolId id : deleted) symbols.remove(id);
    }
}
