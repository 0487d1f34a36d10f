package de.upb.sse.jsweep.model;

import de.upb.sse.jsweep.exceptions.MutationException;
import de.upb.sse.jsweep.exceptions.StaleSymbolException;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * One snapshot of the project's code model. Reads are stable for the lifetime of the snapshot;
 * {@link #delete(Symbol)} mutates it and {@link #commit()} persists the mutations. A snapshot
 * is used for at most one pass and then discarded.
 *
 * Read methods throw {@link de.upb.sse.jsweep.exceptions.ModelReadException} when the
 * underlying sources cannot be read consistently.
 */
public interface CodeModel {

    CleanupScope getScope();

    /** Candidate files of the scope that exist in this snapshot. */
    List<Path> listFiles();

    FileSymbols getSymbols(Path file);

    /** Every usage of {@code symbol} in the indexed roots, self-references included. */
    List<ReferenceSite> findReferences(Symbol symbol);

    /** Call expressions in the body of {@code method}, one entry per call expression. */
    List<CallSite> getCallSites(Symbol method);

    Optional<Symbol> resolveCallTarget(CallSite callSite);

    /** Looks a symbol up by identity in this snapshot. */
    Optional<Symbol> find(SymbolId id);

    /** True while the symbol is still attached to its file in this snapshot. */
    boolean isValid(Symbol symbol);

    void delete(Symbol symbol) throws StaleSymbolException, MutationException;

    /**
     * Writes every file modified through {@link #delete(Symbol)} back to its source.
     *
     * @return the files that were rewritten or removed
     */
    Set<Path> commit() throws MutationException;
}
