package de.upb.sse.jsweep.model;

import java.util.List;

/**
 * Project-wide usage lookup for one snapshot.
 * Implementations may build their tables lazily, but never change what an answer is once given.
 */
public interface ReferenceIndex {

    /**
     * All usages of the symbol, including usages inside its own body.
     *
     * @param symbol declared symbol of the same snapshot
     * @return reference sites, empty when the symbol is never used
     */
    List<ReferenceSite> findReferences(Symbol symbol);

    /**
     * Call expressions written inside a method body (lambdas and anonymous classes included).
     *
     * @param method method symbol of the same snapshot
     * @return call sites in source order
     */
    List<CallSite> getCallSites(Symbol method);
}
