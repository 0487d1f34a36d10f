package de.upb.sse.jsweep.cleanup;

import de.upb.sse.jsweep.analysis.CleanupAnalysis;

/**
 * Asks whether the removals found by the initial analysis may be applied. Asked exactly once per
 * run, before anything is changed.
 */
@FunctionalInterface
public interface ConfirmationPort {

    boolean confirm(CleanupAnalysis analysis);

    static ConfirmationPort always() {
        return analysis -> true;
    }
}
