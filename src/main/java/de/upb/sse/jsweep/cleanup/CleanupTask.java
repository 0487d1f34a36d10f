package de.upb.sse.jsweep.cleanup;

import de.upb.sse.jsweep.analysis.CleanupAnalysis;
import de.upb.sse.jsweep.model.CleanupScope;
import de.upb.sse.jsweep.model.CodeModel;
import de.upb.sse.jsweep.plan.RemovalBatch;

/**
 * What a cleanup run removes. The {@link FixpointCleanupDriver} calls {@link #analyze} and
 * {@link #plan} once per pass, each time on a fresh snapshot.
 */
public interface CleanupTask {

    String getName();

    /** Narrows the requested scope. Called once per run, before the first read. */
    default CleanupScope resolveScope(CleanupScope requested) {
        return requested;
    }

    CleanupAnalysis analyze(CodeModel model);

    RemovalBatch plan(CodeModel model, CleanupAnalysis analysis);

    /** Called once the run has ended, whatever its status. */
    default void onFinished(Report report, ProgressSink sink) {
    }
}
