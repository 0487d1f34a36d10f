package de.upb.sse.jsweep.cleanup;

/**
 * Where a cleanup run reports what it is doing. Called at pass start, per removed or failed item,
 * at pass end and with the final report.
 */
public interface ProgressSink {

    /** Short status text, replaced by the next call. */
    void text(String message);

    /** A line for the run's log. */
    void log(String message);

    /** Polled between passes; a pass that has started always runs to its end. */
    default boolean isCancelled() {
        return false;
    }
}
