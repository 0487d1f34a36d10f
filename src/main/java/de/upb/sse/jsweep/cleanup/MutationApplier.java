package de.upb.sse.jsweep.cleanup;

import de.upb.sse.jsweep.exceptions.MutationException;
import de.upb.sse.jsweep.exceptions.StaleSymbolException;
import de.upb.sse.jsweep.model.CodeModel;
import de.upb.sse.jsweep.model.Symbol;
import de.upb.sse.jsweep.plan.RemovalBatch;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Deletes planned symbols from a snapshot, one at a time. A failing item never stops the batch.
 */
public class MutationApplier {
    private static final Logger logger = Logger.getLogger(MutationApplier.class.getName());

    public enum Status {
        REMOVED,
        /** No longer in the snapshot, usually because its enclosing element went first. Not a failure. */
        SKIPPED,
        FAILED
    }

    @Value
    public static class Outcome {
        Status status;
        String reason;

        public static Outcome removed() {
            return new Outcome(Status.REMOVED, "");
        }

        public static Outcome skipped(String reason) {
            return new Outcome(Status.SKIPPED, reason);
        }

        public static Outcome failed(String reason) {
            return new Outcome(Status.FAILED, reason == null ? "unknown error" : reason);
        }
    }

    @Value
    public static class Applied {
        RemovalBatch.Item item;
        Outcome outcome;
    }

    public Outcome apply(CodeModel model, Symbol symbol) {
        if (!model.isValid(symbol)) {
            return Outcome.skipped("no longer present");
        }
        try {
            model.delete(symbol);
            return Outcome.removed();
        } catch (StaleSymbolException e) {
            return Outcome.skipped(e.getMessage());
        } catch (MutationException e) {
            logger.warning("Failed to remove " + symbol.getDisplayName() + ": " + e.getMessage());
            return Outcome.failed(e.getMessage());
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Unexpected error removing " + symbol.getDisplayName(), e);
            return Outcome.failed(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    /** Applies every item of the batch in order. */
    public List<Applied> applyAll(CodeModel model, RemovalBatch batch) {
        List<Applied> results = new ArrayList<>();
        for (RemovalBatch.Item item : batch.getItems()) {
            results.add(new Applied(item, apply(model, item.getSymbol())));
        }
        return results;
    }
}
