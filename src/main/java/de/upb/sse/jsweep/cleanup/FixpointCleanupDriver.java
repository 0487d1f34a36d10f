package de.upb.sse.jsweep.cleanup;

import de.upb.sse.jsweep.analysis.Category;
import de.upb.sse.jsweep.analysis.CleanupAnalysis;
import de.upb.sse.jsweep.exceptions.ModelReadException;
import de.upb.sse.jsweep.exceptions.MutationException;
import de.upb.sse.jsweep.model.CleanupScope;
import de.upb.sse.jsweep.model.CodeModel;
import de.upb.sse.jsweep.model.CodeModelProvider;
import de.upb.sse.jsweep.model.Symbol;
import de.upb.sse.jsweep.plan.RemovalBatch;
import de.upb.sse.jsweep.stats.CleanupStats;
import lombok.Getter;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs a {@link CleanupTask} to a fixpoint.
 *
 * After one read-only analysis and a single confirmation, the driver runs up to
 * {@link #MAX_PASSES} passes. Every pass reads a fresh snapshot, analyzes it again, deletes the
 * planned symbols and commits before the next pass starts, so removals that make more code unused
 * are picked up by the following pass. A pass that removes nothing ends the run.
 */
public class FixpointCleanupDriver {
    private static final Logger logger = Logger.getLogger(FixpointCleanupDriver.class.getName());

    public static final int MAX_PASSES = 3;

    public enum State { IDLE, ANALYZING, AWAITING_CONFIRMATION, APPLYING }

    private final CodeModelProvider provider;
    private final MutationApplier applier;
    private final ProgressSink sink;

    @Getter
    private volatile State state = State.IDLE;

    public FixpointCleanupDriver(CodeModelProvider provider, ProgressSink sink) {
        this(provider, new MutationApplier(), sink);
    }

    public FixpointCleanupDriver(CodeModelProvider provider, MutationApplier applier, ProgressSink sink) {
        this.provider = provider;
        this.applier = applier;
        this.sink = sink;
    }

    /** Read-only: resolves the task's scope, reads one snapshot and analyzes it. */
    public CleanupAnalysis analyze(CleanupTask task, CleanupScope scope) {
        CleanupScope effective = task.resolveScope(scope);
        return task.analyze(provider.read(effective));
    }

    public Report run(CleanupTask task, CleanupScope scope, ConfirmationPort confirmation) {
        if (!ProjectLocks.tryAcquire(scope)) {
            Report busy = Report.of(Report.Status.BUSY, "A cleanup is already running on files overlapping " + scope.getProjectRoot());
            sink.log(busy.describe());
            return busy;
        }
        try {
            Report report = runExclusively(task, scope, confirmation);
            task.onFinished(report, sink);
            sink.log(report.describe());
            return report;
        } finally {
            state = State.IDLE;
            ProjectLocks.release(scope);
        }
    }

    private Report runExclusively(CleanupTask task, CleanupScope scope, ConfirmationPort confirmation) {
        state = State.ANALYZING;
        sink.text(task.getName() + ": analyzing...");

        CleanupScope effective;
        CleanupAnalysis initial;
        try {
            effective = task.resolveScope(scope);
            initial = task.analyze(provider.read(effective));
        } catch (ModelReadException | UncheckedIOException e) {
            logger.log(Level.SEVERE, "Analysis failed", e);
            return Report.of(Report.Status.FAILED, e.getMessage());
        }
        if (initial.isEmpty()) {
            return Report.of(Report.Status.NOTHING_TO_DO, null);
        }

        state = State.AWAITING_CONFIRMATION;
        boolean confirmed;
        try {
            confirmed = confirmation.confirm(initial);
        } catch (UncheckedIOException e) {
            logger.log(Level.SEVERE, "Confirmation failed", e);
            return Report.of(Report.Status.FAILED, e.getMessage());
        }
        if (!confirmed) {
            return Report.of(Report.Status.DECLINED, null);
        }

        state = State.APPLYING;
        return applyPasses(task, effective);
    }

    private Report applyPasses(CleanupTask task, CleanupScope scope) {
        CleanupStats stats = new CleanupStats();
        List<Report.Failure> failures = new ArrayList<>();
        Set<Path> affected = new TreeSet<>();
        Report.Status status = Report.Status.COMPLETED;
        String error = null;

        for (int pass = 1; pass <= MAX_PASSES; pass++) {
            if (sink.isCancelled()) {
                sink.log("Cancelled before pass " + pass);
                status = Report.Status.CANCELLED;
                break;
            }
            sink.text("Starting cleanup pass " + pass + " of " + MAX_PASSES + "...");

            CodeModel model;
            RemovalBatch batch;
            try {
                model = provider.read(scope);
                batch = task.plan(model, task.analyze(model));
            } catch (ModelReadException e) {
                logger.log(Level.SEVERE, "Pass " + pass + " could not read the project", e);
                status = Report.Status.FAILED;
                error = e.getMessage();
                break;
            }

            int removedInPass = 0;
            for (MutationApplier.Applied applied : applier.applyAll(model, batch)) {
                Symbol symbol = applied.getItem().getSymbol();
                Path file = symbol.getDeclaringFile();
                MutationApplier.Outcome outcome = applied.getOutcome();
                switch (outcome.getStatus()) {
                    case REMOVED:
                        removedInPass++;
                        stats.incrementRemoved(applied.getItem().getCategory());
                        affected.add(file);
                        sink.log("Pass " + pass + " - Removed " + symbol.getDisplayName() + " from " + file.getFileName());
                        break;
                    case SKIPPED:
                        stats.incrementSkipped();
                        break;
                    case FAILED:
                        stats.incrementFailed();
                        failures.add(new Report.Failure(symbol.getDisplayName(), file, outcome.getReason()));
                        sink.log("Failed to remove " + symbol.getDisplayName() + " from " + file.getFileName() + ": " + outcome.getReason());
                        break;
                    default:
                        break;
                }
            }

            try {
                model.commit();
            } catch (MutationException e) {
                logger.log(Level.SEVERE, "Pass " + pass + " could not be written", e);
                failures.add(new Report.Failure("pass " + pass, null, e.getMessage()));
                stats.incrementPassesRun();
                status = Report.Status.FAILED;
                error = e.getMessage();
                break;
            }
            stats.incrementPassesRun();
            sink.log("Pass " + pass + " complete: removed " + removedInPass + " element(s)");

            if (removedInPass == 0) {
                sink.log("No changes in pass " + pass + ", stopping cleanup.");
                break;
            }
        }

        Map<Category, Integer> removed = new EnumMap<>(Category.class);
        for (Category category : Category.values()) removed.put(category, stats.getRemoved(category));
        logger.info("Cleanup finished, removed " + stats.totalRemoved() + " element(s): " + stats);
        return new Report(status, removed, failures, stats.getSkipped(), stats.getPassesRun(), affected, error);
    }
}
