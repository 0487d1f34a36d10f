package de.upb.sse.jsweep.cleanup;

import de.upb.sse.jsweep.analysis.Category;

import java.nio.file.Path;
import java.util.*;

/** Outcome of one cleanup run. */
public final class Report {

    public enum Status {
        /** At least one pass ran to its end. Individual items may still have failed. */
        COMPLETED,
        NOTHING_TO_DO,
        DECLINED,
        /** Cancelled between passes. Passes that already ran stay applied. */
        CANCELLED,
        /** The model could not be read, or a pass could not be written back. */
        FAILED,
        /** Another run holds the project. */
        BUSY
    }

    public static final class Failure {
        public final String symbolName;
        /** File the failure relates to; null if not file specific. */
        public final Path file;
        public final String reason;

        public Failure(String symbolName, Path file, String reason) {
            this.symbolName = Objects.requireNonNull(symbolName, "symbolName");
            this.file = file;
            this.reason = reason == null ? "" : reason;
        }

        @Override
        public String toString() {
            return symbolName + ": " + reason;
        }
    }

    public final Status status;
    public final Map<Category, Integer> removed;
    public final List<Failure> failures;
    /** Items that were gone by the time they were applied. */
    public final int skipped;
    public final int passesRun;
    /** Files rewritten or deleted, sorted. */
    public final List<Path> affectedFiles;
    /** Why the run failed; empty otherwise. */
    public final String error;

    public Report(Status status,
                  Map<Category, Integer> removed,
                  List<Failure> failures,
                  int skipped,
                  int passesRun,
                  Collection<Path> affectedFiles,
                  String error) {
        this.status = Objects.requireNonNull(status, "status");
        Map<Category, Integer> counts = new EnumMap<>(Category.class);
        counts.putAll(Objects.requireNonNull(removed, "removed"));
        this.removed = Collections.unmodifiableMap(counts);
        this.failures = List.copyOf(Objects.requireNonNull(failures, "failures"));
        this.skipped = skipped;
        this.passesRun = passesRun;
        this.affectedFiles = List.copyOf(new TreeSet<>(Objects.requireNonNull(affectedFiles, "affectedFiles")));
        this.error = error == null ? "" : error;
    }

    /** A report for a run that changed nothing. */
    public static Report of(Status status, String error) {
        return new Report(status, Collections.emptyMap(), Collections.emptyList(), 0, 0, Collections.emptyList(), error);
    }

    public int removed(Category category) {
        return removed.getOrDefault(category, 0);
    }

    public int totalRemoved() {
        int total = 0;
        for (int count : removed.values()) total += count;
        return total;
    }

    public boolean isSuccess() {
        return status == Status.COMPLETED || status == Status.NOTHING_TO_DO || status == Status.DECLINED;
    }

    public String describe() {
        switch (status) {
            case NOTHING_TO_DO:
                return "Nothing to clean up.";
            case DECLINED:
                return "Operation cancelled by user.";
            case BUSY:
                return "Another cleanup is already running for this project.";
            default:
                break;
        }
        StringBuilder sb = new StringBuilder();
        if (status == Status.FAILED) sb.append("Cleanup failed: ").append(error).append('\n');
        if (status == Status.CANCELLED) sb.append("Cleanup cancelled.\n");

        StringJoiner counts = new StringJoiner(", ");
        for (Category category : Category.values()) {
            if (removed(category) > 0) counts.add(removed(category) + " " + category.getLabel());
        }
        sb.append("Removed ").append(counts.length() == 0 ? "nothing" : counts.toString())
                .append(" from ").append(affectedFiles.size()).append(" file(s) over ")
                .append(passesRun).append(passesRun == 1 ? " pass" : " passes").append('.');
        if (skipped > 0) sb.append(' ').append(skipped).append(" already gone.");
        for (Failure failure : failures) {
            sb.append('\n').append("Failed: ").append(failure);
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "Report{status=" + status + ", removed=" + totalRemoved() + ", failures=" + failures.size()
                + ", skipped=" + skipped + ", passesRun=" + passesRun + "}";
    }
}
