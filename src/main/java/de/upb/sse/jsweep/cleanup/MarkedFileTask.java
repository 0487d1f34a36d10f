package de.upb.sse.jsweep.cleanup;

import de.upb.sse.jsweep.analysis.Category;
import de.upb.sse.jsweep.analysis.CleanupAnalysis;
import de.upb.sse.jsweep.analysis.LivenessAnalyzer;
import de.upb.sse.jsweep.configuration.JSweepConfiguration;
import de.upb.sse.jsweep.model.CleanupScope;
import de.upb.sse.jsweep.model.CodeModel;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Removes unused imports, unused fields and empty classes from the marked files. The set of marked
 * files is taken once, when the run starts. Files that come through the run without a failure are
 * unmarked at the end; the others stay marked for another attempt.
 */
public class MarkedFileTask extends AbstractCleanupTask {
    private final FileMarkingCoordinator marking;
    private List<Path> markedFiles = new ArrayList<>();

    public MarkedFileTask(JSweepConfiguration config, FileMarkingCoordinator marking) {
        super(config);
        this.marking = marking;
    }

    @Override
    public String getName() {
        return "Marked file cleanup";
    }

    @Override
    public CleanupScope resolveScope(CleanupScope requested) {
        markedFiles = marking.listMarkedFiles(requested);
        return requested.restrictTo(markedFiles);
    }

    @Override
    protected CleanupAnalysis analyze(CodeModel model, LivenessAnalyzer analyzer) {
        List<Path> files = model.listFiles();
        return CleanupAnalysis.builder(getName(), files)
                .put(Category.UNUSED_IMPORT, analyzer.findUnusedImports(files))
                .put(Category.UNUSED_FIELD, analyzer.findUnusedFields(files))
                .put(Category.UNUSED_CLASS, analyzer.findEmptyClasses(files))
                .build();
    }

    @Override
    public void onFinished(Report report, ProgressSink sink) {
        if (report.status != Report.Status.COMPLETED && report.status != Report.Status.NOTHING_TO_DO) return;

        Set<Path> keep = new LinkedHashSet<>();
        for (Report.Failure failure : report.failures) {
            if (failure.file != null) keep.add(failure.file);
        }
        List<Path> done = new ArrayList<>(markedFiles);
        done.removeAll(keep);
        List<Path> unmarked = marking.unmark(done);
        sink.log("Removed " + marking.getMarker() + " from " + unmarked.size() + " file(s)"
                + (keep.isEmpty() ? "" : ", " + keep.size() + " file(s) with failures stay marked"));
    }
}
