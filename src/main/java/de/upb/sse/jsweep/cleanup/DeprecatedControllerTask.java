package de.upb.sse.jsweep.cleanup;

import de.upb.sse.jsweep.analysis.Category;
import de.upb.sse.jsweep.analysis.CleanupAnalysis;
import de.upb.sse.jsweep.analysis.LivenessAnalyzer;
import de.upb.sse.jsweep.configuration.JSweepConfiguration;
import de.upb.sse.jsweep.model.CodeModel;
import de.upb.sse.jsweep.model.Symbol;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Removes unreferenced deprecated controller methods together with the methods only they called.
 * Every file something was removed from is marked afterwards, so a marked-file cleanup can tidy
 * up the imports and fields left behind.
 */
public class DeprecatedControllerTask extends AbstractCleanupTask {
    private final FileMarkingCoordinator marking;

    public DeprecatedControllerTask(JSweepConfiguration config, FileMarkingCoordinator marking) {
        super(config);
        this.marking = marking;
    }

    @Override
    public String getName() {
        return "Deprecated controller cleanup";
    }

    @Override
    protected CleanupAnalysis analyze(CodeModel model, LivenessAnalyzer analyzer) {
        List<Path> files = model.listFiles();
        Map<Path, List<Symbol>> deprecated = analyzer.findUnusedMethods(files);

        List<Symbol> seed = new ArrayList<>();
        deprecated.values().forEach(seed::addAll);

        return CleanupAnalysis.builder(getName(), files)
                .put(Category.DEPRECATED_METHOD, deprecated)
                .add(Category.TRANSITIVE_METHOD, analyzer.findTransitivelyUnusedMethods(seed))
                .build();
    }

    @Override
    public void onFinished(Report report, ProgressSink sink) {
        if (report.affectedFiles.isEmpty()) return;
        List<Path> marked = marking.mark(report.affectedFiles);
        if (!marked.isEmpty()) {
            sink.log("Marked " + marked.size() + " file(s) with " + marking.getMarker() + " for follow-up cleanup");
        }
    }
}
