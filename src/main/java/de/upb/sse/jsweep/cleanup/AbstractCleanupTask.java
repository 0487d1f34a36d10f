package de.upb.sse.jsweep.cleanup;

import de.upb.sse.jsweep.analysis.CleanupAnalysis;
import de.upb.sse.jsweep.analysis.LivenessAnalyzer;
import de.upb.sse.jsweep.analysis.SymbolClassifier;
import de.upb.sse.jsweep.configuration.JSweepConfiguration;
import de.upb.sse.jsweep.model.CodeModel;
import de.upb.sse.jsweep.plan.RemovalBatch;
import de.upb.sse.jsweep.plan.RemovalPlanner;

public abstract class AbstractCleanupTask implements CleanupTask {
    protected final JSweepConfiguration config;

    protected AbstractCleanupTask(JSweepConfiguration config) {
        this.config = config;
    }

    @Override
    public final CleanupAnalysis analyze(CodeModel model) {
        SymbolClassifier classifier = SymbolClassifier.forModel(config, model);
        return analyze(model, new LivenessAnalyzer(model, classifier));
    }

    protected abstract CleanupAnalysis analyze(CodeModel model, LivenessAnalyzer analyzer);

    @Override
    public RemovalBatch plan(CodeModel model, CleanupAnalysis analysis) {
        return new RemovalPlanner(SymbolClassifier.forModel(config, model)).plan(analysis);
    }
}
