package de.upb.sse.jsweep;

import de.upb.sse.jsweep.analysis.CleanupAnalysis;
import de.upb.sse.jsweep.cleanup.*;
import de.upb.sse.jsweep.configuration.JSweepConfiguration;
import de.upb.sse.jsweep.finder.PackageFinder;
import de.upb.sse.jsweep.model.CleanupScope;
import de.upb.sse.jsweep.model.CodeModelProvider;
import de.upb.sse.jsweep.model.javaparser.JavaParserCodeModelProvider;
import lombok.Getter;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

public class JSweep {
    private static final Logger logger = Logger.getLogger(JSweep.class.getName());

    @Getter private final JSweepConfiguration config;
    private final CodeModelProvider provider;
    private final ProgressSink sink;
    @Getter private final FileMarkingCoordinator marking;

    public JSweep() {
        this(new JSweepConfiguration());
    }

    public JSweep(JSweepConfiguration config) {
        this(config, new LoggingProgressSink());
    }

    public JSweep(JSweepConfiguration config, ProgressSink sink) {
        this(config, new JavaParserCodeModelProvider(config), sink);
    }

    public JSweep(JSweepConfiguration config, CodeModelProvider provider, ProgressSink sink) {
        this.config = config;
        this.provider = provider;
        this.sink = sink;
        this.marking = new FileMarkingCoordinator(config.getMarker());
    }

    /**
     * Scope over every source root found below {@code projectDir}. Roots with a {@code test} path
     * segment are indexed but only cleaned when test sources are enabled.
     */
    public CleanupScope scopeOf(Path projectDir) {
        if (!Files.isDirectory(projectDir)) {
            throw new IllegalArgumentException("Not a directory: " + projectDir);
        }
        Set<Path> roots = PackageFinder.findPackageRoots(projectDir);
        List<Path> mainRoots = PackageFinder.mainRoots(projectDir, roots);
        List<Path> testRoots = PackageFinder.testRoots(projectDir, roots);
        logger.fine("Source roots of " + projectDir + ": " + mainRoots + ", test roots: " + testRoots);
        return new CleanupScope(projectDir, mainRoots, testRoots, config.isCleanTestSources());
    }

    public CleanupAnalysis analyzeDeprecatedControllers(CleanupScope scope) {
        return newDriver().analyze(new DeprecatedControllerTask(config, marking), scope);
    }

    public Report runDeprecatedControllerCleanup(CleanupScope scope, ConfirmationPort confirmation) {
        return newDriver().run(new DeprecatedControllerTask(config, marking), scope, confirmation);
    }

    public CleanupAnalysis analyzeMarkedFiles(CleanupScope scope) {
        return newDriver().analyze(new MarkedFileTask(config, marking), scope);
    }

    public Report runMarkedFileCleanup(CleanupScope scope, ConfirmationPort confirmation) {
        return newDriver().run(new MarkedFileTask(config, marking), scope, confirmation);
    }

    public List<Path> listMarkedFiles(CleanupScope scope) {
        return marking.listMarkedFiles(scope);
    }

    public List<Path> markFiles(Collection<Path> files) {
        return marking.mark(files);
    }

    public List<Path> unmarkFiles(Collection<Path> files) {
        return marking.unmark(files);
    }

    private FixpointCleanupDriver newDriver() {
        return new FixpointCleanupDriver(provider, sink);
    }
}
