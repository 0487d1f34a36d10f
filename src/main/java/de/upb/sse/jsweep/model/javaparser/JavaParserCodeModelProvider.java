package de.upb.sse.jsweep.model.javaparser;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.printer.lexicalpreservation.LexicalPreservingPrinter;
import com.github.javaparser.symbolsolver.JavaSymbolSolver;
import com.github.javaparser.symbolsolver.javaparsermodel.JavaParserFacade;
import com.github.javaparser.symbolsolver.resolution.typesolvers.CombinedTypeSolver;
import com.github.javaparser.symbolsolver.resolution.typesolvers.JarTypeSolver;
import com.github.javaparser.symbolsolver.resolution.typesolvers.JavaParserTypeSolver;
import com.github.javaparser.symbolsolver.resolution.typesolvers.ReflectionTypeSolver;
import de.upb.sse.jsweep.configuration.JSweepConfiguration;
import de.upb.sse.jsweep.exceptions.ModelReadException;
import de.upb.sse.jsweep.model.CleanupScope;
import de.upb.sse.jsweep.model.CodeModel;
import de.upb.sse.jsweep.model.CodeModelProvider;
import de.upb.sse.jsweep.util.FileUtil;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Parses every Java file of the scope's indexed roots with a symbol solver over those roots, the
 * JDK and the configured jars. Each call builds a new solver and parser, so no resolution state
 * is shared between passes.
 */
public class JavaParserCodeModelProvider implements CodeModelProvider {
    private static final Logger logger = Logger.getLogger(JavaParserCodeModelProvider.class.getName());

    private final JSweepConfiguration config;

    public JavaParserCodeModelProvider() {
        this(new JSweepConfiguration());
    }

    public JavaParserCodeModelProvider(JSweepConfiguration config) {
        this.config = config;
    }

    @Override
    public CodeModel read(CleanupScope scope) {
        JavaParserFacade.clearInstances();

        CombinedTypeSolver combinedTypeSolver = new CombinedTypeSolver();
        combinedTypeSolver.add(new ReflectionTypeSolver());
        for (Path root : scope.getIndexedRoots()) {
            if (!Files.isDirectory(root)) {
                throw new ModelReadException("Source root does not exist or is not a directory: " + root);
            }
            combinedTypeSolver.add(new JavaParserTypeSolver(root));
        }
        for (Path jar : config.getClasspathJars()) {
            try {
                combinedTypeSolver.add(new JarTypeSolver(jar));
            } catch (IOException e) {
                logger.warning("Could not load JarTypeSolver for " + jar + ": " + e.getMessage());
            }
        }

        ParserConfiguration parserConfig = new ParserConfiguration();
        parserConfig.setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17);
        parserConfig.setSymbolResolver(new JavaSymbolSolver(combinedTypeSolver));
        JavaParser jp = new JavaParser(parserConfig);

        Set<Path> files = new TreeSet<>();
        for (Path root : scope.getIndexedRoots()) {
            try {
                files.addAll(FileUtil.getAllJavaFiles(root));
            } catch (RuntimeException e) {
                throw new ModelReadException("Could not list sources of " + root, e);
            }
        }

        Map<Path, CompilationUnit> units = new LinkedHashMap<>();
        for (Path file : files) {
            units.put(file, parse(jp, file, scope.isCandidate(file)));
        }
        logger.info("Read " + units.size() + " files from " + scope.getIndexedRoots().size() + " source root(s)");
        return new JavaParserCodeModel(scope, units);
    }

    private static CompilationUnit parse(JavaParser jp, Path file, boolean candidate) {
        ParseResult<CompilationUnit> result;
        try {
            result = jp.parse(file);
        } catch (IOException e) {
            throw new ModelReadException("Could not read " + file, e);
        }
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            String problems = result.getProblems().stream()
                    .map(Problem::getVerboseMessage)
                    .collect(Collectors.joining("; "));
            throw new ModelReadException("Could not parse " + file + ": " + problems);
        }
        CompilationUnit cu = result.getResult().get();
        if (candidate) LexicalPreservingPrinter.setup(cu);
        return cu;
    }
}
