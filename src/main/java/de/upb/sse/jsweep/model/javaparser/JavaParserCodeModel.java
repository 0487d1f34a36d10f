package de.upb.sse.jsweep.model.javaparser;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.printer.lexicalpreservation.LexicalPreservingPrinter;
import com.github.javaparser.symbolsolver.javaparsermodel.JavaParserFacade;
import de.upb.sse.jsweep.exceptions.MutationException;
import de.upb.sse.jsweep.exceptions.StaleSymbolException;
import de.upb.sse.jsweep.model.*;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.logging.Logger;

/**
 * CodeModel snapshot backed by JavaParser compilation units. Candidate files are parsed with
 * lexical preservation set up, so untouched code keeps its formatting when written back.
 */
public class JavaParserCodeModel implements CodeModel {
    private static final Logger logger = Logger.getLogger(JavaParserCodeModel.class.getName());

    private final CleanupScope scope;
    private final SymbolTable table;
    private final JavaParserReferenceIndex index;
    private final Set<Path> modified = new LinkedHashSet<>();
    // files that lost a top-level type in this snapshot
    private final Set<Path> lostTopLevelType = new HashSet<>();

    JavaParserCodeModel(CleanupScope scope, Map<Path, CompilationUnit> units) {
        this.scope = scope;
        this.table = SymbolExtractor.extract(units);
        this.index = new JavaParserReferenceIndex(table);
    }

    @Override
    public CleanupScope getScope() {
        return scope;
    }

    @Override
    public List<Path> listFiles() {
        List<Path> files = new ArrayList<>();
        for (Path file : table.getUnits().keySet()) {
            if (scope.isCandidate(file)) files.add(file);
        }
        Collections.sort(files);
        return files;
    }

    @Override
    public FileSymbols getSymbols(Path file) {
        return table.fileSymbols(file.toAbsolutePath().normalize());
    }

    @Override
    public List<ReferenceSite> findReferences(Symbol symbol) {
        return index.findReferences(symbol);
    }

    @Override
    public List<CallSite> getCallSites(Symbol method) {
        return index.getCallSites(method);
    }

    @Override
    public Optional<Symbol> resolveCallTarget(CallSite callSite) {
        if (!callSite.isResolved()) return Optional.empty();
        return find(callSite.getTarget());
    }

    @Override
    public Optional<Symbol> find(SymbolId id) {
        return Optional.ofNullable(table.get(id));
    }

    @Override
    public boolean isValid(Symbol symbol) {
        Node node = table.nodeOf(symbol.getId());
        if (node == null) return false;
        CompilationUnit unit = table.getUnits().get(symbol.getDeclaringFile());
        Optional<CompilationUnit> attachedTo = node.findCompilationUnit();
        return unit != null && attachedTo.isPresent() && attachedTo.get() == unit;
    }

    @Override
    public void delete(Symbol symbol) throws StaleSymbolException, MutationException {
        if (!isValid(symbol)) throw new StaleSymbolException(symbol.getId());

        Node node = table.nodeOf(symbol.getId());
        Node target = node;
        if (node instanceof VariableDeclarator) {
            // the last declarator takes its whole field declaration along
            Optional<Node> parent = node.getParentNode();
            if (parent.isPresent() && parent.get() instanceof FieldDeclaration
                    && ((FieldDeclaration) parent.get()).getVariables().size() == 1) {
                target = parent.get();
            }
        }

        boolean topLevel = target.getParentNode().map(p -> p instanceof CompilationUnit).orElse(false);
        boolean removed;
        try {
            removed = target.remove();
        } catch (RuntimeException e) {
            throw new MutationException("Could not remove " + symbol.getDisplayName() + ": " + e.getMessage(), e);
        }
        if (!removed) {
            throw new MutationException("Could not remove " + symbol.getDisplayName() + " from its parent");
        }
        modified.add(symbol.getDeclaringFile());
        if (topLevel && symbol.getKind() == SymbolKind.CLASS) lostTopLevelType.add(symbol.getDeclaringFile());
        logger.fine("Removed " + symbol.getDisplayName() + " from " + symbol.getDeclaringFile().getFileName());
    }

    @Override
    public Set<Path> commit() throws MutationException {
        Set<Path> written = new LinkedHashSet<>();
        List<String> failures = new ArrayList<>();
        try {
            for (Path file : modified) {
                CompilationUnit unit = table.getUnits().get(file);
                try {
                    if (unit.getTypes().isEmpty() && lostTopLevelType.contains(file)) {
                        Files.deleteIfExists(file);
                        logger.info("Deleted " + file + " (no types left)");
                    } else {
                        Files.write(file, print(unit).getBytes(StandardCharsets.UTF_8));
                    }
                    written.add(file);
                } catch (IOException e) {
                    failures.add(file + ": " + e.getMessage());
                }
            }
        } finally {
            modified.clear();
            lostTopLevelType.clear();
            JavaParserFacade.clearInstances();
        }
        if (!failures.isEmpty()) {
            throw new MutationException("Could not write " + String.join(", ", failures));
        }
        return written;
    }

    private String print(CompilationUnit unit) {
        try {
            return LexicalPreservingPrinter.print(unit);
        } catch (RuntimeException e) {
            logger.warning("Lexical preserving printing failed, falling back to pretty printing: " + e.getMessage());
            return unit.toString();
        }
    }
}
