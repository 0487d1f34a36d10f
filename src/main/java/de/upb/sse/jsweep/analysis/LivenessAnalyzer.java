package de.upb.sse.jsweep.analysis;

import de.upb.sse.jsweep.model.*;

import java.nio.file.Path;
import java.util.*;
import java.util.logging.Logger;

/**
 * Decides which candidate symbols of one snapshot are unreachable.
 *
 * A symbol is directly unused when it has no external references, i.e. none outside its own body
 * or initializer. Methods can also become unused transitively: once every caller of a method is
 * dead, so is the method.
 *
 * One analyzer serves one snapshot. External reference counts are cached for its lifetime.
 */
public class LivenessAnalyzer {
    private static final Logger logger = Logger.getLogger(LivenessAnalyzer.class.getName());

    private final CodeModel model;
    private final SymbolClassifier classifier;
    private final Map<SymbolId, Integer> externalCounts = new HashMap<>();

    public LivenessAnalyzer(CodeModel model, SymbolClassifier classifier) {
        this.model = model;
        this.classifier = classifier;
    }

    /** Number of references to {@code symbol} that are not self-references. */
    public int externalReferenceCount(Symbol symbol) {
        Integer cached = externalCounts.get(symbol.getId());
        if (cached != null) return cached;
        int count = 0;
        for (ReferenceSite site : model.findReferences(symbol)) {
            if (!site.isSelfReference(symbol.getId())) count++;
        }
        externalCounts.put(symbol.getId(), count);
        return count;
    }

    public boolean isUnused(Symbol symbol) {
        return externalReferenceCount(symbol) == 0;
    }

    public Map<Path, List<Symbol>> findUnusedImports(List<Path> files) {
        Map<Path, List<Symbol>> result = new LinkedHashMap<>();
        for (Path file : files) {
            List<Symbol> unused = new ArrayList<>();
            for (Symbol imp : model.getSymbols(file).getImports()) {
                if (classifier.classify(imp).orElse(null) != Category.UNUSED_IMPORT) continue;
                if (SymbolClassifier.isRedundantJavaLangImport(imp) || isUnused(imp)) unused.add(imp);
            }
            if (!unused.isEmpty()) result.put(file, unused);
        }
        return result;
    }

    public Map<Path, List<Symbol>> findUnusedFields(List<Path> files) {
        return findDirectlyUnused(files, Category.UNUSED_FIELD);
    }

    public Map<Path, List<Symbol>> findEmptyClasses(List<Path> files) {
        return findDirectlyUnused(files, Category.UNUSED_CLASS);
    }

    /**
     * Deprecated controller methods without external references. Interface methods and overrides
     * are left alone: they may be reached through dispatch.
     */
    public Map<Path, List<Symbol>> findUnusedMethods(List<Path> files) {
        Map<Path, List<Symbol>> result = new LinkedHashMap<>();
        for (Path file : files) {
            List<Symbol> unused = new ArrayList<>();
            for (Symbol method : model.getSymbols(file).getMethods()) {
                if (classifier.classify(method).orElse(null) != Category.DEPRECATED_METHOD) continue;
                if (method.isInterfaceMember() || method.isOverriding()) {
                    logger.fine("Keeping " + method.getDisplayName() + ": dispatch target");
                    continue;
                }
                if (isUnused(method)) unused.add(method);
            }
            if (!unused.isEmpty()) result.put(file, unused);
        }
        return result;
    }

    /**
     * Methods that become unreachable once every method of {@code seed} is gone. The seed itself
     * is not part of the result.
     *
     * Each call site of a dead method enqueues its target once. A dequeued method loses one
     * remaining caller; when none remain it is dead and its own callees are enqueued. Methods
     * declared outside the candidate files, interface methods and overrides stay alive and are
     * never expanded.
     */
    public List<Symbol> findTransitivelyUnusedMethods(List<Symbol> seed) {
        Set<SymbolId> dead = new HashSet<>();
        for (Symbol s : seed) dead.add(s.getId());

        Deque<SymbolId> queue = new ArrayDeque<>();
        for (Symbol s : seed) queue.addAll(calledMethods(s));

        Map<SymbolId, Integer> remaining = new HashMap<>();
        List<Symbol> result = new ArrayList<>();
        while (!queue.isEmpty()) {
            SymbolId id = queue.poll();
            if (dead.contains(id)) continue;

            Optional<Symbol> target = model.find(id);
            if (target.isEmpty()) continue;
            Symbol method = target.get();
            if (method.getKind() != SymbolKind.METHOD) continue;
            if (method.isInterfaceMember() || method.isOverriding()) continue;
            if (!model.getScope().isCandidate(method.getDeclaringFile())) continue;

            int left = remaining.getOrDefault(id, externalReferenceCount(method)) - 1;
            remaining.put(id, left);
            if (left <= 0) {
                dead.add(id);
                result.add(method);
                logger.fine("Transitively unused: " + method.getDisplayName());
                queue.addAll(calledMethods(method));
            }
        }
        return result;
    }

    /** Resolved project methods called from {@code method}'s body, one entry per call site. */
    public List<SymbolId> calledMethods(Symbol method) {
        List<SymbolId> callees = new ArrayList<>();
        for (CallSite callSite : model.getCallSites(method)) {
            model.resolveCallTarget(callSite).ifPresent(callee -> callees.add(callee.getId()));
        }
        return callees;
    }

    private Map<Path, List<Symbol>> findDirectlyUnused(List<Path> files, Category category) {
        Map<Path, List<Symbol>> result = new LinkedHashMap<>();
        for (Path file : files) {
            FileSymbols symbols = model.getSymbols(file);
            List<Symbol> declared = category == Category.UNUSED_FIELD ? symbols.getFields() : symbols.getClasses();
            List<Symbol> unused = new ArrayList<>();
            for (Symbol symbol : declared) {
                if (classifier.classify(symbol).orElse(null) != category) continue;
                if (isUnused(symbol)) unused.add(symbol);
            }
            if (!unused.isEmpty()) result.put(file, unused);
        }
        return result;
    }
}
