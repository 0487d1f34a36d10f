package de.upb.sse.jsweep.model.javaparser;

import com.github.javaparser.Position;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.*;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.github.javaparser.resolution.declarations.ResolvedMethodDeclaration;
import com.github.javaparser.resolution.declarations.ResolvedValueDeclaration;
import de.upb.sse.jsweep.model.CallSite;
import de.upb.sse.jsweep.model.ReferenceIndex;
import de.upb.sse.jsweep.model.ReferenceSite;
import de.upb.sse.jsweep.model.Symbol;
import de.upb.sse.jsweep.model.SymbolId;
import de.upb.sse.jsweep.model.SymbolKind;
import de.upb.sse.jsweep.model.SymbolModifier;

import java.nio.file.Path;
import java.util.*;
import java.util.logging.Logger;

/**
 * ReferenceIndex over the parsed compilation units of one snapshot.
 *
 * The index is built on first use by a single walk over every unit:
 * - method calls are resolved through the symbol solver and mapped onto project methods
 *   (owner, name, arity); calls that cannot be resolved count for every project method of that
 *   name and arity
 * - method references count for every project method of that name
 * - simple-name occurrences (types, names, field accesses, annotations, imports) are kept per
 *   identifier and matched against fields, imports and classes on lookup
 *
 * Javadoc is never scanned.
 */
public class JavaParserReferenceIndex implements ReferenceIndex {
    private static final Logger logger = Logger.getLogger(JavaParserReferenceIndex.class.getName());

    enum OccurrenceKind { TYPE, NAME, FIELD_ACCESS, ANNOTATION, IMPORT, METHOD_NAME, METHOD_REF }

    private static final class Occurrence {
        final Node node;
        final Path file;
        final OccurrenceKind kind;

        Occurrence(Node node, Path file, OccurrenceKind kind) {
            this.node = node;
            this.file = file;
            this.kind = kind;
        }
    }

    private static final class UnresolvedCall {
        final MethodCallExpr call;
        final Path file;

        UnresolvedCall(MethodCallExpr call, Path file) {
            this.call = call;
            this.file = file;
        }
    }

    private final SymbolTable table;
    private boolean built;

    // project method -> resolved call expressions targeting it
    private final Map<SymbolId, List<ReferenceSite>> methodReferences = new HashMap<>();
    // method name -> calls that could not be resolved
    private final Map<String, List<UnresolvedCall>> unresolvedCalls = new HashMap<>();
    // method name -> method reference expressions
    private final Map<String, List<Occurrence>> methodRefs = new HashMap<>();
    // identifier -> occurrences
    private final Map<String, List<Occurrence>> occurrences = new HashMap<>();
    // caller method -> call sites in its body
    private final Map<SymbolId, List<CallSite>> callSites = new HashMap<>();

    private int resolvedCount;
    private int unresolvedCount;

    JavaParserReferenceIndex(SymbolTable table) {
        this.table = table;
    }

    @Override
    public List<ReferenceSite> findReferences(Symbol symbol) {
        ensureBuilt();
        switch (symbol.getKind()) {
            case METHOD:
                return methodReferencesOf(symbol);
            case FIELD:
                return fieldReferencesOf(symbol);
            case IMPORT:
                return importReferencesOf(symbol);
            case CLASS:
                return classReferencesOf(symbol);
            default:
                return Collections.emptyList();
        }
    }

    @Override
    public List<CallSite> getCallSites(Symbol method) {
        ensureBuilt();
        return Collections.unmodifiableList(callSites.getOrDefault(method.getId(), Collections.emptyList()));
    }

    private synchronized void ensureBuilt() {
        if (built) return;
        for (Map.Entry<Path, CompilationUnit> entry : table.getUnits().entrySet()) {
            Path file = entry.getKey();
            entry.getValue().walk(node -> visit(node, file));
        }
        built = true;
        logger.fine("Reference index complete: " + resolvedCount + " calls resolved, " + unresolvedCount + " unresolved");
    }

    private void visit(Node node, Path file) {
        if (node instanceof MethodCallExpr) {
            MethodCallExpr call = (MethodCallExpr) node;
            indexCall(call, file);
            if (call.getScope().isEmpty()) addOccurrence(call.getNameAsString(), node, file, OccurrenceKind.METHOD_NAME);
        } else if (node instanceof MethodReferenceExpr) {
            MethodReferenceExpr ref = (MethodReferenceExpr) node;
            Occurrence occurrence = new Occurrence(node, file, OccurrenceKind.METHOD_REF);
            methodRefs.computeIfAbsent(ref.getIdentifier(), k -> new ArrayList<>()).add(occurrence);
            addOccurrence(ref.getIdentifier(), node, file, OccurrenceKind.METHOD_REF);
        } else if (node instanceof NameExpr) {
            addOccurrence(((NameExpr) node).getNameAsString(), node, file, OccurrenceKind.NAME);
        } else if (node instanceof FieldAccessExpr) {
            addOccurrence(((FieldAccessExpr) node).getNameAsString(), node, file, OccurrenceKind.FIELD_ACCESS);
        } else if (node instanceof ClassOrInterfaceType) {
            addOccurrence(((ClassOrInterfaceType) node).getNameAsString(), node, file, OccurrenceKind.TYPE);
        } else if (node instanceof AnnotationExpr) {
            Name name = ((AnnotationExpr) node).getName();
            while (name != null) {
                addOccurrence(name.getIdentifier(), node, file, OccurrenceKind.ANNOTATION);
                name = name.getQualifier().orElse(null);
            }
        } else if (node instanceof ImportDeclaration) {
            ImportDeclaration imp = (ImportDeclaration) node;
            Name name = imp.getName();
            if (!imp.isAsterisk()) addOccurrence(name.getIdentifier(), node, file, OccurrenceKind.IMPORT);
            if (imp.isStatic()) {
                Name owner = imp.isAsterisk() ? name : name.getQualifier().orElse(null);
                if (owner != null) addOccurrence(owner.getIdentifier(), node, file, OccurrenceKind.IMPORT);
            }
        }
    }

    private void addOccurrence(String identifier, Node node, Path file, OccurrenceKind kind) {
        occurrences.computeIfAbsent(identifier, k -> new ArrayList<>()).add(new Occurrence(node, file, kind));
    }

    private void indexCall(MethodCallExpr call, Path file) {
        SymbolId caller = enclosingMethod(call);
        List<Symbol> targets;
        try {
            targets = resolveCall(call);
            resolvedCount++;
        } catch (RuntimeException | StackOverflowError e) {
            Optional<Symbol> local = resolveLocally(call);
            if (local.isPresent()) {
                targets = List.of(local.get());
                resolvedCount++;
            } else {
                unresolvedCount++;
                unresolvedCalls.computeIfAbsent(call.getNameAsString(), k -> new ArrayList<>()).add(new UnresolvedCall(call, file));
                if (caller != null) {
                    callSites.computeIfAbsent(caller, k -> new ArrayList<>()).add(callSite(caller, call, file, null));
                }
                return;
            }
        }

        for (Symbol target : targets) {
            methodReferences.computeIfAbsent(target.getId(), k -> new ArrayList<>()).add(site(target.getId(), call, file));
            if (caller != null) {
                callSites.computeIfAbsent(caller, k -> new ArrayList<>()).add(callSite(caller, call, file, target.getId()));
            }
        }
        // calls into library code leave no call site: there is nothing to cascade into
    }

    /**
     * Project methods the call resolves to. Empty when the call targets code outside the project.
     * Several results when overloads of the same arity cannot be told apart.
     */
    private List<Symbol> resolveCall(MethodCallExpr call) {
        ResolvedMethodDeclaration resolved = call.resolve();
        String owner = resolved.declaringType().getQualifiedName();
        List<Symbol> candidates = new ArrayList<>();
        for (Symbol method : table.methods(owner, resolved.getName())) {
            if (method.getParameterCount() == resolved.getNumberOfParams()) candidates.add(method);
        }
        if (candidates.size() <= 1) return candidates;

        List<String> resolvedTypes = new ArrayList<>();
        for (int i = 0; i < resolved.getNumberOfParams(); i++) {
            resolvedTypes.add(resolved.getParam(i).getType().describe());
        }
        for (Symbol candidate : candidates) {
            if (resolvedTypes.equals(parameterTypes(candidate))) return List.of(candidate);
        }
        return candidates;
    }

    private List<String> parameterTypes(Symbol method) {
        Node node = table.nodeOf(method.getId());
        if (!(node instanceof MethodDeclaration)) return Collections.emptyList();
        List<String> types = new ArrayList<>();
        for (Parameter parameter : ((MethodDeclaration) node).getParameters()) {
            try {
                types.add(parameter.getType().resolve().describe() + (parameter.isVarArgs() ? "[]" : ""));
            } catch (RuntimeException | StackOverflowError e) {
                return Collections.emptyList();
            }
        }
        return types;
    }

    /**
     * Falls back to the enclosing class for unqualified and {@code this.} calls the solver gave up
     * on. Only used when the class has no superclass and declares exactly one matching method, and
     * the call is not inside an anonymous class.
     */
    private Optional<Symbol> resolveLocally(MethodCallExpr call) {
        if (call.getScope().isPresent() && !call.getScope().get().isThisExpr()) return Optional.empty();

        Optional<TypeDeclaration> enclosing = call.findAncestor(TypeDeclaration.class);
        if (enclosing.isEmpty()) return Optional.empty();
        TypeDeclaration<?> type = enclosing.get();
        if (!SymbolExtractor.isIndexedType(type)) return Optional.empty();
        if (type instanceof ClassOrInterfaceDeclaration && ((ClassOrInterfaceDeclaration) type).getExtendedTypes().isNonEmpty()) {
            return Optional.empty();
        }

        Optional<ObjectCreationExpr> creation = call.findAncestor(ObjectCreationExpr.class);
        if (creation.isPresent() && creation.get().getAnonymousClassBody().isPresent() && type.isAncestorOf(creation.get())) {
            return Optional.empty();
        }

        List<MethodDeclaration> matching = new ArrayList<>();
        for (MethodDeclaration md : type.getMethodsByName(call.getNameAsString())) {
            if (md.getParameters().size() == call.getArguments().size()) matching.add(md);
        }
        if (matching.size() != 1) return Optional.empty();
        SymbolId id = table.idOf(matching.get(0));
        return id == null ? Optional.empty() : Optional.ofNullable(table.get(id));
    }

    private List<ReferenceSite> methodReferencesOf(Symbol method) {
        List<ReferenceSite> sites = new ArrayList<>(methodReferences.getOrDefault(method.getId(), Collections.emptyList()));
        boolean varArgs = isVarArgs(method);

        for (UnresolvedCall unresolved : unresolvedCalls.getOrDefault(method.getSimpleName(), Collections.emptyList())) {
            int arguments = unresolved.call.getArguments().size();
            boolean arityMatches = arguments == method.getParameterCount()
                    || (varArgs && arguments >= method.getParameterCount() - 1);
            if (arityMatches) sites.add(site(method.getId(), unresolved.call, unresolved.file));
        }
        for (Occurrence ref : methodRefs.getOrDefault(method.getSimpleName(), Collections.emptyList())) {
            sites.add(site(method.getId(), ref.node, ref.file));
        }
        return sites;
    }

    private boolean isVarArgs(Symbol method) {
        Node node = table.nodeOf(method.getId());
        if (!(node instanceof MethodDeclaration)) return false;
        MethodDeclaration md = (MethodDeclaration) node;
        return md.getParameters().isNonEmpty() && md.getParameters().getLast().map(Parameter::isVarArgs).orElse(false);
    }

    private List<ReferenceSite> fieldReferencesOf(Symbol field) {
        List<ReferenceSite> sites = new ArrayList<>();
        boolean isPrivate = field.is(SymbolModifier.PRIVATE);
        for (Occurrence occurrence : occurrences.getOrDefault(field.getSimpleName(), Collections.emptyList())) {
            if (occurrence.kind != OccurrenceKind.NAME && occurrence.kind != OccurrenceKind.FIELD_ACCESS) continue;
            if (isPrivate && !occurrence.file.equals(field.getDeclaringFile())) continue;
            if (!mayReferToField(occurrence.node, field)) continue;
            sites.add(site(field.getId(), occurrence.node, occurrence.file));
        }
        return sites;
    }

    /** False only when the solver positively resolves the name to something else. */
    private boolean mayReferToField(Node node, Symbol field) {
        try {
            ResolvedValueDeclaration declaration = node instanceof NameExpr
                    ? ((NameExpr) node).resolve()
                    : ((FieldAccessExpr) node).resolve();
            if (!declaration.isField()) return false;
            return declaration.asField().declaringType().getQualifiedName().equals(field.getContainingClass());
        } catch (RuntimeException | StackOverflowError e) {
            return true;
        }
    }

    private List<ReferenceSite> importReferencesOf(Symbol imp) {
        if (imp.isWildcardImport()) return Collections.emptyList();
        List<ReferenceSite> sites = new ArrayList<>();
        for (Occurrence occurrence : occurrences.getOrDefault(imp.getSimpleName(), Collections.emptyList())) {
            if (!occurrence.file.equals(imp.getDeclaringFile())) continue;
            if (occurrence.kind == OccurrenceKind.IMPORT) continue;
            boolean methodUse = occurrence.kind == OccurrenceKind.METHOD_NAME || occurrence.kind == OccurrenceKind.METHOD_REF;
            if (methodUse && !imp.isStaticImport()) continue;
            sites.add(site(imp.getId(), occurrence.node, occurrence.file));
        }
        return sites;
    }

    private List<ReferenceSite> classReferencesOf(Symbol type) {
        Node declaration = table.nodeOf(type.getId());
        List<ReferenceSite> sites = new ArrayList<>();
        for (Occurrence occurrence : occurrences.getOrDefault(type.getSimpleName(), Collections.emptyList())) {
            if (occurrence.kind == OccurrenceKind.METHOD_NAME || occurrence.kind == OccurrenceKind.METHOD_REF) continue;
            if (declaration != null && declaration.isAncestorOf(occurrence.node)) continue;
            sites.add(site(type.getId(), occurrence.node, occurrence.file));
        }
        return sites;
    }

    private ReferenceSite site(SymbolId target, Node node, Path file) {
        Position begin = node.getBegin().orElse(Position.HOME);
        return new ReferenceSite(target, file, begin.line, begin.column, enclosingMethod(node), enclosingField(node));
    }

    private CallSite callSite(SymbolId caller, MethodCallExpr call, Path file, SymbolId target) {
        Position begin = call.getBegin().orElse(Position.HOME);
        return new CallSite(caller, file, begin.line, begin.column, call.getNameAsString(), call.getArguments().size(), target);
    }

    /** Nearest enclosing method that is itself an indexed symbol. */
    private SymbolId enclosingMethod(Node node) {
        Optional<Node> parent = node.getParentNode();
        while (parent.isPresent()) {
            Node p = parent.get();
            if (p instanceof MethodDeclaration) {
                SymbolId id = table.idOf(p);
                if (id != null) return id;
            }
            parent = p.getParentNode();
        }
        return null;
    }

    private SymbolId enclosingField(Node node) {
        Optional<Node> parent = node.getParentNode();
        while (parent.isPresent()) {
            Node p = parent.get();
            if (p instanceof VariableDeclarator) {
                SymbolId id = table.idOf(p);
                if (id != null && id.getKind() == SymbolKind.FIELD) return id;
            }
            parent = p.getParentNode();
        }
        return null;
    }
}
