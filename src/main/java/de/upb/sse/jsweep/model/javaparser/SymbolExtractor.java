package de.upb.sse.jsweep.model.javaparser;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.Modifier;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.*;
import com.github.javaparser.ast.expr.AnnotationExpr;
import com.github.javaparser.ast.nodeTypes.NodeWithJavadoc;
import com.github.javaparser.javadoc.JavadocBlockTag;
import com.github.javaparser.resolution.MethodUsage;
import com.github.javaparser.resolution.declarations.ResolvedReferenceTypeDeclaration;
import com.github.javaparser.resolution.types.ResolvedReferenceType;
import de.upb.sse.jsweep.model.FileSymbols;
import de.upb.sse.jsweep.model.Symbol;
import de.upb.sse.jsweep.model.SymbolId;
import de.upb.sse.jsweep.model.SymbolKind;
import de.upb.sse.jsweep.model.SymbolModifier;

import java.nio.file.Path;
import java.util.*;
import java.util.logging.Logger;

/**
 * Reads the declared classes, methods, fields and imports of parsed compilation units.
 *
 * Only member types are indexed: a type counts when every ancestor up to the compilation unit is
 * itself a type declaration. Local and anonymous classes are part of their enclosing method.
 */
final class SymbolExtractor {
    private static final Logger logger = Logger.getLogger(SymbolExtractor.class.getName());

    // name/arity of the methods every class inherits from java.lang.Object and may override
    private static final Set<String> OBJECT_METHODS = Set.of("equals/1", "hashCode/0", "toString/0", "finalize/0", "clone/0");

    private SymbolExtractor() {}

    static SymbolTable extract(Map<Path, CompilationUnit> units) {
        SymbolTable table = new SymbolTable(units);
        for (Map.Entry<Path, CompilationUnit> entry : units.entrySet()) {
            extractFile(table, entry.getKey(), entry.getValue());
        }
        return table;
    }

    static boolean isIndexedType(Node node) {
        if (!(node instanceof TypeDeclaration)) return false;
        Optional<Node> parent = node.getParentNode();
        while (parent.isPresent()) {
            Node p = parent.get();
            if (p instanceof CompilationUnit) return true;
            if (!(p instanceof TypeDeclaration)) return false;
            parent = p.getParentNode();
        }
        return false;
    }

    private static void extractFile(SymbolTable table, Path file, CompilationUnit cu) {
        List<Symbol> classes = new ArrayList<>();
        List<Symbol> methods = new ArrayList<>();
        List<Symbol> fields = new ArrayList<>();
        List<Symbol> imports = new ArrayList<>();

        for (ImportDeclaration imp : cu.getImports()) {
            String name = imp.getNameAsString();
            String qualifiedName = (imp.isStatic() ? "static " : "") + name + (imp.isAsterisk() ? ".*" : "");
            SymbolId id = SymbolId.of(SymbolKind.IMPORT, file, qualifiedName);
            if (table.get(id) != null) {
                logger.fine("Duplicate import " + qualifiedName + " in " + file);
                continue;
            }
            Symbol symbol = Symbol.builder()
                    .id(id)
                    .simpleName(imp.isAsterisk() ? "*" : lastSegment(name))
                    .staticImport(imp.isStatic())
                    .wildcardImport(imp.isAsterisk())
                    .build();
            table.add(symbol, imp);
            imports.add(symbol);
        }

        List<TypeDeclaration<?>> types = new ArrayList<>();
        for (TypeDeclaration<?> td : cu.findAll(TypeDeclaration.class)) {
            if (isIndexedType(td)) types.add(td);
        }

        for (TypeDeclaration<?> td : types) {
            String fqn = td.getFullyQualifiedName().orElse(td.getNameAsString());
            Set<String> typeAnnotations = annotationNames(td.getAnnotations());
            boolean isInterface = td instanceof ClassOrInterfaceDeclaration && ((ClassOrInterfaceDeclaration) td).isInterface();

            if (td instanceof ClassOrInterfaceDeclaration) {
                Symbol classSymbol = classSymbol(file, (ClassOrInterfaceDeclaration) td, fqn, typeAnnotations);
                table.add(classSymbol, td);
                classes.add(classSymbol);
            }

            for (BodyDeclaration<?> member : td.getMembers()) {
                if (member instanceof MethodDeclaration) {
                    MethodDeclaration md = (MethodDeclaration) member;
                    Symbol method = methodSymbol(file, td, fqn, typeAnnotations, isInterface, md);
                    table.add(method, md);
                    methods.add(method);
                } else if (member instanceof FieldDeclaration) {
                    FieldDeclaration fd = (FieldDeclaration) member;
                    for (VariableDeclarator variable : fd.getVariables()) {
                        Symbol field = fieldSymbol(file, td, fqn, typeAnnotations, isInterface, fd, variable);
                        table.add(field, variable);
                        fields.add(field);
                    }
                }
            }
        }

        table.putFile(new FileSymbols(file, List.copyOf(classes), List.copyOf(methods), List.copyOf(fields), List.copyOf(imports)));
    }

    private static Symbol classSymbol(Path file, ClassOrInterfaceDeclaration td, String fqn, Set<String> annotations) {
        int fieldCount = 0;
        int nestedCount = 0;
        int initializerCount = 0;
        for (BodyDeclaration<?> member : td.getMembers()) {
            if (member instanceof FieldDeclaration) fieldCount += ((FieldDeclaration) member).getVariables().size();
            else if (member instanceof TypeDeclaration) nestedCount++;
            else if (member instanceof InitializerDeclaration) initializerCount++;
        }
        Optional<TypeDeclaration<?>> outer = parentType(td);

        return Symbol.builder()
                .id(SymbolId.of(SymbolKind.CLASS, file, fqn))
                .simpleName(td.getNameAsString())
                .containingClass(outer.map(o -> o.getFullyQualifiedName().orElse(o.getNameAsString())).orElse(null))
                .containingClassSimpleName(outer.map(o -> o.getNameAsString()).orElse(null))
                .modifiers(modifiers(td.getModifiers()))
                .annotations(annotations)
                .containerAnnotations(outer.map(o -> annotationNames(o.getAnnotations())).orElse(Set.of()))
                .docDeprecated(hasDeprecatedTag(td))
                .interfaceType(td.isInterface())
                .methodCount(td.getMethods().size() + td.getConstructors().size())
                .fieldCount(fieldCount)
                .nestedClassCount(nestedCount)
                .initializerCount(initializerCount)
                .build();
    }

    private static Symbol methodSymbol(Path file, TypeDeclaration<?> owner, String ownerFqn, Set<String> ownerAnnotations,
                                       boolean isInterface, MethodDeclaration md) {
        Set<SymbolModifier> modifiers = modifiers(md.getModifiers());
        if (isInterface && !md.isPrivate()) modifiers.add(SymbolModifier.PUBLIC);

        return Symbol.builder()
                .id(SymbolId.of(SymbolKind.METHOD, file, ownerFqn + "#" + md.getSignature().asString()))
                .simpleName(md.getNameAsString())
                .containingClass(ownerFqn)
                .containingClassSimpleName(owner.getNameAsString())
                .modifiers(modifiers)
                .annotations(annotationNames(md.getAnnotations()))
                .containerAnnotations(ownerAnnotations)
                .docDeprecated(hasDeprecatedTag(md))
                .interfaceMember(isInterface)
                .overriding(isInterface ? hasOverrideAnnotation(md) : isOverriding(owner, md))
                .parameterCount(md.getParameters().size())
                .build();
    }

    private static Symbol fieldSymbol(Path file, TypeDeclaration<?> owner, String ownerFqn, Set<String> ownerAnnotations,
                                      boolean isInterface, FieldDeclaration fd, VariableDeclarator variable) {
        Set<SymbolModifier> modifiers = modifiers(fd.getModifiers());
        if (isInterface) {
            modifiers.add(SymbolModifier.PUBLIC);
            modifiers.add(SymbolModifier.STATIC);
            modifiers.add(SymbolModifier.FINAL);
        }

        return Symbol.builder()
                .id(SymbolId.of(SymbolKind.FIELD, file, ownerFqn + "#" + variable.getNameAsString()))
                .simpleName(variable.getNameAsString())
                .containingClass(ownerFqn)
                .containingClassSimpleName(owner.getNameAsString())
                .modifiers(modifiers)
                .annotations(annotationNames(fd.getAnnotations()))
                .containerAnnotations(ownerAnnotations)
                .docDeprecated(hasDeprecatedTag(fd))
                .interfaceMember(isInterface)
                .build();
    }

    /**
     * True if the method overrides or implements a supertype method. Anything that cannot be decided
     * through the symbol solver counts as overriding.
     */
    static boolean isOverriding(TypeDeclaration<?> owner, MethodDeclaration md) {
        if (hasOverrideAnnotation(md)) return true;
        if (md.isStatic() || md.isPrivate()) return false;

        String key = md.getNameAsString() + "/" + md.getParameters().size();
        if (!hasDeclaredSupertypes(owner)) {
            return OBJECT_METHODS.contains(key);
        }

        try {
            ResolvedReferenceTypeDeclaration resolved = owner.resolve();
            for (ResolvedReferenceType ancestor : resolved.getAllAncestors()) {
                for (MethodUsage usage : ancestor.getDeclaredMethods()) {
                    if (usage.getName().equals(md.getNameAsString()) && usage.getNoParams() == md.getParameters().size()) {
                        return true;
                    }
                }
            }
            return false;
        } catch (RuntimeException | StackOverflowError e) {
            logger.fine("Could not resolve supertypes of " + owner.getNameAsString() + ", treating "
                    + md.getNameAsString() + " as overriding: " + e.getMessage());
            return true;
        }
    }

    private static boolean hasDeclaredSupertypes(TypeDeclaration<?> td) {
        if (td instanceof ClassOrInterfaceDeclaration) {
            ClassOrInterfaceDeclaration coi = (ClassOrInterfaceDeclaration) td;
            return coi.getExtendedTypes().isNonEmpty() || coi.getImplementedTypes().isNonEmpty();
        }
        if (td instanceof EnumDeclaration) return true;
        if (td instanceof RecordDeclaration) return true;
        return false;
    }

    private static boolean hasOverrideAnnotation(MethodDeclaration md) {
        for (AnnotationExpr annotation : md.getAnnotations()) {
            String name = annotation.getNameAsString();
            if (name.equals("Override") || name.equals("java.lang.Override")) return true;
        }
        return false;
    }

    private static boolean hasDeprecatedTag(NodeWithJavadoc<?> node) {
        return node.getJavadoc()
                .map(doc -> doc.getBlockTags().stream().anyMatch(tag -> tag.getType() == JavadocBlockTag.Type.DEPRECATED))
                .orElse(false);
    }

    private static Optional<TypeDeclaration<?>> parentType(TypeDeclaration<?> td) {
        Optional<Node> parent = td.getParentNode();
        if (parent.isPresent() && parent.get() instanceof TypeDeclaration) {
            return Optional.of((TypeDeclaration<?>) parent.get());
        }
        return Optional.empty();
    }

    private static Set<SymbolModifier> modifiers(NodeList<Modifier> modifiers) {
        Set<SymbolModifier> result = EnumSet.noneOf(SymbolModifier.class);
        for (Modifier modifier : modifiers) {
            switch (modifier.getKeyword()) {
                case PUBLIC: result.add(SymbolModifier.PUBLIC); break;
                case PROTECTED: result.add(SymbolModifier.PROTECTED); break;
                case PRIVATE: result.add(SymbolModifier.PRIVATE); break;
                case STATIC: result.add(SymbolModifier.STATIC); break;
                case FINAL: result.add(SymbolModifier.FINAL); break;
                case ABSTRACT: result.add(SymbolModifier.ABSTRACT); break;
                case DEFAULT: result.add(SymbolModifier.DEFAULT); break;
                default: break;
            }
        }
        return result;
    }

    private static Set<String> annotationNames(NodeList<AnnotationExpr> annotations) {
        Set<String> names = new LinkedHashSet<>();
        for (AnnotationExpr annotation : annotations) names.add(annotation.getNameAsString());
        return names;
    }

    static String lastSegment(String name) {
        int dot = name.lastIndexOf('.');
        return dot < 0 ? name : name.substring(dot + 1);
    }
}
