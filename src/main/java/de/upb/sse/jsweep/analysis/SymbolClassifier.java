package de.upb.sse.jsweep.analysis;

import de.upb.sse.jsweep.configuration.AnnotationPolicy;
import de.upb.sse.jsweep.configuration.JSweepConfiguration;
import de.upb.sse.jsweep.model.CodeModel;
import de.upb.sse.jsweep.model.Symbol;
import de.upb.sse.jsweep.model.SymbolKind;
import de.upb.sse.jsweep.model.SymbolModifier;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

/**
 * Decides which removal category, if any, a declared symbol is a candidate for. Only structural
 * rules are checked here; whether the symbol is actually unused is up to the
 * {@link LivenessAnalyzer}.
 */
public class SymbolClassifier {
    private static final String CONTROLLER = "Controller";

    private final JSweepConfiguration config;
    private final AnnotationPolicy policy;
    private final boolean controllerByName;

    /**
     * @param controllerByName treat classes whose simple name contains {@code Controller} as
     *                         controllers even without a controller annotation
     */
    public SymbolClassifier(JSweepConfiguration config, boolean controllerByName) {
        this.config = config;
        this.policy = config.getAnnotationPolicy();
        this.controllerByName = controllerByName;
    }

    public SymbolClassifier(JSweepConfiguration config) {
        this(config, false);
    }

    /**
     * Classifier for one snapshot. The name fallback for controllers kicks in only when it is
     * enabled and none of the snapshot's candidate files declares an annotated controller.
     */
    public static SymbolClassifier forModel(JSweepConfiguration config, CodeModel model) {
        if (!config.isControllerNameFallback()) return new SymbolClassifier(config, false);
        AnnotationPolicy policy = config.getAnnotationPolicy();
        for (Path file : model.listFiles()) {
            for (Symbol type : model.getSymbols(file).getClasses()) {
                if (policy.hasEffect(type.getAnnotations(), AnnotationPolicy.Effect.CONTROLLER)) {
                    return new SymbolClassifier(config, false);
                }
            }
        }
        return new SymbolClassifier(config, true);
    }

    public Optional<Category> classify(Symbol symbol) {
        switch (symbol.getKind()) {
            case METHOD:
                return isDeprecatedControllerMethod(symbol) ? Optional.of(Category.DEPRECATED_METHOD) : Optional.empty();
            case IMPORT:
                return symbol.isWildcardImport() ? Optional.empty() : Optional.of(Category.UNUSED_IMPORT);
            case FIELD:
                return isRemovableField(symbol) ? Optional.of(Category.UNUSED_FIELD) : Optional.empty();
            case CLASS:
                return isRemovableClass(symbol) ? Optional.of(Category.UNUSED_CLASS) : Optional.empty();
            default:
                return Optional.empty();
        }
    }

    public boolean isDeprecatedControllerMethod(Symbol method) {
        if (method.getKind() != SymbolKind.METHOD) return false;
        if (!isInController(method)) return false;
        return policy.hasEffect(method.getAnnotations(), AnnotationPolicy.Effect.DEPRECATED)
                || method.isDocDeprecated()
                || method.getSimpleName().toLowerCase(Locale.ROOT).contains("deprecated");
    }

    /** True if the method's containing class is a controller. */
    public boolean isInController(Symbol member) {
        if (policy.hasEffect(member.getContainerAnnotations(), AnnotationPolicy.Effect.CONTROLLER)) return true;
        return controllerByName && member.getContainingClassSimpleName() != null
                && member.getContainingClassSimpleName().contains(CONTROLLER);
    }

    /** Controller classes are never removed, whatever the name fallback says. */
    public boolean isControllerClass(Symbol type) {
        return policy.hasEffect(type.getAnnotations(), AnnotationPolicy.Effect.CONTROLLER)
                || type.getSimpleName().contains(CONTROLLER);
    }

    /**
     * Importing a type of the {@code java.lang} package itself is redundant. Subpackages such as
     * {@code java.lang.reflect} are not implicitly imported and go through the usual check.
     */
    public static boolean isRedundantJavaLangImport(Symbol imp) {
        if (imp.getKind() != SymbolKind.IMPORT || imp.isStaticImport() || imp.isWildcardImport()) return false;
        String name = imp.getQualifiedName();
        return name.startsWith("java.lang.") && name.indexOf('.', "java.lang.".length()) < 0;
    }

    private boolean isRemovableField(Symbol field) {
        if (field.is(SymbolModifier.PUBLIC) || field.is(SymbolModifier.STATIC)) return false;
        if (!field.getAnnotations().isEmpty()) return false;
        if (field.isInterfaceMember()) return false;
        if (config.getFieldMode() == JSweepConfiguration.FieldMode.FINAL_PRIVATE_ONLY) {
            return field.is(SymbolModifier.FINAL) && field.is(SymbolModifier.PRIVATE);
        }
        return true;
    }

    private boolean isRemovableClass(Symbol type) {
        if (isControllerClass(type)) return false;
        if (type.getMethodCount() > 0 || type.getInitializerCount() > 0) return false;
        if (config.getClassMode() == JSweepConfiguration.ClassMode.EMPTY_ONLY) {
            return type.getFieldCount() == 0 && type.getNestedClassCount() == 0;
        }
        return true;
    }
}
