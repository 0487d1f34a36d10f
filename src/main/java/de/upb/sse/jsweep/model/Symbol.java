package de.upb.sse.jsweep.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.Singular;

import java.nio.file.Path;
import java.util.Set;

/**
 * A declared program element (class, method, field or import) as read from one snapshot of the
 * code model. Immutable; equality is identity equality.
 */
@Getter
@Builder
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public final class Symbol {
    @EqualsAndHashCode.Include
    @NonNull private final SymbolId id;
    @NonNull private final String simpleName;

    /** FQN of the containing class; null for top-level classes and imports. */
    private final String containingClass;
    private final String containingClassSimpleName;

    @Singular private final Set<SymbolModifier> modifiers;
    @Singular private final Set<String> annotations;
    /** Annotations of the containing class, as written. */
    @Singular private final Set<String> containerAnnotations;

    private final boolean docDeprecated;

    // methods
    private final boolean interfaceMember;
    private final boolean overriding;
    private final int parameterCount;

    // classes
    private final boolean interfaceType;
    private final int methodCount;
    private final int fieldCount;
    private final int nestedClassCount;
    private final int initializerCount;

    // imports
    private final boolean staticImport;
    private final boolean wildcardImport;

    public SymbolKind getKind() {
        return id.getKind();
    }

    public String getQualifiedName() {
        return id.getQualifiedName();
    }

    public Path getDeclaringFile() {
        return id.getFile();
    }

    public boolean is(SymbolModifier modifier) {
        return modifiers.contains(modifier);
    }

    /** Short human readable name, e.g. {@code UserController.legacy()} or {@code import java.io.File}. */
    public String getDisplayName() {
        switch (getKind()) {
            case METHOD:
                return owner() + simpleName + "()";
            case FIELD:
                return owner() + simpleName;
            case IMPORT:
                return "import " + getQualifiedName();
            default:
                return getQualifiedName();
        }
    }

    private String owner() {
        return containingClassSimpleName == null ? "" : containingClassSimpleName + ".";
    }

    @Override
    public String toString() {
        return getKind() + " " + getDisplayName();
    }
}
