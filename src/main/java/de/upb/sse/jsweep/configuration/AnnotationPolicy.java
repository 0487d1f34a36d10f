package de.upb.sse.jsweep.configuration;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Table of recognized annotations and what they mean to the classifier.
 *
 * Entries are keyed by simple or fully qualified name. An annotation written in source is
 * looked up both as written and by its simple name, so {@code @RestController} and
 * {@code @org.springframework.web.bind.annotation.RestController} hit the same entry.
 */
public final class AnnotationPolicy {

    public enum Effect {
        /** Marks a type as a framework controller: its deprecated methods are cleanup seeds and the type itself is never removed. */
        CONTROLLER,
        /** Marks a method as deprecated. */
        DEPRECATED
    }

    private final Map<String, Set<Effect>> effects = new LinkedHashMap<>();

    public static AnnotationPolicy defaults() {
        AnnotationPolicy policy = new AnnotationPolicy();
        policy.register("Controller", Effect.CONTROLLER);
        policy.register("org.springframework.stereotype.Controller", Effect.CONTROLLER);
        policy.register("RestController", Effect.CONTROLLER);
        policy.register("org.springframework.web.bind.annotation.RestController", Effect.CONTROLLER);
        policy.register("Deprecated", Effect.DEPRECATED);
        policy.register("java.lang.Deprecated", Effect.DEPRECATED);
        return policy;
    }

    public AnnotationPolicy register(String annotationName, Effect effect) {
        if (annotationName == null || annotationName.isBlank()) {
            throw new IllegalArgumentException("Annotation name must not be blank");
        }
        effects.computeIfAbsent(annotationName.trim(), k -> EnumSet.noneOf(Effect.class)).add(effect);
        return this;
    }

    /** Drops every entry carrying the given effect. */
    public AnnotationPolicy clear(Effect effect) {
        effects.values().forEach(set -> set.remove(effect));
        effects.values().removeIf(Set::isEmpty);
        return this;
    }

    public Set<Effect> effectsOf(String annotationName) {
        if (annotationName == null) return Collections.emptySet();
        Set<Effect> result = EnumSet.noneOf(Effect.class);
        Set<Effect> direct = effects.get(annotationName);
        if (direct != null) result.addAll(direct);
        int dot = annotationName.lastIndexOf('.');
        if (dot >= 0) {
            Set<Effect> bySimpleName = effects.get(annotationName.substring(dot + 1));
            if (bySimpleName != null) result.addAll(bySimpleName);
        }
        return result;
    }

    public boolean hasEffect(Collection<String> annotationNames, Effect effect) {
        for (String name : annotationNames) {
            if (effectsOf(name).contains(effect)) return true;
        }
        return false;
    }

    public Set<String> namesWith(Effect effect) {
        Set<String> names = new LinkedHashSet<>();
        effects.forEach((name, set) -> {
            if (set.contains(effect)) names.add(name);
        });
        return names;
    }

    @Override
    public String toString() {
        return "AnnotationPolicy" + effects;
    }
}
