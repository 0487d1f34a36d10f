package de.upb.sse.jsweep.configuration;

import lombok.*;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Properties;

@Getter
@Setter
@ToString
@NoArgsConstructor
public class JSweepConfiguration {
    public static final String DEFAULT_MARKER = "//Controller Cleaner";
    public static final String PROPERTY_PREFIX = "jsweep.";

    /** Which fields the unused-field rule may consider. */
    public enum FieldMode {
        /** Only {@code private final} fields (besides the common rules). */
        FINAL_PRIVATE_ONLY,
        /** Any field that is neither public nor static. */
        NON_PUBLIC_NON_STATIC
    }

    /** Which classes the unused-class rule may consider. */
    public enum ClassMode {
        /** No methods, fields, nested classes or initializers. */
        EMPTY_ONLY,
        /** No methods or initializers, fields and nested classes allowed. */
        NO_METHODS
    }

    private FieldMode fieldMode = FieldMode.FINAL_PRIVATE_ONLY;
    private ClassMode classMode = ClassMode.EMPTY_ONLY;
    private String marker = DEFAULT_MARKER;
    private boolean controllerNameFallback = true;
    private boolean cleanTestSources = false;
    private AnnotationPolicy annotationPolicy = AnnotationPolicy.defaults();
    private List<Path> classpathJars = new ArrayList<>();

    public JSweepConfiguration(FieldMode fieldMode, ClassMode classMode) {
        this.fieldMode = fieldMode;
        this.classMode = classMode;
    }

    public static JSweepConfiguration load(Path propertiesFile) throws IOException {
        Properties properties = new Properties();
        try (InputStream in = Files.newInputStream(propertiesFile)) {
            properties.load(in);
        }
        JSweepConfiguration config = new JSweepConfiguration();
        config.apply(properties);
        return config;
    }

    /**
     * Applies {@code jsweep.*} keys from the given properties. Unknown keys are ignored.
     *
     * @throws IllegalArgumentException if a value cannot be parsed
     */
    public JSweepConfiguration apply(Properties properties) {
        String fm = properties.getProperty(PROPERTY_PREFIX + "fieldMode");
        if (fm != null) setFieldMode(parseEnum(FieldMode.class, fm));

        String cm = properties.getProperty(PROPERTY_PREFIX + "classMode");
        if (cm != null) setClassMode(parseEnum(ClassMode.class, cm));

        String mk = properties.getProperty(PROPERTY_PREFIX + "marker");
        if (mk != null) {
            if (!mk.trim().startsWith("//")) {
                throw new IllegalArgumentException("Marker must be a line comment: " + mk);
            }
            setMarker(mk.trim());
        }

        String fallback = properties.getProperty(PROPERTY_PREFIX + "controllerNameFallback");
        if (fallback != null) setControllerNameFallback(Boolean.parseBoolean(fallback.trim()));

        String tests = properties.getProperty(PROPERTY_PREFIX + "cleanTestSources");
        if (tests != null) setCleanTestSources(Boolean.parseBoolean(tests.trim()));

        String controllers = properties.getProperty(PROPERTY_PREFIX + "controllerAnnotations");
        if (controllers != null) {
            annotationPolicy.clear(AnnotationPolicy.Effect.CONTROLLER);
            for (String name : splitList(controllers)) annotationPolicy.register(name, AnnotationPolicy.Effect.CONTROLLER);
        }

        String deprecated = properties.getProperty(PROPERTY_PREFIX + "deprecatedAnnotations");
        if (deprecated != null) {
            annotationPolicy.clear(AnnotationPolicy.Effect.DEPRECATED);
            for (String name : splitList(deprecated)) annotationPolicy.register(name, AnnotationPolicy.Effect.DEPRECATED);
        }

        String jars = properties.getProperty(PROPERTY_PREFIX + "classpath");
        if (jars != null) {
            List<Path> paths = new ArrayList<>();
            for (String jar : splitList(jars)) paths.add(Paths.get(jar));
            setClasspathJars(paths);
        }
        return this;
    }

    /** Same keys as {@link #apply(Properties)}, read from {@code -Djsweep.*} system properties. */
    public JSweepConfiguration applySystemOverrides() {
        return apply(System.getProperties());
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String value) {
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return Enum.valueOf(type, normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown " + type.getSimpleName() + ": " + value, e);
        }
    }

    private static List<String> splitList(String value) {
        List<String> items = new ArrayList<>();
        for (String part : value.split(",")) {
            if (!part.isBlank()) items.add(part.trim());
        }
        return items;
    }
}
