package de.upb.sse.jsweep.configuration;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Properties;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class JSweepConfigurationTests {
    private static JSweepConfiguration config;

    @BeforeEach
    void setup() {
        config = new JSweepConfiguration();
    }

    @Test
    @DisplayName("Defaults")
    void defaults() {
        assertEquals(JSweepConfiguration.FieldMode.FINAL_PRIVATE_ONLY, config.getFieldMode());
        assertEquals(JSweepConfiguration.ClassMode.EMPTY_ONLY, config.getClassMode());
        assertEquals("//Controller Cleaner", config.getMarker());
        assertTrue(config.isControllerNameFallback());
        assertFalse(config.isCleanTestSources());
        assertTrue(config.getAnnotationPolicy().namesWith(AnnotationPolicy.Effect.CONTROLLER).contains("RestController"));
    }

    @Test
    @DisplayName("Properties override the defaults")
    void apply_properties() {
        Properties properties = new Properties();
        properties.setProperty("jsweep.fieldMode", "non-public-non-static");
        properties.setProperty("jsweep.classMode", "NO_METHODS");
        properties.setProperty("jsweep.marker", " //Sweep ");
        properties.setProperty("jsweep.controllerNameFallback", "false");
        properties.setProperty("jsweep.cleanTestSources", "true");
        properties.setProperty("jsweep.classpath", "lib/a.jar, lib/b.jar");
        properties.setProperty("other.key", "ignored");
        config.apply(properties);

        assertEquals(JSweepConfiguration.FieldMode.NON_PUBLIC_NON_STATIC, config.getFieldMode());
        assertEquals(JSweepConfiguration.ClassMode.NO_METHODS, config.getClassMode());
        assertEquals("//Sweep", config.getMarker());
        assertFalse(config.isControllerNameFallback());
        assertTrue(config.isCleanTestSources());
        assertEquals(List.of(Paths.get("lib/a.jar"), Paths.get("lib/b.jar")), config.getClasspathJars());
    }

    @Test
    @DisplayName("Annotation lists replace the defaults")
    void annotation_lists() {
        Properties properties = new Properties();
        properties.setProperty("jsweep.controllerAnnotations", "Resource, javax.ws.rs.Path");
        properties.setProperty("jsweep.deprecatedAnnotations", "Legacy");
        config.apply(properties);

        AnnotationPolicy policy = config.getAnnotationPolicy();
        assertEquals(Set.of("Resource", "javax.ws.rs.Path"), policy.namesWith(AnnotationPolicy.Effect.CONTROLLER));
        assertEquals(Set.of("Legacy"), policy.namesWith(AnnotationPolicy.Effect.DEPRECATED));
        assertTrue(policy.hasEffect(List.of("com.example.Legacy"), AnnotationPolicy.Effect.DEPRECATED));
        assertFalse(policy.hasEffect(List.of("Deprecated"), AnnotationPolicy.Effect.DEPRECATED));
    }

    @Test
    @DisplayName("Invalid values are rejected")
    void invalid_values() {
        Properties mode = new Properties();
        mode.setProperty("jsweep.fieldMode", "ALL");
        assertThrows(IllegalArgumentException.class, () -> config.apply(mode));

        Properties marker = new Properties();
        marker.setProperty("jsweep.marker", "Controller Cleaner");
        assertThrows(IllegalArgumentException.class, () -> config.apply(marker));
    }

    @Test
    @DisplayName("Loading from a file")
    void load(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("jsweep.properties");
        Files.writeString(file, "jsweep.classMode=NO_METHODS\n");
        assertEquals(JSweepConfiguration.ClassMode.NO_METHODS, JSweepConfiguration.load(file).getClassMode());
    }

    @Test
    @DisplayName("Qualified annotations match by simple name")
    void qualified_lookup() {
        AnnotationPolicy policy = AnnotationPolicy.defaults();
        assertTrue(policy.effectsOf("org.springframework.stereotype.Controller").contains(AnnotationPolicy.Effect.CONTROLLER));
        assertTrue(policy.effectsOf("Unknown").isEmpty());
        assertThrows(IllegalArgumentException.class, () -> policy.register(" ", AnnotationPolicy.Effect.DEPRECATED));
    }
}
