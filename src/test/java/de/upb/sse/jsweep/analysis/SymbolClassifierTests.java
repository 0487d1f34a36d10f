package de.upb.sse.jsweep.analysis;

import de.upb.sse.jsweep.configuration.JSweepConfiguration;
import de.upb.sse.jsweep.model.InMemoryProject;
import de.upb.sse.jsweep.model.Symbol;
import de.upb.sse.jsweep.model.SymbolModifier;
import org.junit.jupiter.api.*;

import java.util.Optional;

import static de.upb.sse.jsweep.model.TestSymbols.*;
import static org.junit.jupiter.api.Assertions.*;

public class SymbolClassifierTests {
    private static JSweepConfiguration config;
    private static SymbolClassifier classifier;

    @BeforeEach
    void setup() {
        config = new JSweepConfiguration();
        classifier = new SymbolClassifier(config);
    }

    @Test
    @DisplayName("Annotated deprecated method of a RestController")
    void deprecated_annotated_controller_method() {
        Symbol old = deprecatedControllerMethod("UserController", "old").build();
        assertEquals(Optional.of(Category.DEPRECATED_METHOD), classifier.classify(old));
    }

    @Test
    @DisplayName("Qualified annotation names are recognized")
    void qualified_annotation_names() {
        Symbol old = method("UserController", "old")
                .containerAnnotation("org.springframework.web.bind.annotation.RestController")
                .annotation("java.lang.Deprecated")
                .build();
        assertTrue(classifier.isDeprecatedControllerMethod(old));
    }

    @Test
    @DisplayName("Javadoc @deprecated tag counts as deprecated")
    void javadoc_deprecated() {
        Symbol old = controllerMethod("UserController", "old").docDeprecated(true).build();
        assertTrue(classifier.isDeprecatedControllerMethod(old));
    }

    @Test
    @DisplayName("Method name containing deprecated, any case")
    void deprecated_by_name() {
        Symbol old = controllerMethod("UserController", "legacyDeprecatedCall").build();
        assertTrue(classifier.isDeprecatedControllerMethod(old));
    }

    @Test
    @DisplayName("Deprecated method outside a controller is no seed")
    void deprecated_outside_controller() {
        Symbol old = method("UserService", "old").annotation("Deprecated").build();
        assertEquals(Optional.empty(), classifier.classify(old));
    }

    @Test
    @DisplayName("Controller by class name only when the fallback is on")
    void controller_name_fallback() {
        Symbol old = method("UserController", "old").annotation("Deprecated").build();
        assertFalse(new SymbolClassifier(config, false).isDeprecatedControllerMethod(old));
        assertTrue(new SymbolClassifier(config, true).isDeprecatedControllerMethod(old));
    }

    @Test
    @DisplayName("Name fallback is off when an annotated controller exists")
    void fallback_disabled_by_annotated_controller() {
        InMemoryProject project = new InMemoryProject()
                .add(type("AccountController").annotation("Controller").build());
        SymbolClassifier forModel = SymbolClassifier.forModel(config, project.read(project.scope()));

        Symbol old = method("UserController", "old").annotation("Deprecated").build();
        assertFalse(forModel.isDeprecatedControllerMethod(old));
    }

    @Test
    @DisplayName("Name fallback is on for projects without annotated controllers")
    void fallback_enabled_without_annotated_controller() {
        InMemoryProject project = new InMemoryProject().add(type("UserController").build());
        SymbolClassifier forModel = SymbolClassifier.forModel(config, project.read(project.scope()));

        Symbol old = method("UserController", "old").annotation("Deprecated").build();
        assertTrue(forModel.isDeprecatedControllerMethod(old));
    }

    @Test
    @DisplayName("Name fallback can be switched off")
    void fallback_switched_off() {
        config.setControllerNameFallback(false);
        InMemoryProject project = new InMemoryProject().add(type("UserController").build());
        SymbolClassifier forModel = SymbolClassifier.forModel(config, project.read(project.scope()));

        Symbol old = method("UserController", "old").annotation("Deprecated").build();
        assertFalse(forModel.isDeprecatedControllerMethod(old));
    }

    @Test
    @DisplayName("Single type imports are candidates, wildcards are not")
    void imports() {
        assertEquals(Optional.of(Category.UNUSED_IMPORT), classifier.classify(imp("A", "java.util.List").build()));
        assertEquals(Optional.empty(), classifier.classify(imp("A", "java.util.*").wildcardImport(true).build()));
    }

    @Test
    @DisplayName("Only single segment java.lang imports are redundant")
    void java_lang_imports() {
        assertTrue(SymbolClassifier.isRedundantJavaLangImport(imp("A", "java.lang.String").build()));
        assertFalse(SymbolClassifier.isRedundantJavaLangImport(imp("A", "java.lang.reflect.Method").build()));
        assertFalse(SymbolClassifier.isRedundantJavaLangImport(imp("A", "java.util.List").build()));
        assertFalse(SymbolClassifier.isRedundantJavaLangImport(
                imp("A", "static java.lang.Math.max").staticImport(true).build()));
    }

    @Test
    @DisplayName("Private final fields are candidates by default")
    void private_final_field() {
        assertEquals(Optional.of(Category.UNUSED_FIELD), classifier.classify(field("A", "unusedField").build()));
    }

    @Test
    @DisplayName("Non-final fields depend on the field mode")
    void non_final_field() {
        Symbol nonFinal = field("A", "nonFinalField").clearModifiers().modifier(SymbolModifier.PRIVATE).build();
        assertEquals(Optional.empty(), classifier.classify(nonFinal));

        config.setFieldMode(JSweepConfiguration.FieldMode.NON_PUBLIC_NON_STATIC);
        assertEquals(Optional.of(Category.UNUSED_FIELD), new SymbolClassifier(config).classify(nonFinal));
    }

    @Test
    @DisplayName("Public, static and annotated fields are never candidates")
    void protected_fields() {
        config.setFieldMode(JSweepConfiguration.FieldMode.NON_PUBLIC_NON_STATIC);
        SymbolClassifier lenient = new SymbolClassifier(config);
        assertEquals(Optional.empty(), lenient.classify(field("A", "publicField").modifier(SymbolModifier.PUBLIC).build()));
        assertEquals(Optional.empty(), lenient.classify(field("A", "CONSTANT").modifier(SymbolModifier.STATIC).build()));
        assertEquals(Optional.empty(), lenient.classify(field("A", "annotatedField").annotation("Deprecated").build()));
    }

    @Test
    @DisplayName("Empty classes are candidates")
    void empty_class() {
        assertEquals(Optional.of(Category.UNUSED_CLASS), classifier.classify(type("Placeholder").build()));
    }

    @Test
    @DisplayName("Classes with members depend on the class mode")
    void class_modes() {
        Symbol withMethod = type("Holder").methodCount(1).build();
        Symbol withField = type("Holder").fieldCount(2).build();
        Symbol withInitializer = type("Holder").initializerCount(1).build();

        assertEquals(Optional.empty(), classifier.classify(withMethod));
        assertEquals(Optional.empty(), classifier.classify(withField));
        assertEquals(Optional.empty(), classifier.classify(withInitializer));

        config.setClassMode(JSweepConfiguration.ClassMode.NO_METHODS);
        SymbolClassifier noMethods = new SymbolClassifier(config);
        assertEquals(Optional.empty(), noMethods.classify(withMethod));
        assertEquals(Optional.of(Category.UNUSED_CLASS), noMethods.classify(withField));
        assertEquals(Optional.empty(), noMethods.classify(withInitializer));
    }

    @Test
    @DisplayName("Controller classes are never candidates")
    void controller_classes() {
        assertEquals(Optional.empty(), classifier.classify(type("LegacyController").build()));
        assertEquals(Optional.empty(), classifier.classify(type("Endpoints").annotation("RestController").build()));
    }
}
