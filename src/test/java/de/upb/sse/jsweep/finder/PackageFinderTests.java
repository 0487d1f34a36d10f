package de.upb.sse.jsweep.finder;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class PackageFinderTests {

    @TempDir
    Path dir;

    private void write(String relative, String content) throws IOException {
        Path file = dir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }

    @Test
    @DisplayName("Maven layout gives a main and a test root")
    void maven_layout() throws IOException {
        write("src/main/java/com/example/A.java", "//Controller Cleaner\npackage com.example;\nclass A {}\n");
        write("src/test/java/com/example/ATest.java", "/* header */\npackage com.example;\nclass ATest {}\n");

        Set<Path> roots = PackageFinder.findPackageRoots(dir);
        Path main = dir.resolve("src/main/java").toAbsolutePath().normalize();
        Path test = dir.resolve("src/test/java").toAbsolutePath().normalize();
        assertEquals(Set.of(main, test), roots);
        assertEquals(List.of(main), PackageFinder.mainRoots(dir, roots));
        assertEquals(List.of(test), PackageFinder.testRoots(dir, roots));
    }

    @Test
    @DisplayName("Test segments above the project do not count")
    void project_below_test_directory() {
        Path project = dir.resolve("test/project");
        Path root = project.resolve("src/main/java");
        assertFalse(PackageFinder.isTestRoot(project, root));
        assertTrue(PackageFinder.isTestRoot(project, project.resolve("module/src/test/java")));
    }

    @Test
    @DisplayName("Default package files make the directory a root")
    void default_package() throws IOException {
        write("src/main/java/com/example/A.java", "package com.example;\nclass A {}\n");
        write("Script.java", "class Script {}\n");

        Set<Path> roots = PackageFinder.findPackageRoots(dir);
        assertTrue(roots.contains(dir.toAbsolutePath().normalize()));
        assertTrue(roots.contains(dir.resolve("src/main/java").toAbsolutePath().normalize()));
    }

    @Test
    @DisplayName("Package not matching the path is not a root")
    void mismatched_package() throws IOException {
        write("src/main/java/wrong/A.java", "package com.example;\nclass A {}\n");

        assertEquals(Set.of(dir.toAbsolutePath().normalize()), PackageFinder.findPackageRoots(dir));
    }

    @Test
    @DisplayName("Build output is skipped")
    void build_output() throws IOException {
        write("src/main/java/a/A.java", "package a;\nclass A {}\n");
        write("target/generated-sources/b/B.java", "package b;\nclass B {}\n");

        assertEquals(Set.of(dir.resolve("src/main/java").toAbsolutePath().normalize()), PackageFinder.findPackageRoots(dir));
    }
}
