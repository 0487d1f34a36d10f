package de.upb.sse.jsweep.cleanup;

import de.upb.sse.jsweep.configuration.JSweepConfiguration;
import de.upb.sse.jsweep.model.CleanupScope;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class FileMarkingCoordinatorTests {
    private static final String MARKER = JSweepConfiguration.DEFAULT_MARKER;
    private static FileMarkingCoordinator marking;

    @TempDir
    Path dir;

    @BeforeEach
    void setup() {
        marking = new FileMarkingCoordinator(MARKER);
    }

    private Path write(String name, String content) throws IOException {
        Path file = dir.resolve(name);
        Files.createDirectories(file.getParent());
        Files.write(file, content.getBytes(StandardCharsets.UTF_8));
        return file;
    }

    private static String read(Path file) throws IOException {
        return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("Marking puts the marker line first and keeps the content")
    void mark() throws IOException {
        Path file = write("A.java", "package a;\n\nclass A {}\n");
        assertEquals(List.of(file), marking.mark(List.of(file)));
        assertEquals(MARKER + "\npackage a;\n\nclass A {}\n", read(file));
        assertTrue(marking.isMarked(file));
    }

    @Test
    @DisplayName("Marking twice changes nothing")
    void mark_is_idempotent() throws IOException {
        Path file = write("A.java", "class A {}\n");
        marking.mark(List.of(file));
        assertTrue(marking.mark(List.of(file)).isEmpty());
        assertEquals(MARKER + "\nclass A {}\n", read(file));
    }

    @Test
    @DisplayName("Windows line endings are kept")
    void crlf() throws IOException {
        Path file = write("A.java", "package a;\r\nclass A {}\r\n");
        marking.mark(List.of(file));
        assertEquals(MARKER + "\r\npackage a;\r\nclass A {}\r\n", read(file));
        marking.unmark(List.of(file));
        assertEquals("package a;\r\nclass A {}\r\n", read(file));
    }

    @Test
    @DisplayName("Byte order mark stays in front of the marker")
    void bom() throws IOException {
        Path file = write("A.java", "\uFEFFclass A {}\n");
        marking.mark(List.of(file));
        assertEquals("\uFEFF" + MARKER + "\nclass A {}\n", read(file));
        assertTrue(marking.isMarked(file));
        marking.unmark(List.of(file));
        assertEquals("\uFEFFclass A {}\n", read(file));
    }

    @Test
    @DisplayName("Marker after leading blank lines counts")
    void leading_whitespace() throws IOException {
        Path file = write("A.java", "\n  " + MARKER + "\nclass A {}\n");
        assertTrue(marking.isMarked(file));
    }

    @Test
    @DisplayName("Marker must be the first token")
    void not_first_token() throws IOException {
        Path late = write("A.java", "package a;\n" + MARKER + "\nclass A {}\n");
        Path longer = write("B.java", MARKER + "2\nclass B {}\n");
        assertFalse(marking.isMarked(late));
        assertFalse(marking.isMarked(longer));
    }

    @Test
    @DisplayName("Unmarking removes only the marker line")
    void unmark() throws IOException {
        Path file = write("A.java", MARKER + "\n// keep me\nclass A {}\n");
        assertEquals(List.of(file), marking.unmark(List.of(file)));
        assertEquals("// keep me\nclass A {}\n", read(file));
        assertTrue(marking.unmark(List.of(file)).isEmpty());
    }

    @Test
    @DisplayName("Missing files are skipped")
    void missing_files() {
        Path missing = dir.resolve("Missing.java");
        assertTrue(marking.mark(List.of(missing)).isEmpty());
        assertTrue(marking.unmark(List.of(missing)).isEmpty());
        assertFalse(marking.isMarked(missing));
    }

    @Test
    @DisplayName("Listing finds marked candidate files only")
    void list_marked() throws IOException {
        Path marked = write("src/a/A.java", MARKER + "\npackage a;\nclass A {}\n");
        write("src/a/B.java", "package a;\nclass B {}\n");
        write("other/C.java", MARKER + "\nclass C {}\n");

        CleanupScope scope = CleanupScope.ofRoot(dir.resolve("src"));
        assertEquals(List.of(marked.toAbsolutePath().normalize()), marking.listMarkedFiles(scope));
    }

    @Test
    @DisplayName("Marker has to be a line comment")
    void invalid_marker() {
        assertThrows(IllegalArgumentException.class, () -> new FileMarkingCoordinator("Controller Cleaner"));
    }
}
