package de.upb.sse.jsweep;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/** Copies a fixture project from {@code src/test/resources/fixtures} so tests can change it. */
public final class Fixtures {
    private static final Path FIXTURES = Paths.get("src/test/resources/fixtures");

    private Fixtures() {}

    public static Path copy(String name, Path target) throws IOException {
        Path source = FIXTURES.resolve(name);
        List<Path> paths;
        try (Stream<Path> walk = Files.walk(source)) {
            paths = walk.collect(Collectors.toList());
        }
        for (Path path : paths) {
            Path copy = target.resolve(source.relativize(path).toString());
            if (Files.isDirectory(path)) Files.createDirectories(copy);
            else Files.copy(path, copy);
        }
        return target.toAbsolutePath().normalize();
    }

    public static String read(Path file) throws IOException {
        return Files.readString(file);
    }
}
