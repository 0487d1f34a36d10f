package de.upb.sse.jsweep.util;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

public final class FileUtil {
    private static final Set<String> SKIPPED_DIRECTORIES = Set.of("target", "node_modules");

    private FileUtil() {}

    /** All {@code .java} files below {@code dir}, sorted, skipping hidden and build output directories. */
    public static List<Path> getAllJavaFiles(Path dir) {
        List<Path> files = new ArrayList<>();
        if (dir == null || !Files.isDirectory(dir)) return files;
        try {
            Files.walkFileTree(dir, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path d, BasicFileAttributes attrs) {
                    if (d.equals(dir)) return FileVisitResult.CONTINUE;
                    String name = d.getFileName().toString();
                    if (name.startsWith(".") || SKIPPED_DIRECTORIES.contains(name)) return FileVisitResult.SKIP_SUBTREE;
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    String name = file.getFileName().toString();
                    if (attrs.isRegularFile() && name.endsWith(".java")
                            && !name.equals("package-info.java") && !name.equals("module-info.java")) {
                        files.add(file.toAbsolutePath().normalize());
                    }
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new UncheckedIOException("Could not walk " + dir, e);
        }
        files.sort(null);
        return files;
    }

    /** Line separator used by {@code text}, defaulting to {@code \n}. */
    public static String lineSeparatorOf(String text) {
        int nl = text.indexOf('\n');
        if (nl > 0 && text.charAt(nl - 1) == '\r') return "\r\n";
        return "\n";
    }
}
