package de.upb.sse.jsweep.finder;

import de.upb.sse.jsweep.util.FileUtil;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Derives source roots from the package declarations of the Java files in a directory tree.
 *
 * Unlike a compilation setup, liveness analysis needs every root: a usage in a test or in a
 * secondary module keeps a symbol alive. Roots are therefore never filtered, only split into
 * main and test roots.
 */
public class PackageFinder {
    private static final Logger logger = Logger.getLogger(PackageFinder.class.getName());

    private final static String PACKAGE_REGEX = "package\\s+([\\d|\\w|.]+)\\s*;";
    private final static Pattern PACKAGE_PATTERN = Pattern.compile(PACKAGE_REGEX);

    public static Set<Path> findPackageRoots(Path dir) {
        Set<Path> roots = new TreeSet<>();
        List<Path> allJavaFiles = FileUtil.getAllJavaFiles(dir);
        boolean defaultPackageFiles = false;

        for (Path javaFile : allJavaFiles) {
            try {
                Path root = getPackageRoot(javaFile);
                if (root == null) {
                    defaultPackageFiles = true;
                    continue;
                }
                if (!isValidSourceRoot(root)) {
                    logger.warning("Skipping invalid source root: " + root);
                    continue;
                }
                roots.add(root);
            } catch (IOException e) {
                logger.warning("Could not read package of " + javaFile + ": " + e.getMessage());
            }
        }

        // Files in the default package (or with a package that does not match their path) are
        // only reachable through the directory itself.
        if (defaultPackageFiles || roots.isEmpty()) roots.add(dir.toAbsolutePath().normalize());
        return roots;
    }

    public static List<Path> mainRoots(Path dir, Set<Path> roots) {
        return roots.stream().filter(root -> !isTestRoot(dir, root)).collect(Collectors.toList());
    }

    public static List<Path> testRoots(Path dir, Set<Path> roots) {
        return roots.stream().filter(root -> isTestRoot(dir, root)).collect(Collectors.toList());
    }

    /** True if a path segment of {@code root} below {@code dir} is named {@code test}. */
    public static boolean isTestRoot(Path dir, Path root) {
        Path base = dir.toAbsolutePath().normalize();
        Path normalized = root.toAbsolutePath().normalize();
        Path relative = normalized.startsWith(base) ? base.relativize(normalized) : normalized;
        for (Path segment : relative) {
            if (segment.toString().toLowerCase(Locale.ROOT).equals("test")) return true;
        }
        return false;
    }

    private static boolean isValidSourceRoot(Path path) {
        String trimmed = path.toString().trim();
        if (trimmed.isEmpty()) return false;
        if (trimmed.endsWith("-") || trimmed.endsWith("_") || trimmed.endsWith(".")) return false;
        return Files.isDirectory(path);
    }

    private static Path getPackageRoot(Path javaFile) throws IOException {
        String packageDec = findPackage(javaFile);
        if (packageDec == null) return null;

        Matcher m = PACKAGE_PATTERN.matcher(packageDec);
        if (!m.find()) return null;
        if (m.group(1) == null) return null;

        String[] segments = m.group(1).split("\\.");
        Path dir = javaFile.getParent();
        for (int i = segments.length - 1; i >= 0; i--) {
            if (dir == null || dir.getFileName() == null || !dir.getFileName().toString().equals(segments[i])) return null;
            dir = dir.getParent();
        }
        return dir == null ? null : dir.toAbsolutePath().normalize();
    }

    private static String findPackage(Path path) throws IOException {
        boolean commentScope = false;
        try (BufferedReader reader = Files.newBufferedReader(path)) {
            String line;
            while ((line = reader.readLine()) != null) {
                String trimmedLine = line.replace("\uFEFF", "").trim();

                if (trimmedLine.startsWith("package")) return trimmedLine;
                if (trimmedLine.startsWith("/*")) commentScope = true;
                if (!commentScope && !trimmedLine.startsWith("//") && !trimmedLine.startsWith("*")
                        && !trimmedLine.startsWith("@") && !trimmedLine.isEmpty()) {
                    break;
                }

                if (commentScope) {
                    int closeCommentIndex = trimmedLine.indexOf("*/");
                    int openCommentIndex = trimmedLine.lastIndexOf("/*");
                    if (closeCommentIndex > -1 && openCommentIndex < closeCommentIndex) commentScope = false;
                }
            }
            return null;
        }
    }
}
