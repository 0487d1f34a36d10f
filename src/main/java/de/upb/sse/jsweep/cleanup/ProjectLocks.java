package de.upb.sse.jsweep.cleanup;

import de.upb.sse.jsweep.model.CleanupScope;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Exclusive ownership of cleanup scopes. Two scopes overlap when the project root or one of the
 * indexed roots of either contains, or lies inside, a root of the other. At most one run holds an
 * overlapping scope at a time.
 */
public final class ProjectLocks {
    private static final List<CleanupScope> HELD = new ArrayList<>();

    private ProjectLocks() {}

    public static synchronized boolean tryAcquire(CleanupScope scope) {
        for (CleanupScope held : HELD) {
            if (overlaps(held, scope)) return false;
        }
        HELD.add(scope);
        return true;
    }

    public static synchronized void release(CleanupScope scope) {
        HELD.removeIf(held -> held == scope);
    }

    /** True if a held scope covers {@code path} or lies below it. */
    public static synchronized boolean isHeld(Path path) {
        Path normalized = path.toAbsolutePath().normalize();
        for (CleanupScope held : HELD) {
            for (Path root : rootsOf(held)) {
                if (nested(root, normalized)) return true;
            }
        }
        return false;
    }

    static boolean overlaps(CleanupScope a, CleanupScope b) {
        for (Path first : rootsOf(a)) {
            for (Path second : rootsOf(b)) {
                if (nested(first, second)) return true;
            }
        }
        return false;
    }

    private static List<Path> rootsOf(CleanupScope scope) {
        List<Path> roots = new ArrayList<>(scope.getIndexedRoots());
        roots.add(scope.getProjectRoot());
        return roots;
    }

    private static boolean nested(Path a, Path b) {
        return a.startsWith(b) || b.startsWith(a);
    }
}
