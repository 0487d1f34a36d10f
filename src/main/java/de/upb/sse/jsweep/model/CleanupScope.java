package de.upb.sse.jsweep.model;

import lombok.Getter;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Which part of a project takes part in a cleanup run.
 *
 * All source roots are indexed for references. Candidates for removal come only from the
 * candidate files: every Java file of the non-test roots by default, or an explicit subset
 * (for instance the files carrying the cleanup marker).
 */
@Getter
public final class CleanupScope {
    private final Path projectRoot;
    private final List<Path> sourceRoots;
    private final List<Path> testRoots;
    /** Null means "every Java file under the candidate roots". */
    private final Set<Path> restriction;
    private final boolean includeTestSources;

    public CleanupScope(Path projectRoot, List<Path> sourceRoots, List<Path> testRoots, boolean includeTestSources) {
        this(projectRoot, sourceRoots, testRoots, null, includeTestSources);
    }

    private CleanupScope(Path projectRoot, List<Path> sourceRoots, List<Path> testRoots,
                         Set<Path> restriction, boolean includeTestSources) {
        this.projectRoot = projectRoot.toAbsolutePath().normalize();
        this.sourceRoots = List.copyOf(normalize(sourceRoots));
        this.testRoots = List.copyOf(normalize(testRoots));
        this.restriction = restriction == null ? null : Collections.unmodifiableSet(new LinkedHashSet<>(normalize(restriction)));
        this.includeTestSources = includeTestSources;
    }

    /** A scope that indexes {@code root} and treats every file below it as a candidate. */
    public static CleanupScope ofRoot(Path root) {
        return new CleanupScope(root, List.of(root), List.of(), false);
    }

    /** Same roots, candidates limited to {@code files}. */
    public CleanupScope restrictTo(Collection<Path> files) {
        return new CleanupScope(projectRoot, sourceRoots, testRoots, new LinkedHashSet<>(files), includeTestSources);
    }

    public boolean isRestricted() {
        return restriction != null;
    }

    /** Every root that is indexed for references (source and test roots). */
    public List<Path> getIndexedRoots() {
        Set<Path> roots = new LinkedHashSet<>(sourceRoots);
        roots.addAll(testRoots);
        return new ArrayList<>(roots);
    }

    /** Roots whose files may be candidates for removal. */
    public List<Path> getCandidateRoots() {
        if (includeTestSources) return getIndexedRoots();
        return sourceRoots.stream()
                .filter(root -> testRoots.stream().noneMatch(root::equals))
                .collect(Collectors.toList());
    }

    /**
     * True if symbols declared in {@code file} may be removed in this scope. A file belongs to the
     * most specific indexed root containing it.
     */
    public boolean isCandidate(Path file) {
        Path normalized = file.toAbsolutePath().normalize();
        if (restriction != null && !restriction.contains(normalized)) return false;
        Path owner = null;
        for (Path root : getIndexedRoots()) {
            if (normalized.startsWith(root) && (owner == null || root.getNameCount() > owner.getNameCount())) {
                owner = root;
            }
        }
        return owner != null && getCandidateRoots().contains(owner);
    }

    private static List<Path> normalize(Collection<Path> paths) {
        List<Path> result = new ArrayList<>();
        for (Path p : paths) result.add(p.toAbsolutePath().normalize());
        return result;
    }

    @Override
    public String toString() {
        return "CleanupScope{root=" + projectRoot + ", sourceRoots=" + sourceRoots.size()
                + ", testRoots=" + testRoots.size()
                + (restriction == null ? "" : ", restrictedTo=" + restriction.size() + " files") + "}";
    }
}
