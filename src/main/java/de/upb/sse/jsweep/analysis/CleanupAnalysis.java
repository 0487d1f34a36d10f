package de.upb.sse.jsweep.analysis;

import de.upb.sse.jsweep.model.Symbol;

import java.nio.file.Path;
import java.util.*;

/**
 * Immutable result of one read-only analysis pass: the files looked at and, per category, the
 * symbols found removable in each file.
 */
public final class CleanupAnalysis {
    private static final int SUMMARY_ITEMS = 10;

    private final String title;
    private final List<Path> files;
    private final Set<Category> categories;
    private final Map<Category, Map<Path, List<Symbol>>> findings;

    private CleanupAnalysis(Builder builder) {
        this.title = builder.title;
        this.files = List.copyOf(builder.files);
        Set<Category> covered = EnumSet.noneOf(Category.class);
        covered.addAll(builder.findings.keySet());
        this.categories = Collections.unmodifiableSet(covered);
        Map<Category, Map<Path, List<Symbol>>> copy = new EnumMap<>(Category.class);
        builder.findings.forEach((category, byFile) -> {
            Map<Path, List<Symbol>> nonEmpty = new LinkedHashMap<>();
            byFile.forEach((file, symbols) -> {
                if (!symbols.isEmpty()) nonEmpty.put(file, List.copyOf(symbols));
            });
            copy.put(category, Collections.unmodifiableMap(nonEmpty));
        });
        this.findings = Collections.unmodifiableMap(copy);
    }

    public static Builder builder(String title, Collection<Path> files) {
        return new Builder(title, files);
    }

    public String getTitle() {
        return title;
    }

    /** Files the analysis looked at. */
    public List<Path> getFiles() {
        return files;
    }

    /** Categories this analysis covers, whether or not anything was found. */
    public Set<Category> getCategories() {
        return categories;
    }

    public Map<Path, List<Symbol>> byFile(Category category) {
        return findings.getOrDefault(category, Collections.emptyMap());
    }

    public List<Symbol> get(Category category) {
        List<Symbol> symbols = new ArrayList<>();
        byFile(category).values().forEach(symbols::addAll);
        return symbols;
    }

    /** Every finding keyed by category, in category order. */
    public Map<Category, List<Symbol>> getCandidates() {
        Map<Category, List<Symbol>> candidates = new EnumMap<>(Category.class);
        for (Category category : categories) candidates.put(category, get(category));
        return candidates;
    }

    public int count(Category category) {
        int count = 0;
        for (List<Symbol> symbols : byFile(category).values()) count += symbols.size();
        return count;
    }

    public int getTotal() {
        int total = 0;
        for (Category category : categories) total += count(category);
        return total;
    }

    public boolean isEmpty() {
        return getTotal() == 0;
    }

    /** Files with at least one finding, sorted. */
    public Set<Path> getAffectedFiles() {
        Set<Path> affected = new TreeSet<>();
        for (Map<Path, List<Symbol>> byFile : findings.values()) affected.addAll(byFile.keySet());
        return affected;
    }

    /** Multi-line summary: counts per category and the first few findings. */
    public String describe() {
        StringBuilder sb = new StringBuilder();
        sb.append(title).append(": found ").append(getTotal()).append(" removable element(s) in ")
                .append(getAffectedFiles().size()).append(" of ").append(files.size()).append(" file(s)\n");
        for (Category category : categories) {
            sb.append("• ").append(count(category)).append(' ').append(category.getLabel()).append('\n');
        }

        List<Symbol> all = new ArrayList<>();
        for (Category category : categories) all.addAll(get(category));
        if (!all.isEmpty()) {
            sb.append('\n');
            for (Symbol symbol : all.subList(0, Math.min(SUMMARY_ITEMS, all.size()))) {
                sb.append("• ").append(symbol.getDeclaringFile().getFileName()).append(": ")
                        .append(symbol.getDisplayName()).append('\n');
            }
            if (all.size() > SUMMARY_ITEMS) {
                sb.append("... and ").append(all.size() - SUMMARY_ITEMS).append(" more\n");
            }
        }
        return sb.toString().stripTrailing();
    }

    @Override
    public String toString() {
        StringJoiner joiner = new StringJoiner(", ", "CleanupAnalysis{", "}");
        for (Category category : categories) joiner.add(category + "=" + count(category));
        return joiner.toString();
    }

    public static final class Builder {
        private final String title;
        private final List<Path> files;
        private final Map<Category, Map<Path, List<Symbol>>> findings = new EnumMap<>(Category.class);

        private Builder(String title, Collection<Path> files) {
            this.title = Objects.requireNonNull(title, "title");
            this.files = new ArrayList<>(files);
        }

        public Builder put(Category category, Map<Path, List<Symbol>> byFile) {
            Map<Path, List<Symbol>> target = findings.computeIfAbsent(category, k -> new LinkedHashMap<>());
            byFile.forEach((file, symbols) -> target.computeIfAbsent(file, k -> new ArrayList<>()).addAll(symbols));
            return this;
        }

        /** Adds symbols grouped by their declaring file. */
        public Builder add(Category category, List<Symbol> symbols) {
            Map<Path, List<Symbol>> target = findings.computeIfAbsent(category, k -> new LinkedHashMap<>());
            for (Symbol symbol : symbols) {
                target.computeIfAbsent(symbol.getDeclaringFile(), k -> new ArrayList<>()).add(symbol);
            }
            return this;
        }

        public CleanupAnalysis build() {
            return new CleanupAnalysis(this);
        }
    }
}
