package de.upb.sse.jsweep.stats;

import de.upb.sse.jsweep.analysis.Category;
import lombok.Data;

@Data
public class CleanupStats {
    private int passesRun;
    private int removedImports;
    private int removedFields;
    private int removedClasses;
    private int removedDeprecatedMethods;
    private int removedTransitiveMethods;
    private int failed;
    private int skipped;

    public void incrementPassesRun() {
        passesRun++;
    }

    public void incrementRemoved(Category category) {
        switch (category) {
            case UNUSED_IMPORT: removedImports++; break;
            case UNUSED_FIELD: removedFields++; break;
            case UNUSED_CLASS: removedClasses++; break;
            case DEPRECATED_METHOD: removedDeprecatedMethods++; break;
            case TRANSITIVE_METHOD: removedTransitiveMethods++; break;
            default: throw new IllegalArgumentException("Unknown category " + category);
        }
    }

    public int getRemoved(Category category) {
        switch (category) {
            case UNUSED_IMPORT: return removedImports;
            case UNUSED_FIELD: return removedFields;
            case UNUSED_CLASS: return removedClasses;
            case DEPRECATED_METHOD: return removedDeprecatedMethods;
            case TRANSITIVE_METHOD: return removedTransitiveMethods;
            default: throw new IllegalArgumentException("Unknown category " + category);
        }
    }

    public void incrementFailed() {
        failed++;
    }

    public void incrementSkipped() {
        skipped++;
    }

    public int totalRemoved() {
        return removedImports + removedFields + removedClasses + removedDeprecatedMethods + removedTransitiveMethods;
    }
}
