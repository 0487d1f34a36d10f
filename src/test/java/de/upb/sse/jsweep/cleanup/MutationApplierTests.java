package de.upb.sse.jsweep.cleanup;

import de.upb.sse.jsweep.analysis.Category;
import de.upb.sse.jsweep.analysis.SymbolClassifier;
import de.upb.sse.jsweep.configuration.JSweepConfiguration;
import de.upb.sse.jsweep.model.InMemoryCodeModel;
import de.upb.sse.jsweep.model.InMemoryProject;
import de.upb.sse.jsweep.model.Symbol;
import de.upb.sse.jsweep.plan.RemovalBatch;
import de.upb.sse.jsweep.plan.RemovalPlanner;
import org.junit.jupiter.api.*;

import java.util.List;
import java.util.Map;

import static de.upb.sse.jsweep.model.TestSymbols.*;
import static org.junit.jupiter.api.Assertions.*;

public class MutationApplierTests {
    private static InMemoryProject project;
    private static MutationApplier applier;

    @BeforeEach
    void setup() {
        project = new InMemoryProject();
        applier = new MutationApplier();
    }

    private static RemovalBatch batch(Category category, Symbol... symbols) {
        return new RemovalPlanner(new SymbolClassifier(new JSweepConfiguration())).plan(Map.of(category, List.of(symbols)));
    }

    @Test
    @DisplayName("Valid symbol is removed")
    void removed() {
        Symbol f = field("A", "unusedField").build();
        project.add(f);
        InMemoryCodeModel model = project.read(project.scope());

        assertEquals(MutationApplier.Status.REMOVED, applier.apply(model, f).getStatus());
        assertFalse(model.isValid(f));
    }

    @Test
    @DisplayName("Member of an already deleted class is skipped")
    void stale_member_is_skipped() {
        Symbol holder = type("Holder").fieldCount(1).build();
        Symbol f = field("Holder", "value").build();
        project.add(holder, f);
        InMemoryCodeModel model = project.read(project.scope());

        assertEquals(MutationApplier.Status.REMOVED, applier.apply(model, holder).getStatus());
        MutationApplier.Outcome outcome = applier.apply(model, f);
        assertEquals(MutationApplier.Status.SKIPPED, outcome.getStatus());
        assertEquals(1, model.getDeleteCalls());
    }

    @Test
    @DisplayName("Failed removal does not stop the batch")
    void failure_continues() {
        Symbol first = field("A", "first").build();
        Symbol second = field("A", "second").build();
        project.add(first, second).failDeleteOf(first);
        InMemoryCodeModel model = project.read(project.scope());

        List<MutationApplier.Applied> results = applier.applyAll(model, batch(Category.UNUSED_FIELD, first, second));
        assertEquals(2, results.size());
        assertEquals(MutationApplier.Status.FAILED, results.get(0).getOutcome().getStatus());
        assertEquals("cannot remove first", results.get(0).getOutcome().getReason());
        assertEquals(MutationApplier.Status.REMOVED, results.get(1).getOutcome().getStatus());
    }

    @Test
    @DisplayName("Unexpected exceptions become failures")
    void runtime_exception_is_failure() {
        Symbol f = field("A", "f").build();
        project.add(f).crashDeleteOf(f);
        InMemoryCodeModel model = project.read(project.scope());

        MutationApplier.Outcome outcome = applier.apply(model, f);
        assertEquals(MutationApplier.Status.FAILED, outcome.getStatus());
        assertTrue(outcome.getReason().startsWith("IllegalStateException"));
    }

    @Test
    @DisplayName("Symbols missing from the snapshot are skipped")
    void missing_symbol() {
        Symbol f = field("A", "f").build();
        InMemoryCodeModel model = project.read(project.scope());

        assertEquals(MutationApplier.Status.SKIPPED, applier.apply(model, f).getStatus());
        assertEquals(0, model.getDeleteCalls());
    }
}
