package work.agentflow.kernel.variables;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class VariableStoreTest {
    @Test
    void latestCaptureWins() {
        var store = new VariableStore();
        store.capture("bugs", "first");
        store.capture("bugs", "second");
        assertEquals("second", store.get("bugs"));
        assertEquals(1, store.names().size());
    }

    @Test
    void copyIsIndependent() {
        var store = new VariableStore();
        store.capture("bugs", "3");
        var copy = store.copy();
        store.capture("bugs", "4");
        assertEquals("3", copy.get("bugs"));
    }

    @Test
    void summaryShowsShortPreviews() {
        var store = new VariableStore();
        store.capture("log", "x".repeat(80));
        store.capture("empty", null);
        var summary = store.summary();
        assertTrue(summary.contains("log: " + "x".repeat(50) + "..."));
        assertTrue(summary.contains("empty: (empty)"));
        assertEquals("No variables captured yet.", new VariableStore().summary());
    }
}
