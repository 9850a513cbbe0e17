package work.agentflow.kernel.variables;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class VariableInterpolatorTest {
    private final VariableInterpolator interpolator = new VariableInterpolator();

    @Test
    void replacesPlaceholders() {
        var store = new VariableStore();
        store.capture("bugs", "3 issues");
        assertEquals("fix 3 issues now, 3 issues", interpolator.interpolate("fix {bugs} now, {bugs}", store, "n2"));
    }

    @Test
    void leavesTextWithoutPlaceholdersAlone() {
        assertEquals("plain { text }", interpolator.interpolate("plain { text }", new VariableStore(), "n1"));
    }

    @Test
    void unknownVariableNamesItAndListsAvailableOnes() {
        var store = new VariableStore();
        store.capture("patch", "diff");
        store.capture("report", "ok");
        var ex = assertThrows(VariableException.class, () -> interpolator.interpolate("fix {bugs}", store, "n2"));
        assertEquals("bugs", ex.variable());
        assertEquals(List.of("patch", "report"), ex.available());
        assertTrue(ex.getMessage().contains("'{bugs}'"));
        assertTrue(ex.getMessage().contains("Available variables: patch, report"));
        assertTrue(ex.getMessage().contains("n2"));
    }

    @Test
    void nullValueIsAnError() {
        var store = new VariableStore();
        store.capture("bugs", null);
        var ex = assertThrows(VariableException.class, () -> interpolator.interpolate("fix {bugs}", store, "n2"));
        assertTrue(ex.getMessage().contains("has no value yet"));
    }

    @Test
    void structuredValuesBecomePrettyJson() {
        var store = new VariableStore();
        store.capture("report", Map.of("count", 3));
        var text = interpolator.interpolate("{report}", store, "n1");
        assertTrue(text.contains("\"count\" : 3"), text);
    }

    @Test
    void longValuesAreTruncated() {
        var store = new VariableStore();
        store.capture("log", "abcdefghij");
        var text = new VariableInterpolator(4).interpolate("{log}", store, "n1");
        assertEquals("abcd" + VariableInterpolator.TRUNCATION_MARKER, text);
    }

    @Test
    void replacementTextIsLiteral() {
        var store = new VariableStore();
        store.capture("price", "$5 \\ off");
        assertEquals("cost: $5 \\ off", interpolator.interpolate("cost: {price}", store, "n1"));
    }
}
