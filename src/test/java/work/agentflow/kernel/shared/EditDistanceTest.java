package work.agentflow.kernel.shared;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class EditDistanceTest {
    @Test
    void countsEdits() {
        assertEquals(0, EditDistance.between("fixer", "fixer"));
        assertEquals(3, EditDistance.between("kitten", "sitting"));
        assertEquals(5, EditDistance.between("", "fixer"));
    }

    @Test
    void suggestsClosestName() {
        var known = List.of("analyzer", "fixer", "reviewer");
        assertEquals(Optional.of("analyzer"), EditDistance.nearest("analyser", known));
        assertEquals(Optional.of("fixer"), EditDistance.nearest("Fixr", known));
    }

    @Test
    void noSuggestionBeyondThreshold() {
        assertTrue(EditDistance.nearest("deploy", List.of("analyzer", "fixer")).isEmpty());
        assertTrue(EditDistance.nearest("fixer", List.of()).isEmpty());
    }
}
