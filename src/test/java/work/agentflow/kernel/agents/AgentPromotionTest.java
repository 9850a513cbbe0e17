package work.agentflow.kernel.agents;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class AgentPromotionTest {
    private final AgentRepository repository = AgentRepository.inMemory(List.of(AgentDefinition.named("reviewer", AgentKind.DEFINED)));
    private final AgentPromotion promotion = new AgentPromotion(repository);

    @Test
    void workflowSpecificAgentsAreNotRecommended() {
        var suggestion = promotion.analyze(temporary("patcher", "Fix the crash in src/app/main.ts", ""));
        assertFalse(suggestion.recommended());
        assertTrue(suggestion.reason().contains("workflow-specific"));
    }

    @Test
    void genericCapabilitiesAreRecommended() {
        var suggestion = promotion.analyze(temporary("inspector", "", "Responsibilities: list every risky change"));
        assertTrue(suggestion.recommended());
    }

    @Test
    void genericNameIsEnoughWithoutOtherIndicators() {
        assertTrue(promotion.analyze(temporary("formatter-js", "Make it pretty", "")).recommended());
        var unknown = promotion.analyze(temporary("helper", "Does things", ""));
        assertFalse(unknown.recommended());
        assertEquals("Insufficient indicators of reusability", unknown.reason());
    }

    @Test
    void specificIndicatorsWinOverGenericOnes() {
        var suggestion = promotion.analyze(temporary("scanner", "Scan line 42 of this project", ""));
        assertFalse(suggestion.recommended());
    }

    @Test
    void promotesSelectionAndRefusesExistingNames() {
        var temporaries = List.of(
            temporary("scanner", "Scan code", ""),
            temporary("reviewer", "Review the diff", ""),
            temporary("scratch", "One-off", "")
        );
        var report = promotion.promote(temporaries, List.of("scanner", "reviewer", "ghost"));

        assertEquals(List.of("scanner"), report.promoted());
        assertEquals(List.of("scratch"), report.discarded());
        assertEquals(List.of("reviewer", "ghost"), report.failed().stream().map(PromotionReport.Failure::name).toList());
        assertEquals("Agent already exists in defined agents", report.failed().get(0).reason());

        var saved = repository.load();
        assertEquals(List.of("reviewer", "scanner"), saved.stream().map(AgentDefinition::name).toList());
        assertEquals(AgentKind.DEFINED, saved.get(1).kind());
    }

    @Test
    void describeMarksRecommendations() {
        var text = AgentPromotion.describe(promotion.suggest(List.of(temporary("tester", "Run tests", ""))));
        assertTrue(text.contains("[recommended] tester"));
    }

    private static AgentDefinition temporary(String name, String description, String prompt) {
        return new AgentDefinition(name, AgentKind.TEMPORARY, description, prompt, null, null, List.of());
    }
}
