package work.agentflow.kernel.agents;

/**
 * Verdict on whether a temporary agent is worth keeping as a defined agent.
 */
public record PromotionSuggestion(String name, boolean recommended, String reason) {}
