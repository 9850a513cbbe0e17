package work.agentflow.kernel.agents;

import java.util.List;

/**
 * Outcome of promoting a selection of temporary agents.
 */
public record PromotionReport(List<String> promoted, List<Failure> failed, List<String> discarded) {
    public PromotionReport {
        promoted = List.copyOf(promoted);
        failed = List.copyOf(failed);
        discarded = List.copyOf(discarded);
    }

    public record Failure(String name, String reason) {}
}
