package work.agentflow.kernel.agents;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides which temporary agents are generic enough to keep, and saves the chosen ones as defined agents.
 */
public final class AgentPromotion {
    private static final Logger log = LoggerFactory.getLogger(AgentPromotion.class);

    private static final List<Pattern> SPECIFIC_INDICATORS = List.of(
        Pattern.compile("src/[a-zA-Z0-9/_-]+\\.(js|ts|py|java|kt|go|rs)"),
        Pattern.compile("line \\d+", Pattern.CASE_INSENSITIVE),
        Pattern.compile("fix.*bug.*in", Pattern.CASE_INSENSITIVE),
        Pattern.compile("(this project|our codebase)", Pattern.CASE_INSENSITIVE)
    );
    private static final List<Pattern> GENERIC_INDICATORS = List.of(
        Pattern.compile("analyze|scan|check|review|test", Pattern.CASE_INSENSITIVE),
        Pattern.compile("responsibilities:", Pattern.CASE_INSENSITIVE),
        Pattern.compile("output format:", Pattern.CASE_INSENSITIVE)
    );
    private static final Pattern GENERIC_NAME =
        Pattern.compile("^(analyzer|scanner|checker|reviewer|tester|fixer|validator|formatter)", Pattern.CASE_INSENSITIVE);

    private final AgentRepository repository;

    public AgentPromotion(AgentRepository repository) {
        this.repository = Objects.requireNonNull(repository, "repository");
    }

    public PromotionSuggestion analyze(AgentDefinition agent) {
        var content = agent.description() + "\n" + agent.prompt();
        if (SPECIFIC_INDICATORS.stream().anyMatch(p -> p.matcher(content).find())) {
            return new PromotionSuggestion(
                agent.name(),
                false,
                "Contains workflow-specific references (file paths, line numbers, or project-specific context)"
            );
        }
        if (GENERIC_INDICATORS.stream().anyMatch(p -> p.matcher(content).find())) {
            return new PromotionSuggestion(
                agent.name(),
                true,
                "Generic capability with structured format - likely useful for other workflows"
            );
        }
        if (GENERIC_NAME.matcher(agent.name()).find()) {
            return new PromotionSuggestion(agent.name(), true, "Generic agent name suggests reusable pattern");
        }
        return new PromotionSuggestion(agent.name(), false, "Insufficient indicators of reusability");
    }

    public List<PromotionSuggestion> suggest(List<AgentDefinition> temporaryAgents) {
        var suggestions = new ArrayList<PromotionSuggestion>();
        for (var agent : temporaryAgents) {
            suggestions.add(analyze(agent));
        }
        return suggestions;
    }

    public static String describe(List<PromotionSuggestion> suggestions) {
        var text = new StringBuilder("Temporary agents used in this workflow:").append(System.lineSeparator());
        for (var suggestion : suggestions) {
            text.append(suggestion.recommended() ? "  ✓ [recommended] " : "  ✗ [not recommended] ")
                .append(suggestion.name())
                .append(System.lineSeparator())
                .append("      ")
                .append(suggestion.reason())
                .append(System.lineSeparator());
        }
        return text.toString();
    }

    /**
     * Saves {@code selected} as defined agents. Names already defined are refused; temporary
     * agents not selected are reported as discarded.
     */
    public PromotionReport promote(List<AgentDefinition> temporaryAgents, List<String> selected) {
        var existing = new ArrayList<>(repository.load());
        var definedNames = new HashSet<String>();
        for (var definition : existing) {
            definedNames.add(definition.name());
        }
        var chosen = new HashSet<>(selected);
        var promoted = new ArrayList<String>();
        var failed = new ArrayList<PromotionReport.Failure>();
        var discarded = new ArrayList<String>();

        for (var agent : temporaryAgents) {
            if (!chosen.contains(agent.name())) {
                discarded.add(agent.name());
                continue;
            }
            if (definedNames.contains(agent.name())) {
                failed.add(new PromotionReport.Failure(agent.name(), "Agent already exists in defined agents"));
                continue;
            }
            existing.add(agent.withKind(AgentKind.DEFINED));
            definedNames.add(agent.name());
            promoted.add(agent.name());
        }
        for (var name : selected) {
            if (temporaryAgents.stream().noneMatch(agent -> agent.name().equals(name))) {
                failed.add(new PromotionReport.Failure(name, "No temporary agent with that name in this workflow"));
            }
        }
        if (!promoted.isEmpty()) {
            repository.save(existing);
        }
        log.info("Promotion finished: promoted={} failed={} discarded={}", promoted, failed.size(), discarded);
        return new PromotionReport(promoted, failed, discarded);
    }
}
