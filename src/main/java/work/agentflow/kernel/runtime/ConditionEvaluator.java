package work.agentflow.kernel.runtime;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import work.agentflow.kernel.syntax.Condition;
import work.agentflow.kernel.variables.VariableInterpolator;

/**
 * Decides whether a conditional edge lets control through.
 *
 * <p>Aggregate forms look at the tributaries of a merge source, or at the source alone when it
 * is not a merge. Unrecognized text is matched word by word against the serialized payload and
 * otherwise falls back to the source's success flag.
 */
public final class ConditionEvaluator {
    private static final Pattern WORD = Pattern.compile("[\\p{L}\\p{N}_]+");
    private static final int MIN_KEYWORD_LENGTH = 4;

    /**
     * @param source output of the edge source, {@code null} when it never ran
     * @param tributaries outputs feeding a merge source, empty otherwise
     */
    public boolean evaluate(String conditionText, NodeOutput source, List<NodeOutput> tributaries) {
        return evaluate(Condition.parse(conditionText), source, tributaries);
    }

    public boolean evaluate(Condition condition, NodeOutput source, List<NodeOutput> tributaries) {
        var outputs = tributaries == null || tributaries.isEmpty()
            ? Collections.singletonList(source)
            : tributaries;
        return switch (condition.form()) {
            case PASSED -> succeeded(source);
            case FAILED -> !succeeded(source);
            case ALL_SUCCESS -> outputs.stream().allMatch(ConditionEvaluator::succeeded);
            case ANY_SUCCESS -> outputs.stream().anyMatch(ConditionEvaluator::succeeded);
            case ALL_FAILED -> outputs.stream().allMatch(Predicate.not(ConditionEvaluator::succeeded));
            case ANY_FAILED -> outputs.stream().anyMatch(Predicate.not(ConditionEvaluator::succeeded));
            case CONTAINS -> text(source).contains(condition.argument().toLowerCase(Locale.ROOT));
            case HEURISTIC -> heuristic(condition.text(), source);
        };
    }

    private static boolean heuristic(String conditionText, NodeOutput source) {
        var haystack = text(source);
        var matcher = WORD.matcher(conditionText.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            var word = matcher.group();
            if (word.length() >= MIN_KEYWORD_LENGTH && haystack.contains(word)) {
                return true;
            }
        }
        return succeeded(source);
    }

    private static boolean succeeded(NodeOutput output) {
        return output != null && output.success();
    }

    private static String text(NodeOutput output) {
        if (output == null) {
            return "";
        }
        var value = output.payload() != null ? VariableInterpolator.stringify(output.payload()) : output.error();
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }
}
