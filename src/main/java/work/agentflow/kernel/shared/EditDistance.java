package work.agentflow.kernel.shared;

import java.util.Collection;
import java.util.Locale;
import java.util.Optional;

/**
 * Levenshtein distance and nearest-name lookup used for "did you mean" hints.
 */
public final class EditDistance {
    private EditDistance() {}

    public static int between(String left, String right) {
        var a = left == null ? "" : left;
        var b = right == null ? "" : right;
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }

    /**
     * Closest candidate within {@code max(2, length / 3)} edits, ties resolved by iteration order.
     */
    public static Optional<String> nearest(String name, Collection<String> candidates) {
        if (name == null || candidates == null || candidates.isEmpty()) {
            return Optional.empty();
        }
        var needle = name.toLowerCase(Locale.ROOT);
        int threshold = Math.max(2, needle.length() / 3);
        String best = null;
        int bestDistance = Integer.MAX_VALUE;
        for (var candidate : candidates) {
            int distance = between(needle, candidate.toLowerCase(Locale.ROOT));
            if (distance < bestDistance) {
                best = candidate;
                bestDistance = distance;
            }
        }
        return bestDistance <= threshold ? Optional.ofNullable(best) : Optional.empty();
    }
}
