package work.agentflow.kernel.shared;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Parses and prints agent timeouts written as {@code 1500}, {@code 250ms}, {@code 30s},
 * {@code 2m} or {@code 1h}. A bare number is milliseconds.
 */
public final class DurationParser {
    private static final Pattern SYNTAX = Pattern.compile("(\\d+)\\s*(ms|s|m|h)?");
    private static final Map<String, Long> UNITS = new LinkedHashMap<>();

    static {
        // largest first, format() picks the first exact divisor
        UNITS.put("h", 3_600_000L);
        UNITS.put("m", 60_000L);
        UNITS.put("s", 1_000L);
        UNITS.put("ms", 1L);
    }

    private DurationParser() {}

    public static Optional<Duration> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        var matcher = SYNTAX.matcher(raw.trim().toLowerCase(Locale.ROOT));
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Invalid duration '" + raw + "' (expected e.g. 1500, 30s, 2m, 1h)");
        }
        var unit = matcher.group(2) == null ? "ms" : matcher.group(2);
        try {
            long amount = Long.parseLong(matcher.group(1));
            return Optional.of(Duration.ofMillis(Math.multiplyExact(amount, UNITS.get(unit))));
        } catch (NumberFormatException | ArithmeticException ex) {
            throw new IllegalArgumentException("Duration '" + raw + "' is out of range", ex);
        }
    }

    /**
     * Renders a duration in the largest unit that represents it exactly.
     */
    public static String format(Duration duration) {
        long millis = duration.toMillis();
        if (millis != 0) {
            for (var unit : UNITS.entrySet()) {
                if (millis % unit.getValue() == 0) {
                    return (millis / unit.getValue()) + unit.getKey();
                }
            }
        }
        return millis + "ms";
    }
}
