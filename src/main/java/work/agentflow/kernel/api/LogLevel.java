package work.agentflow.kernel.api;

import java.util.Locale;

/**
 * Log thresholds accepted by {@code --log-level}.
 */
public enum LogLevel {
    TRACE,
    DEBUG,
    INFO,
    WARN,
    ERROR,
    OFF;

    public static LogLevel from(String value) {
        if (value == null || value.isBlank()) {
            return WARN;
        }
        try {
            return LogLevel.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported log level: " + value + " (expected trace|debug|info|warn|error|off)");
        }
    }
}
