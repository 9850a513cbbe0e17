package work.agentflow.kernel.config;

import java.util.Locale;

/**
 * What an unattended run does with a failed node.
 *
 * @param maxRetries retries per node before the run aborts; only meaningful for {@link Mode#RETRY}
 */
public record FailurePolicy(Mode mode, int maxRetries) {
    public FailurePolicy {
        if (mode == null) {
            mode = Mode.ABORT;
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("max-retries must not be negative: " + maxRetries);
        }
    }

    public static FailurePolicy abort() {
        return new FailurePolicy(Mode.ABORT, 0);
    }

    public static FailurePolicy skip() {
        return new FailurePolicy(Mode.SKIP, 0);
    }

    public static FailurePolicy retry(int maxRetries) {
        return new FailurePolicy(Mode.RETRY, maxRetries);
    }

    public enum Mode {
        RETRY,
        SKIP,
        ABORT;

        public static Mode from(String value) {
            if (value == null || value.isBlank()) {
                return ABORT;
            }
            try {
                return Mode.valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException ex) {
                throw new IllegalArgumentException("Unknown failure policy '" + value + "' (expected retry, skip or abort)", ex);
            }
        }
    }
}
