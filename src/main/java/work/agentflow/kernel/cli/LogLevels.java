package work.agentflow.kernel.cli;

import ch.qos.logback.classic.Level;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.agentflow.kernel.api.LogLevel;

/**
 * Applies {@code --log-level} to the Logback root logger.
 */
final class LogLevels {
    private LogLevels() {}

    static void apply(LogLevel level) {
        if (LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME) instanceof ch.qos.logback.classic.Logger root) {
            root.setLevel(Level.toLevel(level.name(), Level.WARN));
        }
    }
}
