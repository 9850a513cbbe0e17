package work.agentflow.kernel.steering;

import java.util.List;

/**
 * Operator-facing questions. Implementations return {@code null} when input is exhausted.
 */
public interface PromptCollaborator {
    /**
     * @return one of {@code options}
     */
    String ask(String question, List<String> options);

    /**
     * @return a subset of {@code options}, possibly empty
     */
    List<String> askMany(String question, List<String> options);

    String askText(String question);

    default void say(String message) {}
}
