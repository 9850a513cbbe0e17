package work.agentflow.kernel.support;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import work.agentflow.kernel.steering.PromptCollaborator;

/**
 * Answers prompts from a fixed script and records everything said to the operator. Once the
 * script runs out every question is answered with {@code null}, like a closed console.
 */
public final class ScriptedPrompt implements PromptCollaborator {
    private final Deque<String> answers;
    private final List<String> questions = new ArrayList<>();
    private final List<String> messages = new ArrayList<>();

    public ScriptedPrompt(String... answers) {
        this.answers = new ArrayDeque<>(Arrays.asList(answers));
    }

    @Override
    public String ask(String question, List<String> options) {
        questions.add(question);
        var answer = answers.poll();
        if (answer == null) {
            return null;
        }
        if (!options.contains(answer)) {
            throw new AssertionError("Scripted answer '" + answer + "' is not among " + options + " for: " + question);
        }
        return answer;
    }

    @Override
    public List<String> askMany(String question, List<String> options) {
        questions.add(question);
        var answer = answers.poll();
        if (answer == null || answer.isBlank()) {
            return List.of();
        }
        return Arrays.stream(answer.split(",")).map(String::trim).toList();
    }

    @Override
    public String askText(String question) {
        questions.add(question);
        return answers.poll();
    }

    @Override
    public void say(String message) {
        messages.add(message);
    }

    public List<String> questions() {
        return questions;
    }

    public List<String> messages() {
        return messages;
    }

    public String transcript() {
        return String.join(System.lineSeparator(), messages);
    }

    public int remaining() {
        return answers.size();
    }
}
