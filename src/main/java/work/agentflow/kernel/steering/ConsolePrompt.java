package work.agentflow.kernel.steering;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Line-based prompt over a reader and writer. Options may be answered by number, by full label
 * or by a unique prefix.
 */
public final class ConsolePrompt implements PromptCollaborator {
    private final BufferedReader in;
    private final PrintWriter out;

    public ConsolePrompt(BufferedReader in, PrintWriter out) {
        this.in = Objects.requireNonNull(in, "in");
        this.out = Objects.requireNonNull(out, "out");
    }

    @Override
    public String ask(String question, List<String> options) {
        if (options.isEmpty()) {
            return null;
        }
        while (true) {
            out.println(question);
            for (int i = 0; i < options.size(); i++) {
                out.println("  " + (i + 1) + ") " + options.get(i));
            }
            out.print("> ");
            out.flush();
            var line = readLine();
            if (line == null) {
                return null;
            }
            var match = match(line.trim(), options);
            if (match != null) {
                return match;
            }
            out.println("Please choose one of the listed options.");
        }
    }

    @Override
    public List<String> askMany(String question, List<String> options) {
        while (true) {
            out.println(question + " (comma separated, 'all' or empty for none)");
            for (int i = 0; i < options.size(); i++) {
                out.println("  " + (i + 1) + ") " + options.get(i));
            }
            out.print("> ");
            out.flush();
            var line = readLine();
            if (line == null || line.isBlank()) {
                return List.of();
            }
            if (line.trim().equalsIgnoreCase("all")) {
                return List.copyOf(options);
            }
            var selected = new ArrayList<String>();
            boolean valid = true;
            for (var part : line.split(",")) {
                var match = match(part.trim(), options);
                if (match == null) {
                    out.println("Unknown option: " + part.trim());
                    valid = false;
                    break;
                }
                if (!selected.contains(match)) {
                    selected.add(match);
                }
            }
            if (valid) {
                return selected;
            }
        }
    }

    @Override
    public String askText(String question) {
        out.print(question + " ");
        out.flush();
        return readLine();
    }

    @Override
    public void say(String message) {
        out.println(message);
        out.flush();
    }

    static String match(String answer, List<String> options) {
        if (answer.isEmpty()) {
            return null;
        }
        try {
            int index = Integer.parseInt(answer);
            return index >= 1 && index <= options.size() ? options.get(index - 1) : null;
        } catch (NumberFormatException ignored) {
            // not a number, try labels
        }
        var lower = answer.toLowerCase(Locale.ROOT);
        String prefixMatch = null;
        int prefixMatches = 0;
        for (var option : options) {
            var candidate = option.toLowerCase(Locale.ROOT);
            if (candidate.equals(lower)) {
                return option;
            }
            if (candidate.startsWith(lower)) {
                prefixMatch = option;
                prefixMatches++;
            }
        }
        return prefixMatches == 1 ? prefixMatch : null;
    }

    private String readLine() {
        try {
            return in.readLine();
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read operator input", ex);
        }
    }
}
