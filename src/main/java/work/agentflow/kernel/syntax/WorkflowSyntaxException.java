package work.agentflow.kernel.syntax;

import work.agentflow.kernel.error.WorkflowException;

/**
 * Raised by the tokenizer and the AST builder. Always anchored to a character position.
 */
public final class WorkflowSyntaxException extends WorkflowException {
    private final int position;

    public WorkflowSyntaxException(String message, int position, String hint) {
        super("syntax_error", "SyntaxError at position " + position + ": " + message, hint);
        this.position = position;
    }

    public int position() {
        return position;
    }

    /**
     * Two-line excerpt of {@code source} with a caret under {@code position}.
     */
    public static String pointer(String source, int position) {
        if (source == null) {
            return "";
        }
        int lineStart = source.lastIndexOf('\n', Math.max(0, Math.min(position, source.length()) - 1)) + 1;
        int lineEnd = source.indexOf('\n', lineStart);
        if (lineEnd < 0) {
            lineEnd = source.length();
        }
        int column = Math.max(0, Math.min(position, lineEnd) - lineStart);
        return source.substring(lineStart, lineEnd) + System.lineSeparator() + " ".repeat(column) + "^";
    }
}
