package work.agentflow.kernel.syntax;

import java.util.ArrayList;
import java.util.List;

/**
 * Single left-to-right scan of workflow text into {@link Token}s.
 *
 * <p>Recognized, in priority order: the operators {@code ->}, {@code ||} and {@code ~>};
 * {@code @label} checkpoints; {@code [} and {@code ]}; {@code (if ...)} conditions; step names
 * optionally followed by {@code :"instruction"} and {@code :capture}.
 */
public final class Tokenizer {
    private final String text;
    private final List<Token> tokens = new ArrayList<>();
    private int index;

    private Tokenizer(String text) {
        this.text = text;
    }

    public static List<Token> tokenize(String text) {
        if (text == null) {
            throw new WorkflowSyntaxException("workflow text is missing", 0, "Provide workflow syntax such as: analyzer -> fixer");
        }
        var tokenizer = new Tokenizer(text);
        tokenizer.scan();
        return List.copyOf(tokenizer.tokens);
    }

    private void scan() {
        while (index < text.length()) {
            char c = text.charAt(index);
            if (Character.isWhitespace(c)) {
                index++;
            } else if (startsWith("->")) {
                emitOperator(TokenKind.SEQUENTIAL, "->");
            } else if (startsWith("||")) {
                emitOperator(TokenKind.PARALLEL, "||");
            } else if (startsWith("~>")) {
                emitOperator(TokenKind.CONDITIONAL, "~>");
            } else if (c == '@') {
                scanCheckpoint();
            } else if (c == '[') {
                emitOperator(TokenKind.OPEN_BRACKET, "[");
            } else if (c == ']') {
                emitOperator(TokenKind.CLOSE_BRACKET, "]");
            } else if (c == '(') {
                scanCondition();
            } else if (c == '"') {
                throw new WorkflowSyntaxException(
                    "instruction without a step name",
                    index,
                    "Attach the instruction to a step, e.g. reviewer:\"check the diff\""
                );
            } else if (isNameChar(c)) {
                scanStep();
            } else {
                throw new WorkflowSyntaxException(
                    "unexpected character '" + c + "'",
                    index,
                    "Steps are joined with ->, || or ~>; group with [ ] and guard with (if ...)"
                );
            }
        }
    }

    private void emitOperator(TokenKind kind, String symbol) {
        tokens.add(Token.of(kind, symbol, index, symbol.length()));
        index += symbol.length();
    }

    private void scanCheckpoint() {
        int start = index;
        int cursor = index + 1;
        while (cursor < text.length() && isLabelChar(cursor)) {
            cursor++;
        }
        if (cursor == start + 1) {
            throw new WorkflowSyntaxException("empty checkpoint label", start, "Name the checkpoint, e.g. @review");
        }
        tokens.add(Token.of(TokenKind.CHECKPOINT, text.substring(start + 1, cursor), start, cursor - start));
        index = cursor;
    }

    private void scanCondition() {
        int start = index;
        if (!text.startsWith("(if ", start) && !text.startsWith("(if)", start)) {
            throw new WorkflowSyntaxException(
                "condition must start with '(if '",
                start,
                "Write conditions as (if passed), (if failed) or (if contains <text>)"
            );
        }
        int depth = 0;
        int cursor = start;
        while (cursor < text.length()) {
            char c = text.charAt(cursor);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0) {
                    break;
                }
            }
            cursor++;
        }
        if (cursor >= text.length()) {
            throw new WorkflowSyntaxException("unterminated condition", start, "Close the condition with ')'");
        }
        var inner = text.substring(start + 1, cursor).trim().replaceAll("\\s+", " ");
        tokens.add(Token.of(TokenKind.CONDITION, inner, start, cursor + 1 - start));
        index = cursor + 1;
    }

    private void scanStep() {
        int start = index;
        int cursor = index;
        while (cursor < text.length() && isNameChar(text.charAt(cursor)) && !isOperatorAt(cursor)) {
            cursor++;
        }
        var name = text.substring(start, cursor);
        String instruction = null;
        String capture = null;

        if (cursor < text.length() && text.charAt(cursor) == '"') {
            var quoted = readQuoted(cursor);
            instruction = quoted.value();
            cursor = quoted.end();
        } else if (cursor + 1 < text.length() && text.charAt(cursor) == ':' && text.charAt(cursor + 1) == '"') {
            var quoted = readQuoted(cursor + 1);
            instruction = quoted.value();
            cursor = quoted.end();
        }

        if (cursor < text.length() && text.charAt(cursor) == ':') {
            int captureStart = cursor + 1;
            int captureEnd = captureStart;
            while (captureEnd < text.length() && isWordChar(text.charAt(captureEnd))) {
                captureEnd++;
            }
            if (captureEnd == captureStart) {
                throw new WorkflowSyntaxException(
                    "expected a variable name after ':'",
                    cursor,
                    "Capture the output with " + name + ":result, then use {result} in later instructions"
                );
            }
            capture = text.substring(captureStart, captureEnd);
            cursor = captureEnd;
        }

        tokens.add(Token.step(name, instruction, capture, start, cursor - start));
        index = cursor;
    }

    private Quoted readQuoted(int openQuote) {
        var builder = new StringBuilder();
        int cursor = openQuote + 1;
        while (cursor < text.length()) {
            char c = text.charAt(cursor);
            if (c == '\\' && cursor + 1 < text.length()) {
                char next = text.charAt(cursor + 1);
                if (next == '"' || next == '\\') {
                    builder.append(next);
                    cursor += 2;
                    continue;
                }
            }
            if (c == '"') {
                return new Quoted(builder.toString(), cursor + 1);
            }
            builder.append(c);
            cursor++;
        }
        throw new WorkflowSyntaxException("unterminated quote", openQuote, "Close the instruction with a matching '\"'");
    }

    private boolean startsWith(String symbol) {
        return text.startsWith(symbol, index);
    }

    private boolean isOperatorAt(int position) {
        return text.startsWith("->", position) || text.startsWith("~>", position) || text.startsWith("||", position);
    }

    private boolean isLabelChar(int position) {
        char c = text.charAt(position);
        if (Character.isWhitespace(c) || c == '[' || c == ']' || c == '(' || c == ')' || c == '"') {
            return false;
        }
        return !isOperatorAt(position);
    }

    static boolean isNameChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.' || c == '$';
    }

    static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    private record Quoted(String value, int end) {}
}
