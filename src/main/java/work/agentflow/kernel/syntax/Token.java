package work.agentflow.kernel.syntax;

import java.util.Objects;

/**
 * One lexical token. Step tokens additionally carry the parsed name, instruction and capture.
 *
 * @param position zero-based offset of the first character in the source text
 * @param length number of source characters the token spans
 */
public record Token(
    TokenKind kind,
    String value,
    int position,
    int length,
    String name,
    String instruction,
    String capture
) {
    public Token {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(value, "value");
    }

    static Token of(TokenKind kind, String value, int position, int length) {
        return new Token(kind, value, position, length, null, null, null);
    }

    static Token step(String name, String instruction, String capture, int position, int length) {
        var kind = instruction == null ? TokenKind.STEP_NAME : TokenKind.STEP_WITH_INSTRUCTION;
        return new Token(kind, name, position, length, name, instruction, capture);
    }

    public int end() {
        return position + length;
    }

    /**
     * Human-readable form used in error messages.
     */
    public String display() {
        return switch (kind) {
            case SEQUENTIAL -> "'->'";
            case PARALLEL -> "'||'";
            case CONDITIONAL -> "'~>'";
            case OPEN_BRACKET -> "'['";
            case CLOSE_BRACKET -> "']'";
            case CHECKPOINT -> "checkpoint '@" + value + "'";
            case CONDITION -> "condition '(" + value + ")'";
            default -> "step '" + value + "'";
        };
    }
}
