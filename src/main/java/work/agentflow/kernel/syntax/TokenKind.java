package work.agentflow.kernel.syntax;

/**
 * Lexical categories of the workflow syntax.
 */
public enum TokenKind {
    STEP_NAME,
    STEP_WITH_INSTRUCTION,
    SEQUENTIAL,
    PARALLEL,
    CONDITIONAL,
    CHECKPOINT,
    OPEN_BRACKET,
    CLOSE_BRACKET,
    CONDITION;

    public boolean isStep() {
        return this == STEP_NAME || this == STEP_WITH_INSTRUCTION;
    }

    public boolean isOperator() {
        return this == SEQUENTIAL || this == PARALLEL || this == CONDITIONAL;
    }
}
