package work.agentflow.kernel.syntax;

import java.util.ArrayList;
import java.util.List;

/**
 * Operator-precedence recursive descent over the token stream.
 *
 * <p>Binding strength, tightest first: brackets, {@code ||}, {@code ->}, {@code ~>}. Repeated
 * {@code ->} and {@code ||} fold into flat lists, so {@code a -> b -> c} is one three-step
 * sequence. A {@code ~>} without a preceding {@code (if ...)} defaults to {@code if failed}.
 *
 * <p>The engine evaluates a {@code ~>} edge only once its source is completed or skipped. A failed
 * source holds the edge until steering or the failure policy resolves it, so {@code a ~> fallback}
 * reaches {@code fallback} after {@code skip} and never under the {@code abort} policy.
 */
public final class AstBuilder {
    public static final String DEFAULT_CONDITION = "if failed";

    private final List<Token> tokens;
    private final int sourceLength;
    private int index;

    private AstBuilder(List<Token> tokens, int sourceLength) {
        this.tokens = tokens;
        this.sourceLength = sourceLength;
    }

    public static AstNode build(List<Token> tokens) {
        int end = tokens == null || tokens.isEmpty() ? 0 : tokens.get(tokens.size() - 1).end();
        return build(tokens, end);
    }

    public static AstNode build(List<Token> tokens, int sourceLength) {
        if (tokens == null || tokens.isEmpty()) {
            throw new WorkflowSyntaxException("workflow is empty", 0, "Provide at least one step, e.g. analyzer");
        }
        var builder = new AstBuilder(tokens, sourceLength);
        var root = builder.parseConditional();
        if (builder.index < tokens.size()) {
            var stray = tokens.get(builder.index);
            if (stray.kind() == TokenKind.CLOSE_BRACKET) {
                throw new WorkflowSyntaxException("unmatched ']'", stray.position(), "Remove the ']' or add the matching '['");
            }
            throw new WorkflowSyntaxException(
                "unexpected " + stray.display() + " after a complete expression",
                stray.position(),
                "Join steps with ->, || or ~>"
            );
        }
        return root;
    }

    private AstNode parseConditional() {
        var left = parseSequence();
        while (peekIs(TokenKind.CONDITION) || peekIs(TokenKind.CONDITIONAL)) {
            var condition = DEFAULT_CONDITION;
            if (peekIs(TokenKind.CONDITION)) {
                var conditionToken = next();
                if (!peekIs(TokenKind.CONDITIONAL)) {
                    throw new WorkflowSyntaxException(
                        conditionToken.display() + " must be followed by '~>'",
                        conditionToken.end(),
                        "Write conditional steps as: source (if passed)~> target"
                    );
                }
                condition = conditionToken.value();
            }
            next();
            var right = parseSequence();
            left = new AstNode.Conditional(left, condition, right);
        }
        return left;
    }

    private AstNode parseSequence() {
        var steps = new ArrayList<AstNode>();
        steps.add(parseParallel());
        while (peekIs(TokenKind.SEQUENTIAL)) {
            next();
            steps.add(parseParallel());
        }
        return steps.size() == 1 ? steps.get(0) : new AstNode.Sequence(steps);
    }

    private AstNode parseParallel() {
        var branches = new ArrayList<AstNode>();
        branches.add(parsePrimary());
        while (peekIs(TokenKind.PARALLEL)) {
            next();
            branches.add(parsePrimary());
        }
        return branches.size() == 1 ? branches.get(0) : new AstNode.Parallel(branches);
    }

    private AstNode parsePrimary() {
        if (index >= tokens.size()) {
            throw new WorkflowSyntaxException(
                "expected a step, checkpoint or '[' but the workflow ended",
                sourceLength,
                "Remove the trailing operator or add the missing step"
            );
        }
        var token = next();
        switch (token.kind()) {
            case STEP_NAME, STEP_WITH_INSTRUCTION -> {
                return new AstNode.Step(token.name(), token.instruction(), token.capture(), token.position());
            }
            case CHECKPOINT -> {
                return new AstNode.Checkpoint(token.value(), token.position());
            }
            case OPEN_BRACKET -> {
                if (peekIs(TokenKind.CLOSE_BRACKET)) {
                    throw new WorkflowSyntaxException("empty brackets", token.position(), "Put at least one step inside [ ]");
                }
                var child = parseConditional();
                if (!peekIs(TokenKind.CLOSE_BRACKET)) {
                    int expectedAt = index < tokens.size() ? tokens.get(index).position() : sourceLength;
                    throw new WorkflowSyntaxException(
                        "unclosed bracket opened at position " + token.position() + ", expected ']' at position " + expectedAt,
                        expectedAt,
                        "Add ']' to close the group started at position " + token.position()
                    );
                }
                next();
                return new AstNode.Subgraph(child);
            }
            default -> throw new WorkflowSyntaxException(
                "unexpected " + token.display() + ", expected a step, checkpoint or '['",
                token.position(),
                token.kind().isOperator()
                    ? "An operator needs a step on both sides"
                    : "Check the operator placement around position " + token.position()
            );
        }
    }

    private boolean peekIs(TokenKind kind) {
        return index < tokens.size() && tokens.get(index).kind() == kind;
    }

    private Token next() {
        return tokens.get(index++);
    }
}
