package work.agentflow.kernel.syntax;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class TokenizerTest {
    @Test
    void readsStepsWithInstructionAndCapture() {
        var tokens = Tokenizer.tokenize("analyzer:\"scan\":bugs -> fixer");
        assertEquals(List.of(TokenKind.STEP_WITH_INSTRUCTION, TokenKind.SEQUENTIAL, TokenKind.STEP_NAME), kinds(tokens));

        var analyzer = tokens.get(0);
        assertEquals("analyzer", analyzer.name());
        assertEquals("scan", analyzer.instruction());
        assertEquals("bugs", analyzer.capture());
        assertEquals(0, analyzer.position());
        assertEquals(21, tokens.get(1).position());
        assertEquals(24, tokens.get(2).position());
        assertNull(tokens.get(2).instruction());
    }

    @Test
    void acceptsInstructionWithoutColonAndBareCapture() {
        var tokens = Tokenizer.tokenize("reviewer\"look closely\" || counter:total");
        assertEquals("look closely", tokens.get(0).instruction());
        assertEquals(TokenKind.PARALLEL, tokens.get(1).kind());
        assertEquals(TokenKind.STEP_NAME, tokens.get(2).kind());
        assertEquals("total", tokens.get(2).capture());
    }

    @Test
    void unescapesQuotesAndBackslashes() {
        var tokens = Tokenizer.tokenize("echo:\"say \\\"hi\\\" \\\\ bye\"");
        assertEquals("say \"hi\" \\ bye", tokens.get(0).instruction());
    }

    @Test
    void readsCheckpointsConditionsAndBrackets() {
        var tokens = Tokenizer.tokenize("[a || b] -> @review (if   passed)~> c");
        assertEquals(
            List.of(
                TokenKind.OPEN_BRACKET,
                TokenKind.STEP_NAME,
                TokenKind.PARALLEL,
                TokenKind.STEP_NAME,
                TokenKind.CLOSE_BRACKET,
                TokenKind.SEQUENTIAL,
                TokenKind.CHECKPOINT,
                TokenKind.CONDITION,
                TokenKind.CONDITIONAL,
                TokenKind.STEP_NAME
            ),
            kinds(tokens)
        );
        assertEquals("review", tokens.get(6).value());
        assertEquals("if passed", tokens.get(7).value());
    }

    @Test
    void operatorsNeedNoWhitespace() {
        var tokens = Tokenizer.tokenize("a->b~>c");
        assertEquals(List.of("a", "->", "b", "~>", "c"), tokens.stream().map(Token::value).toList());
    }

    @Test
    void stepNamesAllowDotsDashesAndDollar() {
        var tokens = Tokenizer.tokenize("code.review-v2 -> $tool_1");
        assertEquals("code.review-v2", tokens.get(0).name());
        assertEquals("$tool_1", tokens.get(2).name());
    }

    @Test
    void reportsUnterminatedQuote() {
        var ex = assertThrows(WorkflowSyntaxException.class, () -> Tokenizer.tokenize("a:\"oops"));
        assertEquals(2, ex.position());
        assertTrue(ex.getMessage().contains("unterminated quote"));
    }

    @Test
    void reportsUnterminatedCondition() {
        var ex = assertThrows(WorkflowSyntaxException.class, () -> Tokenizer.tokenize("a (if passed ~> b"));
        assertEquals(2, ex.position());
        assertTrue(ex.getMessage().contains("unterminated condition"));
    }

    @Test
    void conditionMustStartWithIf() {
        var ex = assertThrows(WorkflowSyntaxException.class, () -> Tokenizer.tokenize("a (when done)~> b"));
        assertTrue(ex.getMessage().contains("(if "));
    }

    @Test
    void reportsEmptyCheckpointLabel() {
        var ex = assertThrows(WorkflowSyntaxException.class, () -> Tokenizer.tokenize("a -> @ -> b"));
        assertEquals(5, ex.position());
    }

    @Test
    void reportsMissingCaptureName() {
        var ex = assertThrows(WorkflowSyntaxException.class, () -> Tokenizer.tokenize("a: -> b"));
        assertEquals(1, ex.position());
        assertTrue(ex.hint().contains("a:result"));
    }

    @Test
    void reportsUnexpectedCharacter() {
        var ex = assertThrows(WorkflowSyntaxException.class, () -> Tokenizer.tokenize("a & b"));
        assertEquals(2, ex.position());
        assertTrue(ex.getMessage().startsWith("SyntaxError at position 2"));
    }

    private static List<TokenKind> kinds(List<Token> tokens) {
        return tokens.stream().map(Token::kind).toList();
    }
}
