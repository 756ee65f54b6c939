package ghnotif.domain.filter.parser;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

public class FilterTokenizerTest {
    @Test
    public void testParenthesesAreSeparateTokens() {
        final List<TokenType> types = FilterTokenizer.tokenize("(is:unread OR type:Issue)").stream()
                .map(Token::type)
                .toList();

        Assertions.assertEquals(
                List.of(TokenType.LEFT_PAREN, TokenType.OPERAND, TokenType.OR, TokenType.OPERAND, TokenType.RIGHT_PAREN),
                types);
    }

    @Test
    public void testImplicitAnd() {
        final List<Token> tokens = FilterTokenizer.tokenize("a (b) NOT c");

        Assertions.assertEquals(
                List.of(
                        new Token(TokenType.OPERAND, "a"),
                        new Token(TokenType.AND, "AND"),
                        new Token(TokenType.LEFT_PAREN, "("),
                        new Token(TokenType.OPERAND, "b"),
                        new Token(TokenType.RIGHT_PAREN, ")"),
                        new Token(TokenType.AND, "AND"),
                        new Token(TokenType.NOT, "NOT"),
                        new Token(TokenType.OPERAND, "c")),
                tokens);
    }

    @Test
    public void testKeywordsAreCaseSensitive() {
        Assertions.assertEquals(TokenType.OPERAND, FilterTokenizer.tokenize("or").get(0).type());
        Assertions.assertEquals(TokenType.OR, FilterTokenizer.tokenize("OR").get(0).type());
    }

    @Test
    public void testPrecedence() {
        Assertions.assertTrue(TokenType.NOT.getPrecedence() > TokenType.AND.getPrecedence());
        Assertions.assertTrue(TokenType.AND.getPrecedence() > TokenType.OR.getPrecedence());
    }
}
