package ghnotif.domain.filter.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a query on whitespace. Parentheses are tokens of their own even when they touch a word.
 * AND, OR and NOT are only operators when written in upper case; "and" is a plain text search.
 * Where two operands, or a closing parenthesis and an operand, follow each other without an operator,
 * an AND is inserted.
 */
public final class FilterTokenizer {
    private FilterTokenizer() {
    }

    public static List<Token> tokenize(final String query) {
        final String[] words = query
                .replace("(", " ( ")
                .replace(")", " ) ")
                .trim()
                .split("\\s+");

        final List<Token> tokens = new ArrayList<>();
        for (final String word : words) {
            if (word.isEmpty()) {
                continue;
            }

            final Token token = toToken(word);
            if (!tokens.isEmpty() && endsOperand(tokens.get(tokens.size() - 1)) && startsOperand(token)) {
                tokens.add(new Token(TokenType.AND, "AND"));
            }
            tokens.add(token);
        }
        return tokens;
    }

    private static Token toToken(final String word) {
        return switch (word) {
            case "AND" -> new Token(TokenType.AND, word);
            case "OR" -> new Token(TokenType.OR, word);
            case "NOT" -> new Token(TokenType.NOT, word);
            case "(" -> new Token(TokenType.LEFT_PAREN, word);
            case ")" -> new Token(TokenType.RIGHT_PAREN, word);
            default -> new Token(TokenType.OPERAND, word);
        };
    }

    private static boolean endsOperand(final Token token) {
        return token.type() == TokenType.OPERAND || token.type() == TokenType.RIGHT_PAREN;
    }

    private static boolean startsOperand(final Token token) {
        return token.type() == TokenType.OPERAND
                || token.type() == TokenType.LEFT_PAREN
                || token.type() == TokenType.NOT;
    }
}
