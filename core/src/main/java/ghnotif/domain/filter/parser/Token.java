package ghnotif.domain.filter.parser;

public record Token(TokenType type, String text) {
}
