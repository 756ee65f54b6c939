package ghnotif.domain.filter.parser;

public enum TokenType {
    OPERAND(0),
    LEFT_PAREN(0),
    RIGHT_PAREN(0),
    OR(1),
    AND(2),
    NOT(3);

    private final int precedence;

    TokenType(final int precedence) {
        this.precedence = precedence;
    }

    public int getPrecedence() {
        return precedence;
    }

    public boolean isOperator() {
        return precedence > 0;
    }
}
