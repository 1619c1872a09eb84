package nadra.ast;

import nadra.lexer.TokenType;

public enum UnaryOperator {
    NEGATE, NOT;

    public static UnaryOperator fromToken(TokenType t) {
        return switch (t) {
            case MINUS -> NEGATE;
            case BANG -> NOT;
            default -> throw new IllegalArgumentException("Not a unary operator token: " + t);
        };
    }
}
