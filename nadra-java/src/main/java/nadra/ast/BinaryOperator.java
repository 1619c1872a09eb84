package nadra.ast;

import nadra.lexer.TokenType;

public enum BinaryOperator {
    ADD, SUBTRACT, MULTIPLY, DIVIDE, MODULUS, EXPONENT,
    ASSIGN, ADD_ASSIGN, SUBTRACT_ASSIGN, MULTIPLY_ASSIGN, DIVIDE_ASSIGN, MODULUS_ASSIGN,
    EQUAL, NOT_EQUAL, LESS, GREATER, LESS_EQUAL, GREATER_EQUAL,
    AND, OR;

    public static BinaryOperator fromToken(TokenType t) {
        return switch (t) {
            case PLUS          -> ADD;
            case MINUS         -> SUBTRACT;
            case STAR          -> MULTIPLY;
            case SLASH         -> DIVIDE;
            case PERCENT       -> MODULUS;
            case STAR_STAR     -> EXPONENT;

            case EQUAL         -> ASSIGN;
            case PLUS_EQUAL    -> ADD_ASSIGN;
            case MINUS_EQUAL   -> SUBTRACT_ASSIGN;
            case STAR_EQUAL    -> MULTIPLY_ASSIGN;
            case SLASH_EQUAL   -> DIVIDE_ASSIGN;
            case PERCENT_EQUAL -> MODULUS_ASSIGN;

            case EQUAL_EQUAL   -> EQUAL;
            case BANG_EQUAL    -> NOT_EQUAL;
            case LESS          -> LESS;
            case GREATER       -> GREATER;
            case LESS_EQUAL    -> LESS_EQUAL;
            case GREATER_EQUAL -> GREATER_EQUAL;

            case AND -> AND;
            case OR  -> OR;

            default -> throw new IllegalArgumentException("Not a binary operator token: " + t);
        };
    }

    public boolean isAssignment() {
        return switch (this) {
            case ASSIGN, ADD_ASSIGN, SUBTRACT_ASSIGN, MULTIPLY_ASSIGN, DIVIDE_ASSIGN, MODULUS_ASSIGN -> true;
            default -> false;
        };
    }

    public boolean isComparison() {
        return switch (this) {
            case EQUAL, NOT_EQUAL, LESS, GREATER, LESS_EQUAL, GREATER_EQUAL -> true;
            default -> false;
        };
    }
}
