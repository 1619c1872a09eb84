package nadra.lexer;

public enum TokenType {

    // arithmetic
    PLUS(Precedence.ADDITIVE), PLUS_EQUAL(Precedence.ASSIGNMENT),
    MINUS(Precedence.ADDITIVE), MINUS_EQUAL(Precedence.ASSIGNMENT),
    STAR(Precedence.MULTIPLICATIVE), STAR_STAR(Precedence.EXPONENT), STAR_EQUAL(Precedence.ASSIGNMENT),
    SLASH(Precedence.MULTIPLICATIVE), SLASH_EQUAL(Precedence.ASSIGNMENT),
    PERCENT(Precedence.MULTIPLICATIVE), PERCENT_EQUAL(Precedence.ASSIGNMENT),
    AT,

    // comparison / logic
    EQUAL(Precedence.ASSIGNMENT), EQUAL_EQUAL(Precedence.EQUALITY),
    BANG, BANG_EQUAL(Precedence.EQUALITY),
    AND(Precedence.ADDITIVE), OR(Precedence.ADDITIVE),
    LESS(Precedence.EQUALITY), LESS_EQUAL(Precedence.EQUALITY),
    GREATER(Precedence.EQUALITY), GREATER_EQUAL(Precedence.EQUALITY),

    // punctuation
    DOT, DOT_DOT, COMMA,
    LPAREN, RPAREN,
    LBRACKET, RBRACKET,
    LBRACE, RBRACE,
    UNDERSCORE, COLON, SCOPE, ARROW,

    // literals
    INT_LITERAL,
    FLOAT_LITERAL,
    STRING_LITERAL,
    TRUE,
    FALSE,
    IDENTIFIER,

    // keywords
    ENUM, ENDENUM,
    STRUCT, ENDSTRUCT,
    DEF, ENDDEF,
    IF, THEN, ENDIF, ELSE,
    FOR, WHILE, DO, DONE,
    RETURN, BREAK, CONTINUE,
    USE,

    EOF;

    /** Binding strength of binary operators, loosest first. */
    public static final class Precedence {
        public static final int NONE = -1;
        public static final int ASSIGNMENT = 0;
        public static final int EQUALITY = 1;
        public static final int ADDITIVE = 2;
        public static final int MULTIPLICATIVE = 3;
        public static final int EXPONENT = 4;

        private Precedence() {}
    }

    private final int precedence;

    TokenType() {
        this(Precedence.NONE);
    }

    TokenType(int precedence) {
        this.precedence = precedence;
    }

    public int precedence() {
        return precedence;
    }

    public boolean isBinaryOperator() {
        return precedence != Precedence.NONE;
    }

    public boolean isLiteral() {
        return this == INT_LITERAL || this == FLOAT_LITERAL || this == STRING_LITERAL;
    }
}
