package nadra.lexer;

import java.util.Objects;

/**
 * A single lexical unit. {@code value} is only set for literal tokens and is null otherwise.
 */
public record Token(
        TokenType type,
        String lexeme,
        LiteralValue value,
        int line,
        int column
) {

    public Token {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(lexeme, "lexeme");
    }

    public Token(TokenType type, String lexeme, int line, int column) {
        this(type, lexeme, null, line, column);
    }

    public static Token eof(int line, int column) {
        return new Token(TokenType.EOF, "", line, column);
    }

    public boolean hasValue() {
        return value != null;
    }

    public boolean is(TokenType t) {
        return type == t;
    }

    @Override
    public String toString() {
        return type + "('" + lexeme + "')@" + line + ":" + column;
    }
}
