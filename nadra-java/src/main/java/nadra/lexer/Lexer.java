package nadra.lexer;

import com.google.common.collect.ImmutableMap;

import java.util.ArrayList;
import java.util.List;

public final class Lexer {

    private static final ImmutableMap<String, TokenType> KEYWORDS = ImmutableMap.<String, TokenType>builder()
            .put("enum", TokenType.ENUM)
            .put("endenum", TokenType.ENDENUM)
            .put("struct", TokenType.STRUCT)
            .put("endstruct", TokenType.ENDSTRUCT)
            .put("if", TokenType.IF)
            .put("then", TokenType.THEN)
            .put("endif", TokenType.ENDIF)
            .put("else", TokenType.ELSE)
            .put("def", TokenType.DEF)
            .put("enddef", TokenType.ENDDEF)
            .put("for", TokenType.FOR)
            .put("do", TokenType.DO)
            .put("done", TokenType.DONE)
            .put("while", TokenType.WHILE)
            .put("true", TokenType.TRUE)
            .put("false", TokenType.FALSE)
            .put("return", TokenType.RETURN)
            .put("break", TokenType.BREAK)
            .put("continue", TokenType.CONTINUE)
            .put("use", TokenType.USE)
            .build();

    private final Cursor cursor;
    private final List<Token> tokens = new ArrayList<>();

    private int line = 1;
    private int col = 1;
    private int startLine;
    private int startCol;

    public Lexer(String source) {
        this.cursor = new Cursor(source);
    }

    /** Scans the whole source. Nothing is returned if scanning fails part way. */
    public static TokenStream tokenize(String source) {
        return new TokenStream(new Lexer(source).scanTokens());
    }

    public static TokenType keyword(String lexeme) {
        return KEYWORDS.get(lexeme);
    }

    public List<Token> scanTokens() {
        while (!cursor.isAtEnd()) {
            startLine = line;
            startCol = col;
            scanToken();
            cursor.advanceLeftToRight();
        }

        tokens.add(Token.eof(line, col));
        return tokens;
    }

    private void scanToken() {
        char c = advance();

        switch (c) {
            case ' ', '\r', '\t' -> { }
            case '\n' -> {
                line++;
                col = 1;
            }

            case '+' -> add(match('=') ? TokenType.PLUS_EQUAL : TokenType.PLUS);
            case '-' -> {
                if (match('=')) add(TokenType.MINUS_EQUAL);
                else if (match('>')) add(TokenType.ARROW);
                else add(TokenType.MINUS);
            }
            case '*' -> {
                if (match('=')) add(TokenType.STAR_EQUAL);
                else if (match('*')) add(TokenType.STAR_STAR);
                else add(TokenType.STAR);
            }
            case '/' -> add(match('=') ? TokenType.SLASH_EQUAL : TokenType.SLASH);
            case '%' -> add(match('=') ? TokenType.PERCENT_EQUAL : TokenType.PERCENT);
            case '=' -> add(match('=') ? TokenType.EQUAL_EQUAL : TokenType.EQUAL);
            case '!' -> add(match('=') ? TokenType.BANG_EQUAL : TokenType.BANG);
            case '<' -> add(match('=') ? TokenType.LESS_EQUAL : TokenType.LESS);
            case '>' -> add(match('=') ? TokenType.GREATER_EQUAL : TokenType.GREATER);
            case ':' -> add(match(':') ? TokenType.SCOPE : TokenType.COLON);
            case '.' -> add(match('.') ? TokenType.DOT_DOT : TokenType.DOT);

            case '&' -> {
                if (match('&')) add(TokenType.AND);
                else error("Unexpected character: '&'");
            }
            case '|' -> {
                if (match('|')) add(TokenType.OR);
                else error("Unexpected character: '|'");
            }

            case '@' -> add(TokenType.AT);
            case ',' -> add(TokenType.COMMA);
            case '(' -> add(TokenType.LPAREN);
            case ')' -> add(TokenType.RPAREN);
            case '[' -> add(TokenType.LBRACKET);
            case ']' -> add(TokenType.RBRACKET);
            case '{' -> add(TokenType.LBRACE);
            case '}' -> add(TokenType.RBRACE);
            case '_' -> add(TokenType.UNDERSCORE);

            case '"' -> stringLiteral();

            default -> {
                int cp = c;
                if (Character.isHighSurrogate(c) && Character.isLowSurrogate(cursor.current())) {
                    cp = Character.toCodePoint(c, cursor.advanceRight()); // one column per code point
                }
                if (isDigit(c)) numberLiteral();
                else if (Character.isLetter(cp)) identifier();
                else error("Unexpected character: '" + Character.toString(cp) + "'");
            }
        }
    }

    // ================= helpers =================

    private void numberLiteral() {
        while (isDigit(cursor.current())) advance();

        boolean isFloat = false;
        if (cursor.current() == '.' && isDigit(cursor.next())) {
            isFloat = true;
            advance();
            while (isDigit(cursor.current())) advance();
        }

        String text = cursor.capture();
        try {
            if (isFloat) {
                double value = Double.parseDouble(text);
                if (!Double.isFinite(value)) {
                    throw new NumberFormatException("out of range for a 64-bit float");
                }
                add(TokenType.FLOAT_LITERAL, new LiteralValue.FloatValue(value));
            } else {
                add(TokenType.INT_LITERAL, new LiteralValue.IntValue(Long.parseLong(text)));
            }
        } catch (NumberFormatException e) {
            throw new LexerException(position() + "Malformed numeric literal: " + text, e);
        }
    }

    private void identifier() {
        while (Character.isLetterOrDigit(cursor.currentCodePoint())) {
            col++;
            cursor.advanceCodePoint();
        }

        TokenType type = KEYWORDS.getOrDefault(cursor.capture(), TokenType.IDENTIFIER);
        add(type);
    }

    private void stringLiteral() {
        while (!cursor.isAtEnd() && cursor.current() != '"') {
            char c = advance();
            if (c == '\n') {
                line++;
                col = 1;
            } else if (c == '\\' && !cursor.isAtEnd()) {
                advance(); // escaped char never closes the literal
            }
        }

        if (cursor.isAtEnd()) {
            throw new LexerException("[" + startLine + ":" + startCol + "] Unterminated string");
        }

        advance(); // closing "
        String lexeme = cursor.capture();
        add(TokenType.STRING_LITERAL, new LiteralValue.StringValue(lexeme.substring(1, lexeme.length() - 1)));
    }

    private boolean match(char expected) {
        if (cursor.isAtEnd() || cursor.current() != expected) return false;
        advance();
        return true;
    }

    private char advance() {
        col++;
        return cursor.advanceRight();
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private void add(TokenType type) {
        add(type, null);
    }

    private void add(TokenType type, LiteralValue value) {
        tokens.add(new Token(type, cursor.capture(), value, startLine, startCol));
    }

    private String position() {
        return "[" + startLine + ":" + startCol + "] ";
    }

    private void error(String message) {
        throw new LexerException(position() + message);
    }
}
