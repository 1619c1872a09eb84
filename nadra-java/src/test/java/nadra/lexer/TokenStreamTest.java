package nadra.lexer;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TokenStreamTest {

    private static Token ident(String name) {
        return new Token(TokenType.IDENTIFIER, name, 1, 1);
    }

    @Test
    void take_returns_tokens_in_order_once() {
        var s = new TokenStream(List.of(ident("a"), ident("b"), Token.eof(1, 4)));
        assertEquals("a", s.peek().lexeme());
        assertEquals("a", s.take().lexeme());
        assertEquals("b", s.take().lexeme());
        assertTrue(s.isAtEnd());
    }

    @Test
    void reads_past_the_end_keep_returning_eof() {
        var s = new TokenStream(List.of(ident("a")));
        s.take();
        for (int i = 0; i < 3; i++) {
            assertEquals(TokenType.EOF, s.take().type());
            assertEquals(TokenType.EOF, s.peek().type());
        }
        assertEquals(1, s.remaining());
    }

    @Test
    void eof_is_appended_when_missing() {
        var s = new TokenStream(List.of(ident("a")));
        assertEquals(2, s.size());
        assertEquals(TokenType.EOF, s.peek(1).type());
    }

    @Test
    void empty_stream_yields_eof_immediately() {
        var s = TokenStream.empty();
        assertTrue(s.isAtEnd());
        assertEquals(TokenType.EOF, s.take().type());
        assertEquals(1, s.size());
    }

    @Test
    void eof_in_the_middle_is_rejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new TokenStream(List.of(Token.eof(1, 1), ident("a"))));
    }

    @Test
    void peek_offset_clamps_at_eof() {
        var s = new TokenStream(List.of(ident("a"), ident("b")));
        assertEquals("b", s.peek(1).lexeme());
        assertEquals(TokenType.EOF, s.peek(2).type());
        assertEquals(TokenType.EOF, s.peek(50).type());
        assertThrows(IllegalArgumentException.class, () -> s.peek(-1));
    }

    @Test
    void stream_does_not_see_later_changes_to_source_list() {
        var list = new java.util.ArrayList<>(List.of(ident("a")));
        var s = new TokenStream(list);
        list.add(0, ident("z"));
        assertEquals("a", s.take().lexeme());
    }
}
