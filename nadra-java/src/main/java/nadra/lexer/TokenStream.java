package nadra.lexer;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Ordered, read-once sequence of tokens ending in exactly one {@link TokenType#EOF}.
 * Reading never moves past the end-of-stream token; it is returned again on every read.
 */
public final class TokenStream {

    private final ImmutableList<Token> tokens;
    private int pos = 0;

    public TokenStream(List<Token> tokens) {
        ImmutableList.Builder<Token> b = ImmutableList.builder();
        for (int i = 0; i < tokens.size(); i++) {
            Token t = tokens.get(i);
            Preconditions.checkArgument(!t.is(TokenType.EOF) || i == tokens.size() - 1,
                    "EOF token at position %s is not the last token", i);
            b.add(t);
        }
        if (tokens.isEmpty() || !tokens.get(tokens.size() - 1).is(TokenType.EOF)) {
            b.add(Token.eof(1, 1));
        }
        this.tokens = b.build();
    }

    public static TokenStream empty() {
        return new TokenStream(List.of());
    }

    public Token peek() {
        return tokens.get(pos);
    }

    /** Looks {@code offset} tokens past the front; clamps at end-of-stream. */
    public Token peek(int offset) {
        Preconditions.checkArgument(offset >= 0, "negative offset: %s", offset);
        return tokens.get(Math.min(pos + offset, tokens.size() - 1));
    }

    public Token take() {
        Token t = tokens.get(pos);
        if (!t.is(TokenType.EOF)) pos++;
        return t;
    }

    public boolean isAtEnd() {
        return peek().is(TokenType.EOF);
    }

    /** Number of tokens not yet taken, end-of-stream included. */
    public int remaining() {
        return tokens.size() - pos;
    }

    public int size() {
        return tokens.size();
    }

    @Override
    public String toString() {
        return tokens.subList(pos, tokens.size()).toString();
    }
}
