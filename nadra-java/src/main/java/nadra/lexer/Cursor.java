package nadra.lexer;

import com.google.common.base.Preconditions;

/**
 * Two-pointer window over the source text. {@code left} is inclusive, {@code right}
 * exclusive; the characters in between form the lexeme being matched.
 */
final class Cursor {

    private final String source;
    private int left = 0;
    private int right = 0;

    Cursor(String source) {
        this.source = Preconditions.checkNotNull(source, "source");
    }

    boolean isAtEnd() {
        return right >= source.length();
    }

    /** Character under the right pointer, or {@code '\0'} past the end. */
    char current() {
        return isAtEnd() ? '\0' : source.charAt(right);
    }

    /** Code point under the right pointer, or 0 past the end. */
    int currentCodePoint() {
        return isAtEnd() ? 0 : source.codePointAt(right);
    }

    void advanceCodePoint() {
        Preconditions.checkState(!isAtEnd(), "cursor already at end of input");
        right += Character.charCount(source.codePointAt(right));
    }

    char next() {
        return right + 1 >= source.length() ? '\0' : source.charAt(right + 1);
    }

    char advanceRight() {
        Preconditions.checkState(!isAtEnd(), "cursor already at end of input");
        return source.charAt(right++);
    }

    void advanceLeftToRight() {
        left = right;
    }

    String capture() {
        return source.substring(left, right);
    }

    int left() {
        return left;
    }

    int right() {
        return right;
    }
}
