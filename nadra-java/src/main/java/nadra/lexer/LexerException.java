package nadra.lexer;

import nadra.NadraException;

public class LexerException extends NadraException {

    public LexerException(String message) {
        super(message);
    }

    public LexerException(String message, Throwable cause) {
        super(message, cause);
    }
}
