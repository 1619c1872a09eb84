package nadra.parser;

import nadra.NadraException;

public class ParserException extends NadraException {

    public ParserException(String message) {
        super(message);
    }
}
