package nadra.codegen;

import nadra.NadraException;

public class GenerationException extends NadraException {

    public GenerationException(String message) {
        super(message);
    }
}
