package FA.Codec;

import FA.Model.ErrorKind;

/**
 * Malformed automaton file: missing required field, dangling state or symbol reference, bad syntax.
 */
public class AutomatonFormatException extends Exception {

    public AutomatonFormatException(String message) {
        super(message);
    }

    public AutomatonFormatException(String message, Throwable cause) {
        super(message, cause);
    }

    public ErrorKind getKind() {
        return ErrorKind.PARSE_ERROR;
    }
}
