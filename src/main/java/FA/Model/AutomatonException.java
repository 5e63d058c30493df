package FA.Model;

/**
 * Thrown by the automaton core when a single call is rejected.
 * The automaton the call was made on is left unchanged.
 */
public class AutomatonException extends RuntimeException {
    private final ErrorKind kind;

    public AutomatonException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public AutomatonException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    static AutomatonException invalidState(String state) {
        return new AutomatonException(ErrorKind.INVALID_STATE, "Unknown state: '" + state + "'");
    }

    static AutomatonException invalidSymbol(String symbol) {
        return new AutomatonException(ErrorKind.INVALID_SYMBOL, "Invalid symbol: '" + symbol + "'");
    }
}
