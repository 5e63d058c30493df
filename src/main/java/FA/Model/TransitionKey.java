package FA.Model;

/**
 * A (source state, symbol) pair of the transition relation.
 */
public record TransitionKey(String state, String symbol) {
    @Override
    public String toString() {
        return "(" + state + ", " + symbol + ")";
    }
}
