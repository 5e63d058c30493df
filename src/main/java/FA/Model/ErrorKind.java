package FA.Model;

/**
 * Closed set of failure kinds reported by the automaton core.
 */
public enum ErrorKind {
    /** A state name that is not part of the automaton, or a missing initial/accepting state. */
    INVALID_STATE,
    /** A transition label outside the alphabet, a reserved or blank symbol. */
    INVALID_SYMBOL,
    /** Simulation input contains a symbol outside the declared alphabet. */
    UNKNOWN_SYMBOL,
    /** Simulation reached a configuration with no outgoing transition. */
    NO_TRANSITION,
    /** Negative or non-numeric closure length, or an oversized request. */
    INVALID_ARGUMENT,
    /** Malformed native, JFLAP or JSON input. */
    PARSE_ERROR
}
