package FA.Simulation;

import java.util.List;

/**
 * One move of a simulation: the configuration before reading {@code symbol} and the one after.
 * Configurations list their states in lexicographic order; a DFA configuration has a single state.
 */
public record TraceStep(List<String> source, String symbol, List<String> target) {
    public TraceStep {
        source = List.copyOf(source);
        target = List.copyOf(target);
    }

    @Override
    public String toString() {
        return "(" + format(source) + ", " + symbol + ", " + format(target) + ")";
    }

    static String format(List<String> configuration) {
        return configuration.size() == 1 ? configuration.get(0) : "{" + String.join(",", configuration) + "}";
    }
}
