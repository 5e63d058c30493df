package FA.Report;

import FA.Model.Automaton;
import FA.Simulation.Simulator;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Runs many strings through one automaton and splits them into accepted and rejected.
 */
public final class BatchValidation {

    public record Result(List<String> accepted, List<String> rejected) {
        public Result {
            accepted = List.copyOf(accepted);
            rejected = List.copyOf(rejected);
        }

        public int total() {
            return accepted.size() + rejected.size();
        }
    }

    private BatchValidation() { }

    /**
     * Split comma-separated input, trimming entries and dropping blanks. Repeated strings are kept.
     */
    public static List<String> splitInput(String text) {
        List<String> strings = new ArrayList<>();
        for (String part : text.split(",")) {
            String s = part.strip();
            if (!s.isEmpty()) {
                strings.add(s);
            }
        }
        return strings;
    }

    public static Result validate(Automaton automaton, String text) {
        return validate(automaton, splitInput(text));
    }

    public static Result validate(Automaton automaton, Collection<String> strings) {
        List<String> accepted = new ArrayList<>();
        List<String> rejected = new ArrayList<>();
        for (String s : strings) {
            if (Simulator.accepts(automaton, s)) {
                accepted.add(s);
            } else {
                rejected.add(s);
            }
        }
        return new Result(accepted, rejected);
    }
}
