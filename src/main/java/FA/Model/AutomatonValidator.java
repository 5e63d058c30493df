package FA.Model;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks that an automaton is fully defined before it is exported or handed to a user as "ready".
 */
public final class AutomatonValidator {

    public record Problem(ErrorKind kind, String message) { }

    private AutomatonValidator() { }

    /**
     * @return every problem found, empty if the automaton is ready to use.
     */
    public static List<Problem> validate(Automaton automaton) {
        List<Problem> problems = new ArrayList<>();
        if (automaton.getInitial() == null) {
            problems.add(new Problem(ErrorKind.INVALID_STATE, "No initial state selected"));
        }
        if (automaton.getAccepting().isEmpty()) {
            problems.add(new Problem(ErrorKind.INVALID_STATE, "Select at least one accepting state"));
        }
        if (automaton.getMode() == Mode.DFA) {
            for (TransitionKey key : automaton.missingTransitions()) {
                problems.add(new Problem(ErrorKind.NO_TRANSITION, "Missing transition for " + key));
            }
        }
        return problems;
    }

    /**
     * @throws AutomatonException for the first problem found.
     */
    public static void requireValid(Automaton automaton) {
        List<Problem> problems = validate(automaton);
        if (!problems.isEmpty()) {
            Problem first = problems.get(0);
            throw new AutomatonException(first.kind(), first.message());
        }
    }
}
