package FA.Codec;

import FA.Model.Automaton;
import FA.Model.AutomatonException;
import FA.Model.Mode;
import FA.Model.TransitionKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Fields read from a file, before they are checked against each other.
 * {@link #build()} turns them into an {@link Automaton}, reporting dangling references as format errors.
 */
final class AutomatonDraft {
    private static final Logger logger = LoggerFactory.getLogger(AutomatonDraft.class);

    /** Null when the file does not say; inferred from the transitions. */
    Mode mode;
    boolean hasStates;
    final List<String> alphabet = new ArrayList<>();
    final List<String> states = new ArrayList<>();
    String initial;
    final List<String> accepting = new ArrayList<>();
    final List<Row> rows = new ArrayList<>();

    /**
     * One transition entry as written in the file; {@code where} locates it for error messages.
     */
    record Row(String from, String symbol, List<String> to, String where) { }

    void addRow(String from, String symbol, List<String> to, String where) {
        rows.add(new Row(from, symbol, List.copyOf(to), where));
    }

    /**
     * NFA if some entry uses ε, lists several destinations, or repeats a (state, symbol) pair.
     */
    Mode inferMode() {
        Set<TransitionKey> seen = new HashSet<>();
        for (Row row : rows) {
            if (Automaton.EPSILON.equals(row.symbol()) || row.to().size() > 1
                || !seen.add(new TransitionKey(row.from(), row.symbol()))) {
                return Mode.NFA;
            }
        }
        return Mode.DFA;
    }

    Automaton build() throws AutomatonFormatException {
        if (!hasStates) {
            throw new AutomatonFormatException("Missing state list");
        }
        final Mode effective = mode != null ? mode : inferMode();
        final Automaton automaton = new Automaton(effective);
        // ε is a transition label, never a declared symbol, but some writers list it
        if (alphabet.removeIf(Automaton.EPSILON::equals)) {
            logger.debug("Dropped {} from the declared alphabet", Automaton.EPSILON);
        }
        try {
            automaton.setAlphabet(alphabet);
            automaton.setStates(states);
            if (initial != null && !initial.isBlank()) {
                automaton.setInitial(initial);
            }
            for (String state : accepting) {
                automaton.toggleAccepting(state, true);
            }
        } catch (AutomatonException e) {
            throw new AutomatonFormatException(e.getMessage(), e);
        }

        for (Row row : rows) {
            if (row.to().isEmpty()) {
                throw new AutomatonFormatException(row.where() + ": missing destination");
            }
            try {
                if (effective == Mode.NFA) {
                    for (String to : row.to()) {
                        automaton.setTransition(row.from(), row.symbol(), to);
                    }
                } else {
                    if (row.to().size() > 1) {
                        logger.warn("{}: DFA transition lists {} destinations, keeping {}",
                            row.where(), row.to().size(), row.to().get(0));
                    }
                    automaton.setTransition(row.from(), row.symbol(), row.to().get(0));
                }
            } catch (AutomatonException e) {
                throw new AutomatonFormatException(row.where() + ": " + e.getMessage(), e);
            }
        }
        return automaton;
    }
}
