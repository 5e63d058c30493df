package FA.Model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Mutable finite automaton over string symbols and string state names.
 * Alphabet and states keep the order they were given in.
 * Every mutator checks its arguments before touching any field, so a rejected call leaves the automaton as it was.
 */
public class Automaton {
    public static final String EPSILON = "ε";

    private static final Logger logger = LoggerFactory.getLogger(Automaton.class);

    private final Set<String> alphabet = new LinkedHashSet<>();
    private final Set<String> states = new LinkedHashSet<>();
    private final Set<String> accepting = new LinkedHashSet<>();
    private final Map<String, Map<String, Destination>> transitions = new LinkedHashMap<>();
    private String initial;
    private Mode mode;

    public Automaton() {
        this(Mode.DFA);
    }

    public Automaton(Mode mode) {
        this.mode = mode;
    }

    /**
     * Split user text on commas, trimming entries and dropping blanks and repeats.
     */
    public static List<String> parseList(String text) {
        if (text == null) {
            return new ArrayList<>();
        }
        Set<String> items = new LinkedHashSet<>();
        for (String part : text.split(",")) {
            String item = part.trim();
            if (!item.isEmpty()) {
                items.add(item);
            }
        }
        return new ArrayList<>(items);
    }

    public void setAlphabet(String text) {
        setAlphabet(parseList(text));
    }

    /**
     * Replace the alphabet. Transitions on symbols that are no longer declared stay stored,
     * but are not reported by {@link #getTransitions()} until the symbol is declared again.
     */
    public void setAlphabet(Collection<String> symbols) {
        for (String symbol : symbols) {
            if (symbol == null || symbol.isBlank() || EPSILON.equals(symbol)) {
                throw AutomatonException.invalidSymbol(symbol);
            }
        }
        alphabet.clear();
        alphabet.addAll(symbols);
        logger.debug("Alphabet set to {}", alphabet);
    }

    public void setStates(String text) {
        setStates(parseList(text));
    }

    /**
     * Replace the state set, removing every reference to dropped states:
     * the initial state, accepting states, transitions from them and destinations pointing to them.
     */
    public void setStates(Collection<String> names) {
        for (String name : names) {
            if (name == null || name.isBlank()) {
                throw AutomatonException.invalidState(name);
            }
        }
        Set<String> removed = new HashSet<>(states);
        removed.removeAll(names);

        states.clear();
        states.addAll(names);

        if (initial != null && !states.contains(initial)) {
            initial = null;
        }
        accepting.retainAll(states);
        transitions.keySet().retainAll(states);
        if (!removed.isEmpty()) {
            for (Map<String, Destination> row : transitions.values()) {
                row.replaceAll((symbol, dest) -> dest.without(removed));
                row.values().removeIf(dest -> dest == null);
            }
            transitions.values().removeIf(Map::isEmpty);
        }
        logger.debug("States set to {}, removed {}", states, removed);
    }

    /**
     * Wholesale redefinition of the state list: like {@link #setStates(Collection)},
     * but also clears the transition table and the accepting selection.
     */
    public void redefineStates(Collection<String> names) {
        setStates(names);
        transitions.clear();
        accepting.clear();
    }

    public void setInitial(String state) {
        requireState(state);
        initial = state;
    }

    public void clearInitial() {
        initial = null;
    }

    public void toggleAccepting(String state, boolean isAccepting) {
        requireState(state);
        if (isAccepting) {
            accepting.add(state);
        } else {
            accepting.remove(state);
        }
    }

    /**
     * Define a transition. In DFA mode the destination replaces any previous one;
     * in NFA mode it is added to the destination set. A null or blank destination removes the entry.
     */
    public void setTransition(String from, String symbol, String to) {
        requireState(from);
        requireTransitionSymbol(symbol);
        if (to == null || to.isBlank()) {
            removeTransition(from, symbol);
            return;
        }
        requireState(to);

        Map<String, Destination> row = transitions.computeIfAbsent(from, k -> new LinkedHashMap<>());
        if (mode == Mode.DFA) {
            row.put(symbol, Destination.single(to));
        } else {
            Destination prev = row.get(symbol);
            Set<String> targets = new LinkedHashSet<>();
            if (prev != null) {
                targets.addAll(prev.targets());
            }
            targets.add(to);
            row.put(symbol, Destination.multiple(targets));
        }
    }

    /**
     * Replace the whole destination set of (from, symbol). An empty collection removes the entry.
     * In DFA mode at most one destination is allowed.
     */
    public void setTransition(String from, String symbol, Collection<String> to) {
        requireState(from);
        requireTransitionSymbol(symbol);
        for (String target : to) {
            requireState(target);
        }
        if (mode == Mode.DFA && to.size() > 1) {
            throw new AutomatonException(ErrorKind.INVALID_ARGUMENT,
                "DFA transition " + new TransitionKey(from, symbol) + " needs a single destination, got " + to);
        }
        if (to.isEmpty()) {
            removeTransition(from, symbol);
            return;
        }
        Map<String, Destination> row = transitions.computeIfAbsent(from, k -> new LinkedHashMap<>());
        row.put(symbol, mode == Mode.DFA ? Destination.single(to.iterator().next()) : Destination.multiple(to));
    }

    public void removeTransition(String from, String symbol) {
        Map<String, Destination> row = transitions.get(from);
        if (row != null) {
            row.remove(symbol);
            if (row.isEmpty()) {
                transitions.remove(from);
            }
        }
    }

    /**
     * Switch between DFA and NFA representation.
     * DFA to NFA wraps every destination in a singleton set.
     * NFA to DFA is lossy: ε-transitions are dropped and every destination set is cut down to its first element.
     * No determinization is attempted; see {@link FA.Determinizer} for that.
     */
    public void setMode(Mode newMode) {
        if (newMode == mode) {
            return;
        }
        int dropped = 0;
        for (Map<String, Destination> row : transitions.values()) {
            if (newMode == Mode.NFA) {
                row.replaceAll((symbol, dest) -> Destination.toMultiple(dest));
            } else {
                if (row.remove(EPSILON) != null) {
                    dropped++;
                }
                for (Destination dest : row.values()) {
                    dropped += Math.max(0, dest.targets().size() - 1);
                }
                row.replaceAll((symbol, dest) -> Destination.toSingle(dest));
                row.values().removeIf(dest -> dest == null);
            }
        }
        transitions.values().removeIf(Map::isEmpty);
        if (dropped > 0) {
            logger.warn("Switching to {} dropped {} transition target(s)", newMode, dropped);
        }
        mode = newMode;
    }

    /**
     * True iff every (state, symbol) pair with a declared symbol has a destination.
     */
    public boolean isComplete() {
        return missingTransitions().isEmpty();
    }

    public List<TransitionKey> missingTransitions() {
        List<TransitionKey> missing = new ArrayList<>();
        for (String state : states) {
            for (String symbol : alphabet) {
                if (getTargets(state, symbol).isEmpty()) {
                    missing.add(new TransitionKey(state, symbol));
                }
            }
        }
        return missing;
    }

    public Set<String> getAlphabet() {
        return Collections.unmodifiableSet(alphabet);
    }

    public Set<String> getStates() {
        return Collections.unmodifiableSet(states);
    }

    public String getInitial() {
        return initial;
    }

    public Set<String> getAccepting() {
        return Collections.unmodifiableSet(accepting);
    }

    public boolean isAccepting(String state) {
        return accepting.contains(state);
    }

    public Mode getMode() {
        return mode;
    }

    public Destination getDestination(String from, String symbol) {
        Map<String, Destination> row = transitions.get(from);
        return row == null ? null : row.get(symbol);
    }

    /**
     * Destination states of (from, symbol); empty if none are defined.
     */
    public Set<String> getTargets(String from, String symbol) {
        Destination dest = getDestination(from, symbol);
        return dest == null ? Collections.emptySet() : dest.targets();
    }

    /**
     * Transitions on declared symbols (and ε), in definition order.
     */
    public Map<TransitionKey, Destination> getTransitions() {
        Map<TransitionKey, Destination> result = new LinkedHashMap<>();
        for (Map.Entry<String, Map<String, Destination>> row : transitions.entrySet()) {
            for (Map.Entry<String, Destination> cell : row.getValue().entrySet()) {
                if (isTransitionSymbol(cell.getKey())) {
                    result.put(new TransitionKey(row.getKey(), cell.getKey()), cell.getValue());
                }
            }
        }
        return Collections.unmodifiableMap(result);
    }

    public boolean isTransitionSymbol(String symbol) {
        if (EPSILON.equals(symbol)) {
            return mode == Mode.NFA;
        }
        return alphabet.contains(symbol);
    }

    private void requireState(String state) {
        if (state == null || !states.contains(state)) {
            throw AutomatonException.invalidState(state);
        }
    }

    private void requireTransitionSymbol(String symbol) {
        if (symbol == null || !isTransitionSymbol(symbol)) {
            throw AutomatonException.invalidSymbol(symbol);
        }
    }

    @Override
    public String toString() {
        return mode.getLabel() + "{alphabet=" + alphabet + ", states=" + states + ", initial=" + initial
            + ", accepting=" + accepting + ", transitions=" + getTransitions() + "}";
    }
}
