package FA.Model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Target of a (state, symbol) transition.
 * DFA automata hold {@link Single} values, NFA automata hold {@link Multiple} values.
 */
public interface Destination {

    /**
     * Target states, in insertion order.
     */
    Set<String> targets();

    boolean contains(String state);

    /**
     * Copy without the given states, or null if nothing is left.
     */
    Destination without(Set<String> removed);

    static Single single(String state) {
        return new Single(state);
    }

    static Multiple multiple(Collection<String> states) {
        return new Multiple(Collections.unmodifiableSet(new LinkedHashSet<>(states)));
    }

    /**
     * DFA to NFA: a single target becomes a singleton set.
     */
    static Multiple toMultiple(Destination dest) {
        if (dest instanceof Multiple m) {
            return m;
        }
        return multiple(dest.targets());
    }

    /**
     * NFA to DFA: keeps the first target of the set, or null for an empty set.
     */
    static Single toSingle(Destination dest) {
        if (dest instanceof Single s) {
            return s;
        }
        Set<String> targets = dest.targets();
        return targets.isEmpty() ? null : single(targets.iterator().next());
    }

    record Single(String state) implements Destination {
        public Single {
            Objects.requireNonNull(state);
        }

        @Override
        public Set<String> targets() {
            return Collections.singleton(state);
        }

        @Override
        public boolean contains(String s) {
            return state.equals(s);
        }

        @Override
        public Destination without(Set<String> removed) {
            return removed.contains(state) ? null : this;
        }

        @Override
        public String toString() {
            return state;
        }
    }

    record Multiple(Set<String> states) implements Destination {
        @Override
        public Set<String> targets() {
            return states;
        }

        @Override
        public boolean contains(String s) {
            return states.contains(s);
        }

        @Override
        public Destination without(Set<String> removed) {
            Set<String> kept = new LinkedHashSet<>(states);
            kept.removeAll(removed);
            if (kept.isEmpty()) {
                return null;
            }
            return kept.size() == states.size() ? this : multiple(kept);
        }

        @Override
        public String toString() {
            return String.join(",", states);
        }
    }
}
