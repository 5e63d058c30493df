package FA;

import FA.Model.Automaton;
import FA.Model.AutomatonException;
import FA.Model.ErrorKind;
import FA.Model.Mode;
import FA.Simulation.Simulator;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.automaton.fsa.impl.CompactNFA;
import net.automatalib.util.automaton.minimizer.HopcroftMinimizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Subset construction for automata with ε-transitions.
 * Unlike {@link Automaton#setMode(Mode)}, the result accepts exactly the same language as the input.
 */
public class Determinizer {
    private static final Logger logger = LoggerFactory.getLogger(Determinizer.class);

    /** Prefix of state names produced by minimization. */
    public static final String MINIMIZED_PREFIX = "m";

    public static Automaton determinize(Automaton automaton) {
        return determinize(automaton, true);
    }

    /**
     * @param automaton - DFA or NFA, with or without ε-transitions
     * @param minimize - if false, states are named after the subsets they stand for, e.g. "{q0 q1}".
     *                 If true, the DFA is minimized and states are renamed m0, m1, ... in breadth-first order.
     * @return partial DFA (no dead state) over the same alphabet
     */
    public static Automaton determinize(Automaton automaton, boolean minimize) {
        final Alphabet<String> alphabet = Alphabets.fromCollection(automaton.getAlphabet());
        final List<String> labels = new ArrayList<>();
        final CompactDFA<String> powerset = new CompactDFA<>(alphabet);
        doDeterminize(automaton, alphabet, powerset, labels);
        logger.info("Powerset DFA size: {}", powerset.size());

        if (!minimize) {
            return fromCompactDFA(powerset, alphabet, labels);
        }
        completeWithSink(powerset, alphabet);
        final CompactDFA<String> minimized = HopcroftMinimizer.minimizeDFA(powerset, alphabet);
        logger.info("Minimized DFA size: {}", minimized.size());
        return fromCompactDFA(minimized, alphabet, null);
    }

    private static void doDeterminize(Automaton automaton,
                                      Collection<String> inputs,
                                      CompactDFA<String> out,
                                      List<String> labels) {
        if (automaton.getInitial() == null) {
            throw new AutomatonException(ErrorKind.INVALID_STATE, "No initial state defined");
        }
        final Map<Set<String>, Integer> outStateMap = new HashMap<>();
        final Deque<DeterminizeRecord> stack = new ArrayDeque<>();

        final TreeSet<String> init = Simulator.epsilonClosure(automaton, List.of(automaton.getInitial()));
        final Integer initOut = out.addInitialState(anyAccepting(automaton, init));
        labels.add(label(init));
        outStateMap.put(init, initOut);
        stack.push(new DeterminizeRecord(init, initOut));

        while (!stack.isEmpty()) {
            DeterminizeRecord curr = stack.pop();

            for (String sym : inputs) {
                TreeSet<String> succ = Simulator.epsilonClosure(automaton, Simulator.step(automaton, curr.inputState(), sym));
                if (succ.isEmpty()) {
                    continue;
                }
                Integer outSucc = outStateMap.get(succ);
                if (outSucc == null) {
                    // add new state to DFA and to stack
                    outSucc = out.addState(anyAccepting(automaton, succ));
                    labels.add(label(succ));
                    outStateMap.put(succ, outSucc);
                    stack.push(new DeterminizeRecord(succ, outSucc));
                }
                out.setTransition(curr.outputState(), sym, outSucc);
            }
        }
    }

    /**
     * Total AutomataLib DFA for a DFA-mode automaton; a sink state is added when transitions are missing.
     */
    public static CompactDFA<String> toCompactDFA(Automaton automaton) {
        if (automaton.getMode() != Mode.DFA) {
            throw new AutomatonException(ErrorKind.INVALID_ARGUMENT, "Expected a DFA, use determinize() for an NFA");
        }
        final Alphabet<String> alphabet = Alphabets.fromCollection(automaton.getAlphabet());
        final CompactDFA<String> dfa = new CompactDFA<>(alphabet, automaton.getStates().size());
        final Object2IntMap<String> index = new Object2IntOpenHashMap<>();
        for (String state : automaton.getStates()) {
            index.put(state, (int) dfa.addState(automaton.isAccepting(state)));
        }
        if (automaton.getInitial() != null) {
            Integer init = index.getInt(automaton.getInitial());
            dfa.setInitialState(init);
        }
        for (String state : automaton.getStates()) {
            for (String sym : alphabet) {
                Set<String> targets = automaton.getTargets(state, sym);
                if (!targets.isEmpty()) {
                    Integer from = index.getInt(state);
                    Integer to = index.getInt(targets.iterator().next());
                    dfa.setTransition(from, sym, to);
                }
            }
        }
        completeWithSink(dfa, alphabet);
        return dfa;
    }

    /**
     * AutomataLib NFA without ε-transitions: state p moves on a to the ε-closure of everything
     * the ε-closure of p reaches on a, and accepts if its ε-closure contains an accepting state.
     */
    public static CompactNFA<String> toCompactNFA(Automaton automaton) {
        final Alphabet<String> alphabet = Alphabets.fromCollection(automaton.getAlphabet());
        final CompactNFA<String> nfa = new CompactNFA<>(alphabet, automaton.getStates().size());
        final Object2IntMap<String> index = new Object2IntOpenHashMap<>();
        for (String state : automaton.getStates()) {
            boolean accepting = anyAccepting(automaton, Simulator.epsilonClosureOf(automaton, state));
            index.put(state, (int) nfa.addState(accepting));
        }
        if (automaton.getInitial() != null) {
            Integer init = index.getInt(automaton.getInitial());
            nfa.setInitial(init, true);
        }
        for (String state : automaton.getStates()) {
            final Integer from = index.getInt(state);
            final TreeSet<String> closure = Simulator.epsilonClosureOf(automaton, state);
            for (String sym : alphabet) {
                for (String target : Simulator.epsilonClosure(automaton, Simulator.step(automaton, closure, sym))) {
                    Integer to = index.getInt(target);
                    nfa.addTransition(from, sym, to);
                }
            }
        }
        return nfa;
    }

    private static void completeWithSink(CompactDFA<String> dfa, Alphabet<String> alphabet) {
        Integer sink = null;
        final int size = dfa.size();
        for (int i = 0; i < size; i++) {
            final Integer s = i;
            for (String sym : alphabet) {
                if (dfa.getSuccessor(s, sym) == null) {
                    if (sink == null) {
                        sink = dfa.addState(false);
                        for (String a : alphabet) {
                            dfa.setTransition(sink, a, sink);
                        }
                    }
                    dfa.setTransition(s, sym, sink);
                }
            }
        }
    }

    /**
     * Convert back, leaving out dead states (non-accepting, every transition a self-loop).
     * @param labels - state names by index, or null to name states m0, m1, ... in breadth-first order
     */
    private static Automaton fromCompactDFA(CompactDFA<String> dfa, Alphabet<String> alphabet, List<String> labels) {
        final Automaton result = new Automaton(Mode.DFA);
        result.setAlphabet(alphabet);
        final Integer init = dfa.getInitialState();
        if (init == null) {
            return result;
        }

        final List<Integer> order = new ArrayList<>();
        final Map<Integer, String> names = new HashMap<>();
        final Deque<Integer> queue = new ArrayDeque<>();
        queue.add(init);
        names.put(init, null);
        while (!queue.isEmpty()) {
            Integer s = queue.poll();
            if (!s.equals(init) && isDead(dfa, alphabet, s)) {
                continue;
            }
            order.add(s);
            for (String sym : alphabet) {
                Integer t = dfa.getSuccessor(s, sym);
                if (t != null && !names.containsKey(t)) {
                    names.put(t, null);
                    queue.add(t);
                }
            }
        }
        for (int i = 0; i < order.size(); i++) {
            Integer s = order.get(i);
            names.put(s, labels == null ? MINIMIZED_PREFIX + i : labels.get(s));
        }

        final List<String> stateNames = new ArrayList<>();
        for (Integer s : order) {
            stateNames.add(names.get(s));
        }
        result.setStates(stateNames);
        result.setInitial(names.get(init));
        for (Integer s : order) {
            result.toggleAccepting(names.get(s), dfa.isAccepting(s));
            for (String sym : alphabet) {
                Integer t = dfa.getSuccessor(s, sym);
                if (t != null && order.contains(t)) {
                    result.setTransition(names.get(s), sym, names.get(t));
                }
            }
        }
        return result;
    }

    private static boolean isDead(CompactDFA<String> dfa, Alphabet<String> alphabet, Integer s) {
        if (dfa.isAccepting(s)) {
            return false;
        }
        for (String sym : alphabet) {
            Integer t = dfa.getSuccessor(s, sym);
            if (t != null && !t.equals(s)) {
                return false;
            }
        }
        return true;
    }

    private static boolean anyAccepting(Automaton automaton, Collection<String> states) {
        for (String s : states) {
            if (automaton.isAccepting(s)) {
                return true;
            }
        }
        return false;
    }

    // no commas, so that list fields in the native format keep the name whole
    private static String label(Collection<String> states) {
        return "{" + String.join(" ", states) + "}";
    }

    private record DeterminizeRecord(TreeSet<String> inputState, Integer outputState) { }
}
