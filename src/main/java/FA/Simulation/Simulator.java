package FA.Simulation;

import FA.Model.Automaton;
import FA.Model.AutomatonException;
import FA.Model.ErrorKind;
import FA.Model.Mode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Runs input strings through an {@link Automaton}.
 * DFA automata are walked one state at a time; NFA automata are walked on sets of states,
 * expanding ε-transitions after every step.
 */
public final class Simulator {
  private static final Logger logger = LoggerFactory.getLogger(Simulator.class);

  private Simulator() { }

  /**
   * Run a string, split into symbols by {@link #tokenize}.
   */
  public static SimulationResult run(Automaton automaton, String input) {
    return run(automaton, tokenize(automaton, input));
  }

  /**
   * Run a sequence of (possibly multi-character) symbols.
   */
  public static SimulationResult run(Automaton automaton, List<String> symbols) {
    if (automaton.getInitial() == null) {
      return SimulationResult.failed(ErrorKind.INVALID_STATE, "No initial state defined",
          Collections.emptyList(), Collections.emptyList());
    }
    SimulationResult result = automaton.getMode() == Mode.DFA
        ? runDeterministic(automaton, symbols)
        : runNondeterministic(automaton, symbols);
    logger.debug("Input {} -> {}", symbols, result);
    return result;
  }

  public static boolean accepts(Automaton automaton, String input) {
    return run(automaton, input).isAccepted();
  }

  /**
   * Split input into alphabet symbols, taking the longest symbol that matches at each position.
   * Where no symbol matches, a single character is taken so that the run reports it as unknown.
   */
  public static List<String> tokenize(Automaton automaton, String input) {
    final List<String> symbols = new ArrayList<>();
    int pos = 0;
    while (pos < input.length()) {
      String match = null;
      for (String symbol : automaton.getAlphabet()) {
        if (input.startsWith(symbol, pos) && (match == null || symbol.length() > match.length())) {
          match = symbol;
        }
      }
      if (match == null) {
        match = new String(Character.toChars(input.codePointAt(pos)));
      }
      symbols.add(match);
      pos += match.length();
    }
    return symbols;
  }

  private static SimulationResult runDeterministic(Automaton automaton, List<String> symbols) {
    final List<TraceStep> trace = new ArrayList<>();
    String current = automaton.getInitial();

    for (String symbol : symbols) {
      if (!automaton.getAlphabet().contains(symbol)) {
        return SimulationResult.failed(ErrorKind.UNKNOWN_SYMBOL,
            "Symbol '" + symbol + "' is not in the alphabet", trace, List.of(current));
      }
      Set<String> targets = automaton.getTargets(current, symbol);
      if (targets.isEmpty()) {
        return SimulationResult.failed(ErrorKind.NO_TRANSITION,
            "No transition for '" + symbol + "' from " + current, trace, List.of(current));
      }
      String next = targets.iterator().next();
      trace.add(new TraceStep(List.of(current), symbol, List.of(next)));
      current = next;
    }
    return SimulationResult.completed(automaton.isAccepting(current), trace, List.of(current));
  }

  private static SimulationResult runNondeterministic(Automaton automaton, List<String> symbols) {
    final List<TraceStep> trace = new ArrayList<>();
    TreeSet<String> current = epsilonClosure(automaton, List.of(automaton.getInitial()));

    for (String symbol : symbols) {
      if (!automaton.getAlphabet().contains(symbol)) {
        return SimulationResult.failed(ErrorKind.UNKNOWN_SYMBOL,
            "Symbol '" + symbol + "' is not in the alphabet", trace, new ArrayList<>(current));
      }
      TreeSet<String> next = epsilonClosure(automaton, step(automaton, current, symbol));
      if (next.isEmpty()) {
        return SimulationResult.failed(ErrorKind.NO_TRANSITION,
            "No transition for '" + symbol + "' from " + TraceStep.format(new ArrayList<>(current)),
            trace, new ArrayList<>(current));
      }
      trace.add(new TraceStep(new ArrayList<>(current), symbol, new ArrayList<>(next)));
      current = next;
    }

    boolean accepted = current.stream().anyMatch(automaton::isAccepting);
    return SimulationResult.completed(accepted, trace, new ArrayList<>(current));
  }

  /**
   * Union of the destinations of every state in {@code states} on {@code symbol}, without ε-expansion.
   */
  public static Set<String> step(Automaton automaton, Collection<String> states, String symbol) {
    Set<String> next = new TreeSet<>();
    for (String state : states) {
      next.addAll(automaton.getTargets(state, symbol));
    }
    return next;
  }

  /**
   * @throws AutomatonException with {@link ErrorKind#INVALID_STATE} if the state is unknown
   */
  public static TreeSet<String> epsilonClosureOf(Automaton automaton, String state) {
    if (!automaton.getStates().contains(state)) {
      throw new AutomatonException(ErrorKind.INVALID_STATE, "Unknown state: '" + state + "'");
    }
    return epsilonClosure(automaton, List.of(state));
  }

  /**
   * States reachable from {@code states} through zero or more ε-transitions.
   * Each state enters the work list at most once, so ε-cycles terminate.
   */
  public static TreeSet<String> epsilonClosure(Automaton automaton, Collection<String> states) {
    final TreeSet<String> closure = new TreeSet<>(states);
    final Deque<String> work = new ArrayDeque<>(states);

    while (!work.isEmpty()) {
      String state = work.pop();
      for (String next : automaton.getTargets(state, Automaton.EPSILON)) {
        if (closure.add(next)) {
          work.push(next);
        }
      }
    }
    return closure;
  }
}
