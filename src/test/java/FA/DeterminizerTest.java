package FA;

import FA.Codec.NativeFormat;
import FA.Model.Automaton;
import FA.Model.AutomatonException;
import FA.Model.ErrorKind;
import FA.Model.Mode;
import FA.Simulation.Simulator;
import FA.Strings.StringOps;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.util.automaton.Automata;
import net.automatalib.util.automaton.fsa.NFAs;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

public class DeterminizerTest {
  private static final List<Automaton> SAMPLES = List.of(SampleAutomata.endsInA(), SampleAutomata.epsilonThenA(),
      SampleAutomata.secondToLastIsA(), SampleAutomata.epsilonCycle());

  @Test
  void testSameLanguageAsSimulator() {
    for (Automaton nfa : SAMPLES) {
      for (boolean minimize : List.of(false, true)) {
        Automaton dfa = Determinizer.determinize(nfa, minimize);
        Assertions.assertEquals(Mode.DFA, dfa.getMode());
        for (String w : StringOps.kleeneClosure(nfa.getAlphabet(), 5)) {
          Assertions.assertEquals(Simulator.accepts(nfa, w), Simulator.accepts(dfa, w), "Input '" + w + "'");
        }
      }
    }
  }

  @Test
  void testEquivalentToAutomataLib() {
    for (Automaton nfa : SAMPLES) {
      Alphabet<String> alphabet = Alphabets.fromCollection(nfa.getAlphabet());
      CompactDFA<String> ours = Determinizer.toCompactDFA(Determinizer.determinize(nfa));
      CompactDFA<String> theirs = NFAs.determinize(Determinizer.toCompactNFA(nfa), alphabet);
      Assertions.assertTrue(Automata.testEquivalence(ours, theirs, alphabet));
    }
  }

  @Test
  void testMinimalSizes() {
    // strings ending in 'a' need two states
    Assertions.assertEquals(2, Determinizer.determinize(SampleAutomata.endsInA()).getStates().size());
    // second-to-last 'a' needs four
    Assertions.assertEquals(4, Determinizer.determinize(SampleAutomata.secondToLastIsA()).getStates().size());
    // the dead state is left out: b(a|b)* needs two
    Automaton cycle = Determinizer.determinize(SampleAutomata.epsilonCycle());
    Assertions.assertEquals(2, cycle.getStates().size());
    Assertions.assertEquals("m0", cycle.getInitial());
    Assertions.assertFalse(cycle.isComplete());
  }

  @Test
  void testSubsetLabels() {
    Automaton dfa = Determinizer.determinize(SampleAutomata.epsilonThenA(), false);
    Assertions.assertEquals("{q0 q1}", dfa.getInitial());
    Assertions.assertTrue(dfa.getStates().contains("{q2}"));
    Assertions.assertTrue(dfa.isAccepting("{q2}"));
    Assertions.assertEquals(2, dfa.getStates().size());
  }

  @Test
  void testSubsetLabelsSurviveNativeFormat() throws Exception {
    NativeFormat format = new NativeFormat();
    for (Automaton nfa : SAMPLES) {
      Automaton dfa = Determinizer.determinize(nfa, false);
      Automaton copy = format.decode(format.encode(dfa));
      Assertions.assertEquals(dfa.getStates(), copy.getStates());
      Assertions.assertEquals(dfa.getInitial(), copy.getInitial());
      Assertions.assertEquals(dfa.getAccepting(), copy.getAccepting());
      Assertions.assertEquals(dfa.getTransitions(), copy.getTransitions());
    }
  }

  @Test
  void testRequiresInitialState() {
    Automaton nfa = SampleAutomata.epsilonThenA();
    nfa.clearInitial();
    AutomatonException e = Assertions.assertThrows(AutomatonException.class, () -> Determinizer.determinize(nfa));
    Assertions.assertEquals(ErrorKind.INVALID_STATE, e.getKind());
  }

  @Test
  void testToCompactDFARejectsNfa() {
    AutomatonException e = Assertions.assertThrows(AutomatonException.class,
        () -> Determinizer.toCompactDFA(SampleAutomata.epsilonThenA()));
    Assertions.assertEquals(ErrorKind.INVALID_ARGUMENT, e.getKind());
  }
}
