package FA.Model;

import FA.SampleAutomata;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

public class AutomatonValidatorTest {
  @Test
  void testValidAutomaton() {
    Assertions.assertTrue(AutomatonValidator.validate(SampleAutomata.endsInA()).isEmpty());
    AutomatonValidator.requireValid(SampleAutomata.endsInA());
    // partial NFAs are fine
    Assertions.assertTrue(AutomatonValidator.validate(SampleAutomata.epsilonThenA()).isEmpty());
  }

  @Test
  void testProblems() {
    Automaton dfa = SampleAutomata.endsInA();
    dfa.clearInitial();
    dfa.toggleAccepting("q1", false);
    dfa.removeTransition("q1", "b");

    List<AutomatonValidator.Problem> problems = AutomatonValidator.validate(dfa);
    Assertions.assertEquals(List.of(
        new AutomatonValidator.Problem(ErrorKind.INVALID_STATE, "No initial state selected"),
        new AutomatonValidator.Problem(ErrorKind.INVALID_STATE, "Select at least one accepting state"),
        new AutomatonValidator.Problem(ErrorKind.NO_TRANSITION, "Missing transition for (q1, b)")), problems);

    AutomatonException e = Assertions.assertThrows(AutomatonException.class, () -> AutomatonValidator.requireValid(dfa));
    Assertions.assertEquals(ErrorKind.INVALID_STATE, e.getKind());
  }
}
