package FA.Codec;

import FA.Model.Automaton;
import FA.Model.ErrorKind;
import FA.Model.Mode;
import FA.SampleAutomata;
import FA.Simulation.Simulator;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.InputStream;
import java.util.List;
import java.util.Objects;
import java.util.Set;

public class JFLAPFormatTest {
  private final JFLAPFormat format = new JFLAPFormat();

  private static Automaton load(JFLAPFormat format, String name) throws Exception {
    try (InputStream is = Objects.requireNonNull(
        JFLAPFormatTest.class.getClassLoader().getResourceAsStream("automata/" + name))) {
      return format.read(is);
    }
  }

  @Test
  void testReadDfa() throws Exception {
    Automaton a = load(format, "dfa_ab.jff");
    Assertions.assertEquals(Mode.DFA, a.getMode());
    Assertions.assertEquals(List.of("q0", "q1"), List.copyOf(a.getStates()));
    Assertions.assertEquals(Set.of("a", "b"), a.getAlphabet());
    Assertions.assertEquals("q0", a.getInitial());
    Assertions.assertEquals(Set.of("q1"), a.getAccepting());
    Assertions.assertTrue(a.isComplete());
    Assertions.assertTrue(Simulator.accepts(a, "aba"));
    Assertions.assertFalse(Simulator.accepts(a, "ab"));
  }

  @Test
  void testReadNfa() throws Exception {
    Automaton a = load(format, "nfa.jff");
    Assertions.assertEquals(Mode.NFA, a.getMode());
    // a state without a name is named after its id
    Assertions.assertEquals(List.of("s", "x", "2"), List.copyOf(a.getStates()));
    Assertions.assertEquals(Set.of("2"), a.getTargets("x", Automaton.EPSILON));
    Assertions.assertEquals(Set.of("s", "x"), a.getTargets("s", "a"));
    Assertions.assertEquals(Set.of("a", "b"), a.getAlphabet());
    Assertions.assertTrue(Simulator.accepts(a, "ba"));
    Assertions.assertFalse(Simulator.accepts(a, "ab"));
  }

  @Test
  void testEncode() throws Exception {
    String xml = format.encode(SampleAutomata.epsilonThenA());
    Assertions.assertTrue(xml.contains("<structure type=\"fa\">"), xml);
    Assertions.assertTrue(xml.contains("<type>fa</type>"), xml);
    Assertions.assertTrue(xml.contains("<state id=\"0\" name=\"q0\">"), xml);
    Assertions.assertTrue(xml.contains("<initial/>"), xml);
    Assertions.assertTrue(xml.contains("<final/>"), xml);
    Assertions.assertTrue(xml.contains("<read/>"), xml);

    Automaton copy = format.decode(xml);
    Assertions.assertEquals(Set.of("q1"), copy.getTargets("q0", Automaton.EPSILON));
  }

  @Test
  void testRoundTrip() throws Exception {
    for (Automaton original : List.of(SampleAutomata.endsInA(), SampleAutomata.secondToLastIsA(),
        SampleAutomata.epsilonCycle())) {
      Automaton copy = format.decode(format.encode(original));
      Assertions.assertEquals(original.getMode(), copy.getMode());
      Assertions.assertEquals(original.getAlphabet(), copy.getAlphabet());
      Assertions.assertEquals(original.getStates(), copy.getStates());
      Assertions.assertEquals(original.getInitial(), copy.getInitial());
      Assertions.assertEquals(original.getAccepting(), copy.getAccepting());
      Assertions.assertEquals(original.getTransitions(), copy.getTransitions());
    }
  }

  @Test
  void testUnusedSymbolSurvives() throws Exception {
    Automaton nfa = new Automaton(Mode.NFA);
    nfa.setAlphabet("a,b");
    nfa.setStates("q0,q1");
    nfa.setInitial("q0");
    nfa.setTransition("q0", "a", "q1");

    String xml = format.encode(nfa);
    Assertions.assertTrue(xml.contains("<symbol>b</symbol>"), xml);
    Automaton copy = format.decode(xml);
    Assertions.assertEquals(List.of("a", "b"), List.copyOf(copy.getAlphabet()));
    Assertions.assertEquals(Set.of("q1"), copy.getTargets("q0", "a"));
    Assertions.assertEquals(1, copy.getTransitions().size());
  }

  @Test
  void testDeclaredAlphabetMergedWithReads() throws Exception {
    Automaton a = format.decode("<structure><type>fa</type>"
        + "<alphabet><symbol>c</symbol><symbol> </symbol><symbol>ε</symbol></alphabet><automaton>"
        + "<state id=\"0\" name=\"q0\"><initial/></state>"
        + "<transition><from>0</from><to>0</to><read>a</read></transition>"
        + "</automaton></structure>");
    Assertions.assertEquals(List.of("c", "a"), List.copyOf(a.getAlphabet()));
  }

  @Test
  void testParseErrors() {
    assertParseError("<structure><type>fa</type><automaton>", "Malformed XML");
    assertParseError("<structure><type>pda</type><automaton/></structure>", "pda");
    assertParseError("<structure><type>fa</type></structure>", "<automaton>");
    assertParseError("<structure><type>fa</type><automaton>"
        + "<state id=\"0\" name=\"q0\"/>"
        + "<transition><from>0</from><to>3</to><read>a</read></transition>"
        + "</automaton></structure>", "unknown state id 3");
    assertParseError("<structure><type>fa</type><automaton>"
        + "<state id=\"0\" name=\"q0\"/><state id=\"0\" name=\"q1\"/>"
        + "</automaton></structure>", "Duplicate state id");
    assertParseError("<structure><type>fa</type><automaton>"
        + "<state id=\"0\" name=\"q\"/><state id=\"1\" name=\"q\"/>"
        + "</automaton></structure>", "Duplicate state name");
  }

  @Test
  void testDoctypeRejected() {
    String xml = "<?xml version=\"1.0\"?>\n"
        + "<!DOCTYPE structure [<!ENTITY x \"y\">]>\n"
        + "<structure><type>fa</type><automaton/></structure>";
    assertParseError(xml, "Malformed XML");
  }

  private void assertParseError(String text, String expectedInMessage) {
    AutomatonFormatException e = Assertions.assertThrows(AutomatonFormatException.class, () -> format.decode(text));
    Assertions.assertEquals(ErrorKind.PARSE_ERROR, e.getKind());
    Assertions.assertTrue(e.getMessage().contains(expectedInMessage), e.getMessage());
  }
}
