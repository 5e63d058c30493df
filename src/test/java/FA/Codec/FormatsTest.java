package FA.Codec;

import FA.Model.Automaton;
import FA.Model.ErrorKind;
import FA.SampleAutomata;
import FA.Simulation.Simulator;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

public class FormatsTest {
  @TempDir
  Path dir;

  @Test
  void testForFile() throws Exception {
    Assertions.assertTrue(Formats.forFile(Paths.get("a.txt")) instanceof NativeFormat);
    Assertions.assertTrue(Formats.forFile(Paths.get("dir", "a.FA")) instanceof NativeFormat);
    Assertions.assertTrue(Formats.forFile(Paths.get("a.jff")) instanceof JFLAPFormat);
    Assertions.assertTrue(Formats.forFile(Paths.get("a.afd")) instanceof JSONFormat);
    Assertions.assertTrue(Formats.forFile(Paths.get("a.json")) instanceof JSONFormat);

    AutomatonFormatException e = Assertions.assertThrows(AutomatonFormatException.class,
        () -> Formats.forFile(Paths.get("a.png")));
    Assertions.assertEquals(ErrorKind.PARSE_ERROR, e.getKind());
    Assertions.assertThrows(AutomatonFormatException.class, () -> Formats.forFile(Paths.get("noextension")));
  }

  @Test
  void testAfdHoldsJsonOrNativeText() throws Exception {
    Path nativeAfd = dir.resolve("old.afd");
    Files.writeString(nativeAfd, new NativeFormat().encode(SampleAutomata.endsInA()), StandardCharsets.UTF_8);
    Path jsonAfd = dir.resolve("new.afd");
    Formats.write(jsonAfd, SampleAutomata.endsInA());
    Assertions.assertTrue(Files.readString(jsonAfd, StandardCharsets.UTF_8).startsWith("{"));

    Assertions.assertTrue(Formats.forContent(nativeAfd, "\n Tipo: AFD\n") instanceof NativeFormat);
    Assertions.assertTrue(Formats.forContent(jsonAfd, "  {\"states\": []}") instanceof JSONFormat);
    // only .afd is ambiguous
    Assertions.assertTrue(Formats.forContent(Paths.get("a.json"), "Tipo: AFD") instanceof JSONFormat);

    for (Path file : List.of(nativeAfd, jsonAfd)) {
      Automaton a = Formats.read(file);
      Assertions.assertEquals(SampleAutomata.endsInA().getTransitions(), a.getTransitions(), file.toString());
      Assertions.assertTrue(Simulator.accepts(a, "ba"));
    }
  }

  @Test
  void testConvertAcrossFormats() throws Exception {
    Automaton original = SampleAutomata.secondToLastIsA();
    Path txt = dir.resolve("nfa.txt");
    Path jff = dir.resolve("nfa.jff");
    Path json = dir.resolve("nfa.json");

    Formats.write(txt, original);
    Formats.write(jff, Formats.read(txt));
    Formats.write(json, Formats.read(jff));
    Automaton copy = Formats.read(json);

    Assertions.assertEquals(original.getMode(), copy.getMode());
    Assertions.assertEquals(original.getStates(), copy.getStates());
    Assertions.assertEquals(original.getAlphabet(), copy.getAlphabet());
    Assertions.assertEquals(original.getInitial(), copy.getInitial());
    Assertions.assertEquals(original.getAccepting(), copy.getAccepting());
    Assertions.assertEquals(original.getTransitions(), copy.getTransitions());
  }
}
