package FA.Strings;

import FA.Model.AutomatonException;
import FA.Model.ErrorKind;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

public class StringOpsTest {
  @Test
  void testPrefixesAndSuffixes() {
    Assertions.assertEquals(List.of("", "a", "ab", "abc"), StringOps.prefixes("abc"));
    Assertions.assertEquals(List.of("abc", "bc", "c", ""), StringOps.suffixes("abc"));
    Assertions.assertEquals(List.of(""), StringOps.prefixes(""));
    Assertions.assertEquals(List.of(""), StringOps.suffixes(""));

    String s = "abbab";
    Assertions.assertEquals(s.length() + 1, StringOps.prefixes(s).size());
    Assertions.assertEquals(s.length() + 1, StringOps.suffixes(s).size());
  }

  @Test
  void testSubstrings() {
    Assertions.assertEquals(List.of("a", "ab", "abc", "b", "bc", "c"), StringOps.substrings("abc"));
    // repeats are kept
    Assertions.assertEquals(List.of("a", "aa", "a"), StringOps.substrings("aa"));
    Assertions.assertTrue(StringOps.substrings("").isEmpty());

    for (int n = 0; n < 8; n++) {
      Assertions.assertEquals(n * (n + 1) / 2, StringOps.substrings("x".repeat(n)).size());
    }
  }

  @Test
  void testKleeneClosure() {
    Assertions.assertEquals(List.of("", "a", "b", "aa", "ab", "ba", "bb"),
        StringOps.kleeneClosure(List.of("a", "b"), 2));
    Assertions.assertEquals(List.of(""), StringOps.kleeneClosure(List.of("a", "b"), 0));
    Assertions.assertEquals(1 + 3 + 9 + 27, StringOps.kleeneClosure(List.of("x", "y", "z"), 3).size());
    // alphabet order drives the output order
    Assertions.assertEquals(List.of("", "b", "a"), StringOps.kleeneClosure(List.of("b", "a"), 1));
  }

  @Test
  void testPositiveClosure() {
    Assertions.assertEquals(List.of("a", "b", "aa", "ab", "ba", "bb"),
        StringOps.positiveClosure(List.of("a", "b"), 2));
    Assertions.assertTrue(StringOps.positiveClosure(List.of("a", "b"), 0).isEmpty());
    Assertions.assertEquals(List.of("0", "1", "00", "01", "10", "11"), StringOps.positiveClosure(List.of("0", "1"), 2));
  }

  @Test
  void testEmptyAlphabet() {
    Assertions.assertEquals(List.of(""), StringOps.kleeneClosure(List.of(), 5));
    Assertions.assertTrue(StringOps.positiveClosure(List.of(), 5).isEmpty());
  }

  @Test
  void testInvalidLength() {
    AutomatonException e = Assertions.assertThrows(AutomatonException.class,
        () -> StringOps.kleeneClosure(List.of("a"), -1));
    Assertions.assertEquals(ErrorKind.INVALID_ARGUMENT, e.getKind());
    Assertions.assertThrows(AutomatonException.class, () -> StringOps.positiveClosure(List.of("a"), -2));

    Assertions.assertEquals(3, StringOps.parseLength(" 3 "));
    Assertions.assertEquals(ErrorKind.INVALID_ARGUMENT,
        Assertions.assertThrows(AutomatonException.class, () -> StringOps.parseLength("tres")).getKind());
    Assertions.assertEquals(ErrorKind.INVALID_ARGUMENT,
        Assertions.assertThrows(AutomatonException.class, () -> StringOps.parseLength("-1")).getKind());
  }

  @Test
  void testClosureTooLarge() {
    List<String> digits = List.of("0", "1", "2", "3", "4", "5", "6", "7", "8", "9");
    Assertions.assertEquals(111_111, StringOps.kleeneClosure(digits, 5).size());
    AutomatonException e = Assertions.assertThrows(AutomatonException.class,
        () -> StringOps.kleeneClosure(digits, 6));
    Assertions.assertEquals(ErrorKind.INVALID_ARGUMENT, e.getKind());
  }

  @Test
  void testClosureTooLongStrings() {
    // few strings, but far too many characters in total
    AutomatonException e = Assertions.assertThrows(AutomatonException.class,
        () -> StringOps.kleeneClosure(List.of("a"), 200_000));
    Assertions.assertEquals(ErrorKind.INVALID_ARGUMENT, e.getKind());
    Assertions.assertThrows(AutomatonException.class, () -> StringOps.positiveClosure(List.of("ab"), 10_000));

    List<String> words = StringOps.positiveClosure(List.of("a"), 2_000);
    Assertions.assertEquals(2_000, words.size());
    Assertions.assertEquals(2_000, words.get(1_999).length());
    // the empty alphabet never grows
    Assertions.assertEquals(List.of(""), StringOps.kleeneClosure(List.of(), Integer.MAX_VALUE));
  }
}
