package FA.Strings;

import FA.Model.AutomatonException;
import FA.Model.ErrorKind;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Formal-language generators over strings and alphabets.
 */
public final class StringOps {
    /** Largest closure that will be materialized, in strings. */
    public static final long MAX_CLOSURE_SIZE = 1_000_000L;

    /** Largest closure that will be materialized, in characters over all strings. */
    public static final long MAX_CLOSURE_CHARS = 20_000_000L;

    private StringOps() { }

    /**
     * All contiguous non-empty substrings, by start index then end index. Repeats are kept.
     */
    public static List<String> substrings(String s) {
        List<String> result = new ArrayList<>();
        for (int i = 0; i < s.length(); i++) {
            for (int j = i + 1; j <= s.length(); j++) {
                result.add(s.substring(i, j));
            }
        }
        return result;
    }

    /**
     * All prefixes from the empty string up to {@code s}.
     */
    public static List<String> prefixes(String s) {
        List<String> result = new ArrayList<>(s.length() + 1);
        for (int i = 0; i <= s.length(); i++) {
            result.add(s.substring(0, i));
        }
        return result;
    }

    /**
     * All suffixes from {@code s} down to the empty string.
     */
    public static List<String> suffixes(String s) {
        List<String> result = new ArrayList<>(s.length() + 1);
        for (int i = 0; i <= s.length(); i++) {
            result.add(s.substring(i));
        }
        return result;
    }

    /**
     * Σ* bounded by length: every string of length 0..maxLen over {@code alphabet},
     * shortest first, symbols combined in the order the alphabet iterates.
     */
    public static List<String> kleeneClosure(Collection<String> alphabet, int maxLen) {
        return closure(alphabet, 0, maxLen);
    }

    /**
     * Σ+ bounded by length: like {@link #kleeneClosure} without the empty string.
     */
    public static List<String> positiveClosure(Collection<String> alphabet, int maxLen) {
        return closure(alphabet, 1, maxLen);
    }

    /**
     * Parse a closure length typed by a user.
     */
    public static int parseLength(String text) {
        try {
            int length = Integer.parseInt(text.trim());
            requireLength(length);
            return length;
        } catch (NumberFormatException e) {
            throw new AutomatonException(ErrorKind.INVALID_ARGUMENT, "Not a valid length: '" + text + "'", e);
        }
    }

    private static List<String> closure(Collection<String> alphabet, int minLen, int maxLen) {
        requireLength(maxLen);
        final List<String> symbols = new ArrayList<>(alphabet);
        requireClosureFits(symbols, minLen, maxLen);

        final List<String> result = new ArrayList<>();
        // words of the current length, extended by one symbol per round
        List<String> layer = List.of("");
        for (int len = 0; len <= maxLen; len++) {
            if (len >= minLen) {
                result.addAll(layer);
            }
            if (len == maxLen || symbols.isEmpty()) {
                break;
            }
            List<String> next = new ArrayList<>(layer.size() * symbols.size());
            for (String word : layer) {
                for (String symbol : symbols) {
                    next.add(word + symbol);
                }
            }
            layer = next;
        }
        return result;
    }

    /**
     * Rejects closures over {@link #MAX_CLOSURE_SIZE} strings or {@link #MAX_CLOSURE_CHARS} characters.
     * Words of length len number |Σ|^len and hold len * |Σ|^(len-1) * (total symbol length) characters.
     */
    private static void requireClosureFits(List<String> symbols, int minLen, int maxLen) {
        long symbolChars = 0;
        for (String symbol : symbols) {
            symbolChars += symbol.length();
        }
        long strings = 0;
        long chars = 0;
        long previous = 0;
        long power = 1;
        for (int len = 0; len <= maxLen; len++) {
            if (len >= minLen) {
                strings += power;
                chars += len * previous * symbolChars;
            }
            if (strings > MAX_CLOSURE_SIZE || chars > MAX_CLOSURE_CHARS) {
                throw new AutomatonException(ErrorKind.INVALID_ARGUMENT,
                    "Closure of " + symbols.size() + " symbols up to length " + maxLen + " is too large");
            }
            if (symbols.isEmpty()) {
                break;
            }
            previous = power;
            power *= symbols.size();
        }
    }

    private static void requireLength(int length) {
        if (length < 0) {
            throw new AutomatonException(ErrorKind.INVALID_ARGUMENT, "Length must not be negative: " + length);
        }
    }
}
