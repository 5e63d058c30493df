package FA.Report;

import FA.Model.Automaton;
import FA.Simulation.Simulator;
import FA.Strings.StringOps;

import java.util.List;

/**
 * Plain-text reports of string operations, each string followed by the automaton's verdict.
 * The empty string is printed as ε.
 */
public final class ResultsReport {
    static final String ACCEPTED = "ACEPTADA";
    static final String REJECTED = "RECHAZADA";

    private ResultsReport() { }

    public static String prefixes(Automaton automaton, String s) {
        return listing("Prefijos de '" + s + "':", automaton, StringOps.prefixes(s));
    }

    public static String suffixes(Automaton automaton, String s) {
        return listing("Sufijos de '" + s + "':", automaton, StringOps.suffixes(s));
    }

    public static String substrings(Automaton automaton, String s) {
        return listing("Subcadenas de '" + s + "':", automaton, StringOps.substrings(s));
    }

    public static String kleeneClosure(Automaton automaton, int maxLen) {
        List<String> words = StringOps.kleeneClosure(automaton.getAlphabet(), maxLen);
        return byLength("Cerradura de Kleene (Σ*) con longitud máxima " + maxLen + ":", automaton, words, 0, maxLen);
    }

    public static String positiveClosure(Automaton automaton, int maxLen) {
        List<String> words = StringOps.positiveClosure(automaton.getAlphabet(), maxLen);
        return byLength("Cerradura Positiva (Σ+) con longitud máxima " + maxLen + ":", automaton, words, 1, maxLen);
    }

    public static String batch(BatchValidation.Result result) {
        StringBuilder sb = new StringBuilder("Resultados de validación:\n\n");
        sb.append("Cadenas ACEPTADAS:\n");
        for (String s : result.accepted()) {
            sb.append(quote(s)).append('\n');
        }
        sb.append("\nCadenas RECHAZADAS:\n");
        for (String s : result.rejected()) {
            sb.append(quote(s)).append('\n');
        }
        sb.append("\nTotal: ").append(result.total()).append(" cadenas, ")
            .append(result.accepted().size()).append(" aceptadas, ")
            .append(result.rejected().size()).append(" rechazadas\n");
        return sb.toString();
    }

    private static String listing(String header, Automaton automaton, List<String> words) {
        StringBuilder sb = new StringBuilder(header).append('\n');
        for (String w : words) {
            verdictLine(sb, automaton, w);
        }
        return sb.toString();
    }

    // closures list |Σ|^len words of each length in turn
    private static String byLength(String header, Automaton automaton, List<String> words, int minLen, int maxLen) {
        StringBuilder sb = new StringBuilder(header).append('\n');
        final int symbols = automaton.getAlphabet().size();
        int from = 0;
        long count = minLen == 0 ? 1 : symbols;
        for (int len = minLen; len <= maxLen && from < words.size(); len++) {
            int to = (int) Math.min(words.size(), from + count);
            sb.append("\nLongitud ").append(len).append(":\n");
            for (String w : words.subList(from, to)) {
                verdictLine(sb, automaton, w);
            }
            from = to;
            count *= symbols;
        }
        return sb.toString();
    }

    private static void verdictLine(StringBuilder sb, Automaton automaton, String w) {
        sb.append(quote(w)).append(" - ").append(Simulator.accepts(automaton, w) ? ACCEPTED : REJECTED).append('\n');
    }

    private static String quote(String s) {
        return "'" + (s.isEmpty() ? Automaton.EPSILON : s) + "'";
    }
}
