package FA.Codec;

import FA.Model.Automaton;
import FA.Model.AutomatonException;
import FA.Model.Destination;
import FA.Model.Mode;
import FA.Model.TransitionKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Line-oriented text format, one "Key: value" line per field:
 * <pre>
 * Tipo: AFN
 * Alfabeto: a,b
 * Estados: q0,q1,q2
 * Estado inicial: q0
 * Estados de aceptación: q2
 * Transición: q0,a-&gt;q1
 * Transición: q1,b-&gt;q1,q2
 * </pre>
 * Fields may come in any order and unknown lines are skipped. Without a "Tipo" line the type is inferred.
 * Repeated transition lines for one (state, symbol) pair accumulate in an NFA; in a DFA the last one wins.
 */
public class NativeFormat implements AutomatonFormat {
    private static final Logger logger = LoggerFactory.getLogger(NativeFormat.class);

    static final String TYPE = "Tipo:";
    static final String ALPHABET = "Alfabeto:";
    static final String STATES = "Estados:";
    static final String INITIAL = "Estado inicial:";
    static final String ACCEPTING = "Estados de aceptación:";
    static final String ACCEPTING_PLAIN = "Estados de aceptacion:";
    static final String TRANSITION = "Transición:";
    static final String TRANSITION_PLAIN = "Transicion:";
    static final String ARROW = "->";

    @Override
    public String getName() {
        return "native";
    }

    @Override
    public List<String> getExtensions() {
        return List.of("txt", "fa");
    }

    @Override
    public String encode(Automaton automaton) {
        StringBuilder sb = new StringBuilder();
        line(sb, TYPE, automaton.getMode().getLabel());
        line(sb, ALPHABET, String.join(",", automaton.getAlphabet()));
        line(sb, STATES, String.join(",", automaton.getStates()));
        line(sb, INITIAL, automaton.getInitial() == null ? "" : automaton.getInitial());
        line(sb, ACCEPTING, String.join(",", automaton.getAccepting()));
        for (Map.Entry<TransitionKey, Destination> e : automaton.getTransitions().entrySet()) {
            TransitionKey key = e.getKey();
            line(sb, TRANSITION, key.state() + "," + key.symbol() + ARROW + String.join(",", e.getValue().targets()));
        }
        return sb.toString();
    }

    private static void line(StringBuilder sb, String key, String value) {
        sb.append(key).append(' ').append(value).append('\n');
    }

    @Override
    public Automaton decode(String text) throws AutomatonFormatException {
        final AutomatonDraft draft = new AutomatonDraft();
        final String[] lines = text.split("\\R");

        for (int i = 0; i < lines.length; i++) {
            final String line = lines[i].strip();
            final String where = "line " + (i + 1);
            if (line.isEmpty()) {
                continue;
            }
            if (line.startsWith(TYPE)) {
                try {
                    draft.mode = Mode.fromLabel(value(line, TYPE));
                } catch (AutomatonException e) {
                    throw new AutomatonFormatException(where + ": " + e.getMessage(), e);
                }
            } else if (line.startsWith(ALPHABET)) {
                draft.alphabet.clear();
                draft.alphabet.addAll(Automaton.parseList(value(line, ALPHABET)));
            } else if (line.startsWith(STATES)) {
                draft.hasStates = true;
                draft.states.clear();
                draft.states.addAll(Automaton.parseList(value(line, STATES)));
            } else if (line.startsWith(INITIAL)) {
                draft.initial = value(line, INITIAL);
            } else if (line.startsWith(ACCEPTING) || line.startsWith(ACCEPTING_PLAIN)) {
                draft.accepting.clear();
                draft.accepting.addAll(Automaton.parseList(value(line, line.startsWith(ACCEPTING) ? ACCEPTING : ACCEPTING_PLAIN)));
            } else if (line.startsWith(TRANSITION) || line.startsWith(TRANSITION_PLAIN)) {
                parseTransition(draft, value(line, line.startsWith(TRANSITION) ? TRANSITION : TRANSITION_PLAIN), where);
            } else {
                logger.debug("{}: ignoring '{}'", where, line);
            }
        }
        return draft.build();
    }

    // "q0,a->q1,q2"
    private static void parseTransition(AutomatonDraft draft, String body, String where) throws AutomatonFormatException {
        int arrow = body.indexOf(ARROW);
        if (arrow < 0) {
            throw new AutomatonFormatException(where + ": expected 'state,symbol->destination'");
        }
        String source = body.substring(0, arrow);
        int comma = source.indexOf(',');
        if (comma < 0) {
            throw new AutomatonFormatException(where + ": expected 'state,symbol' before '" + ARROW + "'");
        }
        String from = source.substring(0, comma).trim();
        String symbol = source.substring(comma + 1).trim();
        List<String> to = Automaton.parseList(body.substring(arrow + ARROW.length()));
        if (from.isEmpty() || symbol.isEmpty() || to.isEmpty()) {
            throw new AutomatonFormatException(where + ": incomplete transition '" + body + "'");
        }
        draft.addRow(from, symbol, to, where);
    }

    private static String value(String line, String key) {
        return line.substring(key.length()).trim();
    }
}
