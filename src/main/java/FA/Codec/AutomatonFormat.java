package FA.Codec;

import FA.Model.Automaton;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * A file format for automata. Decoding always builds a new {@link Automaton};
 * callers replace their current automaton only when decoding succeeds.
 */
public interface AutomatonFormat {

    String getName();

    /**
     * File extensions handled by this format, lower case, without the dot.
     */
    List<String> getExtensions();

    String encode(Automaton automaton);

    Automaton decode(String text) throws AutomatonFormatException;

    default void write(Automaton automaton, OutputStream os) throws IOException {
        os.write(encode(automaton).getBytes(StandardCharsets.UTF_8));
        os.flush();
    }

    default Automaton read(InputStream is) throws IOException, AutomatonFormatException {
        return decode(new String(is.readAllBytes(), StandardCharsets.UTF_8));
    }
}
