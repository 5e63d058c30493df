package FA.Codec;

import FA.Model.Automaton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Chooses a format from a file extension and reads or writes whole files.
 */
public final class Formats {
    private static final Logger logger = LoggerFactory.getLogger(Formats.class);

    private static final NativeFormat NATIVE = new NativeFormat();

    public static final List<AutomatonFormat> ALL = List.of(NATIVE, new JFLAPFormat(), new JSONFormat());

    /** Extension shared by the JSON format and older native-text saves. */
    static final String SHARED_EXTENSION = "afd";

    private Formats() { }

    /**
     * Format used to write {@code file}, chosen by extension.
     */
    public static AutomatonFormat forFile(Path file) throws AutomatonFormatException {
        String extension = extension(file);
        for (AutomatonFormat format : ALL) {
            if (format.getExtensions().contains(extension)) {
                return format;
            }
        }
        throw new AutomatonFormatException("Unsupported file type: '" + file.getFileName() + "'");
    }

    /**
     * Format used to read {@code file}: by extension, except that an ".afd" file
     * not starting with '{' holds native text.
     */
    public static AutomatonFormat forContent(Path file, String text) throws AutomatonFormatException {
        AutomatonFormat format = forFile(file);
        if (SHARED_EXTENSION.equals(extension(file)) && firstSignificantChar(text) != '{') {
            return NATIVE;
        }
        return format;
    }

    public static Automaton read(Path file) throws IOException, AutomatonFormatException {
        final String text = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        final AutomatonFormat format = forContent(file, text);
        Automaton automaton = format.decode(text);
        logger.info("Loaded {} automaton from {} ({} states)", format.getName(), file, automaton.getStates().size());
        return automaton;
    }

    public static void write(Path file, Automaton automaton) throws IOException, AutomatonFormatException {
        AutomatonFormat format = forFile(file);
        try (OutputStream os = Files.newOutputStream(file)) {
            format.write(automaton, os);
        }
        logger.info("Saved {} automaton to {}", format.getName(), file);
    }

    private static String extension(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    // skips whitespace and a byte order mark; 0 for blank text
    private static char firstSignificantChar(String text) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (!Character.isWhitespace(c) && c != '\uFEFF') {
                return c;
            }
        }
        return 0;
    }
}
