package FA.Codec;

import FA.Model.Automaton;
import FA.Model.AutomatonException;
import FA.Model.Destination;
import FA.Model.Mode;
import FA.Model.TransitionKey;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * JSON object format ({@code .afd} / {@code .json}):
 * <pre>
 * {
 *   "type" : "AFD",
 *   "alphabet" : [ "a", "b" ],
 *   "states" : [ "q0", "q1" ],
 *   "initialState" : "q0",
 *   "acceptanceStates" : [ "q1" ],
 *   "transitions" : { "q0" : { "a" : [ "q1" ] } }
 * }
 * </pre>
 * Destinations are written as arrays; a plain string destination is accepted on input.
 */
public class JSONFormat implements AutomatonFormat {
    private final ObjectMapper mapper = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT)
        .enable(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    @JsonPropertyOrder({"type", "alphabet", "states", "initialState", "acceptanceStates", "transitions"})
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class AutomatonJson {
        @JsonProperty("type")
        public String type;

        @JsonProperty("alphabet")
        public List<String> alphabet;

        @JsonProperty("states")
        public List<String> states;

        @JsonProperty("initialState")
        public String initialState;

        @JsonProperty("acceptanceStates")
        public List<String> acceptanceStates;

        @JsonProperty("transitions")
        public Map<String, Map<String, List<String>>> transitions;
    }

    @Override
    public String getName() {
        return "json";
    }

    @Override
    public List<String> getExtensions() {
        return List.of("afd", "json");
    }

    @Override
    public String encode(Automaton automaton) {
        AutomatonJson json = new AutomatonJson();
        json.type = automaton.getMode().getLabel();
        json.alphabet = new ArrayList<>(automaton.getAlphabet());
        json.states = new ArrayList<>(automaton.getStates());
        json.initialState = automaton.getInitial();
        json.acceptanceStates = new ArrayList<>(automaton.getAccepting());
        json.transitions = new LinkedHashMap<>();
        for (Map.Entry<TransitionKey, Destination> e : automaton.getTransitions().entrySet()) {
            json.transitions.computeIfAbsent(e.getKey().state(), k -> new LinkedHashMap<>())
                .put(e.getKey().symbol(), new ArrayList<>(e.getValue().targets()));
        }
        try {
            return mapper.writeValueAsString(json);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public Automaton decode(String text) throws AutomatonFormatException {
        final AutomatonJson json;
        try {
            json = mapper.readValue(text, AutomatonJson.class);
        } catch (JsonProcessingException e) {
            throw new AutomatonFormatException("Malformed JSON: " + e.getOriginalMessage(), e);
        }
        if (json == null) {
            throw new AutomatonFormatException("Empty document");
        }

        final AutomatonDraft draft = new AutomatonDraft();
        if (json.type != null) {
            try {
                draft.mode = Mode.fromLabel(json.type);
            } catch (AutomatonException e) {
                throw new AutomatonFormatException(e.getMessage(), e);
            }
        }
        if (json.states != null) {
            draft.hasStates = true;
            draft.states.addAll(json.states);
        }
        if (json.alphabet != null) {
            draft.alphabet.addAll(json.alphabet);
        }
        draft.initial = json.initialState;
        if (json.acceptanceStates != null) {
            draft.accepting.addAll(json.acceptanceStates);
        }
        if (json.transitions != null) {
            for (Map.Entry<String, Map<String, List<String>>> row : json.transitions.entrySet()) {
                if (row.getValue() == null) {
                    continue;
                }
                for (Map.Entry<String, List<String>> cell : row.getValue().entrySet()) {
                    List<String> to = new ArrayList<>();
                    if (cell.getValue() != null) {
                        cell.getValue().stream().filter(Objects::nonNull).forEach(to::add);
                    }
                    draft.addRow(row.getKey(), cell.getKey(), to,
                        "transition " + new TransitionKey(row.getKey(), cell.getKey()));
                }
            }
        }
        return draft.build();
    }
}
