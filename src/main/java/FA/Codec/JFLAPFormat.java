package FA.Codec;

import FA.Model.Automaton;
import FA.Model.Destination;
import FA.Model.TransitionKey;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * JFLAP ".jff" finite automaton files.
 * States are referenced by numeric id; names are kept in the {@code name} attribute.
 * An empty or missing {@code <read>} is an ε-transition.
 * The declared alphabet is written to an {@code <alphabet>} element that JFLAP ignores;
 * files without one get the symbols read by their transitions.
 */
public class JFLAPFormat implements AutomatonFormat {
    static final String FA_TYPE = "fa";
    static final String ALPHABET = "alphabet";
    static final String SYMBOL = "symbol";
    static final int GRID_COLUMNS = 5;
    static final int GRID_PITCH = 100;
    static final int GRID_ORIGIN = 50;

    @Override
    public String getName() {
        return "jflap";
    }

    @Override
    public List<String> getExtensions() {
        return List.of("jff");
    }

    @Override
    public String encode(Automaton automaton) {
        try {
            final Document doc = newBuilder().newDocument();
            doc.setXmlStandalone(true);
            final Element root = doc.createElement("structure");
            root.setAttribute("type", FA_TYPE);
            doc.appendChild(root);
            appendText(doc, root, "type", FA_TYPE);
            final Element alphabet = doc.createElement(ALPHABET);
            for (String symbol : automaton.getAlphabet()) {
                appendText(doc, alphabet, SYMBOL, symbol);
            }
            root.appendChild(alphabet);
            final Element fa = doc.createElement("automaton");
            root.appendChild(fa);

            final Object2IntMap<String> ids = new Object2IntOpenHashMap<>();
            int i = 0;
            for (String name : automaton.getStates()) {
                ids.put(name, i);
                Element state = doc.createElement("state");
                state.setAttribute("id", String.valueOf(i));
                state.setAttribute("name", name);
                appendText(doc, state, "x", String.valueOf((i % GRID_COLUMNS) * GRID_PITCH + GRID_ORIGIN));
                appendText(doc, state, "y", String.valueOf((i / GRID_COLUMNS) * GRID_PITCH + GRID_ORIGIN));
                if (name.equals(automaton.getInitial())) {
                    state.appendChild(doc.createElement("initial"));
                }
                if (automaton.isAccepting(name)) {
                    state.appendChild(doc.createElement("final"));
                }
                fa.appendChild(state);
                i++;
            }

            for (Map.Entry<TransitionKey, Destination> e : automaton.getTransitions().entrySet()) {
                final String symbol = e.getKey().symbol();
                for (String target : e.getValue().targets()) {
                    Element transition = doc.createElement("transition");
                    appendText(doc, transition, "from", String.valueOf(ids.getInt(e.getKey().state())));
                    appendText(doc, transition, "to", String.valueOf(ids.getInt(target)));
                    Element read = doc.createElement("read");
                    if (!Automaton.EPSILON.equals(symbol)) {
                        read.setTextContent(symbol);
                    }
                    transition.appendChild(read);
                    fa.appendChild(transition);
                }
            }
            return toXml(doc);
        } catch (ParserConfigurationException | TransformerException e) {
            throw new IllegalStateException("XML support is not available", e);
        }
    }

    @Override
    public Automaton decode(String text) throws AutomatonFormatException {
        final Document doc;
        try {
            doc = newBuilder().parse(new InputSource(new StringReader(text)));
        } catch (SAXException | IOException e) {
            throw new AutomatonFormatException("Malformed XML: " + e.getMessage(), e);
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML support is not available", e);
        }

        final Element root = doc.getDocumentElement();
        final String type = typeOf(root);
        if (type != null && !FA_TYPE.equals(type)) {
            throw new AutomatonFormatException("Not a finite automaton: type '" + type + "'");
        }
        final Element fa = firstChild(root, "automaton");
        if (fa == null) {
            throw new AutomatonFormatException("Missing <automaton> element");
        }

        final AutomatonDraft draft = new AutomatonDraft();
        draft.hasStates = true;
        final Map<String, String> names = new HashMap<>();
        for (Element state : children(fa, "state")) {
            String id = state.getAttribute("id");
            String name = state.hasAttribute("name") && !state.getAttribute("name").isBlank()
                ? state.getAttribute("name") : id;
            if (id.isBlank()) {
                throw new AutomatonFormatException("State without id");
            }
            if (names.put(id, name) != null) {
                throw new AutomatonFormatException("Duplicate state id " + id);
            }
            if (draft.states.contains(name)) {
                throw new AutomatonFormatException("Duplicate state name '" + name + "'");
            }
            draft.states.add(name);
            if (firstChild(state, "initial") != null) {
                draft.initial = name;
            }
            if (firstChild(state, "final") != null) {
                draft.accepting.add(name);
            }
        }

        final Set<String> alphabet = new LinkedHashSet<>();
        final Element declared = firstChild(root, ALPHABET);
        if (declared != null) {
            for (Element symbol : children(declared, SYMBOL)) {
                String value = symbol.getTextContent().trim();
                if (!value.isEmpty()) {
                    alphabet.add(value);
                }
            }
        }
        int index = 0;
        for (Element transition : children(fa, "transition")) {
            index++;
            final String where = "transition " + index;
            String from = resolve(names, childText(transition, "from"), where);
            String to = resolve(names, childText(transition, "to"), where);
            String read = childText(transition, "read");
            read = read == null ? null : read.trim();
            String symbol;
            if (read == null || read.isEmpty() || Automaton.EPSILON.equals(read)) {
                symbol = Automaton.EPSILON;
            } else {
                symbol = read;
                alphabet.add(read);
            }
            draft.addRow(from, symbol, List.of(to), where);
        }
        draft.alphabet.addAll(alphabet);
        return draft.build();
    }

    private static String resolve(Map<String, String> names, String id, String where) throws AutomatonFormatException {
        if (id == null) {
            throw new AutomatonFormatException(where + ": missing <from> or <to>");
        }
        String name = names.get(id.trim());
        if (name == null) {
            throw new AutomatonFormatException(where + ": unknown state id " + id.trim());
        }
        return name;
    }

    // <structure type="fa"> or <structure><type>fa</type>
    private static String typeOf(Element root) {
        if (root.hasAttribute("type")) {
            return root.getAttribute("type").trim();
        }
        String type = childText(root, "type");
        return type == null ? null : type.trim();
    }

    private static DocumentBuilder newBuilder() throws ParserConfigurationException {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        factory.setExpandEntityReferences(false);
        return factory.newDocumentBuilder();
    }

    private static String toXml(Document doc) throws TransformerException {
        Transformer transformer = TransformerFactory.newInstance().newTransformer();
        transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
        transformer.setOutputProperty(OutputKeys.INDENT, "yes");
        transformer.setOutputProperty("{http://xml.apache.org/xslt}indent-amount", "2");
        StringWriter writer = new StringWriter();
        transformer.transform(new DOMSource(doc), new StreamResult(writer));
        return writer.toString();
    }

    private static void appendText(Document doc, Element parent, String tag, String text) {
        Element child = doc.createElement(tag);
        child.setTextContent(text);
        parent.appendChild(child);
    }

    private static List<Element> children(Element parent, String tag) {
        List<Element> result = new ArrayList<>();
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node.getNodeType() == Node.ELEMENT_NODE && tag.equals(node.getNodeName())) {
                result.add((Element) node);
            }
        }
        return result;
    }

    private static Element firstChild(Element parent, String tag) {
        List<Element> found = children(parent, tag);
        return found.isEmpty() ? null : found.get(0);
    }

    private static String childText(Element parent, String tag) {
        Element child = firstChild(parent, tag);
        return child == null ? null : child.getTextContent();
    }
}
