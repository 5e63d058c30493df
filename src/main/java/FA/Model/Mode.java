package FA.Model;

public enum Mode {
    DFA("AFD"),
    NFA("AFN");

    private final String label;

    Mode(String label) {
        this.label = label;
    }

    /**
     * Label used by the file formats ("AFD" / "AFN").
     */
    public String getLabel() {
        return label;
    }

    public static Mode fromLabel(String label) {
        String trimmed = label.trim();
        for (Mode m : values()) {
            if (m.label.equalsIgnoreCase(trimmed) || m.name().equalsIgnoreCase(trimmed)) {
                return m;
            }
        }
        throw new AutomatonException(ErrorKind.PARSE_ERROR, "Unknown automaton type: '" + label + "'");
    }
}
