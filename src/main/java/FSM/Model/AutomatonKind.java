package FSM.Model;

public enum AutomatonKind {
    DFA("DFA"),
    NFA("NFA"),
    EPSILON_NFA("ε-NFA"),
    PDA("PDA"),
    MEALY("Mealy machine"),
    MOORE("Moore machine");

    private final String displayName;

    AutomatonKind(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
