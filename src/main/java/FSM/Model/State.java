package FSM.Model;

/**
 * A named state. Identity is the name; flags are owned by the automaton, which replaces the
 * record whenever a flag changes.
 */
public record State(String name, boolean accepting, boolean start) {

    State withAccepting(boolean newAccepting) {
        return new State(name, newAccepting, start);
    }

    State withStart(boolean newStart) {
        return new State(name, accepting, newStart);
    }

    @Override
    public String toString() {
        return name;
    }
}
