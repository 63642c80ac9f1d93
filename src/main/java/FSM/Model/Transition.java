package FSM.Model;

/**
 * Generic transition record kept by every automaton for inspection and rendering.
 * {@code output} is set for Mealy edges and for the stack part of PDA labels, otherwise null.
 */
public record Transition(String from, String to, String symbol, String output) {

    public Transition(String from, String to, String symbol) {
        this(from, to, symbol, null);
    }

    public boolean isEpsilon() {
        return Automaton.EPSILON.equals(symbol);
    }

    /**
     * @return edge label, e.g. {@code a} or {@code a/1}
     */
    public String label() {
        return output == null ? symbol : symbol + "/" + output;
    }

    @Override
    public String toString() {
        return from + " --" + label() + "--> " + to;
    }
}
