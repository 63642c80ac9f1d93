package FSM.Model;

import java.util.List;

/**
 * Pushdown transition. {@code push} is listed top first: after the move {@code push.get(0)} is on top.
 * Epsilon entries in {@code push} are ignored.
 */
public record PDATransition(String from, String to, String input, String pop, List<String> push) {

    public PDATransition {
        push = List.copyOf(push);
    }

    public boolean isEpsilon() {
        return Automaton.EPSILON.equals(input);
    }

    public String pushLabel() {
        if (push.isEmpty()) {
            return Automaton.EPSILON;
        }
        return String.join("", push);
    }

    @Override
    public String toString() {
        return from + " --" + input + "," + pop + "/" + pushLabel() + "--> " + to;
    }
}
