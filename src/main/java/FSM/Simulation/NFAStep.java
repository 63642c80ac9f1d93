package FSM.Simulation;

import java.util.SortedSet;

/**
 * Set-based step; for an ε-NFA both sets are already ε-closed.
 */
public record NFAStep(SortedSet<String> current, String symbol, SortedSet<String> next) implements Step {

    @Override
    public String describe() {
        return current + " --" + symbol + "--> " + (next.isEmpty() ? "∅" : next);
    }
}
