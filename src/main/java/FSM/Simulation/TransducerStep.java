package FSM.Simulation;

/**
 * Step of a Mealy or Moore machine. An undefined transition is recorded with {@link #ERROR}
 * as both successor and output.
 */
public record TransducerStep(String state, String symbol, String next, String output) implements Step {
    public static final String ERROR = "ERROR";

    public boolean failed() {
        return ERROR.equals(next);
    }

    @Override
    public String describe() {
        return state + " --" + symbol + "--> " + next + " [" + output + "]";
    }
}
