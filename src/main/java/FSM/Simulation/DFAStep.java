package FSM.Simulation;

public record DFAStep(String state, String symbol, String next) implements Step {
    public static final String REJECT = "REJECT";

    public boolean rejected() {
        return REJECT.equals(next);
    }

    @Override
    public String describe() {
        return state + " --" + symbol + "--> " + next;
    }
}
