package FSM.Simulation;

public enum Verdict {
    ACCEPTED,
    REJECTED,
    /** The search bound was reached before any run accepted or the configuration space was exhausted. */
    UNDECIDED
}
