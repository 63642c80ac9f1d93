package FSM.Simulation;

import FSM.Model.AutomatonException;

/**
 * A bounded search stopped before reaching a decision.
 */
public class SimulationLimitExceededException extends AutomatonException {
    private final SearchOutcome outcome;

    public SimulationLimitExceededException(SearchOutcome outcome) {
        super("Search undecided after " + outcome.explored() + " configurations (" + outcome.limit() + " limit)");
        this.outcome = outcome;
    }

    public SearchOutcome getOutcome() {
        return outcome;
    }
}
