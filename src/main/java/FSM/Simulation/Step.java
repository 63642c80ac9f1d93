package FSM.Simulation;

/**
 * One entry of a simulation trace.
 */
public interface Step {

    /**
     * @return single-line, human-readable rendering of the step
     */
    String describe();
}
