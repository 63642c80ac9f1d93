package FSM.Simulation;

import FSM.Model.Automaton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point running any automaton kind against an input string.
 */
public final class Simulator {
    private static final Logger LOG = LoggerFactory.getLogger(Simulator.class);

    private Simulator() {}

    public static SimulationResult simulate(Automaton automaton, String input) {
        SimulationResult result = automaton.simulate(input);
        LOG.debug("{} on '{}': {} in {} steps", automaton.kind().getDisplayName(), input, result.verdict(),
                result.trace().size());
        return result;
    }
}
