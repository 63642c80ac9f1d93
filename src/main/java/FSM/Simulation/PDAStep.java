package FSM.Simulation;

import FSM.Model.PDAConfiguration;
import FSM.Model.PDATransition;

/**
 * Configuration reached together with the transition that produced it; {@code taken} is null for the
 * initial configuration.
 */
public record PDAStep(PDAConfiguration configuration, PDATransition taken) implements Step {

    @Override
    public String describe() {
        return taken == null ? configuration.toString() : "⊢ " + configuration + "  via " + taken;
    }
}
