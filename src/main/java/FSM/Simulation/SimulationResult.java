package FSM.Simulation;

import java.util.List;

/**
 * Verdict of one run, the step trace, and for Mealy/Moore machines the produced outputs.
 *
 * @param finalOutput output sequence, null for acceptors
 */
public record SimulationResult(Verdict verdict, List<Step> trace, List<String> finalOutput) {

    public SimulationResult {
        trace = List.copyOf(trace);
        finalOutput = finalOutput == null ? null : List.copyOf(finalOutput);
    }

    public static SimulationResult of(boolean accepted, List<? extends Step> trace) {
        return new SimulationResult(accepted ? Verdict.ACCEPTED : Verdict.REJECTED, List.copyOf(trace), null);
    }

    public boolean accepted() {
        return verdict == Verdict.ACCEPTED;
    }

    public boolean undecided() {
        return verdict == Verdict.UNDECIDED;
    }
}
