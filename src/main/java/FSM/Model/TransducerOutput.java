package FSM.Model;

import java.util.List;

/**
 * Output of a Mealy or Moore run.
 *
 * @param success false if the walk stopped at an undefined transition; {@code outputs} then holds the partial output
 */
public record TransducerOutput(boolean success, List<String> outputs) {

    public TransducerOutput {
        outputs = List.copyOf(outputs);
    }
}
