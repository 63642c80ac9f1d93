package FSM.Model;

/**
 * Structurally invalid automaton: raised at the offending construction call, or by
 * {@link Automaton#requireValid()} when an algorithm receives an automaton that does not validate.
 */
public class ValidationException extends AutomatonException {

    public ValidationException(String message) {
        super(message);
    }
}
