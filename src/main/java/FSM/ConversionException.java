package FSM;

import FSM.Model.AutomatonException;
import FSM.Model.AutomatonKind;

/**
 * An operation was invoked on an automaton of the wrong kind.
 */
public class ConversionException extends AutomatonException {

    public ConversionException(String operation, AutomatonKind expected, AutomatonKind actual) {
        super(operation + " requires a " + expected.getDisplayName() + ", got a " + actual.getDisplayName());
    }
}
