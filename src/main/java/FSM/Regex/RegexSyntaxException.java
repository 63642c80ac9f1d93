package FSM.Regex;

import FSM.Model.AutomatonException;

public class RegexSyntaxException extends AutomatonException {
    private final int position;

    public RegexSyntaxException(String message, int position) {
        super(message + " at position " + position);
        this.position = position;
    }

    /**
     * @return cursor position in the whitespace-stripped regex
     */
    public int getPosition() {
        return position;
    }
}
