package FSM.Model;

import java.util.ArrayList;
import java.util.List;

/**
 * Instantaneous description of a PDA run. The stack is listed top first. Never mutated: {@link #apply}
 * returns a new configuration.
 */
public record PDAConfiguration(String state, String remainingInput, List<String> stack) {

    public PDAConfiguration {
        stack = List.copyOf(stack);
    }

    /**
     * @return top of stack, or null if the stack is empty
     */
    public String stackTop() {
        return stack.isEmpty() ? null : stack.get(0);
    }

    /**
     * @return next unread input symbol, or null if the input is exhausted
     */
    public String nextSymbol() {
        return remainingInput.isEmpty() ? null : remainingInput.substring(0, 1);
    }

    public PDAConfiguration apply(PDATransition transition) {
        List<String> newStack = new ArrayList<>(stack.size() + transition.push().size());
        for (String symbol : transition.push()) {
            if (!Automaton.EPSILON.equals(symbol)) {
                newStack.add(symbol);
            }
        }
        newStack.addAll(stack.subList(1, stack.size()));
        String newInput = remainingInput;
        if (!transition.isEpsilon() && !newInput.isEmpty()) {
            newInput = newInput.substring(1);
        }
        return new PDAConfiguration(transition.to(), newInput, newStack);
    }

    @Override
    public String toString() {
        String stackStr = stack.isEmpty() ? "⊥" : String.join("", stack);
        return "(" + state + ", " + (remainingInput.isEmpty() ? Automaton.EPSILON : remainingInput) + ", " + stackStr + ")";
    }
}
