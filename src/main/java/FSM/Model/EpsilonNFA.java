package FSM.Model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * NFA that may also move on {@link #EPSILON} without consuming input.
 * Epsilon is never added to the public alphabet.
 */
public class EpsilonNFA extends NFA {

    @Override
    public AutomatonKind kind() {
        return AutomatonKind.EPSILON_NFA;
    }

    public void addEpsilonTransition(String from, String to) {
        addTransition(from, to, EPSILON);
    }

    /**
     * Fixpoint of the ε-successor relation; always contains {@code states}.
     */
    public SortedSet<String> epsilonClosure(Collection<String> states) {
        SortedSet<String> closure = new TreeSet<>(states);
        Deque<String> worklist = new ArrayDeque<>(states);
        while (!worklist.isEmpty()) {
            String state = worklist.poll();
            for (String next : nextStates(state, EPSILON)) {
                if (closure.add(next)) {
                    worklist.add(next);
                }
            }
        }
        return closure;
    }

    /**
     * @return every ε-edge, in insertion order
     */
    public List<Transition> epsilonTransitions() {
        List<Transition> result = new ArrayList<>();
        for (Transition t : getTransitions()) {
            if (t.isEpsilon()) {
                result.add(t);
            }
        }
        return result;
    }

    @Override
    protected SortedSet<String> initialSet() {
        return epsilonClosure(super.initialSet());
    }

    @Override
    protected SortedSet<String> step(SortedSet<String> current, String symbol) {
        return epsilonClosure(move(current, symbol));
    }
}
