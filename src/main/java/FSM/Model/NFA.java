package FSM.Model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

import FSM.Simulation.NFAStep;
import FSM.Simulation.SimulationResult;

/**
 * Nondeterministic finite automaton: zero or more successors per {@code (state, symbol)}.
 */
public class NFA extends Automaton {
    private final Map<String, Map<String, Set<String>>> table = new HashMap<>();

    @Override
    public AutomatonKind kind() {
        return AutomatonKind.NFA;
    }

    public void addTransition(String from, String to, String symbol) {
        if (EPSILON.equals(symbol) && kind() != AutomatonKind.EPSILON_NFA) {
            throw new ValidationException("NFA transitions cannot be labelled " + EPSILON + "; use an EpsilonNFA");
        }
        Set<String> targets = table.computeIfAbsent(from, k -> new HashMap<>())
                .computeIfAbsent(symbol, k -> new TreeSet<>());
        if (targets.add(to)) {
            recordTransition(new Transition(from, to, symbol));
        }
    }

    /**
     * @return read-only successor set, empty if undefined
     */
    public Set<String> nextStates(String state, String symbol) {
        Map<String, Set<String>> row = table.get(state);
        if (row == null) {
            return Collections.emptySet();
        }
        Set<String> targets = row.get(symbol);
        return targets == null ? Collections.emptySet() : Collections.unmodifiableSet(targets);
    }

    /**
     * Union of the symbol successors of every member of {@code states}.
     */
    public SortedSet<String> move(Collection<String> states, String symbol) {
        SortedSet<String> result = new TreeSet<>();
        for (String state : states) {
            result.addAll(nextStates(state, symbol));
        }
        return result;
    }

    /**
     * Set of states the run starts from; ε-closed for an ε-NFA.
     */
    protected SortedSet<String> initialSet() {
        SortedSet<String> initial = new TreeSet<>();
        initial.add(getStartState());
        return initial;
    }

    /**
     * Successor set after reading one symbol; ε-closed for an ε-NFA.
     */
    protected SortedSet<String> step(SortedSet<String> current, String symbol) {
        return move(current, symbol);
    }

    @Override
    public boolean accepts(String input) {
        if (getStartState() == null) {
            return false;
        }
        SortedSet<String> current = initialSet();
        for (int i = 0; i < input.length(); i++) {
            current = step(current, String.valueOf(input.charAt(i)));
            if (current.isEmpty()) {
                return false;
            }
        }
        return anyAccepting(current);
    }

    public List<NFAStep> stepTrace(String input) {
        List<NFAStep> steps = new ArrayList<>();
        if (getStartState() == null) {
            return steps;
        }
        SortedSet<String> current = initialSet();
        for (int i = 0; i < input.length(); i++) {
            String symbol = String.valueOf(input.charAt(i));
            SortedSet<String> next = step(current, symbol);
            steps.add(new NFAStep(Collections.unmodifiableSortedSet(current), symbol,
                    Collections.unmodifiableSortedSet(next)));
            if (next.isEmpty()) {
                break;
            }
            current = next;
        }
        return steps;
    }

    @Override
    public SimulationResult simulate(String input) {
        return SimulationResult.of(accepts(input), stepTrace(input));
    }

    @Override
    public Map<String, Map<String, SortedSet<String>>> transitionFunction() {
        Map<String, Map<String, SortedSet<String>>> result = new LinkedHashMap<>();
        for (Transition t : getTransitions()) {
            result.computeIfAbsent(t.from(), k -> new LinkedHashMap<>())
                    .computeIfAbsent(t.symbol(), k -> new TreeSet<>())
                    .add(t.to());
        }
        return result;
    }

    @Override
    public ValidationResult validate() {
        ValidationResult base = super.validate();
        return base.valid() ? ValidationResult.ok("Valid " + kind().getDisplayName()) : base;
    }
}
