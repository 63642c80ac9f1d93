package FSM.Model;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import FSM.Simulation.DFAStep;
import FSM.Simulation.SimulationResult;

/**
 * Deterministic finite automaton with a possibly partial transition function.
 */
public class DFA extends Automaton {
    private final Map<String, Map<String, String>> table = new HashMap<>();

    @Override
    public AutomatonKind kind() {
        return AutomatonKind.DFA;
    }

    /**
     * @throws ValidationException if {@code (from, symbol)} already has a successor, or the symbol is epsilon
     */
    public void addTransition(String from, String to, String symbol) {
        if (EPSILON.equals(symbol)) {
            throw new ValidationException("DFA transitions cannot be labelled " + EPSILON);
        }
        Map<String, String> row = table.computeIfAbsent(from, k -> new HashMap<>());
        if (row.containsKey(symbol)) {
            throw new ValidationException("DFA transition already exists: " + from + " --" + symbol + "--> "
                    + row.get(symbol));
        }
        row.put(symbol, to);
        recordTransition(new Transition(from, to, symbol));
    }

    /**
     * @return successor, or null if undefined
     */
    public String nextState(String state, String symbol) {
        Map<String, String> row = table.get(state);
        return row == null ? null : row.get(symbol);
    }

    @Override
    public boolean accepts(String input) {
        String current = getStartState();
        if (current == null) {
            return false;
        }
        for (int i = 0; i < input.length(); i++) {
            current = nextState(current, String.valueOf(input.charAt(i)));
            if (current == null) {
                return false;
            }
        }
        return isAccepting(current);
    }

    public List<DFAStep> stepTrace(String input) {
        List<DFAStep> steps = new ArrayList<>();
        String current = getStartState();
        if (current == null) {
            return steps;
        }
        for (int i = 0; i < input.length(); i++) {
            String symbol = String.valueOf(input.charAt(i));
            String next = nextState(current, symbol);
            if (next == null) {
                steps.add(new DFAStep(current, symbol, DFAStep.REJECT));
                break;
            }
            steps.add(new DFAStep(current, symbol, next));
            current = next;
        }
        return steps;
    }

    @Override
    public SimulationResult simulate(String input) {
        return SimulationResult.of(accepts(input), stepTrace(input));
    }

    @Override
    public Map<String, Map<String, String>> transitionFunction() {
        Map<String, Map<String, String>> result = new LinkedHashMap<>();
        for (Transition t : getTransitions()) {
            result.computeIfAbsent(t.from(), k -> new LinkedHashMap<>()).put(t.symbol(), t.to());
        }
        return result;
    }

    /**
     * @return whether every state has a successor for every alphabet symbol
     */
    public boolean isComplete() {
        for (String state : getStates().keySet()) {
            for (String symbol : getAlphabet()) {
                if (nextState(state, symbol) == null) {
                    return false;
                }
            }
        }
        return true;
    }

    @Override
    public ValidationResult validate() {
        ValidationResult base = super.validate();
        if (!base.valid()) {
            return base;
        }
        Set<String> seen = new HashSet<>();
        for (Transition t : getTransitions()) {
            if (!seen.add(t.from() + '\u0000' + t.symbol())) {
                return ValidationResult.fail("Non-deterministic transition: " + t.from() + " --" + t.symbol() + "-->");
            }
        }
        return ValidationResult.ok("Valid DFA");
    }
}
