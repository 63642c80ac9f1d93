package FSM.Model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

import FSM.Simulation.SimulationResult;
import FSM.Simulation.TransducerStep;
import FSM.Simulation.Verdict;

/**
 * Moore machine: every state carries an output, emitted when the state is entered.
 * A run emits the start state's output before consuming any symbol.
 */
public class MooreMachine extends Automaton {
    /** Emitted for a state that was never assigned an output. */
    public static final String NO_OUTPUT = "";

    private final Map<String, Map<String, String>> table = new HashMap<>();
    private final Map<String, String> stateOutputs = new HashMap<>();
    private final SortedSet<String> outputAlphabet = new TreeSet<>();

    @Override
    public AutomatonKind kind() {
        return AutomatonKind.MOORE;
    }

    public State addState(String name, String output) {
        State state = addState(name);
        if (output != null) {
            setOutput(name, output);
        }
        return state;
    }

    /**
     * @throws ValidationException if the state does not exist
     */
    public void setOutput(String state, String output) {
        requireState(state);
        stateOutputs.put(state, output);
        outputAlphabet.add(output);
    }

    /**
     * @return output of the state, or null if unassigned
     */
    public String getOutput(String state) {
        return stateOutputs.get(state);
    }

    public void addTransition(String from, String to, String symbol) {
        if (EPSILON.equals(symbol)) {
            throw new ValidationException("Moore transitions cannot be labelled " + EPSILON);
        }
        Map<String, String> row = table.computeIfAbsent(from, k -> new HashMap<>());
        if (row.containsKey(symbol)) {
            throw new ValidationException("Moore transition already exists: " + from + " --" + symbol + "--> "
                    + row.get(symbol));
        }
        row.put(symbol, to);
        recordTransition(new Transition(from, to, symbol));
    }

    public String nextState(String state, String symbol) {
        Map<String, String> row = table.get(state);
        return row == null ? null : row.get(symbol);
    }

    public SortedSet<String> getOutputAlphabet() {
        return Collections.unmodifiableSortedSet(outputAlphabet);
    }

    private String outputOf(String state) {
        return stateOutputs.getOrDefault(state, NO_OUTPUT);
    }

    public TransducerOutput process(String input) {
        List<String> outputs = new ArrayList<>();
        String current = getStartState();
        if (current == null) {
            return new TransducerOutput(false, outputs);
        }
        outputs.add(outputOf(current));
        for (int i = 0; i < input.length(); i++) {
            String next = nextState(current, String.valueOf(input.charAt(i)));
            if (next == null) {
                return new TransducerOutput(false, outputs);
            }
            current = next;
            outputs.add(outputOf(current));
        }
        return new TransducerOutput(true, outputs);
    }

    public List<TransducerStep> stepTrace(String input) {
        List<TransducerStep> steps = new ArrayList<>();
        String current = getStartState();
        if (current == null) {
            return steps;
        }
        for (int i = 0; i < input.length(); i++) {
            String symbol = String.valueOf(input.charAt(i));
            String next = nextState(current, symbol);
            if (next == null) {
                steps.add(new TransducerStep(current, symbol, TransducerStep.ERROR, TransducerStep.ERROR));
                break;
            }
            steps.add(new TransducerStep(current, symbol, next, outputOf(next)));
            current = next;
        }
        return steps;
    }

    @Override
    public boolean accepts(String input) {
        return process(input).success();
    }

    @Override
    public SimulationResult simulate(String input) {
        TransducerOutput output = process(input);
        return new SimulationResult(output.success() ? Verdict.ACCEPTED : Verdict.REJECTED,
                new ArrayList<>(stepTrace(input)), output.outputs());
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
     * Every state reachable from the start state must have an output.
     */
    @Override
    public ValidationResult validate() {
        ValidationResult base = super.validate();
        if (!base.valid()) {
            return base;
        }
        for (String state : reachableStates()) {
            if (!stateOutputs.containsKey(state)) {
                return ValidationResult.fail("State '" + state + "' has no output defined");
            }
        }
        return ValidationResult.ok("Valid Moore machine");
    }
}
