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
 * Mealy machine: every transition carries an output.
 */
public class MealyMachine extends Automaton {
    private final Map<String, Map<String, Edge>> table = new HashMap<>();
    private final SortedSet<String> outputAlphabet = new TreeSet<>();

    /** Successor and output of one Mealy transition. */
    public record Edge(String next, String output) {
        @Override
        public String toString() {
            return next + "/" + output;
        }
    }

    @Override
    public AutomatonKind kind() {
        return AutomatonKind.MEALY;
    }

    /**
     * @throws ValidationException always; Mealy transitions must carry an output
     */
    public void addTransition(String from, String to, String symbol) {
        throw new ValidationException("Mealy machine transitions must have an output: " + from + " --" + symbol + "-->");
    }

    public void addTransition(String from, String to, String symbol, String output) {
        if (output == null) {
            addTransition(from, to, symbol);
        }
        if (EPSILON.equals(symbol)) {
            throw new ValidationException("Mealy transitions cannot be labelled " + EPSILON);
        }
        Map<String, Edge> row = table.computeIfAbsent(from, k -> new HashMap<>());
        if (row.containsKey(symbol)) {
            throw new ValidationException("Mealy transition already exists: " + from + " --" + symbol + "--> "
                    + row.get(symbol));
        }
        row.put(symbol, new Edge(to, output));
        outputAlphabet.add(output);
        recordTransition(new Transition(from, to, symbol, output));
    }

    /**
     * @return successor and output, or null if undefined
     */
    public Edge nextEdge(String state, String symbol) {
        Map<String, Edge> row = table.get(state);
        return row == null ? null : row.get(symbol);
    }

    public SortedSet<String> getOutputAlphabet() {
        return Collections.unmodifiableSortedSet(outputAlphabet);
    }

    /**
     * Walk the machine, collecting one output per consumed symbol.
     * The walk stops at the first undefined transition and reports failure with the partial output.
     */
    public TransducerOutput process(String input) {
        List<String> outputs = new ArrayList<>();
        String current = getStartState();
        if (current == null) {
            return new TransducerOutput(false, outputs);
        }
        for (int i = 0; i < input.length(); i++) {
            Edge edge = nextEdge(current, String.valueOf(input.charAt(i)));
            if (edge == null) {
                return new TransducerOutput(false, outputs);
            }
            outputs.add(edge.output());
            current = edge.next();
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
            Edge edge = nextEdge(current, symbol);
            if (edge == null) {
                steps.add(new TransducerStep(current, symbol, TransducerStep.ERROR, TransducerStep.ERROR));
                break;
            }
            steps.add(new TransducerStep(current, symbol, edge.next(), edge.output()));
            current = edge.next();
        }
        return steps;
    }

    /**
     * A transducer "accepts" when every symbol has a defined transition.
     */
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
    public Map<String, Map<String, Edge>> transitionFunction() {
        Map<String, Map<String, Edge>> result = new LinkedHashMap<>();
        for (Transition t : getTransitions()) {
            result.computeIfAbsent(t.from(), k -> new LinkedHashMap<>()).put(t.symbol(), new Edge(t.to(), t.output()));
        }
        return result;
    }

    @Override
    public ValidationResult validate() {
        ValidationResult base = super.validate();
        if (!base.valid()) {
            return base;
        }
        for (Transition t : getTransitions()) {
            if (t.output() == null) {
                return ValidationResult.fail("Transition " + t + " has no output");
            }
        }
        return ValidationResult.ok("Valid Mealy machine");
    }
}
