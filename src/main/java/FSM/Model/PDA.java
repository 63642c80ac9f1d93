package FSM.Model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

import FSM.Simulation.PDASearch;
import FSM.Simulation.PDAStep;
import FSM.Simulation.SearchOutcome;
import FSM.Simulation.SimulationLimitExceededException;
import FSM.Simulation.SimulationResult;
import FSM.Simulation.Verdict;

/**
 * Pushdown automaton accepting by final state with the input consumed.
 */
public class PDA extends Automaton {
    public static final String DEFAULT_START_STACK_SYMBOL = "Z";
    public static final int DEFAULT_MAX_TRACE_STEPS = 100;

    private final List<PDATransition> pdaTransitions = new ArrayList<>();
    private final SortedSet<String> stackAlphabet = new TreeSet<>();
    private String startStackSymbol = DEFAULT_START_STACK_SYMBOL;
    private int maxSearchSteps = Threshold.DEFAULT_STEP_LIMIT;
    private int maxFrontier = Threshold.DEFAULT_FRONTIER_LIMIT;
    private int maxTraceSteps = DEFAULT_MAX_TRACE_STEPS;

    @Override
    public AutomatonKind kind() {
        return AutomatonKind.PDA;
    }

    /**
     * @param input symbol to read, or {@link #EPSILON}
     * @param pop   required top of stack
     * @param push  symbols replacing the popped one, top first; empty to just pop
     */
    public void addTransition(String from, String to, String input, String pop, List<String> push) {
        if (pop == null || EPSILON.equals(pop)) {
            throw new ValidationException("PDA transition " + from + " --" + input + "--> " + to + " must pop a stack symbol");
        }
        PDATransition transition = new PDATransition(from, to, input, pop, push);
        stackAlphabet.add(pop);
        for (String symbol : transition.push()) {
            if (!EPSILON.equals(symbol)) {
                stackAlphabet.add(symbol);
            }
        }
        addSymbol(input);
        pdaTransitions.add(transition);
        recordLabel(new Transition(from, to, input + "," + pop, transition.pushLabel()));
    }

    /**
     * Transitions leaving {@code state} whose pop symbol is {@code stackTop} and whose input is ε or
     * {@code symbol}. {@code symbol} is null once the input is exhausted.
     */
    public List<PDATransition> applicableTransitions(String state, String symbol, String stackTop) {
        List<PDATransition> applicable = new ArrayList<>();
        if (stackTop == null) {
            return applicable;
        }
        for (PDATransition t : pdaTransitions) {
            if (t.from().equals(state) && t.pop().equals(stackTop)
                    && (t.isEpsilon() || t.input().equals(symbol))) {
                applicable.add(t);
            }
        }
        return applicable;
    }

    public PDAConfiguration initialConfiguration(String input) {
        return new PDAConfiguration(getStartState(), input, List.of(startStackSymbol));
    }

    public boolean isAccepting(PDAConfiguration configuration) {
        return isAccepting(configuration.state()) && configuration.remainingInput().isEmpty();
    }

    public SearchOutcome search(String input) {
        return PDASearch.search(this, input, Threshold.searchLimit(maxSearchSteps, maxFrontier));
    }

    /**
     * Existential acceptance: true if some run accepts.
     *
     * @throws SimulationLimitExceededException if the search bound is reached first
     */
    @Override
    public boolean accepts(String input) {
        if (getStartState() == null) {
            return false;
        }
        SearchOutcome outcome = search(input);
        if (outcome.verdict() == Verdict.UNDECIDED) {
            throw new SimulationLimitExceededException(outcome);
        }
        return outcome.verdict() == Verdict.ACCEPTED;
    }

    /**
     * One run, taking the first applicable transition at each step. Illustrative only; it may reject an
     * input that {@link #accepts} accepts.
     */
    public List<PDAStep> stepTrace(String input) {
        List<PDAStep> path = new ArrayList<>();
        if (getStartState() == null) {
            return path;
        }
        PDAConfiguration config = initialConfiguration(input);
        path.add(new PDAStep(config, null));
        for (int i = 0; i < maxTraceSteps; i++) {
            if (isAccepting(config)) {
                break;
            }
            List<PDATransition> transitions =
                    applicableTransitions(config.state(), config.nextSymbol(), config.stackTop());
            if (transitions.isEmpty()) {
                break;
            }
            PDATransition taken = transitions.get(0);
            config = config.apply(taken);
            path.add(new PDAStep(config, taken));
        }
        return path;
    }

    @Override
    public SimulationResult simulate(String input) {
        Verdict verdict = getStartState() == null ? Verdict.REJECTED : search(input).verdict();
        return new SimulationResult(verdict, new ArrayList<>(stepTrace(input)), null);
    }

    @Override
    public Map<String, Map<String, List<PDATransition>>> transitionFunction() {
        Map<String, Map<String, List<PDATransition>>> result = new LinkedHashMap<>();
        for (PDATransition t : pdaTransitions) {
            result.computeIfAbsent(t.from(), k -> new LinkedHashMap<>())
                    .computeIfAbsent(t.input(), k -> new ArrayList<>())
                    .add(t);
        }
        return result;
    }

    @Override
    public ValidationResult validate() {
        ValidationResult base = super.validate();
        if (!base.valid()) {
            return base;
        }
        if (startStackSymbol == null || startStackSymbol.isEmpty()) {
            return ValidationResult.fail("No start stack symbol defined");
        }
        return ValidationResult.ok("Valid PDA");
    }

    public List<PDATransition> getPDATransitions() {
        return Collections.unmodifiableList(pdaTransitions);
    }

    public SortedSet<String> getStackAlphabet() {
        return Collections.unmodifiableSortedSet(stackAlphabet);
    }

    public String getStartStackSymbol() {
        return startStackSymbol;
    }

    public void setStartStackSymbol(String startStackSymbol) {
        this.startStackSymbol = startStackSymbol;
    }

    public void setSearchLimits(int maxSearchSteps, int maxFrontier) {
        this.maxSearchSteps = maxSearchSteps;
        this.maxFrontier = maxFrontier;
    }

    public void setMaxTraceSteps(int maxTraceSteps) {
        this.maxTraceSteps = maxTraceSteps;
    }
}
