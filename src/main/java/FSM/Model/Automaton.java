package FSM.Model;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.ArrayList;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

import FSM.Simulation.SimulationResult;

/**
 * Common state/transition bookkeeping of every automaton kind.
 * <p>
 * Automata are built through {@link #addState} and the per-kind {@code addTransition} calls, and are then
 * handed to algorithms which never mutate them. All collection getters return read-only views.
 */
public abstract class Automaton {
    /** Reserved symbol for transitions that consume no input. Never part of the public alphabet. */
    public static final String EPSILON = "ε";

    private final Map<String, State> states = new LinkedHashMap<>();
    private final SortedSet<String> alphabet = new TreeSet<>();
    private final Set<String> acceptStates = new LinkedHashSet<>();
    private final List<Transition> transitions = new ArrayList<>();
    private String startState;

    public abstract AutomatonKind kind();

    /**
     * Decide membership of the input, one character per symbol.
     */
    public abstract boolean accepts(String input);

    /**
     * Run the automaton on the input and record a step trace.
     */
    public abstract SimulationResult simulate(String input);

    /**
     * @return the transition index of this automaton, keyed by source state then symbol.
     */
    public abstract Map<String, ? extends Map<String, ?>> transitionFunction();

    public State addState(String name) {
        return addState(name, false, false);
    }

    public State addState(String name, boolean accepting, boolean start) {
        if (name == null || name.isEmpty()) {
            throw new ValidationException("State name must not be empty");
        }
        if (states.containsKey(name)) {
            throw new ValidationException("State '" + name + "' already defined");
        }
        if (start && startState != null) {
            // only one start state; demote the previous one
            states.computeIfPresent(startState, (k, s) -> s.withStart(false));
        }
        State state = new State(name, accepting, start);
        states.put(name, state);
        if (accepting) {
            acceptStates.add(name);
        }
        if (start) {
            startState = name;
        }
        return state;
    }

    public void setAccepting(String name, boolean accepting) {
        State state = requireState(name);
        states.put(name, state.withAccepting(accepting));
        if (accepting) {
            acceptStates.add(name);
        } else {
            acceptStates.remove(name);
        }
    }

    public void setStartState(String name) {
        State state = requireState(name);
        if (startState != null) {
            states.computeIfPresent(startState, (k, s) -> s.withStart(false));
        }
        states.put(name, state.withStart(true));
        startState = name;
    }

    /**
     * Declare an input symbol without adding a transition on it.
     */
    public void addSymbol(String symbol) {
        if (!EPSILON.equals(symbol)) {
            alphabet.add(symbol);
        }
    }

    /**
     * Record a transition in the generic transition list, registering its symbol in the alphabet.
     */
    protected void recordTransition(Transition transition) {
        addSymbol(transition.symbol());
        transitions.add(transition);
    }

    /**
     * Record a transition for rendering only, without touching the alphabet.
     */
    protected void recordLabel(Transition transition) {
        transitions.add(transition);
    }

    protected State requireState(String name) {
        State state = states.get(name);
        if (state == null) {
            throw new ValidationException("State '" + name + "' does not exist");
        }
        return state;
    }

    public Map<String, State> getStates() {
        return Collections.unmodifiableMap(states);
    }

    public State getState(String name) {
        return states.get(name);
    }

    public boolean hasState(String name) {
        return states.containsKey(name);
    }

    public SortedSet<String> getAlphabet() {
        return Collections.unmodifiableSortedSet(alphabet);
    }

    public String getStartState() {
        return startState;
    }

    public Set<String> getAcceptStates() {
        return Collections.unmodifiableSet(acceptStates);
    }

    public boolean isAccepting(String name) {
        return acceptStates.contains(name);
    }

    public boolean anyAccepting(Collection<String> names) {
        for (String name : names) {
            if (acceptStates.contains(name)) {
                return true;
            }
        }
        return false;
    }

    public List<Transition> getTransitions() {
        return Collections.unmodifiableList(transitions);
    }

    public int getStateCount() {
        return states.size();
    }

    public int getTransitionCount() {
        return transitions.size();
    }

    public int size() {
        return states.size();
    }

    /**
     * Structural checks shared by every kind. Subclasses call this first and add their own.
     */
    public ValidationResult validate() {
        if (states.isEmpty()) {
            return ValidationResult.fail("No states defined");
        }
        if (startState == null) {
            return ValidationResult.fail("No start state defined");
        }
        if (!states.containsKey(startState)) {
            return ValidationResult.fail("Start state '" + startState + "' not in states");
        }
        for (Transition t : transitions) {
            if (!states.containsKey(t.from())) {
                return ValidationResult.fail("Transition from undefined state '" + t.from() + "'");
            }
            if (!states.containsKey(t.to())) {
                return ValidationResult.fail("Transition to undefined state '" + t.to() + "'");
            }
        }
        return ValidationResult.ok("Valid");
    }

    /**
     * @throws ValidationException if {@link #validate()} fails
     */
    public void requireValid() {
        ValidationResult result = validate();
        if (!result.valid()) {
            throw new ValidationException(kind().getDisplayName() + ": " + result.message());
        }
    }

    /**
     * Forward reachability from the start state over the generic transition list.
     */
    public Set<String> reachableStates() {
        Set<String> reachable = new LinkedHashSet<>();
        if (startState == null) {
            return reachable;
        }
        Map<String, List<String>> successors = new HashMap<>();
        for (Transition t : transitions) {
            successors.computeIfAbsent(t.from(), k -> new ArrayList<>()).add(t.to());
        }
        Deque<String> stack = new ArrayDeque<>();
        stack.push(startState);
        while (!stack.isEmpty()) {
            String state = stack.pop();
            if (reachable.add(state)) {
                for (String next : successors.getOrDefault(state, List.of())) {
                    if (!reachable.contains(next)) {
                        stack.push(next);
                    }
                }
            }
        }
        return reachable;
    }

    @Override
    public String toString() {
        return kind().getDisplayName() + "[states=" + states.size() + ", transitions=" + transitions.size()
                + ", start=" + startState + ", accept=" + acceptStates + "]";
    }
}
