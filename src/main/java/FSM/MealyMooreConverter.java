package FSM;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import FSM.Model.Automaton;
import FSM.Model.AutomatonKind;
import FSM.Model.MealyMachine;
import FSM.Model.MooreMachine;
import FSM.Model.Transition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Conversions between output-on-transition (Mealy) and output-on-state (Moore) machines.
 */
public class MealyMooreConverter {
    private static final Logger LOG = LoggerFactory.getLogger(MealyMooreConverter.class);

    private MealyMooreConverter() {}

    /**
     * @throws ConversionException unless the automaton is a Mealy machine
     */
    public static MooreMachine mealyToMoore(Automaton automaton) {
        if (automaton.kind() != AutomatonKind.MEALY) {
            throw new ConversionException("mealyToMoore", AutomatonKind.MEALY, automaton.kind());
        }
        return doMealyToMoore((MealyMachine) automaton);
    }

    public static MooreMachine mealyToMoore(MealyMachine mealy) {
        return mealyToMoore((Automaton) mealy);
    }

    /**
     * Split every Mealy state {@code s} into one Moore state {@code s_o} per distinct output {@code o}
     * on its outgoing transitions; a state without outgoing transitions keeps its name and gets no output.
     * A name already taken by an earlier Moore state is primed ({@code A_x'}) until it is free.
     * <p>
     * Where a single state is needed for {@code s} (the start state, or the target of an edge) the
     * copy chosen is the one for the output of {@code s}'s first transition in sorted alphabet order.
     * A Mealy edge {@code s --a/o--> t} becomes an edge from {@code s_o} to that copy of {@code t}.
     * When {@code t} has several distinct outputs the choice is arbitrary and the Moore output
     * sequence can diverge from the Mealy one; this is a known limitation of the construction.
     */
    private static MooreMachine doMealyToMoore(MealyMachine mealy) {
        mealy.requireValid();
        MooreMachine moore = new MooreMachine();
        for (String symbol : mealy.getAlphabet()) {
            moore.addSymbol(symbol);
        }

        // (state, output) -> Moore state; null output for states without outgoing transitions
        Map<String, Map<String, String>> split = new LinkedHashMap<>();
        for (String state : mealy.getStates().keySet()) {
            Set<String> outputs = new LinkedHashSet<>();
            for (String symbol : mealy.getAlphabet()) {
                MealyMachine.Edge edge = mealy.nextEdge(state, symbol);
                if (edge != null) {
                    outputs.add(edge.output());
                }
            }
            Map<String, String> copies = new LinkedHashMap<>();
            if (outputs.isEmpty()) {
                String name = freshName(moore, state);
                moore.addState(name);
                copies.put(null, name);
            } else {
                for (String output : outputs) {
                    String name = freshName(moore, state + "_" + output);
                    moore.addState(name, output);
                    copies.put(output, name);
                }
            }
            split.put(state, copies);
        }

        String start = mealy.getStartState();
        moore.setStartState(split.get(start).get(firstOutput(mealy, start)));

        for (Transition t : mealy.getTransitions()) {
            String from = split.get(t.from()).get(t.output());
            String to = split.get(t.to()).get(firstOutput(mealy, t.to()));
            moore.addTransition(from, to, t.symbol());
        }
        LOG.debug("Mealy -> Moore: {} states -> {} states", mealy.size(), moore.size());
        return moore;
    }

    /**
     * @return base, primed until it names no existing Moore state
     */
    private static String freshName(MooreMachine moore, String base) {
        String name = base;
        while (moore.hasState(name)) {
            name += "'";
        }
        return name;
    }

    /**
     * @return output of the state's first defined transition in sorted alphabet order, or null
     */
    private static String firstOutput(MealyMachine mealy, String state) {
        for (String symbol : mealy.getAlphabet()) {
            MealyMachine.Edge edge = mealy.nextEdge(state, symbol);
            if (edge != null) {
                return edge.output();
            }
        }
        return null;
    }

    /**
     * @throws ConversionException unless the automaton is a Moore machine
     */
    public static MealyMachine mooreToMealy(Automaton automaton) {
        if (automaton.kind() != AutomatonKind.MOORE) {
            throw new ConversionException("mooreToMealy", AutomatonKind.MOORE, automaton.kind());
        }
        return doMooreToMealy((MooreMachine) automaton);
    }

    public static MealyMachine mooreToMealy(MooreMachine moore) {
        return mooreToMealy((Automaton) moore);
    }

    /**
     * Same states; the output of {@code s --a--> t} is the output stored on {@code t}.
     */
    private static MealyMachine doMooreToMealy(MooreMachine moore) {
        moore.requireValid();
        MealyMachine mealy = new MealyMachine();
        for (String symbol : moore.getAlphabet()) {
            mealy.addSymbol(symbol);
        }
        for (String state : moore.getStates().keySet()) {
            mealy.addState(state, moore.isAccepting(state), state.equals(moore.getStartState()));
        }
        for (Transition t : moore.getTransitions()) {
            mealy.addTransition(t.from(), t.to(), t.symbol(), moore.getOutput(t.to()));
        }
        LOG.debug("Moore -> Mealy: {} states, {} transitions", mealy.size(), mealy.getTransitionCount());
        return mealy;
    }
}
