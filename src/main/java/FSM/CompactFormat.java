package FSM;

import java.util.ArrayList;
import java.util.List;

import FSM.Model.AutomatonKind;
import FSM.Model.DFA;
import FSM.Model.NFA;
import FSM.Model.Transition;
import FSM.Model.ValidationException;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.automaton.fsa.impl.CompactNFA;

/**
 * Conversion between the engine's named-state automata and AutomataLib's compact integer-state ones.
 * Compact state {@code i} is the {@code i}-th state in insertion order.
 */
public class CompactFormat {

    private CompactFormat() {}

    public static CompactDFA<String> toCompactDFA(DFA dfa) {
        dfa.requireValid();
        final Alphabet<String> alphabet = Alphabets.fromCollection(dfa.getAlphabet());
        CompactDFA<String> out = new CompactDFA<>(alphabet, dfa.size());
        Object2IntMap<String> ids = new Object2IntOpenHashMap<>();
        for (String name : dfa.getStates().keySet()) {
            Integer id = out.addState(dfa.isAccepting(name));
            ids.put(name, id.intValue());
        }
        out.setInitial(ids.getInt(dfa.getStartState()), true);
        for (Transition t : dfa.getTransitions()) {
            Integer from = ids.getInt(t.from());
            Integer to = ids.getInt(t.to());
            out.setTransition(from, t.symbol(), to);
        }
        return out;
    }

    /**
     * Export an NFA without ε-transitions.
     *
     * @throws ConversionException for an ε-NFA
     */
    public static CompactNFA<String> toCompactNFA(NFA nfa) {
        if (nfa.kind() != AutomatonKind.NFA) {
            throw new ConversionException("toCompactNFA", AutomatonKind.NFA, nfa.kind());
        }
        nfa.requireValid();
        final Alphabet<String> alphabet = Alphabets.fromCollection(nfa.getAlphabet());
        CompactNFA<String> out = new CompactNFA<>(alphabet, nfa.size());
        Object2IntMap<String> ids = new Object2IntOpenHashMap<>();
        for (String name : nfa.getStates().keySet()) {
            Integer id = out.addState(nfa.isAccepting(name));
            ids.put(name, id.intValue());
        }
        out.setInitial(ids.getInt(nfa.getStartState()), true);
        for (Transition t : nfa.getTransitions()) {
            Integer from = ids.getInt(t.from());
            Integer to = ids.getInt(t.to());
            out.addTransition(from, t.symbol(), to);
        }
        return out;
    }

    /**
     * Import a compact DFA, keeping only the states reachable from its initial state.
     * Compact state {@code i} becomes {@code q<i>}.
     *
     * @throws ValidationException if the compact DFA has no initial state
     */
    public static DFA fromCompactDFA(CompactDFA<String> compact) {
        Integer init = compact.getInitialState();
        if (init == null) {
            throw new ValidationException("Compact DFA has no initial state");
        }
        final Alphabet<String> alphabet = compact.getInputAlphabet();
        DFA out = new DFA();
        for (String symbol : alphabet) {
            out.addSymbol(symbol);
        }

        List<Integer> pending = new ArrayList<>();
        pending.add(init);
        out.addState(stateName(init), compact.isAccepting(init), true);
        for (int i = 0; i < pending.size(); i++) {
            Integer state = pending.get(i);
            for (String symbol : alphabet) {
                Integer succ = compact.getSuccessor(state, symbol);
                if (succ == null) {
                    continue;
                }
                if (!out.hasState(stateName(succ))) {
                    out.addState(stateName(succ), compact.isAccepting(succ), false);
                    pending.add(succ);
                }
                out.addTransition(stateName(state), stateName(succ), symbol);
            }
        }
        return out;
    }

    private static String stateName(int id) {
        return SubsetConstruction.DFA_STATE_PREFIX + id;
    }
}
