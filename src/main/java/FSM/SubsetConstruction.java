package FSM;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

import FSM.Model.Automaton;
import FSM.Model.AutomatonKind;
import FSM.Model.DFA;
import FSM.Model.DeterminizeRecord;
import FSM.Model.EpsilonNFA;
import FSM.Model.NFA;
import FSM.Registry.Registry;
import FSM.Registry.SubsetRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * ε-elimination and powerset determinization. Neither mutates its input.
 */
public class SubsetConstruction {
    private static final Logger LOG = LoggerFactory.getLogger(SubsetConstruction.class);
    public static final String DFA_STATE_PREFIX = "q";

    private SubsetConstruction() {}

    public static SortedSet<String> epsilonClosure(EpsilonNFA nfa, Collection<String> states) {
        return nfa.epsilonClosure(states);
    }

    /**
     * @throws ConversionException unless the automaton is an ε-NFA
     */
    public static NFA eliminateEpsilons(Automaton automaton) {
        if (automaton.kind() != AutomatonKind.EPSILON_NFA) {
            throw new ConversionException("eliminateEpsilons", AutomatonKind.EPSILON_NFA, automaton.kind());
        }
        return eliminateEpsilons((EpsilonNFA) automaton);
    }

    /**
     * Remove ε-transitions, keeping every state name.
     * A state accepts iff its ε-closure meets the accept set; its successors on a symbol are the
     * ε-closure of the symbol moves out of its ε-closure.
     */
    public static NFA eliminateEpsilons(EpsilonNFA enfa) {
        enfa.requireValid();
        NFA out = new NFA();
        Map<String, SortedSet<String>> closures = new HashMap<>();
        for (String state : enfa.getStates().keySet()) {
            SortedSet<String> closure = enfa.epsilonClosure(Set.of(state));
            closures.put(state, closure);
            out.addState(state, enfa.anyAccepting(closure), state.equals(enfa.getStartState()));
        }
        for (String symbol : enfa.getAlphabet()) {
            out.addSymbol(symbol);
        }

        for (String state : enfa.getStates().keySet()) {
            SortedSet<String> closure = closures.get(state);
            for (String symbol : enfa.getAlphabet()) {
                SortedSet<String> moved = enfa.move(closure, symbol);
                if (moved.isEmpty()) {
                    continue;
                }
                for (String target : enfa.epsilonClosure(moved)) {
                    out.addTransition(state, target, symbol);
                }
            }
        }
        LOG.debug("ε-elimination: {} -> {} transitions over {} states", enfa.getTransitionCount(),
                out.getTransitionCount(), out.size());
        return out;
    }

    /**
     * @throws ConversionException unless the automaton is an NFA without ε-transitions
     */
    public static DFA determinize(Automaton automaton) {
        if (automaton.kind() != AutomatonKind.NFA) {
            throw new ConversionException("determinize", AutomatonKind.NFA, automaton.kind());
        }
        return doDeterminize((NFA) automaton);
    }

    public static DFA determinize(NFA nfa) {
        return determinize((Automaton) nfa);
    }

    /**
     * Breadth-first powerset construction from {start}. Subsets are keyed by a bitset over the NFA
     * states in sorted name order, so equal subsets meet the same registry entry whatever order they
     * are discovered in. Empty successor subsets produce no transition: the result may be partial.
     */
    private static DFA doDeterminize(NFA nfa) {
        nfa.requireValid();
        final List<String> names = new ArrayList<>(new TreeSet<>(nfa.getStates().keySet()));
        final Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < names.size(); i++) {
            index.put(names.get(i), i);
        }
        final BitSet accepting = BitSetUtils.toBitSet(nfa.getAcceptStates(), index);

        DFA out = new DFA();
        for (String symbol : nfa.getAlphabet()) {
            out.addSymbol(symbol);
        }
        Registry registry = new SubsetRegistry();
        Deque<DeterminizeRecord<BitSet>> queue = new ArrayDeque<>();

        BitSet init = BitSetUtils.toBitSet(List.of(nfa.getStartState()), index);
        out.addState(stateName(0), init.intersects(accepting), true);
        registry.put(init, 0);
        queue.add(new DeterminizeRecord<>(init, 0));

        while (!queue.isEmpty()) {
            DeterminizeRecord<BitSet> curr = queue.poll();
            BitSet inState = curr.inputState();
            String outState = stateName(curr.outputAddress());

            for (String symbol : nfa.getAlphabet()) {
                BitSet succ = new BitSet(names.size());
                for (int i = inState.nextSetBit(0); i >= 0; i = inState.nextSetBit(i + 1)) {
                    for (String target : nfa.nextStates(names.get(i), symbol)) {
                        succ.set(index.get(target));
                    }
                }
                if (succ.isEmpty()) {
                    continue;
                }
                int outSucc = registry.get(succ);
                if (outSucc == Registry.MISSING_ELEMENT) {
                    // add new state to DFA and to queue
                    outSucc = registry.size();
                    out.addState(stateName(outSucc), succ.intersects(accepting), false);
                    registry.put(succ, outSucc);
                    queue.add(new DeterminizeRecord<>(succ, outSucc));
                }
                out.addTransition(outState, stateName(outSucc), symbol);
            }
        }

        if (LOG.isDebugEnabled()) {
            for (int i = 0; i < registry.size(); i++) {
                LOG.debug("  {} = {}", stateName(i), BitSetUtils.toNames(registry.subsetOf(i), names));
            }
            LOG.debug("Subset construction: {} NFA states -> {} DFA states", nfa.size(), out.size());
        }
        return out;
    }

    private static String stateName(int id) {
        return DFA_STATE_PREFIX + id;
    }
}
