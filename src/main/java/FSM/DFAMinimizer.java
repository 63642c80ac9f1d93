package FSM;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import FSM.Model.Automaton;
import FSM.Model.AutomatonKind;
import FSM.Model.DFA;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * DFA minimization by iterated partition refinement (Moore's algorithm).
 * <p>
 * Each pass recomputes, for every member of every block, the tuple of blocks its symbol-successors fall
 * into, and splits blocks by that signature. Passes repeat until one splits nothing, which takes at most
 * as many passes as there are states.
 */
public class DFAMinimizer {
    private static final Logger LOG = LoggerFactory.getLogger(DFAMinimizer.class);
    /** Signature entry for an undefined transition. */
    private static final int NO_SUCCESSOR = -1;

    private DFAMinimizer() {}

    /**
     * @throws ConversionException unless the automaton is a DFA
     */
    public static DFA minimize(Automaton automaton) {
        if (automaton.kind() != AutomatonKind.DFA) {
            throw new ConversionException("minimize", AutomatonKind.DFA, automaton.kind());
        }
        return doMinimize((DFA) automaton);
    }

    public static DFA minimize(DFA dfa) {
        return minimize((Automaton) dfa);
    }

    private static DFA doMinimize(DFA dfa) {
        dfa.requireValid();
        final List<String> symbols = new ArrayList<>(dfa.getAlphabet());
        final int numInputs = symbols.size();

        // Unreachable states would take part in the refinement; index only the reachable ones.
        final List<String> reachable = new ArrayList<>();
        final Object2IntMap<String> ids = new Object2IntOpenHashMap<>();
        ids.defaultReturnValue(NO_SUCCESSOR);
        Deque<String> queue = new ArrayDeque<>();
        ids.put(dfa.getStartState(), 0);
        reachable.add(dfa.getStartState());
        queue.add(dfa.getStartState());
        while (!queue.isEmpty()) {
            String state = queue.poll();
            for (String symbol : symbols) {
                String next = dfa.nextState(state, symbol);
                if (next != null && ids.getInt(next) == NO_SUCCESSOR) {
                    ids.put(next, reachable.size());
                    reachable.add(next);
                    queue.add(next);
                }
            }
        }

        final int numStates = reachable.size();
        final int[][] succ = new int[numStates][numInputs];
        for (int s = 0; s < numStates; s++) {
            for (int j = 0; j < numInputs; j++) {
                String next = dfa.nextState(reachable.get(s), symbols.get(j));
                succ[s][j] = next == null ? NO_SUCCESSOR : ids.getInt(next);
            }
        }

        List<IntList> blocks = initialPartition(dfa, reachable);
        final int[] blockOf = new int[numStates];
        int passes = 0;
        boolean split = true;
        while (split) {
            split = false;
            passes++;
            assignBlocks(blocks, blockOf);
            List<IntList> refined = new ArrayList<>(blocks.size());
            for (IntList block : blocks) {
                if (block.size() == 1) {
                    refined.add(block);
                    continue;
                }
                // LinkedHashMap keeps sub-blocks in order of their first member
                Map<IntList, IntList> bySignature = new LinkedHashMap<>();
                for (int m = 0; m < block.size(); m++) {
                    int s = block.getInt(m);
                    IntList signature = new IntArrayList(numInputs);
                    for (int j = 0; j < numInputs; j++) {
                        signature.add(succ[s][j] == NO_SUCCESSOR ? NO_SUCCESSOR : blockOf[succ[s][j]]);
                    }
                    bySignature.computeIfAbsent(signature, k -> new IntArrayList()).add(s);
                }
                if (bySignature.size() > 1) {
                    split = true;
                }
                refined.addAll(bySignature.values());
            }
            blocks = refined;
        }
        assignBlocks(blocks, blockOf);

        DFA out = buildQuotient(dfa, symbols, reachable, succ, blocks, blockOf);
        LOG.debug("Minimization: {} states ({} reachable) -> {} states in {} passes", dfa.size(), numStates,
                out.size(), passes);
        return out;
    }

    /**
     * Accepting block first, then non-accepting; an empty block is omitted.
     */
    private static List<IntList> initialPartition(DFA dfa, List<String> reachable) {
        IntList accepting = new IntArrayList();
        IntList rejecting = new IntArrayList();
        for (int s = 0; s < reachable.size(); s++) {
            (dfa.isAccepting(reachable.get(s)) ? accepting : rejecting).add(s);
        }
        List<IntList> blocks = new ArrayList<>(2);
        if (!accepting.isEmpty()) {
            blocks.add(accepting);
        }
        if (!rejecting.isEmpty()) {
            blocks.add(rejecting);
        }
        return blocks;
    }

    private static void assignBlocks(List<IntList> blocks, int[] blockOf) {
        for (int b = 0; b < blocks.size(); b++) {
            IntList block = blocks.get(b);
            for (int m = 0; m < block.size(); m++) {
                blockOf[block.getInt(m)] = b;
            }
        }
    }

    /**
     * One state per block, named after the block's first member. Members of a block agree on
     * acceptance and on the successor block of every symbol, so the representative speaks for all.
     */
    private static DFA buildQuotient(DFA dfa, List<String> symbols, List<String> reachable, int[][] succ,
                                     List<IntList> blocks, int[] blockOf) {
        DFA out = new DFA();
        for (String symbol : symbols) {
            out.addSymbol(symbol);
        }
        final int startBlock = blockOf[0];
        for (int b = 0; b < blocks.size(); b++) {
            String rep = reachable.get(blocks.get(b).getInt(0));
            out.addState(rep, dfa.isAccepting(rep), b == startBlock);
        }
        for (IntList block : blocks) {
            int rep = block.getInt(0);
            for (int j = 0; j < symbols.size(); j++) {
                if (succ[rep][j] != NO_SUCCESSOR) {
                    String target = reachable.get(blocks.get(blockOf[succ[rep][j]]).getInt(0));
                    out.addTransition(reachable.get(rep), target, symbols.get(j));
                }
            }
        }
        return out;
    }
}
