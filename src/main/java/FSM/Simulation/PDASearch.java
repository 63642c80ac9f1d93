package FSM.Simulation;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

import FSM.Model.PDA;
import FSM.Model.PDAConfiguration;
import FSM.Model.PDATransition;
import FSM.Model.Threshold;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Breadth-first exploration of the PDA configuration graph.
 */
public final class PDASearch {
    private static final Logger LOG = LoggerFactory.getLogger(PDASearch.class);

    private PDASearch() {}

    /**
     * Search for an accepting configuration reachable from the initial one.
     * Identical {@code (state, remaining input, stack)} configurations are visited once.
     * <p>
     * Push-only ε-cycles make the configuration space infinite, so the threshold is tested once per
     * explored configuration against the frontier while unexplored configurations remain; when it triggers the outcome is {@link Verdict#UNDECIDED}.
     *
     * @param pda - automaton with a start state
     * @param input - input word
     * @param threshold - search bound, fresh for this search
     * @return accepted as soon as one run accepts, rejected once the space is exhausted
     */
    public static SearchOutcome search(PDA pda, String input, Threshold threshold) {
        Deque<PDAConfiguration> queue = new ArrayDeque<>();
        Set<PDAConfiguration> visited = new HashSet<>();
        PDAConfiguration initial = pda.initialConfiguration(input);
        queue.add(initial);
        visited.add(initial);

        int explored = 0;
        while (!queue.isEmpty()) {
            PDAConfiguration config = queue.poll();
            explored++;

            if (pda.isAccepting(config)) {
                LOG.debug("Accepted '{}' at {} after {} configurations", input, config, explored);
                return new SearchOutcome(Verdict.ACCEPTED, explored, config, null);
            }

            for (PDATransition t : pda.applicableTransitions(config.state(), config.nextSymbol(), config.stackTop())) {
                PDAConfiguration next = config.apply(t);
                if (visited.add(next)) {
                    queue.add(next);
                }
            }

            // an empty queue means the space is exhausted, whatever the bound
            if (!queue.isEmpty() && threshold.test(queue::size)) {
                String limit = threshold.getName() + "=" + threshold.getParam();
                LOG.debug("Search on '{}' undecided: {} reached after {} configurations", input, limit, explored);
                return new SearchOutcome(Verdict.UNDECIDED, explored, null, limit);
            }
        }
        LOG.debug("Rejected '{}' after exhausting {} configurations", input, explored);
        return new SearchOutcome(Verdict.REJECTED, explored, null, null);
    }
}
