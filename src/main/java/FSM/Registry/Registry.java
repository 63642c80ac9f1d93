package FSM.Registry;

import java.util.BitSet;

/**
 * Interns subsets of NFA states as DFA state IDs during determinization.
 */
public interface Registry {
    int MISSING_ELEMENT = -1;

    /**
     * Get the DFA state ID registered for a subset.
     * @param subset canonical subset of NFA state indices
     * @return state ID or MISSING_ELEMENT if the subset has not been registered.
     */
    int get(BitSet subset);

    /**
     * Register a new subset with its (fixed) DFA state ID.
     * @param subset canonical subset of NFA state indices; must not be mutated afterwards
     * @param stateID state ID
     */
    void put(BitSet subset, int stateID);

    /**
     * @return number of registered subsets
     */
    int size();

    /**
     * @return the subset registered for a state ID, or null
     */
    BitSet subsetOf(int stateID);
}
