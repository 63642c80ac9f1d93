package FSM.Registry;

import java.util.BitSet;

import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

public class SubsetRegistry implements Registry {
    private final Object2IntMap<BitSet> subset2State;
    private final Int2ObjectMap<BitSet> state2Subset;

    public SubsetRegistry() {
        this.subset2State = new Object2IntOpenHashMap<>();
        this.subset2State.defaultReturnValue(MISSING_ELEMENT); // if missing, return MISSING_ELEMENT
        this.state2Subset = new Int2ObjectOpenHashMap<>();
    }

    @Override
    public int get(BitSet subset) {
        return subset2State.getInt(subset);
    }

    @Override
    public void put(BitSet subset, int stateID) {
        if (subset2State.containsKey(subset)) {
            throw new IllegalStateException("Subset " + subset + " already registered as " + subset2State.getInt(subset));
        }
        subset2State.put(subset, stateID);
        state2Subset.put(stateID, subset);
    }

    @Override
    public int size() {
        return subset2State.size();
    }

    @Override
    public BitSet subsetOf(int stateID) {
        return state2Subset.get(stateID);
    }

    @Override
    public String toString() {
        return "SubsetRegistry[" + subset2State.size() + "]";
    }
}
