package FSM;

import java.util.BitSet;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

public class BitSetUtils {
    /**
     * Encode named states as a bitset over their indices.
     */
    public static BitSet toBitSet(Collection<String> names, Map<String, Integer> index) {
        BitSet result = new BitSet(index.size());
        for (String name : names) {
            result.set(index.get(name));
        }
        return result;
    }

    /**
     * Decode a bitset back into the named states, sorted.
     */
    public static SortedSet<String> toNames(BitSet bits, List<String> names) {
        SortedSet<String> result = new TreeSet<>();
        for (int i = bits.nextSetBit(0); i >= 0; i = bits.nextSetBit(i + 1)) {
            result.add(names.get(i));
        }
        return result;
    }
}
