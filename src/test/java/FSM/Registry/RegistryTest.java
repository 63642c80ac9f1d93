package FSM.Registry;

import FSM.BitSetUtils;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.BitSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertThrows;

public class RegistryTest {
  private static final Map<String, Integer> INDEX = Map.of("p", 0, "q", 1, "r", 2, "s", 3);

  @Test
  void testSubsetRegistry() {
    SubsetRegistry registry = new SubsetRegistry();
    Assertions.assertEquals(Registry.MISSING_ELEMENT, registry.get(new BitSet()));
    Assertions.assertEquals(0, registry.size());

    BitSet b = BitSetUtils.toBitSet(List.of("q", "r", "s"), INDEX);
    registry.put(b, 1);
    Assertions.assertEquals(1, registry.get(b));

    // same subset, discovered in another order
    Assertions.assertEquals(1, registry.get(BitSetUtils.toBitSet(List.of("s", "q", "r"), INDEX)));

    b = BitSetUtils.toBitSet(List.of("q"), INDEX);
    registry.put(b, 0);
    Assertions.assertEquals(0, registry.get(b));
    Assertions.assertEquals(2, registry.size());
    Assertions.assertEquals(b, registry.subsetOf(0));
    Assertions.assertNull(registry.subsetOf(7));
    Assertions.assertEquals("SubsetRegistry[2]", registry.toString());

    assertThrows(IllegalStateException.class, () -> registry.put(BitSetUtils.toBitSet(List.of("q"), INDEX), 5));
  }

  @Test
  void testBitSetNames() {
    List<String> names = List.of("p", "q", "r", "s");
    BitSet b = BitSetUtils.toBitSet(Set.of("s", "p"), INDEX);
    Assertions.assertEquals(2, b.cardinality());
    Assertions.assertTrue(b.get(0));
    Assertions.assertTrue(b.get(3));
    Assertions.assertEquals(List.of("p", "s"), List.copyOf(BitSetUtils.toNames(b, names)));
    Assertions.assertTrue(BitSetUtils.toNames(new BitSet(), names).isEmpty());
  }
}
