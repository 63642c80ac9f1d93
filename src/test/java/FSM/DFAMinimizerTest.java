package FSM;

import java.util.List;
import java.util.Set;

import FSM.Model.DFA;
import FSM.Model.NFA;
import FSM.Model.ValidationException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class DFAMinimizerTest {

  /**
   * q3 and q4 are both accepting sinks over {0,1}.
   */
  private static DFA twoSinkDFA() {
    DFA dfa = new DFA();
    dfa.addState("q0", false, true);
    dfa.addState("q1");
    dfa.addState("q2");
    dfa.addState("q3", true, false);
    dfa.addState("q4", true, false);
    dfa.addTransition("q0", "q1", "0");
    dfa.addTransition("q0", "q2", "1");
    dfa.addTransition("q1", "q3", "0");
    dfa.addTransition("q1", "q2", "1");
    dfa.addTransition("q2", "q1", "0");
    dfa.addTransition("q2", "q4", "1");
    for (String sink : List.of("q3", "q4")) {
      dfa.addTransition(sink, sink, "0");
      dfa.addTransition(sink, sink, "1");
    }
    return dfa;
  }

  @Test
  void testEquivalentSinksCollapse() {
    DFA dfa = twoSinkDFA();
    DFA min = DFAMinimizer.minimize(dfa);
    Assertions.assertEquals(4, min.size());
    Assertions.assertTrue(min.size() < dfa.size());
    Assertions.assertEquals("q0", min.getStartState());
    Assertions.assertEquals(Set.of("q3"), min.getAcceptStates());
    Assertions.assertFalse(min.hasState("q4"));
    Assertions.assertEquals("q3", min.nextState("q2", "1"));
    Assertions.assertTrue(min.isComplete());

    for (String word : List.of("00", "01", "10", "11", "000", "101")) {
      Assertions.assertEquals(dfa.accepts(word), min.accepts(word), word);
    }
    // input untouched
    Assertions.assertEquals(5, dfa.size());
  }

  @Test
  void testIdempotent() {
    DFA min = DFAMinimizer.minimize(twoSinkDFA());
    DFA min2 = DFAMinimizer.minimize(min);
    Assertions.assertEquals(min.size(), min2.size());
    Assertions.assertEquals(min.getTransitionCount(), min2.getTransitionCount());
  }

  @Test
  void testNeverGrows() {
    for (String regex : List.of("(a|b)*abb", "a*", "a", "(a|b)*", "ab|ac", "(aa|ab)*b+", "ε")) {
      DFA dfa = SubsetConstruction.determinize(
          SubsetConstruction.eliminateEpsilons(ThompsonBuilder.buildEpsilonNFA(regex)));
      DFA min = DFAMinimizer.minimize(dfa);
      Assertions.assertTrue(min.size() <= dfa.size(), regex);
      Assertions.assertEquals(min.size(), DFAMinimizer.minimize(min).size(), regex);
    }
  }

  @Test
  void testKnownMinimalSizes() {
    Assertions.assertEquals(4, minimalSize("(a|b)*abb"));
    Assertions.assertEquals(1, minimalSize("(a|b)*"));
    Assertions.assertEquals(1, minimalSize("a*"));
    // a then accept; the rejecting sink is never materialized
    Assertions.assertEquals(2, minimalSize("a"));
    Assertions.assertEquals(3, minimalSize("ab|ac"));
  }

  private static int minimalSize(String regex) {
    return DFAMinimizer.minimize(SubsetConstruction.determinize(
        SubsetConstruction.eliminateEpsilons(ThompsonBuilder.buildEpsilonNFA(regex)))).size();
  }

  @Test
  void testUnreachableStatesDropped() {
    DFA dfa = twoSinkDFA();
    dfa.addState("z", true, false);
    dfa.addTransition("z", "q0", "0");
    DFA min = DFAMinimizer.minimize(dfa);
    Assertions.assertFalse(min.hasState("z"));
    Assertions.assertEquals(4, min.size());
  }

  @Test
  void testUndefinedTransitionDiffersFromDeadState() {
    DFA dfa = new DFA();
    dfa.addState("p", false, true);
    dfa.addState("u");
    dfa.addState("d");
    dfa.addTransition("p", "u", "a");
    dfa.addTransition("p", "d", "b");
    dfa.addTransition("d", "d", "a");
    dfa.addTransition("d", "d", "b");

    DFA min = DFAMinimizer.minimize(dfa);
    // all three reject everything, but u has no successors while d loops: they stay apart
    Assertions.assertEquals(3, min.size());
    Assertions.assertEquals(Set.of("p", "u", "d"), min.getStates().keySet());
    Assertions.assertTrue(min.getAcceptStates().isEmpty());
    Assertions.assertEquals("d", min.nextState("p", "b"));
    Assertions.assertNull(min.nextState("u", "a"));
  }

  @Test
  void testErrors() {
    NFA nfa = new NFA();
    nfa.addState("s", true, true);
    Assertions.assertThrows(ConversionException.class, () -> DFAMinimizer.minimize(nfa));

    DFA noStart = new DFA();
    noStart.addState("s");
    Assertions.assertThrows(ValidationException.class, () -> DFAMinimizer.minimize(noStart));
  }
}
