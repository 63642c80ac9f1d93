package FSM;

import java.util.List;
import java.util.Set;

import FSM.Model.DFA;
import FSM.Model.MealyMachine;
import FSM.Model.MooreMachine;
import FSM.Model.TransducerOutput;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class MealyMooreConverterTest {
  private static final List<String> WORDS = List.of("", "0", "1", "01", "10", "0011", "1010", "111000");

  /**
   * Every state emits a single output on all its transitions: A emits x, B emits y.
   */
  private static MealyMachine unambiguousMealy() {
    MealyMachine mealy = new MealyMachine();
    mealy.addState("A", false, true);
    mealy.addState("B");
    mealy.addTransition("A", "B", "0", "x");
    mealy.addTransition("A", "A", "1", "x");
    mealy.addTransition("B", "A", "0", "y");
    mealy.addTransition("B", "B", "1", "y");
    return mealy;
  }

  @Test
  void testMealyToMooreSplitsByOutput() {
    MooreMachine moore = MealyMooreConverter.mealyToMoore(unambiguousMealy());
    Assertions.assertEquals(Set.of("A_x", "B_y"), moore.getStates().keySet());
    Assertions.assertEquals("A_x", moore.getStartState());
    Assertions.assertEquals("x", moore.getOutput("A_x"));
    Assertions.assertEquals("y", moore.getOutput("B_y"));
    Assertions.assertEquals("B_y", moore.nextState("A_x", "0"));
    Assertions.assertEquals("A_x", moore.nextState("B_y", "0"));
    Assertions.assertTrue(moore.validate().valid());
    Assertions.assertEquals(Set.of("0", "1"), moore.getAlphabet());
  }

  @Test
  void testMooreOutputLeadsMealyOutput() {
    // the Moore copy of a state emits that state's outgoing Mealy output on entry,
    // so its sequence is the Mealy sequence shifted one step ahead
    MealyMachine mealy = unambiguousMealy();
    MooreMachine moore = MealyMooreConverter.mealyToMoore(mealy);
    for (String word : WORDS) {
      TransducerOutput mealyOut = mealy.process(word);
      TransducerOutput mooreOut = moore.process(word);
      Assertions.assertTrue(mealyOut.success(), word);
      Assertions.assertTrue(mooreOut.success(), word);
      Assertions.assertEquals(word.length() + 1, mooreOut.outputs().size(), word);
      Assertions.assertEquals(mealyOut.outputs(), mooreOut.outputs().subList(0, word.length()), word);
    }
  }

  @Test
  void testMooreToMealyUsesTargetOutput() {
    MooreMachine moore = new MooreMachine();
    moore.addState("S0", "a");
    moore.addState("S1", "b");
    moore.setStartState("S0");
    moore.addTransition("S0", "S1", "x");
    moore.addTransition("S1", "S0", "x");

    MealyMachine mealy = MealyMooreConverter.mooreToMealy(moore);
    Assertions.assertEquals(Set.of("S0", "S1"), mealy.getStates().keySet());
    Assertions.assertEquals("S0", mealy.getStartState());
    Assertions.assertEquals(new MealyMachine.Edge("S1", "b"), mealy.nextEdge("S0", "x"));
    Assertions.assertEquals(new MealyMachine.Edge("S0", "a"), mealy.nextEdge("S1", "x"));

    for (String word : List.of("", "x", "xx", "xxx")) {
      List<String> mooreOut = moore.process(word).outputs();
      // Moore also emits the start output before reading anything
      Assertions.assertEquals(mooreOut.subList(1, mooreOut.size()), mealy.process(word).outputs(), word);
    }
  }

  @Test
  void testRoundTripWithConstantOutput() {
    MealyMachine mealy = new MealyMachine();
    mealy.addState("A", false, true);
    mealy.addState("B");
    mealy.addState("C");
    mealy.addTransition("A", "B", "0", "o");
    mealy.addTransition("A", "C", "1", "o");
    mealy.addTransition("B", "C", "0", "o");
    mealy.addTransition("B", "A", "1", "o");
    mealy.addTransition("C", "A", "0", "o");
    mealy.addTransition("C", "C", "1", "o");

    MealyMachine roundTrip = MealyMooreConverter.mooreToMealy(MealyMooreConverter.mealyToMoore(mealy));
    for (String word : WORDS) {
      Assertions.assertEquals(mealy.process(word), roundTrip.process(word), word);
    }
  }

  @Test
  void testAmbiguousStateResolvedByFirstSymbol() {
    // C emits p on 0 and q on 1; every edge into C lands on C_p, so the 1-edge out of C_q is only
    // reachable when the run starts there
    MealyMachine mealy = new MealyMachine();
    mealy.addState("C", false, true);
    mealy.addTransition("C", "C", "0", "p");
    mealy.addTransition("C", "C", "1", "q");

    MooreMachine moore = MealyMooreConverter.mealyToMoore(mealy);
    Assertions.assertEquals(Set.of("C_p", "C_q"), moore.getStates().keySet());
    Assertions.assertEquals("C_p", moore.getStartState());
    Assertions.assertEquals("C_p", moore.nextState("C_p", "0"));
    Assertions.assertEquals("C_p", moore.nextState("C_q", "1"));
    Assertions.assertNull(moore.nextState("C_p", "1"));

    Assertions.assertTrue(mealy.process("1").success());
    Assertions.assertFalse(moore.process("1").success());
  }

  @Test
  void testStateWithoutOutgoingTransitions() {
    MealyMachine mealy = new MealyMachine();
    mealy.addState("D", false, true);
    mealy.addState("E");
    mealy.addTransition("D", "E", "a", "o");

    MooreMachine moore = MealyMooreConverter.mealyToMoore(mealy);
    Assertions.assertEquals(Set.of("D_o", "E"), moore.getStates().keySet());
    Assertions.assertNull(moore.getOutput("E"));
    Assertions.assertEquals("E", moore.nextState("D_o", "a"));
    Assertions.assertFalse(moore.validate().valid());
  }

  @Test
  void testSplitNamesDoNotCollide() {
    MealyMachine mealy = new MealyMachine();
    mealy.addState("A", false, true);
    mealy.addState("A_x");
    mealy.addTransition("A", "A_x", "0", "x");
    Assertions.assertTrue(mealy.validate().valid());

    MooreMachine moore = MealyMooreConverter.mealyToMoore(mealy);
    Assertions.assertEquals(Set.of("A_x", "A_x'"), moore.getStates().keySet());
    Assertions.assertEquals("A_x", moore.getStartState());
    Assertions.assertEquals("x", moore.getOutput("A_x"));
    Assertions.assertNull(moore.getOutput("A_x'"));
    Assertions.assertEquals("A_x'", moore.nextState("A_x", "0"));

    // the bare name arrives first and keeps it
    mealy = new MealyMachine();
    mealy.addState("A_x");
    mealy.addState("A", false, true);
    mealy.addTransition("A", "A_x", "0", "x");
    moore = MealyMooreConverter.mealyToMoore(mealy);
    Assertions.assertEquals("A_x'", moore.getStartState());
    Assertions.assertEquals("A_x", moore.nextState("A_x'", "0"));
  }

  @Test
  void testWrongKind() {
    DFA dfa = new DFA();
    dfa.addState("s", true, true);
    Assertions.assertThrows(ConversionException.class, () -> MealyMooreConverter.mealyToMoore(dfa));
    Assertions.assertThrows(ConversionException.class, () -> MealyMooreConverter.mooreToMealy(dfa));
    Assertions.assertThrows(ConversionException.class,
        () -> MealyMooreConverter.mooreToMealy(unambiguousMealy()));
  }
}
