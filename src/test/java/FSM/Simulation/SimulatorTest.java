package FSM.Simulation;

import java.util.List;
import java.util.Set;

import FSM.Model.Automaton;
import FSM.Model.DFA;
import FSM.Model.EpsilonNFA;
import FSM.Model.MealyMachine;
import FSM.Model.MooreMachine;
import FSM.Model.NFA;
import FSM.ThompsonBuilder;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class SimulatorTest {

  private static DFA abDFA() {
    DFA dfa = new DFA();
    dfa.addState("s", false, true);
    dfa.addState("t");
    dfa.addState("u", true, false);
    dfa.addTransition("s", "t", "a");
    dfa.addTransition("t", "u", "b");
    return dfa;
  }

  @Test
  void testDFA() {
    DFA dfa = abDFA();
    SimulationResult result = Simulator.simulate(dfa, "ab");
    Assertions.assertTrue(result.accepted());
    Assertions.assertNull(result.finalOutput());
    Assertions.assertEquals(List.of(new DFAStep("s", "a", "t"), new DFAStep("t", "b", "u")), result.trace());
    Assertions.assertEquals("s --a--> t", result.trace().get(0).describe());

    result = Simulator.simulate(dfa, "aab");
    Assertions.assertEquals(Verdict.REJECTED, result.verdict());
    Assertions.assertEquals(2, result.trace().size());
    Assertions.assertTrue(((DFAStep) result.trace().get(1)).rejected());

    result = Simulator.simulate(dfa, "");
    Assertions.assertFalse(result.accepted());
    Assertions.assertTrue(result.trace().isEmpty());

    // symbol outside the alphabet
    Assertions.assertFalse(dfa.accepts("ax"));
  }

  @Test
  void testEpsilonNFATraceIsClosed() {
    EpsilonNFA enfa = ThompsonBuilder.buildEpsilonNFA("a*b");
    SimulationResult result = Simulator.simulate(enfa, "aab");
    Assertions.assertTrue(result.accepted());
    Assertions.assertEquals(3, result.trace().size());
    for (Step step : result.trace()) {
      NFAStep nfaStep = (NFAStep) step;
      Assertions.assertEquals(nfaStep.current(), enfa.epsilonClosure(nfaStep.current()));
      Assertions.assertEquals(nfaStep.next(), enfa.epsilonClosure(nfaStep.next()));
    }
    NFAStep last = (NFAStep) result.trace().get(2);
    Assertions.assertTrue(enfa.anyAccepting(last.next()));

    // trace stops at the first empty set
    result = Simulator.simulate(enfa, "bab");
    Assertions.assertFalse(result.accepted());
    Assertions.assertEquals(2, result.trace().size());
    Assertions.assertTrue(((NFAStep) result.trace().get(1)).next().isEmpty());
    Assertions.assertTrue(result.trace().get(1).describe().endsWith("∅"));
  }

  @Test
  void testNFA() {
    NFA nfa = new NFA();
    nfa.addState("p", false, true);
    nfa.addState("q", true, false);
    nfa.addTransition("p", "p", "0");
    nfa.addTransition("p", "p", "1");
    nfa.addTransition("p", "q", "1");

    SimulationResult result = Simulator.simulate(nfa, "01");
    Assertions.assertTrue(result.accepted());
    NFAStep step = (NFAStep) result.trace().get(1);
    Assertions.assertEquals(Set.of("p"), step.current());
    Assertions.assertEquals(Set.of("p", "q"), step.next());

    Assertions.assertFalse(Simulator.simulate(nfa, "10").accepted());
  }

  @Test
  void testMealy() {
    MealyMachine mealy = new MealyMachine();
    mealy.addState("even", false, true);
    mealy.addState("odd");
    mealy.addTransition("even", "odd", "1", "o");
    mealy.addTransition("odd", "even", "1", "e");
    mealy.addTransition("even", "even", "0", "e");
    mealy.addTransition("odd", "odd", "0", "o");

    SimulationResult result = Simulator.simulate(mealy, "1101");
    Assertions.assertTrue(result.accepted());
    Assertions.assertEquals(List.of("o", "e", "e", "o"), result.finalOutput());
    Assertions.assertEquals(4, result.trace().size());

    // undefined symbol: partial output and an error step
    result = Simulator.simulate(mealy, "12");
    Assertions.assertFalse(result.accepted());
    Assertions.assertEquals(List.of("o"), result.finalOutput());
    TransducerStep last = (TransducerStep) result.trace().get(1);
    Assertions.assertTrue(last.failed());
    Assertions.assertEquals(TransducerStep.ERROR, last.output());
  }

  @Test
  void testMoore() {
    MooreMachine moore = new MooreMachine();
    moore.addState("off", "0");
    moore.addState("on", "1");
    moore.setStartState("off");
    moore.addTransition("off", "on", "t");
    moore.addTransition("on", "off", "t");

    SimulationResult result = Simulator.simulate(moore, "tt");
    Assertions.assertTrue(result.accepted());
    Assertions.assertEquals(List.of("0", "1", "0"), result.finalOutput());
    Assertions.assertEquals(new TransducerStep("off", "t", "on", "1"), result.trace().get(0));

    result = Simulator.simulate(moore, "");
    Assertions.assertEquals(List.of("0"), result.finalOutput());

    result = Simulator.simulate(moore, "tx");
    Assertions.assertFalse(result.accepted());
    Assertions.assertEquals(List.of("0", "1"), result.finalOutput());
  }

  @Test
  void testNoStartState() {
    List<Automaton> automata = List.of(new DFA(), new NFA(), new EpsilonNFA(), new MealyMachine(), new MooreMachine());
    for (Automaton automaton : automata) {
      automaton.addState("s");
      SimulationResult result = Simulator.simulate(automaton, "a");
      Assertions.assertFalse(result.accepted(), automaton.kind().getDisplayName());
      Assertions.assertTrue(result.trace().isEmpty(), automaton.kind().getDisplayName());
    }
  }
}
