package FSM;

import FSM.Model.Automaton;
import FSM.Model.AutomatonException;
import FSM.Model.DFA;
import FSM.Model.EpsilonNFA;
import FSM.Model.NFA;
import FSM.Simulation.SimulationResult;
import FSM.Simulation.Simulator;
import FSM.Simulation.Step;
import ch.qos.logback.classic.Level;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.automaton.fsa.impl.CompactNFA;
import net.automatalib.util.automaton.Automata;
import net.automatalib.util.automaton.fsa.NFAs;
import net.automatalib.util.automaton.minimizer.HopcroftMinimizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

public class FSMCommandLine {
  private static final List<String> STAGES = List.of("enfa", "nfa", "dfa", "min");

  public static void main(String[] args) {
    boolean verify = false;
    boolean trace = false;
    List<String> positional = new ArrayList<>();

    for (String arg : args) {
      if ("--debug".equalsIgnoreCase(arg)) {
        enableDebugLogging();
      } else if ("--verify".equalsIgnoreCase(arg)) {
        verify = true;
      } else if ("--trace".equalsIgnoreCase(arg)) {
        trace = true;
      } else if (arg.startsWith("--")) {
        // Unknown flag
        printUsageAndExit();
      } else {
        positional.add(arg);
      }
    }

    if (positional.size() < 2 || !STAGES.contains(positional.get(0).toLowerCase())) {
      printUsageAndExit();
    }

    String stage = positional.get(0);
    String regex = positional.get(1);
    List<String> inputs = positional.subList(2, positional.size());

    try {
      long before = System.currentTimeMillis();
      Automaton automaton = runPipeline(stage, regex, verify);
      long after = System.currentTimeMillis();
      System.out.println("Pipeline duration: " + ((after - before) / 1000f) + "s");
      for (String input : inputs) {
        printSimulation(automaton, input, trace);
      }
    } catch (AutomatonException e) {
      System.err.println("Error: " + e.getMessage());
      System.exit(1);
    }
  }

  private static void printUsageAndExit() {
    System.out.println("FSM [--debug] [--verify] [--trace] <stage> <regex> [input ...]");
    System.out.println("[--debug] : Debug logging of every algorithm step");
    System.out.println("[--verify] : Cross-check the minimized DFA against AutomataLib's determinizer and minimizer");
    System.out.println("[--trace] : Print the step trace of every input");
    System.out.println();
    System.out.println("<stage> : automaton to simulate the inputs on, one of:");
    System.out.println("  enfa: Thompson ε-NFA.");
    System.out.println("  nfa: NFA after ε-elimination.");
    System.out.println("  dfa: DFA from subset construction.");
    System.out.println("  min: minimized DFA.");
    System.out.println();
    System.out.println("<regex> : symbols, '|', '*', '+', parentheses, and 'ε' or '\\e' for the empty word.");
    System.exit(0);
  }

  private static void enableDebugLogging() {
    Logger root = LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
    if (root instanceof ch.qos.logback.classic.Logger) {
      ((ch.qos.logback.classic.Logger) root).setLevel(Level.DEBUG);
    }
  }

  /**
   * Run regex -> ε-NFA -> NFA -> DFA -> minimal DFA, stopping at the requested stage.
   * @param stage - one of enfa, nfa, dfa, min
   * @param regex - regular expression
   * @param verify - whether to run all stages and check the minimal DFA against AutomataLib
   * @return automaton of the requested stage
   */
  static Automaton runPipeline(String stage, String regex, boolean verify) {
    String basicStage = stage.toLowerCase();
    if (!STAGES.contains(basicStage)) {
      throw new IllegalArgumentException("Unexpected stage choice: " + stage);
    }
    System.out.println("Regex: " + regex);

    final EpsilonNFA enfa = ThompsonBuilder.buildEpsilonNFA(regex);
    System.out.println("ε-NFA size: " + enfa.size() + " (" + enfa.getTransitionCount() + " transitions)");
    if (basicStage.equals("enfa") && !verify) {
      return enfa;
    }

    final NFA nfa = SubsetConstruction.eliminateEpsilons(enfa);
    System.out.println("NFA size: " + nfa.size() + " (" + nfa.getTransitionCount() + " transitions)");
    if (basicStage.equals("nfa") && !verify) {
      return nfa;
    }

    final DFA dfa = SubsetConstruction.determinize(nfa);
    System.out.println("DFA size: " + dfa.size());
    if (basicStage.equals("dfa") && !verify) {
      return dfa;
    }

    final DFA min = DFAMinimizer.minimize(dfa);
    System.out.println("Minimized DFA size: " + min.size());

    if (verify) {
      boolean equivalent = verify(nfa, min);
      System.out.println("AutomataLib equivalence check: " + (equivalent ? "passed" : "FAILED"));
      if (!equivalent) {
        throw new AutomatonException("Minimized DFA is not equivalent to AutomataLib's determinization of " + regex);
      }
    }

    return switch (basicStage) {
      case "enfa" -> enfa;
      case "nfa" -> nfa;
      case "dfa" -> dfa;
      default -> min;
    };
  }

  /**
   * Determinize and minimize the NFA with AutomataLib, and compare with our minimal DFA.
   * Both sides are completed with a sink first, so a partial and a total DFA compare by language.
   */
  static boolean verify(NFA nfa, DFA min) {
    final CompactNFA<String> compactNFA = CompactFormat.toCompactNFA(nfa);
    final Alphabet<String> alphabet = compactNFA.getInputAlphabet();
    final CompactDFA<String> reference =
        HopcroftMinimizer.minimizeDFA(NFAs.determinize(compactNFA, alphabet, false, false), alphabet);
    final CompactDFA<String> ours = CompactFormat.toCompactDFA(min);
    System.out.println("AutomataLib minimized DFA size: " + reference.size());
    completeWithSink(reference, alphabet);
    completeWithSink(ours, alphabet);
    return Automata.testEquivalence(reference, ours, alphabet);
  }

  /**
   * Route every undefined transition to a single rejecting sink, added only if needed.
   */
  private static void completeWithSink(CompactDFA<String> dfa, Alphabet<String> alphabet) {
    Integer sink = null;
    for (Integer state : new ArrayList<>(dfa.getStates())) {
      for (String symbol : alphabet) {
        if (dfa.getSuccessor(state, symbol) == null) {
          if (sink == null) {
            sink = dfa.addState(false);
            for (String s : alphabet) {
              dfa.setTransition(sink, s, sink);
            }
          }
          dfa.setTransition(state, symbol, sink);
        }
      }
    }
  }

  static SimulationResult printSimulation(Automaton automaton, String input, boolean trace) {
    SimulationResult result = Simulator.simulate(automaton, input);
    System.out.println("'" + input + "': " + result.verdict());
    if (trace) {
      for (Step step : result.trace()) {
        System.out.println("  " + step.describe());
      }
    }
    return result;
  }
}
