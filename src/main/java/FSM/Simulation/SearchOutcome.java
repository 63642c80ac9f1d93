package FSM.Simulation;

import FSM.Model.PDAConfiguration;

/**
 * Result of the breadth-first PDA acceptance search.
 *
 * @param verdict   accepted, rejected (configuration space exhausted) or undecided (bound reached)
 * @param explored  number of distinct configurations dequeued
 * @param witness   accepting configuration, or null
 * @param limit     name of the threshold that stopped the search, or null
 */
public record SearchOutcome(Verdict verdict, int explored, PDAConfiguration witness, String limit) {
}
