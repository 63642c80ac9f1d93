package FSM.Model;

import java.util.function.Predicate;

import net.automatalib.automaton.concept.FiniteRepresentation;

/**
 * Thresholds decide when an unbounded search must give up and report "undecided".
 * The tested representation is the current search frontier. Instances are stateful: use one per search.
 */
public interface Threshold extends Predicate<FiniteRepresentation> {
    int DEFAULT_STEP_LIMIT = 100_000;
    int DEFAULT_FRONTIER_LIMIT = 50_000;

    String getName();

    String getParam();

    /**
     * Default PDA search bound: explored configurations or queued configurations, whichever trips first.
     */
    static Threshold searchLimit() {
        return searchLimit(DEFAULT_STEP_LIMIT, DEFAULT_FRONTIER_LIMIT);
    }

    static Threshold searchLimit(int steps, int frontier) {
        return anyOf(maxSteps(steps), maxFrontier(frontier));
    }

    /**
     * maxSteps(steps): triggers on every call after the first {@code steps} calls; it does not rearm.
     * @param steps - steps before triggering
     */
    static Threshold maxSteps(int steps) {
        return new Threshold() {
            int step = 0;

            @Override
            public boolean test(FiniteRepresentation frontier) {
                step++;
                return step > steps;
            }

            @Override
            public String getName() {
                return "steps";
            }

            @Override
            public String getParam() {
                return String.valueOf(steps);
            }
        };
    }

    /**
     * maxFrontier(limit): triggers while the frontier holds more than {@code limit} elements.
     * @param limit - largest tolerated frontier
     */
    static Threshold maxFrontier(int limit) {
        return new Threshold() {
            @Override
            public boolean test(FiniteRepresentation frontier) {
                return frontier.size() > limit;
            }

            @Override
            public String getName() {
                return "frontier";
            }

            @Override
            public String getParam() {
                return String.valueOf(limit);
            }
        };
    }

    /**
     * Triggers when either threshold triggers. Both are tested on every call so each keeps counting.
     */
    static Threshold anyOf(Threshold first, Threshold second) {
        return new Threshold() {
            Threshold tripped = null;

            @Override
            public boolean test(FiniteRepresentation frontier) {
                boolean a = first.test(frontier);
                boolean b = second.test(frontier);
                if (a || b) {
                    tripped = a ? first : second;
                    return true;
                }
                return false;
            }

            @Override
            public String getName() {
                return tripped != null ? tripped.getName() : first.getName() + "|" + second.getName();
            }

            @Override
            public String getParam() {
                return tripped != null ? tripped.getParam() : first.getParam() + "|" + second.getParam();
            }
        };
    }

    /**
     * Never triggers. A search guarded by this threshold may not terminate.
     */
    static Threshold noop() {
        return new Threshold() {
            @Override
            public boolean test(FiniteRepresentation frontier) {
                return false;
            }

            @Override
            public String getName() {
                return "noop";
            }

            @Override
            public String getParam() {
                return "";
            }
        };
    }
}
