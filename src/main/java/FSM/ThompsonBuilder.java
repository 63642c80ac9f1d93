package FSM;

import FSM.Model.Automaton;
import FSM.Model.EpsilonNFA;
import FSM.Regex.RegexNode;
import FSM.Regex.RegexParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thompson's construction: regex AST to ε-NFA by fragment composition.
 * Each builder owns its state counter and its output automaton, and is used for a single build.
 */
public class ThompsonBuilder {
    private static final Logger LOG = LoggerFactory.getLogger(ThompsonBuilder.class);

    private final EpsilonNFA nfa = new EpsilonNFA();
    private int nextId = 0;

    private ThompsonBuilder() {}

    /**
     * Partial automaton with one entry and one exit state.
     */
    private record Fragment(String start, String accept) { }

    public static EpsilonNFA buildEpsilonNFA(String regex) {
        return buildEpsilonNFA(RegexParser.parse(regex));
    }

    /**
     * @return an ε-NFA with exactly one start state and exactly one accept state
     */
    public static EpsilonNFA buildEpsilonNFA(RegexNode ast) {
        ThompsonBuilder builder = new ThompsonBuilder();
        Fragment fragment = builder.build(ast);
        builder.nfa.setStartState(fragment.start());
        LOG.debug("Thompson ε-NFA for {}: {} states, {} transitions", ast, builder.nfa.size(),
                builder.nfa.getTransitionCount());
        return builder.nfa;
    }

    private String newState(boolean accepting) {
        nextId++;
        String name = "q" + nextId;
        nfa.addState(name, accepting, false);
        return name;
    }

    private Fragment build(RegexNode node) {
        return switch (node.type()) {
            case CHAR -> single(node.symbol());
            case EPSILON -> single(Automaton.EPSILON);
            case CONCAT -> concat(node);
            case OR -> or(node);
            case STAR -> repeat(node.operand(), true);
            case PLUS -> repeat(node.operand(), false);
        };
    }

    private Fragment single(String symbol) {
        String start = newState(false);
        String accept = newState(true);
        nfa.addTransition(start, accept, symbol);
        return new Fragment(start, accept);
    }

    private Fragment concat(RegexNode node) {
        Fragment left = build(node.left());
        Fragment right = build(node.right());
        nfa.setAccepting(left.accept(), false);
        nfa.addEpsilonTransition(left.accept(), right.start());
        return new Fragment(left.start(), right.accept());
    }

    private Fragment or(RegexNode node) {
        Fragment left = build(node.left());
        Fragment right = build(node.right());
        String start = newState(false);
        String accept = newState(true);
        nfa.setAccepting(left.accept(), false);
        nfa.setAccepting(right.accept(), false);
        nfa.addEpsilonTransition(start, left.start());
        nfa.addEpsilonTransition(start, right.start());
        nfa.addEpsilonTransition(left.accept(), accept);
        nfa.addEpsilonTransition(right.accept(), accept);
        return new Fragment(start, accept);
    }

    /**
     * Kleene star, or with {@code allowSkip} false the one-or-more variant: X+ = X X*.
     */
    private Fragment repeat(RegexNode operand, boolean allowSkip) {
        Fragment inner = build(operand);
        String start = newState(false);
        String accept = newState(true);
        nfa.setAccepting(inner.accept(), false);
        nfa.addEpsilonTransition(start, inner.start());
        if (allowSkip) {
            nfa.addEpsilonTransition(start, accept);
        }
        nfa.addEpsilonTransition(inner.accept(), inner.start());
        nfa.addEpsilonTransition(inner.accept(), accept);
        return new Fragment(start, accept);
    }
}
