package FSM.Regex;

import java.util.Objects;

/**
 * Regex AST node. {@code symbol} is set for {@link Type#CHAR}; {@code left} is the operand of
 * {@link Type#STAR} and {@link Type#PLUS}; both children are set for the binary types.
 */
public record RegexNode(Type type, String symbol, RegexNode left, RegexNode right) {

    public enum Type { CHAR, EPSILON, CONCAT, OR, STAR, PLUS }

    public static RegexNode symbol(String symbol) {
        return new RegexNode(Type.CHAR, Objects.requireNonNull(symbol), null, null);
    }

    public static RegexNode epsilon() {
        return new RegexNode(Type.EPSILON, null, null, null);
    }

    public static RegexNode concat(RegexNode left, RegexNode right) {
        return new RegexNode(Type.CONCAT, null, left, right);
    }

    public static RegexNode or(RegexNode left, RegexNode right) {
        return new RegexNode(Type.OR, null, left, right);
    }

    public static RegexNode star(RegexNode operand) {
        return new RegexNode(Type.STAR, null, operand, null);
    }

    public static RegexNode plus(RegexNode operand) {
        return new RegexNode(Type.PLUS, null, operand, null);
    }

    public RegexNode operand() {
        return left;
    }

    /**
     * Fully parenthesised rendering, e.g. {@code ((a|b)*·a)}.
     */
    @Override
    public String toString() {
        return switch (type) {
            case CHAR -> symbol;
            case EPSILON -> "ε";
            case CONCAT -> "(" + left + "·" + right + ")";
            case OR -> "(" + left + "|" + right + ")";
            case STAR -> left + "*";
            case PLUS -> left + "+";
        };
    }
}
