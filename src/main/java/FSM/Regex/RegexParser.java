package FSM.Regex;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent regex parser with a single forward cursor.
 * <pre>
 *   OR     := CONCAT ('|' CONCAT)*
 *   CONCAT := STAR*                  (juxtaposition, left-associative; empty is ε)
 *   STAR   := BASE ('*' | '+')*
 *   BASE   := '(' OR ')' | 'ε' | '\e' | CHAR
 * </pre>
 * Whitespace is ignored. The grammar is LL(1), no backtracking.
 */
public class RegexParser {
    public static final char EPSILON_CHAR = 'ε';
    private static final String RESERVED = ")|*+";

    private final String regex;
    private int pos;

    private RegexParser(String regex) {
        StringBuilder stripped = new StringBuilder(regex.length());
        for (int i = 0; i < regex.length(); i++) {
            char c = regex.charAt(i);
            if (!Character.isWhitespace(c)) {
                stripped.append(c);
            }
        }
        this.regex = stripped.toString();
        this.pos = 0;
    }

    /**
     * @throws RegexSyntaxException on an unclosed or unmatched parenthesis, or an operator where an
     *         operand is expected
     */
    public static RegexNode parse(String regex) {
        RegexParser parser = new RegexParser(regex == null ? "" : regex);
        if (parser.regex.isEmpty()) {
            return RegexNode.epsilon();
        }
        RegexNode root = parser.parseOr();
        if (parser.peek() != 0) {
            throw new RegexSyntaxException("Unexpected '" + parser.peek() + "'", parser.pos);
        }
        return root;
    }

    private char peek() {
        return pos < regex.length() ? regex.charAt(pos) : 0;
    }

    private char consume() {
        return regex.charAt(pos++);
    }

    private boolean atEnd() {
        return pos >= regex.length();
    }

    private RegexNode parseOr() {
        RegexNode left = parseConcat();
        while (peek() == '|') {
            consume();
            left = RegexNode.or(left, parseConcat());
        }
        return left;
    }

    private RegexNode parseConcat() {
        List<RegexNode> nodes = new ArrayList<>();
        while (!atEnd() && peek() != ')' && peek() != '|') {
            nodes.add(parseStar());
        }
        if (nodes.isEmpty()) {
            return RegexNode.epsilon();
        }
        RegexNode result = nodes.get(0);
        for (int i = 1; i < nodes.size(); i++) {
            result = RegexNode.concat(result, nodes.get(i));
        }
        return result;
    }

    private RegexNode parseStar() {
        RegexNode node = parseBase();
        while (peek() == '*' || peek() == '+') {
            node = consume() == '*' ? RegexNode.star(node) : RegexNode.plus(node);
        }
        return node;
    }

    private RegexNode parseBase() {
        if (atEnd()) {
            throw new RegexSyntaxException("Unexpected end of input", pos);
        }
        char c = peek();
        if (c == '(') {
            int open = pos;
            consume();
            RegexNode node = parseOr();
            if (peek() != ')') {
                throw new RegexSyntaxException("Expected ')' to close '(' at " + open, pos);
            }
            consume();
            return node;
        }
        if (c == EPSILON_CHAR) {
            consume();
            return RegexNode.epsilon();
        }
        if (c == '\\' && pos + 1 < regex.length() && regex.charAt(pos + 1) == 'e') {
            pos += 2;
            return RegexNode.epsilon();
        }
        if (RESERVED.indexOf(c) >= 0) {
            throw new RegexSyntaxException("Unexpected '" + c + "'", pos);
        }
        consume();
        return RegexNode.symbol(String.valueOf(c));
    }
}
