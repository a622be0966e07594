package cz.cuni.mff.d3s.ctdtlp.testutils;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Evaluates LTL formulas over a single-state world.
 *
 * <p>In a world with one state that loops on itself, {@code F}, {@code G} and {@code X} are the identity,
 * which is enough to decide the formulas the generator builds. Supported syntax: {@code TRUE},
 * {@code FALSE}, bare variables (true when their value is {@code TRUE}), comparisons
 * {@code a = b} and {@code a != b}, {@code !}, {@code &}, {@code |}, {@code ->}, {@code <->}
 * and parentheses.
 */
public final class StateFormulaEvaluator {

    private final List<String> tokens;
    private final Map<String, String> state;
    private int position;

    private StateFormulaEvaluator(String formula, Map<String, String> state) {
        this.tokens = tokenize(formula);
        this.state = state;
    }

    /**
     * @throws IllegalArgumentException if the formula cannot be parsed
     */
    public static boolean holds(String formula, Map<String, String> state) {
        StateFormulaEvaluator evaluator = new StateFormulaEvaluator(formula, state);
        boolean result = evaluator.equivalence();
        if (evaluator.position != evaluator.tokens.size()) {
            throw new IllegalArgumentException("Unexpected token '" + evaluator.tokens.get(evaluator.position)
                    + "' in formula: " + formula);
        }
        return result;
    }

    private boolean equivalence() {
        boolean left = implication();
        while (accept("<->")) {
            left = left == implication();
        }
        return left;
    }

    private boolean implication() {
        boolean left = disjunction();
        if (accept("->")) {
            boolean right = implication();
            return !left || right;
        }
        return left;
    }

    private boolean disjunction() {
        boolean left = conjunction();
        while (accept("|")) {
            boolean right = conjunction();
            left = left || right;
        }
        return left;
    }

    private boolean conjunction() {
        boolean left = unary();
        while (accept("&")) {
            boolean right = unary();
            left = left && right;
        }
        return left;
    }

    private boolean unary() {
        if (accept("!")) {
            return !unary();
        }
        if (accept("F") || accept("G") || accept("X")) {
            return unary();
        }
        return primary();
    }

    private boolean primary() {
        if (accept("(")) {
            boolean inner = equivalence();
            expect(")");
            return inner;
        }
        String left = next();
        if (accept("=")) {
            return sameValue(resolve(left), resolve(next()));
        }
        if (accept("!=")) {
            return !sameValue(resolve(left), resolve(next()));
        }
        return resolve(left).equalsIgnoreCase("TRUE");
    }

    private String resolve(String operand) {
        return state.getOrDefault(operand, operand);
    }

    private static boolean sameValue(String a, String b) {
        return a.strip().toLowerCase(Locale.ROOT).equals(b.strip().toLowerCase(Locale.ROOT));
    }

    private boolean accept(String token) {
        if (position < tokens.size() && tokens.get(position).equals(token)) {
            position++;
            return true;
        }
        return false;
    }

    private void expect(String token) {
        if (!accept(token)) {
            throw new IllegalArgumentException("Expected '" + token + "' at token " + position + " of " + tokens);
        }
    }

    private String next() {
        if (position >= tokens.size()) {
            throw new IllegalArgumentException("Formula ends unexpectedly: " + tokens);
        }
        return tokens.get(position++);
    }

    private static List<String> tokenize(String formula) {
        List<String> tokens = new ArrayList<>();
        int i = 0;
        while (i < formula.length()) {
            char c = formula.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (formula.startsWith("<->", i)) {
                tokens.add("<->");
                i += 3;
            } else if (formula.startsWith("->", i) || formula.startsWith("!=", i)) {
                tokens.add(formula.substring(i, i + 2));
                i += 2;
            } else if ("()!&|=".indexOf(c) >= 0) {
                tokens.add(String.valueOf(c));
                i++;
            } else if (Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '"') {
                int start = i;
                i++;
                while (i < formula.length()) {
                    char d = formula.charAt(i);
                    if (!(Character.isLetterOrDigit(d) || d == '_' || d == '.' || d == '"')) {
                        break;
                    }
                    i++;
                }
                tokens.add(formula.substring(start, i));
            } else {
                throw new IllegalArgumentException("Unsupported character '" + c + "' in formula: " + formula);
            }
        }
        return tokens;
    }
}
