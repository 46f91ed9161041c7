package domain.convert;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Heuristic 0..1 confidence for a conversion.
 *
 * <p>Blend: 40% structure (non-blank line ratio), 30% syntax (bracket balance, else statement
 * terminator consistency), 30% completion. Each unsupported construct removes 15% of the
 * blend, at most 50%.</p>
 *
 * <p>The bracket scan does not skip string literals or comments, so a lone
 * brace inside a string counts as unbalanced.</p>
 */
public final class ConfidenceScorer {

    private static final double STRUCTURE_WEIGHT = 0.4;
    private static final double SYNTAX_WEIGHT = 0.3;
    private static final double COMPLETION_WEIGHT = 0.3;
    private static final double PENALTY_PER_UNSUPPORTED = 0.15;
    private static final double MAX_PENALTY = 0.5;

    /**
     * @param totalLines number of lines eligible for conversion; 0 when unknown
     */
    public double calculate(String original, String converted, int linesConverted, int totalLines,
                            int unsupportedCount) {
        double structure = structureScore(original, converted);
        double syntax = syntaxScore(converted);
        double completion = completionScore(linesConverted, totalLines, unsupportedCount);

        double blended = structure * STRUCTURE_WEIGHT + syntax * SYNTAX_WEIGHT + completion * COMPLETION_WEIGHT;
        double penalty = Math.min(Math.max(0, unsupportedCount) * PENALTY_PER_UNSUPPORTED, MAX_PENALTY);
        return clamp(blended * (1.0 - penalty));
    }

    double structureScore(String original, String converted) {
        int orig = nonBlankLines(original);
        if (orig == 0) return 0.5;
        double ratio = (double) nonBlankLines(converted) / orig;
        if (ratio >= 0.7 && ratio <= 1.5) return 0.95;
        if (ratio >= 0.5 && ratio <= 2.0) return 0.75;
        return 0.5;
    }

    double syntaxScore(String converted) {
        if (converted == null || converted.isBlank()) return 0.0;
        if (isBalanced(converted)) return 1.0;
        return 0.5 + terminatorConsistency(converted) * 0.2;
    }

    double completionScore(int linesConverted, int totalLines, int unsupportedCount) {
        if (totalLines <= 0) return unsupportedCount == 0 ? 1.0 : 0.5;
        return Math.min(1.0, Math.max(0, linesConverted) / (double) totalLines);
    }

    /** Stack scan over (), [] and {}. */
    static boolean isBalanced(String text) {
        Deque<Character> stack = new ArrayDeque<>();
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '(':
                case '[':
                case '{':
                    stack.push(c);
                    break;
                case ')':
                    if (stack.isEmpty() || stack.pop() != '(') return false;
                    break;
                case ']':
                    if (stack.isEmpty() || stack.pop() != '[') return false;
                    break;
                case '}':
                    if (stack.isEmpty() || stack.pop() != '{') return false;
                    break;
                default:
                    break;
            }
        }
        return stack.isEmpty();
    }

    /**
     * 1.0 when no line or at least 80% of lines end with ';', else 0.7.
     */
    static double terminatorConsistency(String text) {
        int lines = 0;
        int terminated = 0;
        for (String line : text.split("\n", -1)) {
            String t = line.trim();
            if (t.isEmpty()) continue;
            lines++;
            if (t.endsWith(";")) terminated++;
        }
        if (lines == 0 || terminated == 0) return 1.0;
        double ratio = (double) terminated / lines;
        return ratio >= 0.8 ? 1.0 : 0.7;
    }

    static int nonBlankLines(String text) {
        if (text == null || text.isEmpty()) return 0;
        int n = 0;
        for (String line : text.split("\n", -1)) {
            if (!line.isBlank()) n++;
        }
        return n;
    }

    private static double clamp(double v) {
        if (Double.isNaN(v)) return 0.0;
        return Math.max(0.0, Math.min(1.0, v));
    }
}
