package domain.convert;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Single-line scanner that knows about string literals ('...', "...", `...`) and bracket nesting.
 */
final class CodeScan {
    final String s;
    int pos = 0;

    CodeScan(String s) {
        this.s = (s == null) ? "" : s;
    }

    boolean hasNext() {
        return pos < s.length();
    }

    char peek() {
        return (pos < s.length()) ? s.charAt(pos) : '\0';
    }

    char read() {
        return (pos < s.length()) ? s.charAt(pos++) : '\0';
    }

    boolean peekIsQuote() {
        char c = peek();
        return c == '\'' || c == '"' || c == '`';
    }

    boolean peekStartsWith(String token) {
        return s.startsWith(token, pos);
    }

    /** Reads a quoted literal including both quotes; an unterminated literal runs to end of line. */
    String readQuoted() {
        int start = pos;
        char quote = read();
        while (hasNext()) {
            char c = read();
            if (c == '\\') {
                read();
                continue;
            }
            if (c == quote) break;
        }
        return s.substring(start, pos);
    }

    /**
     * Applies {@code fn} to code segments only; literal contents pass through untouched.
     */
    static String mapCode(String line, UnaryOperator<String> fn) {
        if (line == null || line.isEmpty()) return line;
        CodeScan sc = new CodeScan(line);
        StringBuilder out = new StringBuilder(line.length() + 16);
        StringBuilder code = new StringBuilder();
        while (sc.hasNext()) {
            if (sc.peekIsQuote()) {
                if (code.length() > 0) {
                    out.append(fn.apply(code.toString()));
                    code.setLength(0);
                }
                out.append(sc.readQuoted());
            } else {
                code.append(sc.read());
            }
        }
        if (code.length() > 0) out.append(fn.apply(code.toString()));
        return out.toString();
    }

    /**
     * Same-length copy with literal contents replaced by '_' (quotes kept), so indexes found
     * by a regex on the mask are valid on the original.
     */
    static String maskLiterals(String line) {
        if (line == null || line.isEmpty()) return line;
        CodeScan sc = new CodeScan(line);
        StringBuilder out = new StringBuilder(line.length());
        while (sc.hasNext()) {
            if (sc.peekIsQuote()) {
                String lit = sc.readQuoted();
                out.append(lit.charAt(0));
                for (int i = 1; i < lit.length() - 1; i++) out.append('_');
                if (lit.length() > 1) out.append(lit.charAt(lit.length() - 1));
            } else {
                out.append(sc.read());
            }
        }
        return out.toString();
    }

    /**
     * Splits off a trailing comment that starts outside any literal.
     *
     * @return {code, comment text after the prefix or null}
     */
    static String[] splitTrailingComment(String line, String prefix) {
        if (line == null) return new String[]{"", null};
        CodeScan sc = new CodeScan(line);
        while (sc.hasNext()) {
            if (sc.peekIsQuote()) {
                sc.readQuoted();
                continue;
            }
            if (sc.peekStartsWith(prefix)) {
                String code = line.substring(0, sc.pos);
                String comment = line.substring(sc.pos + prefix.length());
                return new String[]{code, comment};
            }
            sc.read();
        }
        return new String[]{line, null};
    }

    /**
     * Index of the bracket closing the one at {@code openIdx}, or -1.
     */
    static int findClosing(String text, int openIdx) {
        if (text == null || openIdx < 0 || openIdx >= text.length()) return -1;
        CodeScan sc = new CodeScan(text);
        sc.pos = openIdx;
        int depth = 0;
        while (sc.hasNext()) {
            if (sc.peekIsQuote()) {
                sc.readQuoted();
                continue;
            }
            char c = sc.read();
            if (c == '(' || c == '[' || c == '{') depth++;
            else if (c == ')' || c == ']' || c == '}') {
                depth--;
                if (depth == 0) return sc.pos - 1;
            }
        }
        return -1;
    }

    /**
     * Splits on {@code sep} at bracket depth 0 outside literals. Parts are trimmed.
     */
    static List<String> splitTopLevel(String text, char sep) {
        List<String> parts = new ArrayList<>();
        if (text == null || text.isBlank()) return parts;
        CodeScan sc = new CodeScan(text);
        int depth = 0;
        int start = 0;
        while (sc.hasNext()) {
            if (sc.peekIsQuote()) {
                sc.readQuoted();
                continue;
            }
            char c = sc.read();
            if (c == '(' || c == '[' || c == '{') depth++;
            else if (c == ')' || c == ']' || c == '}') depth = Math.max(0, depth - 1);
            else if (c == sep && depth == 0) {
                parts.add(text.substring(start, sc.pos - 1).trim());
                start = sc.pos;
            }
        }
        parts.add(text.substring(start).trim());
        return parts;
    }
}
