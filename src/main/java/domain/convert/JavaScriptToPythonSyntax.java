package domain.convert;

import domain.model.ConstructKind;
import domain.model.Severity;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Expression-level helpers for javascript to python rules.
 */
final class JavaScriptToPythonSyntax {

    private static final Pattern STRICT_EQ = Pattern.compile("===");
    private static final Pattern STRICT_NE = Pattern.compile("!==");
    private static final Pattern AND = Pattern.compile("\\s*&&\\s*");
    private static final Pattern OR = Pattern.compile("\\s*\\|\\|\\s*");
    private static final Pattern NOT = Pattern.compile("!(?!=)\\s*");
    private static final Pattern TRUE = Pattern.compile("\\btrue\\b");
    private static final Pattern FALSE = Pattern.compile("\\bfalse\\b");
    private static final Pattern NULL = Pattern.compile("\\b(null|undefined)\\b");
    private static final Pattern THIS = Pattern.compile("\\bthis\\.");
    private static final Pattern NEW = Pattern.compile("\\bnew\\s+(?=[A-Za-z_])");

    private static final Pattern TEMPLATE = Pattern.compile("`((?:\\\\.|[^`\\\\])*)`");
    private static final Pattern TEMPLATE_PLACEHOLDER = Pattern.compile("\\$\\{([^{}]+)\\}");

    private static final Pattern SINGLE_ARROW = Pattern.compile("(?<![\\w$)])(?:\\(\\s*(\\w+)\\s*\\)|(\\w+))\\s*=>(?!\\s*\\{)\\s*");
    private static final Pattern OTHER_ARROW = Pattern.compile("(?:\\(([^()]*)\\)|\\w+)\\s*=>\\s*(\\{)?");

    private static final Pattern CHAIN_START = Pattern.compile("([\\w.$]+(?:\\[[^\\]]*\\])?)\\.(filter|map)\\(");
    private static final Pattern CHAIN_NEXT = Pattern.compile("^\\.(filter|map)\\(");
    private static final Pattern ARROW_ARG = Pattern.compile("^\\s*(?:\\(\\s*(\\w+)\\s*\\)|(\\w+))\\s*=>\\s*(.+?)\\s*$",
            Pattern.DOTALL);

    private static final Pattern DECLARATION = Pattern.compile("^(?:const|let|var)\\s+(\\w+)\\s*=\\s*(.+?);?$");
    private static final Pattern CONSOLE = Pattern.compile("^console\\.(log|info|debug|warn|error)\\s*\\((.*)\\)\\s*;?$");

    private JavaScriptToPythonSyntax() {
    }

    /** Boolean/empty literals, boolean operators and equality, outside string literals. */
    static String tokens(String code) {
        return CodeScan.mapCode(code, JavaScriptToPythonSyntax::tokenSegment);
    }

    private static String tokenSegment(String s) {
        s = STRICT_NE.matcher(s).replaceAll("!=");
        s = STRICT_EQ.matcher(s).replaceAll("==");
        s = AND.matcher(s).replaceAll(" and ");
        s = OR.matcher(s).replaceAll(" or ");
        s = NOT.matcher(s).replaceAll("not ");
        s = TRUE.matcher(s).replaceAll("True");
        s = FALSE.matcher(s).replaceAll("False");
        s = NULL.matcher(s).replaceAll("None");
        s = THIS.matcher(s).replaceAll("self.");
        return s;
    }

    static String stripSemicolon(String s) {
        String t = s.trim();
        while (t.endsWith(";")) t = t.substring(0, t.length() - 1).trim();
        return t;
    }

    /** Template literal to f-string; a template without placeholders becomes a plain string. */
    static String templates(String text) {
        Matcher m = TEMPLATE.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            String body = m.group(1);
            boolean placeholders = TEMPLATE_PLACEHOLDER.matcher(body).find();
            body = TEMPLATE_PLACEHOLDER.matcher(body).replaceAll("{$1}");
            String quote = body.contains("\"") ? "'" : "\"";
            m.appendReplacement(sb, Matcher.quoteReplacement((placeholders ? "f" : "") + quote + body + quote));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    /**
     * Single-parameter expression arrows become lambdas; every other arrow is left as is and
     * recorded as an error-severity unsupported construct.
     */
    static String arrows(String text, int line, RuleContext ctx) {
        String s = CodeScan.mapCode(text, seg -> SINGLE_ARROW.matcher(seg).replaceAll(mr -> {
            String p = mr.group(1) != null ? mr.group(1) : mr.group(2);
            return Matcher.quoteReplacement("lambda " + p + ": ");
        }));
        Matcher other = OTHER_ARROW.matcher(CodeScan.maskLiterals(s));
        while (other.find()) {
            String params = other.group(1);
            String what = other.group(2) != null
                    ? "arrow function with block body"
                    : "arrow function with " + (params == null || params.isBlank() ? "no" : "multiple") + " parameters";
            ctx.diagnostics().unsupported(line, ConstructKind.FUNCTION_DEFINITION, Severity.ERROR, what);
            ctx.diagnostics().warn(line, what + " not converted; only single-parameter expression arrows become lambdas");
        }
        return s;
    }

    static String ternary(String text, int line, RuleContext ctx) {
        String masked = CodeScan.maskLiterals(text);
        if (masked.contains("=>") || masked.contains("?.") || masked.contains("??")) return null;
        int q = masked.indexOf('?');
        if (q < 0 || masked.indexOf('?', q + 1) >= 0) return null;
        int colon = masked.indexOf(':', q);
        if (colon < 0 || masked.substring(0, q).contains(":")) return null;
        String cond = text.substring(0, q).trim();
        String yes = text.substring(q + 1, colon).trim();
        String no = text.substring(colon + 1).trim();
        if (cond.isEmpty() || yes.isEmpty() || no.isEmpty()) return null;
        return expression(yes, line, ctx) + " if " + expression(cond, line, ctx) + " else " + expression(no, line, ctx);
    }

    /** Full expression conversion: templates, new, method table, ternary, arrows, tokens. */
    static String expression(String text, int line, RuleContext ctx) {
        if (text == null || text.isEmpty()) return text;
        String s = stripSemicolon(text);
        String t = ternary(s, line, ctx);
        if (t != null) return t;
        s = templates(s);
        s = CodeScan.mapCode(s, seg -> NEW.matcher(seg).replaceAll(""));
        s = ctx.mapMethods(s, line);
        s = arrows(s, line, ctx);
        return tokens(s);
    }

    static String condition(String cond, int line, RuleContext ctx) {
        return expression(cond.trim(), line, ctx);
    }

    static String print(String method, String args, int line, RuleContext ctx) {
        List<String> out = new ArrayList<>();
        for (String arg : CodeScan.splitTopLevel(args, ',')) {
            if (!arg.isEmpty()) out.add(expression(arg, line, ctx));
        }
        if ("warn".equals(method) || "error".equals(method)) {
            out.add("file=sys.stderr");
            ctx.diagnostics().warn(line, "console." + method + " converted to print(..., file=sys.stderr) - add 'import sys'");
        }
        return "print(" + String.join(", ", out) + ")";
    }

    /** Rest parameters to *args; defaults converted. */
    static String parameters(String params, int line, RuleContext ctx) {
        List<String> out = new ArrayList<>();
        for (String p : CodeScan.splitTopLevel(params, ',')) {
            if (p.isEmpty()) continue;
            if (p.startsWith("{") || p.startsWith("[")) {
                ctx.diagnostics().unsupported(line, ConstructKind.FUNCTION_DEFINITION, Severity.ERROR,
                        "destructuring parameter " + p);
                out.add(p);
                continue;
            }
            if (p.startsWith("...")) {
                out.add("*" + p.substring(3).trim());
                continue;
            }
            List<String> eq = CodeScan.splitTopLevel(p, '=');
            if (eq.size() > 1) {
                String name = eq.get(0);
                String def = p.substring(p.indexOf('=', name.length()) + 1).trim();
                out.add(name + "=" + expression(def, line, ctx));
            } else {
                out.add(p);
            }
        }
        return String.join(", ", out);
    }

    /**
     * Rewrites a {@code recv.filter(v => c)}, {@code recv.map(v => e)} or filter-then-map chain
     * into a list comprehension.
     *
     * @return the rewritten line, or null when the chain is not convertible
     */
    static String chain(String content, int line, RuleContext ctx) {
        String masked = CodeScan.maskLiterals(content);
        Matcher m = CHAIN_START.matcher(masked);
        if (!m.find()) return null;

        String receiver = content.substring(m.start(1), m.end(1));
        List<String[]> calls = new ArrayList<>();
        String op = m.group(2);
        int open = m.end() - 1;
        int end;
        while (true) {
            int close = CodeScan.findClosing(content, open);
            if (close < 0) return null;
            String inner = content.substring(open + 1, close);
            Matcher arrow = ARROW_ARG.matcher(inner);
            if (!arrow.matches() || arrow.group(3).startsWith("{")) {
                if (inner.contains("=>")) {
                    ctx.diagnostics().unsupported(line, ConstructKind.SEQUENCE_TRANSFORM, Severity.ERROR,
                            "." + op + "() callback is not a single-parameter expression arrow");
                }
                return null;
            }
            String var = arrow.group(1) != null ? arrow.group(1) : arrow.group(2);
            calls.add(new String[]{op, var, arrow.group(3)});
            end = close + 1;
            Matcher next = CHAIN_NEXT.matcher(masked.substring(end));
            if (!next.find()) break;
            op = next.group(1);
            open = end + next.end() - 1;
        }

        String comp;
        if (calls.size() == 1 && "map".equals(calls.get(0)[0])) {
            String[] c = calls.get(0);
            comp = "[" + expression(c[2], line, ctx) + " for " + c[1] + " in " + receiver + "]";
        } else if (calls.size() == 1) {
            String[] c = calls.get(0);
            comp = "[" + c[1] + " for " + c[1] + " in " + receiver + " if " + expression(c[2], line, ctx) + "]";
        } else if (calls.size() == 2 && "filter".equals(calls.get(0)[0]) && "map".equals(calls.get(1)[0])) {
            String[] f = calls.get(0);
            String[] mp = calls.get(1);
            String cond = f[2].replaceAll("\\b" + Pattern.quote(f[1]) + "\\b", Matcher.quoteReplacement(mp[1]));
            comp = "[" + expression(mp[2], line, ctx) + " for " + mp[1] + " in " + receiver
                    + " if " + expression(cond, line, ctx) + "]";
        } else {
            return null;
        }
        return content.substring(0, m.start(1)) + comp + content.substring(end);
    }

    /** Finishes a line whose sub-expression was already rewritten. */
    static String finishStatement(String content, int line, RuleContext ctx) {
        Matcher d = DECLARATION.matcher(content);
        if (d.matches()) {
            return d.group(1) + " = " + expression(d.group(2), line, ctx);
        }
        Matcher c = CONSOLE.matcher(content);
        if (c.matches()) {
            return print(c.group(1), c.group(2), line, ctx);
        }
        return expression(content, line, ctx);
    }
}
