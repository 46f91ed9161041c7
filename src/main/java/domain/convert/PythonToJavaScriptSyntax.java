package domain.convert;

import domain.model.ConstructKind;
import domain.model.Severity;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Expression-level helpers for python to javascript rules.
 */
final class PythonToJavaScriptSyntax {

    private static final Pattern IS_NOT = Pattern.compile("\\bis\\s+not\\b");
    private static final Pattern IS = Pattern.compile("\\bis\\b");
    private static final Pattern AND = Pattern.compile("\\band\\b");
    private static final Pattern OR = Pattern.compile("\\bor\\b");
    private static final Pattern NOT = Pattern.compile("\\bnot\\b\\s*");
    private static final Pattern EQ = Pattern.compile("(?<![=!<>])==(?!=)");
    private static final Pattern NE = Pattern.compile("!=(?!=)");
    private static final Pattern TRUE = Pattern.compile("\\bTrue\\b");
    private static final Pattern FALSE = Pattern.compile("\\bFalse\\b");
    private static final Pattern NONE = Pattern.compile("\\bNone\\b");

    private static final Pattern NOT_IN = Pattern.compile("([\\w.\\]\\[]+)\\s+not\\s+in\\s+([\\w.]+)");
    private static final Pattern IN = Pattern.compile("([\\w.\\]\\[]+)\\s+in\\s+([\\w.]+)");
    private static final Pattern FOR_CLAUSE = Pattern.compile("\\bfor\\s+[\\w\\s,()]+?\\s+in\\s");
    private static final Pattern LAMBDA = Pattern.compile("\\blambda\\s*([\\w\\s,]*?)\\s*:\\s*");

    private static final Pattern F_STRING = Pattern.compile("\\b[fF]([\"'])((?:\\\\.|(?!\\1).)*)\\1");
    private static final Pattern F_PLACEHOLDER = Pattern.compile("\\{([^{}]+)\\}");

    private static final Pattern TERNARY = Pattern.compile("^(.+?)\\s+if\\s+(.+?)\\s+else\\s+(.+)$");
    private static final Pattern UPPER_NAME = Pattern.compile("^[A-Z][A-Z0-9_]*$");

    private static final Pattern COMPREHENSION = Pattern.compile(
            "\\[\\s*([^\\[\\]]+?)\\s+for\\s+([^\\[\\]]+?)\\s+in\\s+([^\\[\\]]+?)(?:\\s+if\\s+([^\\[\\]]+?))?\\s*\\]");
    private static final Pattern BINDING = Pattern.compile("^([A-Za-z_]\\w*)\\s*=(?!=)\\s*(.+)$");
    private static final Pattern PRINT = Pattern.compile("^print\\s*\\((.*)\\)$");
    private static final Pattern KWARG = Pattern.compile("^(sep|end|file|flush)\\s*=");

    private PythonToJavaScriptSyntax() {
    }

    /** Boolean/empty literals, boolean operators and equality, outside string literals. */
    static String tokens(String code) {
        return CodeScan.mapCode(code, PythonToJavaScriptSyntax::tokenSegment);
    }

    private static String tokenSegment(String s) {
        s = IS_NOT.matcher(s).replaceAll("!==");
        s = IS.matcher(s).replaceAll("===");
        s = AND.matcher(s).replaceAll("&&");
        s = OR.matcher(s).replaceAll("||");
        s = NOT.matcher(s).replaceAll("!");
        s = EQ.matcher(s).replaceAll("===");
        s = NE.matcher(s).replaceAll("!==");
        s = TRUE.matcher(s).replaceAll("true");
        s = FALSE.matcher(s).replaceAll("false");
        s = NONE.matcher(s).replaceAll("null");
        return s;
    }

    private static String operatorSegment(String s) {
        s = NOT_IN.matcher(s).replaceAll("!$2.includes($1)");
        s = IN.matcher(s).replaceAll("$2.includes($1)");
        return lambdaSegment(s);
    }

    private static String lambdaSegment(String s) {
        s = LAMBDA.matcher(s).replaceAll("($1) => ");
        return tokenSegment(s);
    }

    /** True when the code holds a comprehension or generator {@code for ... in} clause. */
    static boolean hasForClause(String code) {
        return FOR_CLAUSE.matcher(CodeScan.maskLiterals(code)).find();
    }

    /** f"..{x}.." to a template literal. */
    static String fStrings(String text) {
        Matcher m = F_STRING.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            String body = m.group(2).replace("`", "\\`");
            body = F_PLACEHOLDER.matcher(body).replaceAll("\\${$1}");
            m.appendReplacement(sb, Matcher.quoteReplacement("`" + body + "`"));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    /**
     * Full expression conversion: f-strings, method table, membership tests, lambdas, tokens.
     * An expression with a comprehension clause keeps its {@code in} and is recorded as an error.
     */
    static String expression(String text, int line, RuleContext ctx) {
        if (text == null || text.isEmpty()) return text;
        String s = fStrings(text);
        s = ctx.mapMethods(s, line);
        if (hasForClause(s)) {
            ctx.diagnostics().unsupported(line, ConstructKind.SEQUENCE_TRANSFORM, Severity.ERROR,
                    "comprehension not converted");
            return CodeScan.mapCode(s, PythonToJavaScriptSyntax::lambdaSegment);
        }
        return CodeScan.mapCode(s, PythonToJavaScriptSyntax::operatorSegment);
    }

    /** Expression conversion that also turns a conditional expression into a ternary. */
    static String value(String text, int line, RuleContext ctx) {
        String masked = CodeScan.maskLiterals(text);
        Matcher m = TERNARY.matcher(masked);
        if (m.matches() && !masked.contains(" for ") && !masked.trim().startsWith("lambda")) {
            String yes = text.substring(m.start(1), m.end(1));
            String cond = text.substring(m.start(2), m.end(2));
            String no = text.substring(m.start(3), m.end(3));
            return expression(cond, line, ctx) + " ? " + expression(yes, line, ctx) + " : " + value(no, line, ctx);
        }
        return expression(text, line, ctx);
    }

    /** Binding with let/const on first sight of the name, plain assignment afterwards. */
    static String binding(String name, String convertedValue, RuleContext ctx) {
        if (!ctx.blocks().declare(name)) {
            return name + " = " + convertedValue + ";";
        }
        String keyword = UPPER_NAME.matcher(name).matches() ? "const" : "let";
        return keyword + " " + name + " = " + convertedValue + ";";
    }

    /** print(...) arguments to console.log(...). Keyword arguments are dropped with a warning. */
    static String print(String args, int line, RuleContext ctx) {
        List<String> out = new ArrayList<>();
        List<String> dropped = new ArrayList<>();
        for (String arg : CodeScan.splitTopLevel(args, ',')) {
            if (arg.isEmpty()) continue;
            Matcher kw = KWARG.matcher(arg);
            if (kw.find()) {
                dropped.add(kw.group(1));
                continue;
            }
            out.add(value(arg, line, ctx));
        }
        if (!dropped.isEmpty()) {
            ctx.diagnostics().warn(line, "print() keyword arguments dropped: " + String.join(", ", dropped));
        }
        return "console.log(" + String.join(", ", out) + ");";
    }

    static String condition(String cond, int line, RuleContext ctx) {
        return value(cond.trim(), line, ctx);
    }

    /**
     * Replaces the single-clause list comprehension in {@code content} with a map/filter chain.
     *
     * @return the rewritten line, or null when the comprehension is not convertible
     */
    static String comprehension(String content, int line, RuleContext ctx) {
        String masked = CodeScan.maskLiterals(content);
        Matcher m = COMPREHENSION.matcher(masked);
        if (!m.find()) return null;

        String var = content.substring(m.start(2), m.end(2)).trim();
        String expr = content.substring(m.start(1), m.end(1)).trim();
        String iterable = content.substring(m.start(3), m.end(3)).trim();
        String cond = m.group(4) == null ? null : content.substring(m.start(4), m.end(4)).trim();

        if (iterable.matches(".*\\sfor\\s.*") || (cond != null && cond.matches(".*\\sfor\\s.*"))) {
            ctx.diagnostics().unsupported(line, ConstructKind.SEQUENCE_TRANSFORM, Severity.ERROR,
                    "nested list comprehension");
            return null;
        }
        if (!var.matches("\\w+")) {
            ctx.diagnostics().unsupported(line, ConstructKind.SEQUENCE_TRANSFORM, Severity.ERROR,
                    "list comprehension with tuple target: " + var);
            return null;
        }

        StringBuilder js = new StringBuilder(expression(iterable, line, ctx));
        if (cond != null) {
            js.append(".filter(").append(var).append(" => ").append(value(cond, line, ctx)).append(')');
        }
        if (cond == null || !expr.equals(var)) {
            js.append(".map(").append(var).append(" => ").append(value(expr, line, ctx)).append(')');
        }
        return content.substring(0, m.start()) + js + content.substring(m.end());
    }

    /**
     * Finishes a line whose sub-expression was already rewritten: binding, print or plain statement.
     */
    static String finishStatement(String content, int line, RuleContext ctx) {
        Matcher b = BINDING.matcher(content);
        if (b.matches()) {
            return binding(b.group(1), value(b.group(2).trim(), line, ctx), ctx);
        }
        Matcher p = PRINT.matcher(content);
        if (p.matches()) {
            return print(p.group(1), line, ctx);
        }
        String s = expression(content, line, ctx);
        return s.endsWith(";") ? s : s + ";";
    }

    /** Strips type hints and converts python-only parameter forms. */
    static String parameters(String params, int line, RuleContext ctx) {
        List<String> out = new ArrayList<>();
        boolean hinted = false;
        for (String p : CodeScan.splitTopLevel(params, ',')) {
            if (p.isEmpty()) continue;
            String name = p;
            String defaultValue = null;
            List<String> eq = CodeScan.splitTopLevel(p, '=');
            if (eq.size() > 1) {
                name = eq.get(0);
                defaultValue = p.substring(p.indexOf('=', name.length()) + 1).trim();
            }
            int colon = name.indexOf(':');
            if (colon >= 0) {
                name = name.substring(0, colon).trim();
                hinted = true;
            }
            if (name.startsWith("**")) {
                ctx.diagnostics().unsupported(line, ConstructKind.FUNCTION_DEFINITION, Severity.WARNING,
                        "keyword arguments **" + name.substring(2) + " passed as a plain object");
                name = name.substring(2);
            } else if (name.startsWith("*")) {
                if (name.length() == 1) continue;
                name = "..." + name.substring(1);
            }
            out.add(defaultValue == null ? name : name + " = " + value(defaultValue, line, ctx));
        }
        if (hinted) {
            ctx.diagnostics().warn(line, "type hints removed (not applicable in javascript)");
        }
        return String.join(", ", out);
    }
}
