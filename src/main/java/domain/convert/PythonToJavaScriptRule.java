package domain.convert;

import domain.model.ConstructKind;
import domain.model.Severity;
import domain.model.SourceLine;
import domain.model.TransformOutcome;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static domain.convert.PythonToJavaScriptSyntax.binding;
import static domain.convert.PythonToJavaScriptSyntax.condition;
import static domain.convert.PythonToJavaScriptSyntax.expression;
import static domain.convert.PythonToJavaScriptSyntax.value;

/**
 * Rules for python to javascript. Declaration order is bucket priority.
 */
enum PythonToJavaScriptRule implements ConversionRule {

    COMMENT(ConstructKind.COMMENT, 1, false, "^#(.*)$") {
        @Override
        TransformOutcome convert(Matcher m, SourceLine line, RuleContext ctx) {
            return TransformOutcome.success("//" + m.group(1), level());
        }
    },

    FUNCTION(ConstructKind.FUNCTION_DEFINITION, 2, true,
            "^(async\\s+)?def\\s+(\\w+)\\s*\\((.*)\\)\\s*(->\\s*.+?)?\\s*:$") {
        @Override
        TransformOutcome convert(Matcher m, SourceLine line, RuleContext ctx) {
            if (m.group(4) != null) {
                ctx.diagnostics().warn(line.getLineNumber(), "return type hint removed (not applicable in javascript)");
            }
            String params = PythonToJavaScriptSyntax.parameters(m.group(3), line.getLineNumber(), ctx);
            String async = m.group(1) == null ? "" : "async ";
            return TransformOutcome.success(async + "function " + m.group(2) + "(" + params + ") {", level());
        }
    },

    ELIF(ConstructKind.CONDITIONAL_ELIF, 2, true, "^elif\\s+(.+):$") {
        @Override
        TransformOutcome convert(Matcher m, SourceLine line, RuleContext ctx) {
            return TransformOutcome.success(
                    "else if (" + condition(m.group(1), line.getLineNumber(), ctx) + ") {", level());
        }
    },

    IF(ConstructKind.CONDITIONAL_IF, 2, true, "^if\\s+(.+):$") {
        @Override
        TransformOutcome convert(Matcher m, SourceLine line, RuleContext ctx) {
            return TransformOutcome.success(
                    "if (" + condition(m.group(1), line.getLineNumber(), ctx) + ") {", level());
        }
    },

    ELSE(ConstructKind.CONDITIONAL_ELSE, 2, true, "^else\\s*:$") {
        @Override
        TransformOutcome convert(Matcher m, SourceLine line, RuleContext ctx) {
            return TransformOutcome.success("else {", level());
        }
    },

    FOR_RANGE(ConstructKind.LOOP_FOR, 3, true, "^for\\s+(\\w+)\\s+in\\s+range\\s*\\((.*)\\)\\s*:$") {
        @Override
        TransformOutcome convert(Matcher m, SourceLine line, RuleContext ctx) {
            String v = m.group(1);
            List<String> args = CodeScan.splitTopLevel(m.group(2), ',');
            int n = line.getLineNumber();
            String start;
            String stop;
            String step = "1";
            switch (args.size()) {
                case 1:
                    start = "0";
                    stop = expression(args.get(0), n, ctx);
                    break;
                case 2:
                    start = expression(args.get(0), n, ctx);
                    stop = expression(args.get(1), n, ctx);
                    break;
                case 3:
                    start = expression(args.get(0), n, ctx);
                    stop = expression(args.get(1), n, ctx);
                    step = args.get(2).replace(" ", "");
                    break;
                default:
                    return TransformOutcome.failure("range() with " + args.size() + " arguments is not supported");
            }
            String header;
            if (step.startsWith("-")) {
                String amount = step.substring(1);
                header = v + " > " + stop + "; " + v + ("1".equals(amount) ? "--" : " -= " + amount);
            } else {
                header = v + " < " + stop + "; " + v + ("1".equals(step) ? "++" : " += " + expression(step, n, ctx));
            }
            return TransformOutcome.success("for (let " + v + " = " + start + "; " + header + ") {", level());
        }
    },

    FOR_PAIR(ConstructKind.LOOP_FOR, 3, true, "^for\\s+(\\w+)\\s*,\\s*(\\w+)\\s+in\\s+(.+):$") {
        @Override
        TransformOutcome convert(Matcher m, SourceLine line, RuleContext ctx) {
            String iterable = m.group(3).trim();
            Matcher en = ENUMERATE.matcher(iterable);
            String js;
            if (en.matches()) {
                js = expression(en.group(1), line.getLineNumber(), ctx) + ".entries()";
            } else {
                js = expression(iterable, line.getLineNumber(), ctx);
            }
            return TransformOutcome.success(
                    "for (const [" + m.group(1) + ", " + m.group(2) + "] of " + js + ") {", level());
        }
    },

    FOR_EACH(ConstructKind.LOOP_FOR, 3, true, "^for\\s+(\\w+)\\s+in\\s+(.+):$") {
        @Override
        TransformOutcome convert(Matcher m, SourceLine line, RuleContext ctx) {
            return TransformOutcome.success(
                    "for (let " + m.group(1) + " of " + expression(m.group(2).trim(), line.getLineNumber(), ctx) + ") {",
                    level());
        }
    },

    WHILE(ConstructKind.LOOP_WHILE, 2, true, "^while\\s+(.+):$") {
        @Override
        TransformOutcome convert(Matcher m, SourceLine line, RuleContext ctx) {
            return TransformOutcome.success(
                    "while (" + condition(m.group(1), line.getLineNumber(), ctx) + ") {", level());
        }
    },

    TRY(ConstructKind.EXCEPTION_TRY, 2, true, "^try\\s*:$") {
        @Override
        TransformOutcome convert(Matcher m, SourceLine line, RuleContext ctx) {
            return TransformOutcome.success("try {", level());
        }
    },

    EXCEPT_MULTI(ConstructKind.EXCEPTION_HANDLER, 2, true, "^except\\s*\\((.+)\\)\\s*(?:as\\s+(\\w+))?\\s*:$") {
        @Override
        TransformOutcome convert(Matcher m, SourceLine line, RuleContext ctx) {
            String var = m.group(2) == null ? "error" : m.group(2);
            return TransformOutcome.success("catch (" + var + ") {", level(),
                    "exception types (" + m.group(1).trim() + ") merged into one catch");
        }
    },

    EXCEPT_TYPED_AS(ConstructKind.EXCEPTION_HANDLER, 2, true, "^except\\s+([\\w.]+)\\s+as\\s+(\\w+)\\s*:$") {
        @Override
        TransformOutcome convert(Matcher m, SourceLine line, RuleContext ctx) {
            return TransformOutcome.success("catch (" + m.group(2) + ") {", level());
        }
    },

    EXCEPT_TYPED(ConstructKind.EXCEPTION_HANDLER, 2, true, "^except\\s+([\\w.]+)\\s*:$") {
        @Override
        TransformOutcome convert(Matcher m, SourceLine line, RuleContext ctx) {
            return TransformOutcome.success("catch (error) {", level());
        }
    },

    EXCEPT_BARE(ConstructKind.EXCEPTION_HANDLER, 2, true, "^except\\s*:$") {
        @Override
        TransformOutcome convert(Matcher m, SourceLine line, RuleContext ctx) {
            return TransformOutcome.success("catch (error) {", level());
        }
    },

    FINALLY(ConstructKind.EXCEPTION_HANDLER, 2, true, "^finally\\s*:$") {
        @Override
        TransformOutcome convert(Matcher m, SourceLine line, RuleContext ctx) {
            return TransformOutcome.success("finally {", level());
        }
    },

    LIST_COMPREHENSION(ConstructKind.SEQUENCE_TRANSFORM, 3, false,
            "\\[[^\\[\\]]*\\sfor\\s[^\\[\\]]*\\sin\\s[^\\[\\]]*\\]") {
        @Override
        boolean matchesMasked() {
            return true;
        }

        @Override
        TransformOutcome convert(Matcher m, SourceLine line, RuleContext ctx) {
            int n = line.getLineNumber();
            String rewritten = PythonToJavaScriptSyntax.comprehension(line.getContent(), n, ctx);
            if (rewritten == null) {
                return TransformOutcome.failure("list comprehension could not be converted");
            }
            ctx.diagnostics().unsupported(n, ConstructKind.SEQUENCE_TRANSFORM, Severity.WARNING,
                    "list comprehension converted to .map()/.filter()");
            return TransformOutcome.success(PythonToJavaScriptSyntax.finishStatement(rewritten, n, ctx), level(),
                    "List comprehension converted to .map()/.filter() - verify logic matches");
        }
    },

    /** Dict, set and generator comprehensions have no rewrite. */
    OTHER_COMPREHENSION(ConstructKind.SEQUENCE_TRANSFORM, 3, false, "\\bfor\\s+[\\w\\s,()]+?\\s+in\\s") {
        @Override
        boolean matchesMasked() {
            return true;
        }

        @Override
        public boolean matches(String content) {
            return !content.endsWith(":") && super.matches(content);
        }

        @Override
        TransformOutcome convert(Matcher m, SourceLine line, RuleContext ctx) {
            ctx.diagnostics().unsupported(line.getLineNumber(), ConstructKind.SEQUENCE_TRANSFORM, Severity.ERROR,
                    "dict, set or generator comprehension not converted");
            return TransformOutcome.failure("comprehension kept as is, only tokens were substituted");
        }
    },

    PRINT(ConstructKind.OUTPUT_STATEMENT, 1, false, "^print\\s*\\((.*)\\)$") {
        @Override
        TransformOutcome convert(Matcher m, SourceLine line, RuleContext ctx) {
            return TransformOutcome.success(
                    PythonToJavaScriptSyntax.print(m.group(1), line.getLineNumber(), ctx), level());
        }
    },

    ANNOTATED_BINDING(ConstructKind.VARIABLE_BINDING, 1, false,
            "^([A-Za-z_]\\w*)\\s*:\\s*[\\w\\[\\]., |]+?\\s*=(?!=)\\s*(.+)$") {
        @Override
        TransformOutcome convert(Matcher m, SourceLine line, RuleContext ctx) {
            String v = value(m.group(2).trim(), line.getLineNumber(), ctx);
            return TransformOutcome.success(binding(m.group(1), v, ctx), level(),
                    "type hint on '" + m.group(1) + "' removed (not applicable in javascript)");
        }
    },

    AUGMENTED_ASSIGNMENT(ConstructKind.VARIABLE_BINDING, 1, false,
            "^([\\w.\\[\\]]+)\\s*(\\*\\*|//|\\+|-|\\*|/|%)=\\s*(.+)$") {
        @Override
        TransformOutcome convert(Matcher m, SourceLine line, RuleContext ctx) {
            String target = m.group(1);
            String v = value(m.group(3).trim(), line.getLineNumber(), ctx);
            if ("//".equals(m.group(2))) {
                return TransformOutcome.success(target + " = Math.floor(" + target + " / " + v + ");", level());
            }
            return TransformOutcome.success(target + " " + m.group(2) + "= " + v + ";", level());
        }
    },

    BINDING(ConstructKind.VARIABLE_BINDING, 1, false, "^([A-Za-z_]\\w*)\\s*=(?!=)\\s*(.+)$") {
        @Override
        TransformOutcome convert(Matcher m, SourceLine line, RuleContext ctx) {
            String v = value(m.group(2).trim(), line.getLineNumber(), ctx);
            return TransformOutcome.success(binding(m.group(1), v, ctx), level());
        }
    },

    RAISE(ConstructKind.METHOD_CALL, 1, false, "^raise\\s+([\\w.]+)\\s*\\((.*)\\)$") {
        @Override
        TransformOutcome convert(Matcher m, SourceLine line, RuleContext ctx) {
            String type = m.group(1);
            String jsType = type.endsWith("Exception") || "ValueError".equals(type) ? "Error" : type;
            return TransformOutcome.success(
                    "throw new " + jsType + "(" + expression(m.group(2), line.getLineNumber(), ctx) + ");", level());
        }
    },

    CALL(ConstructKind.METHOD_CALL, 1, false, "[\\w\\])]\\s*\\(") {
        @Override
        public boolean matches(String content) {
            return !content.endsWith(":") && super.matches(content);
        }

        @Override
        TransformOutcome convert(Matcher m, SourceLine line, RuleContext ctx) {
            String s = expression(line.getContent(), line.getLineNumber(), ctx);
            return TransformOutcome.success(s.endsWith(";") ? s : s + ";", level());
        }
    };

    private static final Pattern ENUMERATE = Pattern.compile("^enumerate\\s*\\((.+)\\)$");

    private final ConstructKind kind;
    private final int level;
    private final boolean opensBlock;
    private final Pattern pattern;

    PythonToJavaScriptRule(ConstructKind kind, int level, boolean opensBlock, String regex) {
        this.kind = kind;
        this.level = level;
        this.opensBlock = opensBlock;
        this.pattern = Pattern.compile(regex);
    }

    abstract TransformOutcome convert(Matcher m, SourceLine line, RuleContext ctx);

    /** True when the pattern is searched in the literal-masked content. */
    boolean matchesMasked() {
        return false;
    }

    @Override
    public ConstructKind kind() {
        return kind;
    }

    @Override
    public int level() {
        return level;
    }

    @Override
    public boolean opensBlock() {
        return opensBlock;
    }

    @Override
    public boolean matches(String content) {
        if (content == null) return false;
        String text = matchesMasked() ? CodeScan.maskLiterals(content) : content;
        return pattern.matcher(text).find();
    }

    @Override
    public TransformOutcome transform(SourceLine line, RuleContext ctx) {
        String content = line.getContent();
        Matcher m = pattern.matcher(matchesMasked() ? CodeScan.maskLiterals(content) : content);
        if (!m.find()) {
            return TransformOutcome.failure("'" + kind.label() + "' pattern did not match");
        }
        return convert(m, line, ctx);
    }
}
