package domain.convert;

import domain.model.ConstructKind;
import domain.model.Severity;
import domain.model.SourceLine;
import domain.model.TransformOutcome;

import java.math.BigInteger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static domain.convert.JavaScriptToPythonSyntax.condition;
import static domain.convert.JavaScriptToPythonSyntax.expression;

/**
 * Rules for javascript to python. Declaration order is bucket priority.
 *
 * <p>Closing braces never reach these rules; the pipeline strips them before classification.</p>
 */
enum JavaScriptToPythonRule implements ConversionRule {

    COMMENT_LINE(ConstructKind.COMMENT, 1, false, "^//(.*)$") {
        @Override
        TransformOutcome convert(Matcher m, SourceLine line, RuleContext ctx) {
            return TransformOutcome.success("#" + m.group(1), level());
        }
    },

    COMMENT_BLOCK(ConstructKind.COMMENT, 1, false, "^/\\*+(.*?)\\*+/$") {
        @Override
        TransformOutcome convert(Matcher m, SourceLine line, RuleContext ctx) {
            String body = m.group(1).trim();
            return TransformOutcome.success(body.isEmpty() ? "#" : "# " + body, level());
        }
    },

    DOC_START(ConstructKind.COMMENT, 1, false, "^/\\*+(.*)$") {
        @Override
        TransformOutcome convert(Matcher m, SourceLine line, RuleContext ctx) {
            String body = m.group(1).trim();
            return TransformOutcome.success(body.isEmpty() ? "#" : "# " + body, level());
        }
    },

    DOC_END(ConstructKind.COMMENT, 1, false, "^\\*+/$") {
        @Override
        TransformOutcome convert(Matcher m, SourceLine line, RuleContext ctx) {
            return TransformOutcome.success("#", level());
        }
    },

    DOC_LINE(ConstructKind.COMMENT, 1, false, "^\\*(\\s.*)?$") {
        @Override
        TransformOutcome convert(Matcher m, SourceLine line, RuleContext ctx) {
            String body = m.group(1) == null ? "" : m.group(1).trim();
            return TransformOutcome.success(body.isEmpty() ? "#" : "# " + body, level());
        }
    },

    CATCH_BOUND(ConstructKind.EXCEPTION_HANDLER, 2, true, "^catch\\s*\\(\\s*(\\w+)\\s*\\)\\s*\\{$") {
        @Override
        TransformOutcome convert(Matcher m, SourceLine line, RuleContext ctx) {
            return TransformOutcome.success("except Exception as " + m.group(1) + ":", level());
        }
    },

    CATCH_BARE(ConstructKind.EXCEPTION_HANDLER, 2, true, "^catch\\s*\\{$") {
        @Override
        TransformOutcome convert(Matcher m, SourceLine line, RuleContext ctx) {
            return TransformOutcome.success("except Exception:", level());
        }
    },

    FINALLY(ConstructKind.EXCEPTION_HANDLER, 2, true, "^finally\\s*\\{$") {
        @Override
        TransformOutcome convert(Matcher m, SourceLine line, RuleContext ctx) {
            return TransformOutcome.success("finally:", level());
        }
    },

    ELSE_IF(ConstructKind.CONDITIONAL_ELIF, 2, true, "^else\\s+if\\s*\\((.*)\\)\\s*\\{$") {
        @Override
        TransformOutcome convert(Matcher m, SourceLine line, RuleContext ctx) {
            return TransformOutcome.success("elif " + condition(m.group(1), line.getLineNumber(), ctx) + ":", level());
        }
    },

    ELSE(ConstructKind.CONDITIONAL_ELSE, 2, true, "^else\\s*\\{$") {
        @Override
        TransformOutcome convert(Matcher m, SourceLine line, RuleContext ctx) {
            return TransformOutcome.success("else:", level());
        }
    },

    IF(ConstructKind.CONDITIONAL_IF, 2, true, "^if\\s*\\((.*)\\)\\s*\\{$") {
        @Override
        TransformOutcome convert(Matcher m, SourceLine line, RuleContext ctx) {
            return TransformOutcome.success("if " + condition(m.group(1), line.getLineNumber(), ctx) + ":", level());
        }
    },

    FOR_COUNTED(ConstructKind.LOOP_FOR, 3, true,
            "^for\\s*\\(\\s*(?:let|var|const)?\\s*(\\w+)\\s*=\\s*([^;]+?)\\s*;\\s*\\1\\s*(<=|<|>=|>)\\s*([^;]+?)\\s*;"
                    + "\\s*(?:\\1\\s*(\\+\\+|--)|\\1\\s*(\\+=|-=)\\s*([^)]+?)|(\\+\\+|--)\\s*\\1)\\s*\\)\\s*\\{$") {
        @Override
        TransformOutcome convert(Matcher m, SourceLine line, RuleContext ctx) {
            int n = line.getLineNumber();
            String v = m.group(1);
            String start = expression(m.group(2), n, ctx);
            String op = m.group(3);
            String bound = expression(m.group(4), n, ctx);

            boolean up;
            String step;
            if (m.group(5) != null || m.group(8) != null) {
                up = "++".equals(m.group(5) != null ? m.group(5) : m.group(8));
                step = up ? "1" : "-1";
            } else {
                up = "+=".equals(m.group(6));
                String amount = expression(m.group(7), n, ctx);
                step = up ? amount : "-" + amount;
            }
            boolean ascending = op.startsWith("<");
            if (up != ascending) {
                return TransformOutcome.failure("counted loop direction does not match its bound, kept as is");
            }

            String stop = bound;
            if ("<=".equals(op)) stop = offset(bound, 1);
            if (">=".equals(op)) stop = offset(bound, -1);

            String range;
            if ("1".equals(step) && "0".equals(start)) {
                range = "range(" + stop + ")";
            } else if ("1".equals(step)) {
                range = "range(" + start + ", " + stop + ")";
            } else {
                range = "range(" + start + ", " + stop + ", " + step + ")";
            }
            return TransformOutcome.success("for " + v + " in " + range + ":", level());
        }
    },

    FOR_OF_PAIR(ConstructKind.LOOP_FOR, 3, true,
            "^for\\s*\\(\\s*(?:const|let|var)?\\s*\\[\\s*(\\w+)\\s*,\\s*(\\w+)\\s*\\]\\s+of\\s+(.+)\\)\\s*\\{$") {
        @Override
        TransformOutcome convert(Matcher m, SourceLine line, RuleContext ctx) {
            String iterable = m.group(3).trim();
            Matcher entries = ENTRIES.matcher(iterable);
            String py;
            if (entries.matches()) {
                py = "enumerate(" + expression(entries.group(1), line.getLineNumber(), ctx) + ")";
            } else {
                py = expression(iterable, line.getLineNumber(), ctx);
            }
            return TransformOutcome.success("for " + m.group(1) + ", " + m.group(2) + " in " + py + ":", level());
        }
    },

    FOR_OF(ConstructKind.LOOP_FOR, 3, true, "^for\\s*\\(\\s*(?:const|let|var)?\\s*(\\w+)\\s+of\\s+(.+)\\)\\s*\\{$") {
        @Override
        TransformOutcome convert(Matcher m, SourceLine line, RuleContext ctx) {
            return TransformOutcome.success(
                    "for " + m.group(1) + " in " + expression(m.group(2).trim(), line.getLineNumber(), ctx) + ":",
                    level());
        }
    },

    FOR_IN(ConstructKind.LOOP_FOR, 3, true, "^for\\s*\\(\\s*(?:const|let|var)?\\s*(\\w+)\\s+in\\s+(.+)\\)\\s*\\{$") {
        @Override
        TransformOutcome convert(Matcher m, SourceLine line, RuleContext ctx) {
            return TransformOutcome.success(
                    "for " + m.group(1) + " in " + expression(m.group(2).trim(), line.getLineNumber(), ctx) + ":",
                    level(),
                    "for-in loops converted to Python for loops. This may behave differently in Python - use .items() if needed.");
        }
    },

    DO_WHILE(ConstructKind.LOOP_WHILE, 2, true, "^do\\s*\\{$") {
        @Override
        TransformOutcome convert(Matcher m, SourceLine line, RuleContext ctx) {
            ctx.diagnostics().unsupported(line.getLineNumber(), kind(), Severity.ERROR, "do-while loop");
            return TransformOutcome.failure("do-while has no python equivalent - rewrite as 'while True:' with a break");
        }
    },

    WHILE(ConstructKind.LOOP_WHILE, 2, true, "^while\\s*\\((.*)\\)\\s*\\{$") {
        @Override
        TransformOutcome convert(Matcher m, SourceLine line, RuleContext ctx) {
            return TransformOutcome.success("while " + condition(m.group(1), line.getLineNumber(), ctx) + ":", level());
        }
    },

    FUNCTION_DECLARATION(ConstructKind.FUNCTION_DEFINITION, 2, true,
            "^(async\\s+)?function\\s*(\\*)?\\s*(\\w+)\\s*\\((.*)\\)\\s*\\{$") {
        @Override
        TransformOutcome convert(Matcher m, SourceLine line, RuleContext ctx) {
            int n = line.getLineNumber();
            if (m.group(2) != null) {
                ctx.diagnostics().warn(n, "generator function '" + m.group(3) + "' converted to def - check yield usage");
            }
            String async = m.group(1) == null ? "" : "async ";
            return TransformOutcome.success(
                    async + "def " + m.group(3) + "(" + JavaScriptToPythonSyntax.parameters(m.group(4), n, ctx) + "):",
                    level());
        }
    },

    FUNCTION_EXPRESSION(ConstructKind.FUNCTION_DEFINITION, 2, true,
            "^(?:const|let|var)\\s+(\\w+)\\s*=\\s*(async\\s+)?function\\s*\\w*\\s*\\((.*)\\)\\s*\\{$") {
        @Override
        TransformOutcome convert(Matcher m, SourceLine line, RuleContext ctx) {
            String async = m.group(2) == null ? "" : "async ";
            return TransformOutcome.success(
                    async + "def " + m.group(1) + "("
                            + JavaScriptToPythonSyntax.parameters(m.group(3), line.getLineNumber(), ctx) + "):",
                    level());
        }
    },

    ARROW_BLOCK(ConstructKind.FUNCTION_DEFINITION, 2, true,
            "^(?:const|let|var)\\s+(\\w+)\\s*=\\s*(?:async\\s+)?(?:\\([^()]*\\)|\\w+)\\s*=>\\s*\\{$") {
        @Override
        TransformOutcome convert(Matcher m, SourceLine line, RuleContext ctx) {
            ctx.diagnostics().unsupported(line.getLineNumber(), kind(), Severity.ERROR,
                    "arrow function with block body: " + m.group(1));
            return TransformOutcome.failure(
                    "arrow function '" + m.group(1) + "' has a block body; rewrite it as a def by hand");
        }
    },

    TRY(ConstructKind.EXCEPTION_TRY, 2, true, "^try\\s*\\{$") {
        @Override
        TransformOutcome convert(Matcher m, SourceLine line, RuleContext ctx) {
            return TransformOutcome.success("try:", level());
        }
    },

    MAP_FILTER_CHAIN(ConstructKind.SEQUENCE_TRANSFORM, 3, false,
            "\\.(?:map|filter)\\(\\s*(?:\\(\\s*\\w+\\s*\\)|\\w+)\\s*=>") {
        @Override
        boolean matchesMasked() {
            return true;
        }

        @Override
        TransformOutcome convert(Matcher m, SourceLine line, RuleContext ctx) {
            int n = line.getLineNumber();
            String rewritten = JavaScriptToPythonSyntax.chain(line.getContent(), n, ctx);
            if (rewritten == null) {
                return TransformOutcome.failure(".map()/.filter() chain could not be converted");
            }
            return TransformOutcome.success(JavaScriptToPythonSyntax.finishStatement(rewritten, n, ctx), level(),
                    ".map()/.filter() converted to a list comprehension - verify logic matches");
        }
    },

    CONSOLE(ConstructKind.OUTPUT_STATEMENT, 1, false, "^console\\.(log|info|debug|warn|error)\\s*\\((.*)\\)\\s*;?$") {
        @Override
        TransformOutcome convert(Matcher m, SourceLine line, RuleContext ctx) {
            return TransformOutcome.success(
                    JavaScriptToPythonSyntax.print(m.group(1), m.group(2), line.getLineNumber(), ctx), level());
        }
    },

    ARROW_BINDING(ConstructKind.VARIABLE_BINDING, 2, false,
            "^(?:const|let|var)\\s+(\\w+)\\s*=\\s*(?:\\(\\s*(\\w+)\\s*\\)|(\\w+))\\s*=>\\s*([^{\\s].*?)\\s*;?$") {
        @Override
        TransformOutcome convert(Matcher m, SourceLine line, RuleContext ctx) {
            String param = m.group(2) != null ? m.group(2) : m.group(3);
            String body = expression(m.group(4), line.getLineNumber(), ctx);
            return TransformOutcome.success(m.group(1) + " = lambda " + param + ": " + body, level(),
                    "Arrow functions converted to lambda. Python lambdas are limited to single expressions; "
                            + "complex functions need manual conversion.");
        }
    },

    MULTI_ARROW_BINDING(ConstructKind.VARIABLE_BINDING, 2, false,
            "^(?:const|let|var)\\s+(\\w+)\\s*=\\s*(?:async\\s+)?\\(([^()]*)\\)\\s*=>") {
        @Override
        TransformOutcome convert(Matcher m, SourceLine line, RuleContext ctx) {
            String params = m.group(2).trim();
            String what = params.isEmpty() ? "no" : "multiple";
            ctx.diagnostics().unsupported(line.getLineNumber(), ConstructKind.FUNCTION_DEFINITION, Severity.ERROR,
                    "arrow function with " + what + " parameters: " + m.group(1));
            return TransformOutcome.failure("arrow function '" + m.group(1) + "' with " + what
                    + " parameters not converted; only single-parameter expression arrows become lambdas");
        }
    },

    ARRAY_DESTRUCTURE(ConstructKind.VARIABLE_BINDING, 1, false,
            "^(?:const|let|var)\\s+\\[([\\w\\s,]+)\\]\\s*=\\s*(.+?)\\s*;?$") {
        @Override
        TransformOutcome convert(Matcher m, SourceLine line, RuleContext ctx) {
            String names = String.join(", ", CodeScan.splitTopLevel(m.group(1), ','));
            return TransformOutcome.success(names + " = " + expression(m.group(2), line.getLineNumber(), ctx), level());
        }
    },

    OBJECT_DESTRUCTURE(ConstructKind.VARIABLE_BINDING, 1, false, "^(?:const|let|var)\\s+\\{([^}]*)\\}\\s*=") {
        @Override
        TransformOutcome convert(Matcher m, SourceLine line, RuleContext ctx) {
            ctx.diagnostics().unsupported(line.getLineNumber(), kind(), Severity.ERROR,
                    "object destructuring {" + m.group(1).trim() + "}");
            return TransformOutcome.failure("object destructuring has no python equivalent, kept as is");
        }
    },

    DECLARATION(ConstructKind.VARIABLE_BINDING, 1, false,
            "^(?:const|let|var)\\s+(\\w+)\\s*=(?!=)(?!\\s*(?:async\\s+)?\\([^()]*\\)\\s*=>)\\s*(.+?)\\s*;?$") {
        @Override
        TransformOutcome convert(Matcher m, SourceLine line, RuleContext ctx) {
            ctx.blocks().declare(m.group(1));
            return TransformOutcome.success(
                    m.group(1) + " = " + expression(m.group(2), line.getLineNumber(), ctx), level());
        }
    },

    EMPTY_DECLARATION(ConstructKind.VARIABLE_BINDING, 1, false, "^(?:let|var)\\s+(\\w+)\\s*;?$") {
        @Override
        TransformOutcome convert(Matcher m, SourceLine line, RuleContext ctx) {
            ctx.blocks().declare(m.group(1));
            return TransformOutcome.success(m.group(1) + " = None", level());
        }
    },

    INCREMENT(ConstructKind.VARIABLE_BINDING, 1, false, "^(?:(\\+\\+|--)\\s*([\\w.\\[\\]]+)|([\\w.\\[\\]]+)\\s*(\\+\\+|--))\\s*;?$") {
        @Override
        TransformOutcome convert(Matcher m, SourceLine line, RuleContext ctx) {
            String target = m.group(2) != null ? m.group(2) : m.group(3);
            String op = m.group(1) != null ? m.group(1) : m.group(4);
            return TransformOutcome.success(
                    JavaScriptToPythonSyntax.tokens(target) + ("++".equals(op) ? " += 1" : " -= 1"), level());
        }
    },

    ASSIGNMENT(ConstructKind.VARIABLE_BINDING, 1, false,
            "^([A-Za-z_$][\\w.$]*(?:\\[[^\\]]*\\])?)\\s*(\\*\\*|\\+|-|\\*|/|%)?=(?!=)\\s*(.+?)\\s*;?$") {
        @Override
        TransformOutcome convert(Matcher m, SourceLine line, RuleContext ctx) {
            String target = JavaScriptToPythonSyntax.tokens(m.group(1));
            String op = m.group(2) == null ? "" : m.group(2);
            return TransformOutcome.success(
                    target + " " + op + "= " + expression(m.group(3), line.getLineNumber(), ctx), level());
        }
    },

    THROW(ConstructKind.METHOD_CALL, 1, false, "^throw\\s+(?:new\\s+)?(\\w+)\\s*\\((.*)\\)\\s*;?$") {
        @Override
        TransformOutcome convert(Matcher m, SourceLine line, RuleContext ctx) {
            String type = m.group(1);
            String pyType;
            switch (type) {
                case "Error":
                    pyType = "Exception";
                    break;
                case "RangeError":
                    pyType = "ValueError";
                    break;
                default:
                    pyType = type;
            }
            return TransformOutcome.success(
                    "raise " + pyType + "(" + expression(m.group(2), line.getLineNumber(), ctx) + ")", level());
        }
    },

    CALL(ConstructKind.METHOD_CALL, 1, false, "[\\w\\])]\\s*\\(|\\.length\\b|=>") {
        @Override
        public boolean matches(String content) {
            return content != null && !content.endsWith("{") && !CONTROL.matcher(content).find()
                    && super.matches(content);
        }

        @Override
        TransformOutcome convert(Matcher m, SourceLine line, RuleContext ctx) {
            return TransformOutcome.success(expression(line.getContent(), line.getLineNumber(), ctx), level());
        }
    };

    private static final Pattern ENTRIES = Pattern.compile("^([\\w.$\\[\\]]+)\\.entries\\(\\)$");
    private static final Pattern CONTROL = Pattern.compile("^(if|while|for|switch|catch|do|else)\\b");
    private static final Pattern INTEGER = Pattern.compile("^-?\\d+$");

    private final ConstructKind kind;
    private final int level;
    private final boolean opensBlock;
    private final Pattern pattern;

    JavaScriptToPythonRule(ConstructKind kind, int level, boolean opensBlock, String regex) {
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

    /** Integer bounds are folded; anything else gets an explicit offset. */
    private static String offset(String bound, int delta) {
        if (INTEGER.matcher(bound).matches()) {
            return new BigInteger(bound).add(BigInteger.valueOf(delta)).toString();
        }
        return bound + (delta > 0 ? " + " : " - ") + Math.abs(delta);
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
