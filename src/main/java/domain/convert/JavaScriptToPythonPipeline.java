package domain.convert;

import domain.mapping.MethodNameMapper;
import domain.model.ConstructKind;
import domain.model.Grammar;

import java.util.List;
import java.util.regex.Pattern;

/**
 * javascript to python. Closing braces are dropped; indentation is rebuilt from brace depth.
 */
public final class JavaScriptToPythonPipeline extends ConversionPipeline {

    private static final RuleRegistry RULES = new RuleRegistry(List.of(JavaScriptToPythonRule.values()));
    private static final Pattern UNRECOGNIZED_HEADER =
            Pattern.compile("^(class|switch|do|with|interface)\\b.*\\{$|^[\\w$]+\\s*\\(.*\\)\\s*\\{$");
    private static final Pattern ONE_LINE_BLOCK =
            Pattern.compile("(?:\\)|=>|\\b(?:else|try|finally|do))\\s*\\{.*\\}\\s*;?$");

    public JavaScriptToPythonPipeline(MethodNameMapper methods) {
        super(Grammar.JAVASCRIPT, Grammar.PYTHON, RULES, methods);
    }

    @Override
    protected String genericConvert(String content) {
        return JavaScriptToPythonSyntax.tokens(JavaScriptToPythonSyntax.stripSemicolon(content));
    }

    @Override
    protected String unrecognizedBlock(String content, ConstructKind kind) {
        if (kind == ConstructKind.STATEMENT && UNRECOGNIZED_HEADER.matcher(content).find()) {
            return "block header not recognized: " + firstWord(content);
        }
        if (ONE_LINE_BLOCK.matcher(CodeScan.maskLiterals(content)).find()) {
            return "block opened and closed on one line: " + firstWord(content);
        }
        return null;
    }
}
