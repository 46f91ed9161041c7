package domain.convert;

import domain.mapping.MethodNameMapper;
import domain.model.ConstructKind;
import domain.model.Grammar;

import java.util.List;

/**
 * python to javascript. Closing braces are rebuilt from indentation.
 */
public final class PythonToJavaScriptPipeline extends ConversionPipeline {

    private static final RuleRegistry RULES = new RuleRegistry(List.of(PythonToJavaScriptRule.values()));

    public PythonToJavaScriptPipeline(MethodNameMapper methods) {
        super(Grammar.PYTHON, Grammar.JAVASCRIPT, RULES, methods);
    }

    /** {@code pass} becomes an empty statement. */
    @Override
    protected String genericConvert(String content) {
        if ("pass".equals(content)) return ";";
        return PythonToJavaScriptSyntax.tokens(content);
    }

    /** Any statement no rule took that still ends with a colon is a block header. */
    @Override
    protected String unrecognizedBlock(String content, ConstructKind kind) {
        if (kind == ConstructKind.STATEMENT && CodeScan.maskLiterals(content).trim().endsWith(":")) {
            return "block header not recognized: " + firstWord(content);
        }
        return null;
    }
}
