package domain.convert;

import domain.mapping.MethodNameMapper;
import domain.model.ConstructKind;
import domain.model.ConversionResult;
import domain.model.Grammar;
import domain.model.Severity;
import domain.model.SourceLine;
import domain.model.TransformOutcome;
import domain.model.UnsupportedConstruct;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.function.BiFunction;

import static org.junit.jupiter.api.Assertions.*;

class ConversionPipelineTest {

    private static String lines(String... s) {
        return String.join("\n", s);
    }

    @Test
    void should_record_rule_fault_and_keep_converting_following_lines() {
        ConversionRule exploding = new StubRule(ConstructKind.METHOD_CALL, "boom", (line, ctx) -> {
            throw new IllegalStateException("rule exploded");
        });
        ConversionPipeline pipeline = new StubPipeline(List.of(exploding, PythonToJavaScriptRule.BINDING));

        ConversionResult r = pipeline.convert(lines(
                "boom(x)",
                "x = 1",
                "y = x"));

        assertEquals(lines(
                "generic:boom(x)",
                "let x = 1;",
                "let y = x;"), r.getConvertedCode());
        assertEquals(1, r.getErrorCount());
        UnsupportedConstruct u = r.getUnsupportedConstructs().get(0);
        assertEquals(1, u.getLine());
        assertEquals(ConstructKind.METHOD_CALL, u.getKind());
        assertEquals(Severity.ERROR, u.getSeverity());
        assertEquals("rule exploded", u.getDetail());
        assertTrue(r.getWarnings().contains("Line 1: 'method_call' - rule exploded"), r.getWarnings().toString());
    }

    @Test
    void should_name_exception_type_when_fault_has_no_message() {
        ConversionRule exploding = new StubRule(ConstructKind.METHOD_CALL, "boom", (line, ctx) -> {
            throw new NullPointerException();
        });
        ConversionResult r = new StubPipeline(List.of(exploding)).convert("boom()");

        assertEquals("NullPointerException", r.getUnsupportedConstructs().get(0).getDetail());
        assertEquals("generic:boom()", r.getConvertedCode());
    }

    @Test
    void should_stop_at_first_matching_rule_even_when_it_fails() {
        ConversionRule refusing = new StubRule(ConstructKind.METHOD_CALL, "call", (line, ctx) -> {
            ctx.diagnostics().unsupported(line.getLineNumber(), ConstructKind.METHOD_CALL, Severity.WARNING,
                    "first rule gave up");
            return TransformOutcome.failure("first rule could not convert");
        });
        ConversionRule accepting = new StubRule(ConstructKind.METHOD_CALL, "call",
                (line, ctx) -> TransformOutcome.success("second rule output", 1));
        ConversionPipeline pipeline = new StubPipeline(List.of(refusing, accepting));

        ConversionResult r = pipeline.convert("call()");

        assertEquals("generic:call()", r.getConvertedCode());
        assertEquals(1, r.getUnsupportedConstructs().size());
        assertEquals("first rule gave up", r.getUnsupportedConstructs().get(0).getDetail());
        assertTrue(r.getWarnings().contains("Line 1: first rule could not convert"), r.getWarnings().toString());
    }

    @Test
    void should_skip_rules_that_do_not_match_before_first_match() {
        ConversionRule other = new StubRule(ConstructKind.METHOD_CALL, "nope",
                (line, ctx) -> TransformOutcome.success("wrong", 1));
        ConversionRule accepting = new StubRule(ConstructKind.METHOD_CALL, "call",
                (line, ctx) -> TransformOutcome.success("call();", 1));

        ConversionResult r = new StubPipeline(List.of(other, accepting)).convert("call()");

        assertEquals("call();", r.getConvertedCode());
        assertTrue(r.getUnsupportedConstructs().isEmpty());
    }

    private static final class StubPipeline extends ConversionPipeline {

        StubPipeline(List<ConversionRule> rules) {
            super(Grammar.PYTHON, Grammar.JAVASCRIPT, new RuleRegistry(rules), MethodNameMapper.builtIn());
        }

        @Override
        protected String genericConvert(String content) {
            return "generic:" + content;
        }

        @Override
        protected String unrecognizedBlock(String content, ConstructKind kind) {
            return null;
        }
    }

    private static final class StubRule implements ConversionRule {

        private final ConstructKind kind;
        private final String prefix;
        private final BiFunction<SourceLine, RuleContext, TransformOutcome> body;

        StubRule(ConstructKind kind, String prefix, BiFunction<SourceLine, RuleContext, TransformOutcome> body) {
            this.kind = kind;
            this.prefix = prefix;
            this.body = body;
        }

        @Override
        public ConstructKind kind() {
            return kind;
        }

        @Override
        public int level() {
            return 1;
        }

        @Override
        public boolean opensBlock() {
            return false;
        }

        @Override
        public boolean matches(String content) {
            return content.startsWith(prefix);
        }

        @Override
        public TransformOutcome transform(SourceLine line, RuleContext ctx) {
            return body.apply(line, ctx);
        }
    }
}
