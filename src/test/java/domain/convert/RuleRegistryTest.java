package domain.convert;

import domain.model.ConstructKind;
import domain.model.SourceLine;
import domain.model.TransformOutcome;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RuleRegistryTest {

    private final RuleRegistry python = new RuleRegistry(List.of(PythonToJavaScriptRule.values()));
    private final RuleRegistry javascript = new RuleRegistry(List.of(JavaScriptToPythonRule.values()));

    @Test
    void should_classify_by_earliest_bucket_when_several_match() {
        assertEquals(ConstructKind.CONDITIONAL_ELIF, python.classify("elif x:"));
        assertEquals(ConstructKind.SEQUENCE_TRANSFORM, python.classify("evens = [x for x in xs if x % 2 == 0]"));
        assertEquals(ConstructKind.OUTPUT_STATEMENT, python.classify("print(len(xs))"));
    }

    @Test
    void should_classify_python_lines() {
        assertEquals(ConstructKind.CONDITIONAL_ELIF, python.classify("elif x > 1:"));
        assertEquals(ConstructKind.LOOP_FOR, python.classify("for i in range(3):"));
        assertEquals(ConstructKind.OUTPUT_STATEMENT, python.classify("print(x)"));
        assertEquals(ConstructKind.VARIABLE_BINDING, python.classify("x = 1"));
        assertEquals(ConstructKind.METHOD_CALL, python.classify("items.append(x)"));
        assertEquals(ConstructKind.STATEMENT, python.classify("pass"));
    }

    @Test
    void should_classify_javascript_lines() {
        assertEquals(ConstructKind.CONDITIONAL_ELIF, javascript.classify("else if (x) {"));
        assertEquals(ConstructKind.EXCEPTION_HANDLER, javascript.classify("catch (e) {"));
        assertEquals(ConstructKind.SEQUENCE_TRANSFORM, javascript.classify("const a = b.map(x => x + 1);"));
        assertEquals(ConstructKind.VARIABLE_BINDING, javascript.classify("let x = 1;"));
        assertEquals(ConstructKind.STATEMENT, javascript.classify("break;"));
    }

    @Test
    void should_return_first_matching_rule_in_bucket() {
        assertEquals(PythonToJavaScriptRule.FOR_RANGE, python.firstMatch(ConstructKind.LOOP_FOR, "for i in range(3):"));
        assertEquals(PythonToJavaScriptRule.FOR_EACH, python.firstMatch(ConstructKind.LOOP_FOR, "for i in xs:"));
        assertNull(python.firstMatch(ConstructKind.LOOP_FOR, "x = 1"));
        assertTrue(python.bucket(ConstructKind.STATEMENT).isEmpty());
    }

    @Test
    void should_reject_rule_for_generic_statements() {
        ConversionRule generic = new ConversionRule() {
            @Override
            public ConstructKind kind() {
                return ConstructKind.STATEMENT;
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
                return true;
            }

            @Override
            public TransformOutcome transform(SourceLine line, RuleContext ctx) {
                return TransformOutcome.success(line.getContent(), 1);
            }
        };

        assertThrows(IllegalArgumentException.class, () -> new RuleRegistry(List.of(generic)));
    }
}
