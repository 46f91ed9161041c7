package domain.convert;

import domain.mapping.MethodNameMapper;
import domain.model.ConstructKind;
import domain.model.ConversionResult;
import domain.model.Severity;
import domain.model.UnsupportedConstruct;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PythonToJavaScriptPipelineTest {

    private final PythonToJavaScriptPipeline pipeline = new PythonToJavaScriptPipeline(MethodNameMapper.builtIn());

    private static String lines(String... s) {
        return String.join("\n", s);
    }

    @Test
    void should_convert_function_with_print_and_close_brace() {
        ConversionResult r = pipeline.convert(lines(
                "def greet(name):",
                "    print(f\"Hello {name}\")"));

        assertEquals(lines(
                "function greet(name) {",
                "  console.log(`Hello ${name}`);",
                "}"), r.getConvertedCode());
        assertEquals("python", r.getSourceLanguage());
        assertEquals("javascript", r.getTargetLanguage());
        assertEquals(2, r.getLevel());
        assertTrue(r.getUnsupportedConstructs().isEmpty());
    }

    @Test
    void should_rebuild_closers_for_if_elif_else_chain() {
        ConversionResult r = pipeline.convert(lines(
                "x = 5",
                "if x > 3 and x < 10:",
                "    print(\"mid\")",
                "elif x == 10:",
                "    print(\"ten\")",
                "else:",
                "    print(\"other\")"));

        assertEquals(lines(
                "let x = 5;",
                "if (x > 3 && x < 10) {",
                "  console.log(\"mid\");",
                "}",
                "else if (x === 10) {",
                "  console.log(\"ten\");",
                "}",
                "else {",
                "  console.log(\"other\");",
                "}"), r.getConvertedCode());

        assertEquals(3, r.getMetadata().getBlocksOpened());
        assertEquals(1, r.getMetadata().getMaxDepth());
        assertEquals(1, r.getMetadata().count(ConstructKind.CONDITIONAL_IF));
        assertEquals(3, r.getMetadata().count(ConstructKind.OUTPUT_STATEMENT));
        assertTrue(r.getConfidence() > 0.9, "clean conversion should score high: " + r.getConfidence());
    }

    @Test
    void should_close_nested_blocks_before_comment_of_outer_block() {
        ConversionResult r = pipeline.convert(lines(
                "def f(items):",
                "    for item in items:",
                "        if item:",
                "            print(item)",
                "",
                "    # done",
                "    return len(items)"));

        assertEquals(lines(
                "function f(items) {",
                "  for (let item of items) {",
                "    if (item) {",
                "      console.log(item);",
                "    }",
                "  }",
                "",
                "  // done",
                "  return items.length;",
                "}"), r.getConvertedCode());
        assertEquals(3, r.getMetadata().getMaxDepth());
    }

    @Test
    void should_emit_one_closer_per_opened_block() {
        ConversionResult r = pipeline.convert(lines(
                "def outer():",
                "    while True:",
                "        for i in range(3):",
                "            try:",
                "                work(i)",
                "            except:",
                "                pass"));

        String out = r.getConvertedCode();
        long open = out.chars().filter(c -> c == '{').count();
        long close = out.chars().filter(c -> c == '}').count();
        assertEquals(open, close, out);
        assertTrue(out.contains("while (true) {"), out);
        assertTrue(out.contains("catch (error) {"), out);
    }

    @Test
    void should_convert_range_loops_to_counted_for() {
        ConversionResult r = pipeline.convert(lines(
                "for i in range(5):",
                "    print(i)",
                "for j in range(10, 0, -2):",
                "    print(j)"));

        String out = r.getConvertedCode();
        assertTrue(out.contains("for (let i = 0; i < 5; i++) {"), out);
        assertTrue(out.contains("for (let j = 10; j > 0; j -= 2) {"), out);
        assertEquals(3, r.getLevel());
    }

    @Test
    void should_convert_enumerate_pair_loop_to_entries_destructuring() {
        ConversionResult r = pipeline.convert(lines(
                "for i, name in enumerate(names):",
                "    print(i, name)"));

        assertTrue(r.getConvertedCode().startsWith("for (const [i, name] of names.entries()) {"),
                r.getConvertedCode());
    }

    @Test
    void should_declare_once_and_use_const_for_upper_case_names() {
        ConversionResult r = pipeline.convert(lines(
                "MAX_SIZE = 10",
                "count = 0",
                "count = count + 1",
                "count += 2"));

        assertEquals(lines(
                "const MAX_SIZE = 10;",
                "let count = 0;",
                "count = count + 1;",
                "count += 2;"), r.getConvertedCode());
    }

    @Test
    void should_translate_membership_and_identity_tests() {
        ConversionResult r = pipeline.convert(lines(
                "if x not in items:",
                "    print(x)",
                "if value is None:",
                "    print(value)"));

        assertTrue(r.getConvertedCode().contains("if (!items.includes(x)) {"), r.getConvertedCode());
        assertTrue(r.getConvertedCode().contains("if (value === null) {"), r.getConvertedCode());
    }

    @Test
    void should_convert_try_except_finally() {
        ConversionResult r = pipeline.convert(lines(
                "try:",
                "    risky()",
                "except ValueError as e:",
                "    print(e)",
                "finally:",
                "    cleanup()"));

        assertEquals(lines(
                "try {",
                "  risky();",
                "}",
                "catch (e) {",
                "  console.log(e);",
                "}",
                "finally {",
                "  cleanup();",
                "}"), r.getConvertedCode());
    }

    @Test
    void should_rewrite_list_comprehension_with_warning_record() {
        ConversionResult r = pipeline.convert("squares = [x * x for x in nums if x > 0]");

        assertEquals("let squares = nums.filter(x => x > 0).map(x => x * x);", r.getConvertedCode());
        assertEquals(3, r.getLevel());
        assertEquals(1, r.getUnsupportedConstructs().size());
        UnsupportedConstruct u = r.getUnsupportedConstructs().get(0);
        assertEquals(ConstructKind.SEQUENCE_TRANSFORM, u.getKind());
        assertEquals(Severity.WARNING, u.getSeverity());
        assertEquals(0, r.getErrorCount());
        assertTrue(r.getWarnings().contains(
                "Line 1: List comprehension converted to .map()/.filter() - verify logic matches"), r.getWarnings().toString());
    }

    @Test
    void should_keep_trailing_comment_with_target_prefix() {
        ConversionResult r = pipeline.convert("x = 1  # one");
        assertEquals("let x = 1;  // one", r.getConvertedCode());
    }

    @Test
    void should_not_substitute_tokens_inside_string_literals() {
        ConversionResult r = pipeline.convert("print(\"True and None\")");
        assertEquals("console.log(\"True and None\");", r.getConvertedCode());
    }

    @Test
    void should_report_method_without_javascript_equivalent() {
        ConversionResult r = pipeline.convert("total = sum(values)");

        assertEquals("let total = sum(values);", r.getConvertedCode());
        assertEquals(1, r.getUnsupportedConstructs().size());
        assertEquals(Severity.WARNING, r.getUnsupportedConstructs().get(0).getSeverity());
        assertEquals(ConstructKind.METHOD_CALL, r.getUnsupportedConstructs().get(0).getKind());
        assertTrue(r.getWarnings().get(0).startsWith("Line 1: 'sum' has no javascript equivalent"),
                r.getWarnings().toString());
    }

    @Test
    void should_flag_unrecognized_block_header_as_error() {
        ConversionResult r = pipeline.convert(lines(
                "class Foo:",
                "    pass"));

        assertEquals(1, r.getErrorCount());
        assertEquals(1, r.getUnsupportedConstructs().get(0).getLine());
        assertTrue(r.getWarnings().stream().anyMatch(w -> w.contains("block header not recognized")),
                r.getWarnings().toString());
        assertTrue(r.getConvertedCode().startsWith("class Foo:"), r.getConvertedCode());
    }

    @Test
    void should_warn_when_return_type_hint_is_removed() {
        ConversionResult r = pipeline.convert(lines(
                "def add(a: int, b: int) -> int:",
                "    return a + b"));

        assertTrue(r.getConvertedCode().startsWith("function add(a, b) {"), r.getConvertedCode());
        assertTrue(r.getWarnings().stream().anyMatch(w -> w.contains("type hint")), r.getWarnings().toString());
    }

    @Test
    void should_return_empty_result_when_code_is_blank() {
        ConversionResult r = pipeline.convert("   \n  ");
        assertEquals("", r.getConvertedCode());
        assertEquals(1.0, r.getConfidence());
        assertTrue(r.getWarnings().isEmpty());
    }

    @Test
    void should_keep_line_count_for_statements_without_rules() {
        ConversionResult r = pipeline.convert(lines(
                "x = 1",
                "pass",
                "y = x"));

        assertEquals(3, r.getConvertedCode().split("\n").length);
        assertEquals(3, r.getMetadata().getLinesProcessed());
    }

    @Test
    void should_not_rewrite_membership_inside_dict_comprehension() {
        ConversionResult r = pipeline.convert("d = {k: v for k, v in items}");

        assertFalse(r.getConvertedCode().contains(".includes"), r.getConvertedCode());
        assertEquals(1, r.getErrorCount(), r.getUnsupportedConstructs().toString());
        assertEquals(ConstructKind.SEQUENCE_TRANSFORM, r.getUnsupportedConstructs().get(0).getKind());
    }

    @Test
    void should_not_rewrite_membership_inside_generator_argument() {
        ConversionResult r = pipeline.convert("total = sum(x for x in xs)");

        assertFalse(r.getConvertedCode().contains(".includes"), r.getConvertedCode());
        assertTrue(r.getConvertedCode().contains("for x in xs"), r.getConvertedCode());
        assertEquals(1, r.getErrorCount(), r.getUnsupportedConstructs().toString());
    }

    @Test
    void should_flag_generator_in_condition_without_membership_rewrite() {
        ConversionResult r = pipeline.convert(lines(
                "if any(x in seen for x in xs):",
                "    stop()"));

        assertFalse(r.getConvertedCode().contains(".includes"), r.getConvertedCode());
        assertEquals(1, r.getErrorCount(), r.getUnsupportedConstructs().toString());
    }

    @Test
    void should_flag_any_unknown_colon_header() {
        ConversionResult r = pipeline.convert(lines(
                "for (a, b) in pairs:",
                "    print(a)"));

        assertEquals(1, r.getErrorCount(), r.getUnsupportedConstructs().toString());
        assertEquals(1, r.getUnsupportedConstructs().get(0).getLine());
        assertTrue(r.getWarnings().stream().anyMatch(w -> w.contains("block header not recognized")),
                r.getWarnings().toString());
    }

    @Test
    void should_turn_pass_into_empty_statement() {
        ConversionResult r = pipeline.convert(lines(
                "if x:",
                "    pass"));

        assertEquals(lines(
                "if (x) {",
                "  ;",
                "}"), r.getConvertedCode());
        assertEquals(0, r.getErrorCount());
    }
}
