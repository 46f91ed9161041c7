package domain.convert;

import domain.mapping.MethodNameMapper;
import domain.model.ConstructKind;
import domain.model.ConversionResult;
import domain.model.Severity;
import domain.model.UnsupportedConstruct;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class JavaScriptToPythonPipelineTest {

    private final JavaScriptToPythonPipeline pipeline = new JavaScriptToPythonPipeline(MethodNameMapper.builtIn());

    private static String lines(String... s) {
        return String.join("\n", s);
    }

    @Test
    void should_convert_function_and_drop_closing_brace() {
        ConversionResult r = pipeline.convert(lines(
                "function greet(name) {",
                "  console.log(`Hello ${name}`);",
                "}"));

        assertEquals(lines(
                "def greet(name):",
                "    print(f\"Hello {name}\")"), r.getConvertedCode());
        assertEquals("2", r.getMetadata().getExtras().get("indentUnit"));
        assertEquals(1, r.getMetadata().getBlocksOpened());
    }

    @Test
    void should_strip_leading_brace_before_else_branches() {
        ConversionResult r = pipeline.convert(lines(
                "let x = 5;",
                "if (x > 3 && x < 10) {",
                "  console.log(\"mid\");",
                "} else if (x === 10) {",
                "  console.log(\"ten\");",
                "} else {",
                "  console.log(\"other\");",
                "}"));

        assertEquals(lines(
                "x = 5",
                "if x > 3 and x < 10:",
                "    print(\"mid\")",
                "elif x == 10:",
                "    print(\"ten\")",
                "else:",
                "    print(\"other\")"), r.getConvertedCode());
        assertTrue(r.getUnsupportedConstructs().isEmpty());
    }

    @Test
    void should_convert_counted_loops_to_range() {
        ConversionResult r = pipeline.convert(lines(
                "for (let i = 0; i < 5; i++) {",
                "  console.log(i);",
                "}",
                "for (let i = 1; i <= n; i++) {",
                "  console.log(i);",
                "}",
                "for (let i = 10; i > 0; i -= 2) {",
                "  console.log(i);",
                "}"));

        String out = r.getConvertedCode();
        assertTrue(out.contains("for i in range(5):"), out);
        assertTrue(out.contains("for i in range(1, n + 1):"), out);
        assertTrue(out.contains("for i in range(10, 0, -2):"), out);
        assertEquals(3, r.getLevel());
    }

    @Test
    void should_fold_inclusive_integer_bound() {
        ConversionResult r = pipeline.convert(lines(
                "for (let i = 0; i <= 9; i++) {",
                "  total += i;",
                "}"));

        assertEquals(lines(
                "for i in range(10):",
                "    total += i"), r.getConvertedCode());
    }

    @Test
    void should_convert_single_parameter_arrow_to_lambda_with_warning() {
        ConversionResult r = pipeline.convert("const double = x => x * 2;");

        assertEquals("double = lambda x: x * 2", r.getConvertedCode());
        assertEquals(2, r.getLevel());
        assertTrue(r.getWarnings().get(0).startsWith("Line 1: Arrow functions converted to lambda."),
                r.getWarnings().toString());
        assertEquals(0, r.getErrorCount());
    }

    @Test
    void should_flag_multi_parameter_arrow_as_error() {
        ConversionResult r = pipeline.convert("const add = (a, b) => a + b;");

        assertEquals(1, r.getErrorCount());
        UnsupportedConstruct u = r.getUnsupportedConstructs().get(0);
        assertEquals(ConstructKind.FUNCTION_DEFINITION, u.getKind());
        assertEquals(Severity.ERROR, u.getSeverity());
        assertEquals("const add = (a, b) => a + b", r.getConvertedCode());
    }

    @Test
    void should_flag_block_bodied_arrow_as_error() {
        ConversionResult r = pipeline.convert(lines(
                "const handler = (evt) => {",
                "  console.log(evt);",
                "};"));

        assertEquals(1, r.getErrorCount());
        assertTrue(r.getUnsupportedConstructs().get(0).getDetail().contains("block body"),
                r.getUnsupportedConstructs().toString());
    }

    @Test
    void should_rewrite_filter_map_chain_as_list_comprehension() {
        ConversionResult r = pipeline.convert("const evens = nums.filter(n => n % 2 === 0).map(n => n * 10);");

        assertEquals("evens = [n * 10 for n in nums if n % 2 == 0]", r.getConvertedCode());
        assertEquals(3, r.getLevel());
        assertTrue(r.getWarnings().stream().anyMatch(w -> w.contains("list comprehension")),
                r.getWarnings().toString());
    }

    @Test
    void should_convert_try_catch_finally_and_stderr_output() {
        ConversionResult r = pipeline.convert(lines(
                "try {",
                "  risky();",
                "} catch (err) {",
                "  console.error(err);",
                "} finally {",
                "  cleanup();",
                "}"));

        assertEquals(lines(
                "try:",
                "    risky()",
                "except Exception as err:",
                "    print(err, file=sys.stderr)",
                "finally:",
                "    cleanup()"), r.getConvertedCode());
        assertTrue(r.getWarnings().stream().anyMatch(w -> w.contains("import sys")), r.getWarnings().toString());
    }

    @Test
    void should_warn_on_for_in_loop() {
        ConversionResult r = pipeline.convert(lines(
                "for (const key in obj) {",
                "  console.log(key);",
                "}"));

        assertTrue(r.getConvertedCode().startsWith("for key in obj:"), r.getConvertedCode());
        assertTrue(r.getWarnings().contains("Line 1: for-in loops converted to Python for loops. "
                + "This may behave differently in Python - use .items() if needed."), r.getWarnings().toString());
    }

    @Test
    void should_record_do_while_as_unsupported() {
        ConversionResult r = pipeline.convert(lines(
                "do {",
                "  i++;",
                "} while (i < 3);"));

        assertEquals(1, r.getErrorCount());
        assertEquals(ConstructKind.LOOP_WHILE, r.getUnsupportedConstructs().get(0).getKind());
        assertTrue(r.getConvertedCode().contains("i += 1"), r.getConvertedCode());
    }

    @Test
    void should_flag_class_header_as_unrecognized() {
        ConversionResult r = pipeline.convert(lines(
                "class Point {",
                "  constructor(x) {",
                "    this.x = x;",
                "  }",
                "}"));

        assertEquals(2, r.getErrorCount(), r.getUnsupportedConstructs().toString());
        assertTrue(r.getConvertedCode().contains("self.x = x"), r.getConvertedCode());
    }

    @Test
    void should_convert_declarations_literals_and_trailing_comment() {
        ConversionResult r = pipeline.convert(lines(
                "let ready = true;",
                "let nothing;",
                "const items = new Array();",
                "count++; // bump"));

        assertEquals(lines(
                "ready = True",
                "nothing = None",
                "items = Array()",
                "count += 1  # bump"), r.getConvertedCode());
    }

    @Test
    void should_map_methods_and_length() {
        ConversionResult r = pipeline.convert(lines(
                "const n = items.length;",
                "const s = name.toUpperCase();"));
        assertEquals(lines(
                "n = len(items)",
                "s = name.upper()"), r.getConvertedCode());
    }

    @Test
    void should_map_throw_to_raise() {
        ConversionResult r = pipeline.convert("throw new Error(\"bad input\");");
        assertEquals("raise Exception(\"bad input\")", r.getConvertedCode());
    }

    @Test
    void should_detect_four_space_brace_indentation() {
        ConversionResult r = pipeline.convert(lines(
                "if (ok) {",
                "    if (done) {",
                "        stop();",
                "    }",
                "}"));

        assertEquals("4", r.getMetadata().getExtras().get("indentUnit"));
        assertEquals(lines(
                "if ok:",
                "    if done:",
                "        stop()"), r.getConvertedCode());
        assertEquals(2, r.getMetadata().getMaxDepth());
    }

    @Test
    void should_fold_inclusive_bound_beyond_long_range() {
        ConversionResult r = pipeline.convert(lines(
                "for (let i = 0; i <= 9223372036854775807; i++) {",
                "  work(i);",
                "}"));

        assertTrue(r.getConvertedCode().startsWith("for i in range(9223372036854775808):"), r.getConvertedCode());
        assertFalse(r.getConvertedCode().contains("-9223372036854775808"), r.getConvertedCode());
    }

    @Test
    void should_flag_function_opened_and_closed_on_one_line() {
        ConversionResult r = pipeline.convert("function f() {}");

        assertEquals(1, r.getErrorCount(), r.getUnsupportedConstructs().toString());
        assertTrue(r.getUnsupportedConstructs().get(0).getDetail().startsWith("block opened and closed on one line"),
                r.getUnsupportedConstructs().toString());
    }

    @Test
    void should_flag_if_with_inline_body() {
        ConversionResult r = pipeline.convert(lines(
                "if (a) { b(); }",
                "c();"));

        assertEquals(1, r.getErrorCount(), r.getUnsupportedConstructs().toString());
        assertEquals(1, r.getUnsupportedConstructs().get(0).getLine());
        assertTrue(r.getConvertedCode().endsWith("\nc()"), r.getConvertedCode());
    }

    @Test
    void should_fill_empty_blocks_with_pass() {
        ConversionResult r = pipeline.convert(lines(
                "if (a) {",
                "} else {",
                "}"));

        assertEquals(lines(
                "if a:",
                "    pass",
                "else:",
                "    pass"), r.getConvertedCode());
    }

    @Test
    void should_put_pass_after_comment_only_body() {
        ConversionResult r = pipeline.convert(lines(
                "function todo() {",
                "  // later",
                "}",
                "todo();"));

        assertEquals(lines(
                "def todo():",
                "    # later",
                "    pass",
                "todo()"), r.getConvertedCode());
    }
}
