package domain.detect;

import domain.model.DetectionResult;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LanguageIdentifierTest {

    private final LanguageIdentifier identifier = new LanguageIdentifier();

    @Test
    void should_know_three_grammars_in_table_order() {
        assertEquals(List.of("python", "javascript", "java"), identifier.languages());
    }

    @Test
    void should_detect_python_with_reason() {
        DetectionResult d = identifier.detect("def f(x):\n    return x\n");

        assertEquals("python", d.getLanguage());
        assertTrue(d.getConfidence() > 0.0);
        assertTrue(d.getReason().startsWith("Found python patterns: function definition (def)"), d.getReason());
    }

    @Test
    void should_detect_javascript() {
        DetectionResult d = identifier.detect("const x = 1;\nconsole.log(x);");

        assertEquals("javascript", d.getLanguage());
        assertEquals(0.195, d.getConfidence(), 1e-9);
        assertEquals("Found javascript patterns: console.log, const declaration", d.getReason());
    }

    @Test
    void should_detect_java_and_rank_alternatives() {
        String java = "public class Main {\n"
                + "  public static void main(String[] args) {\n"
                + "    System.out.println(\"hi\");\n"
                + "  }\n"
                + "}";
        DetectionResult d = identifier.detect(java);

        assertEquals("java", d.getLanguage());
        assertFalse(d.getAlternatives().isEmpty());
        for (int i = 1; i < d.getAlternatives().size(); i++) {
            assertTrue(d.getAlternatives().get(i - 1).getConfidence() >= d.getAlternatives().get(i).getConfidence());
        }
        assertTrue(d.getAlternatives().stream().allMatch(a -> a.getConfidence() > 0.0));
    }

    @Test
    void should_return_unknown_for_blank_or_unmatched_code() {
        assertEquals("No code provided", identifier.detect(" ").getReason());

        DetectionResult d = identifier.detect("12345");
        assertTrue(d.isUnknown());
        assertEquals(0.0, d.getConfidence());
        assertEquals("Could not detect language - no matching patterns found", d.getReason());
    }

    @Test
    void should_break_ties_by_table_order() {
        Map<String, List<SignaturePattern>> table = new LinkedHashMap<>();
        table.put("first", List.of(new SignaturePattern("foo", 1.0)));
        table.put("second", List.of(new SignaturePattern("foo", 1.0)));

        DetectionResult d = new LanguageIdentifier(table).detect("foo");

        assertEquals("first", d.getLanguage());
        assertEquals("second", d.getAlternatives().get(0).getLanguage());
    }

    @Test
    void should_cap_scaled_confidence_at_one() {
        Map<String, List<SignaturePattern>> table = new LinkedHashMap<>();
        table.put("heavy", List.of(new SignaturePattern("x", 5.0)));

        assertEquals(1.0, new LanguageIdentifier(table).detect("x x x").getConfidence());
    }

    @Test
    void should_never_lower_score_when_idioms_of_same_grammar_are_appended() {
        String[] idioms = {"const a = 1;\n", "console.log(a);\n", "let b = () => a;\n", "function f() {\n}\n"};
        StringBuilder code = new StringBuilder("x = 1\n");
        double previous = identifier.rawScore(code.toString(), "javascript");
        for (int round = 0; round < 5; round++) {
            for (String idiom : idioms) {
                code.append(idiom);
                double score = identifier.rawScore(code.toString(), "javascript");
                assertTrue(score >= previous, "score dropped from " + previous + " to " + score + " after " + code);
                previous = score;
            }
        }
        assertTrue(previous > 0.0);
    }

    @Test
    void should_keep_score_flat_once_match_count_passes_cap() {
        String line = "print(x)\n";
        double atCap = identifier.rawScore(line.repeat(3), "python");
        for (int n = 4; n <= 8; n++) {
            assertEquals(atCap, identifier.rawScore(line.repeat(n), "python"), 1e-9, "repeats: " + n);
        }
        assertTrue(atCap > identifier.rawScore(line, "python"));
    }
}
