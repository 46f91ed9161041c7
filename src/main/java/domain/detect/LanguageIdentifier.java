package domain.detect;

import domain.model.DetectionResult;
import domain.model.Grammar;
import domain.model.LanguageScore;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Weighted-pattern scoring of a snippet against every known grammar.
 *
 * <p>Raw score per grammar is the sum over its patterns of {@code weight * min(matches, 3)};
 * confidence is {@code min(score / 10, 1)}. Ties keep table order (python, javascript, java)
 * because the ranking sort is stable.</p>
 */
public final class LanguageIdentifier {

    private static final double SCORE_SCALE = 10.0;
    private static final int REASON_PATTERNS = 4;

    private final Map<String, List<SignaturePattern>> table;

    public LanguageIdentifier() {
        this(defaultTable());
    }

    public LanguageIdentifier(Map<String, List<SignaturePattern>> table) {
        Map<String, List<SignaturePattern>> copy = new LinkedHashMap<>();
        table.forEach((k, v) -> copy.put(k, List.copyOf(v)));
        this.table = Collections.unmodifiableMap(copy);
    }

    public List<String> languages() {
        return new ArrayList<>(table.keySet());
    }

    /** Raw (unscaled) score of {@code code} for one grammar; 0 for an unknown id. */
    public double rawScore(String code, String language) {
        List<SignaturePattern> patterns = table.get(language);
        if (patterns == null || code == null) return 0.0;
        double score = 0.0;
        for (SignaturePattern p : patterns) {
            score += p.score(code);
        }
        return score;
    }

    public DetectionResult detect(String code) {
        if (code == null || code.isBlank()) {
            return DetectionResult.unknown("No code provided");
        }

        List<LanguageScore> ranked = new ArrayList<>();
        for (String lang : table.keySet()) {
            ranked.add(new LanguageScore(lang, rawScore(code, lang)));
        }
        // List.sort is stable; equal scores stay in table order
        ranked.sort(Comparator.comparingDouble(LanguageScore::getConfidence).reversed());

        LanguageScore top = ranked.get(0);
        if (top.getConfidence() == 0.0) {
            return DetectionResult.unknown("Could not detect language - no matching patterns found");
        }

        List<LanguageScore> alternatives = new ArrayList<>();
        for (LanguageScore s : ranked.subList(1, ranked.size())) {
            if (s.getConfidence() > 0.0) {
                alternatives.add(new LanguageScore(s.getLanguage(), scale(s.getConfidence())));
            }
        }
        return new DetectionResult(top.getLanguage(), scale(top.getConfidence()),
                reason(code, top.getLanguage()), alternatives);
    }

    private String reason(String code, String language) {
        List<String> found = new ArrayList<>();
        for (SignaturePattern p : table.get(language)) {
            if (p.foundIn(code)) found.add(p.readable());
            if (found.size() == REASON_PATTERNS) break;
        }
        if (found.isEmpty()) return "Detected as " + language + " (low confidence)";
        return "Found " + language + " patterns: " + String.join(", ", found);
    }

    private static double scale(double raw) {
        return Math.min(raw / SCORE_SCALE, 1.0);
    }

    static Map<String, List<SignaturePattern>> defaultTable() {
        Map<String, List<SignaturePattern>> m = new LinkedHashMap<>();
        m.put(Grammar.PYTHON.id(), List.of(
                new SignaturePattern("\\bdef\\s+\\w+\\s*\\(", 1.0, "function definition (def)"),
                new SignaturePattern("\\bimport\\s+", 0.8, "import statement"),
                new SignaturePattern("\\bfrom\\s+.*\\s+import\\s+", 0.9),
                new SignaturePattern("@\\w+", 0.7),
                new SignaturePattern("\\bprint\\s*\\(", 0.6),
                new SignaturePattern("\\belif\\s+", 0.95),
                new SignaturePattern("__name__\\s*==\\s*['\"]__main__['\"]", 1.0),
                new SignaturePattern(":\\s*$", 0.4),
                new SignaturePattern("^\\s{4,}", 0.3),
                new SignaturePattern("\\bclass\\s+", 0.7, "class definition"),
                new SignaturePattern("\\blambda\\s+", 0.8),
                new SignaturePattern("\\btry\\s*:", 0.6),
                new SignaturePattern("\\bexcept\\s+", 0.85),
                new SignaturePattern("\\bfinally\\s*:", 0.7),
                new SignaturePattern("\\bwith\\s+", 0.7),
                new SignaturePattern("\\bas\\s+\\w+:", 0.6),
                new SignaturePattern("\\bfor\\s+\\w+\\s+in\\s+", 0.9),
                new SignaturePattern("\\bwhile\\s+", 0.6),
                new SignaturePattern("\\bpass\\b", 0.9),
                new SignaturePattern("\\bNone\\b", 0.4),
                new SignaturePattern("\\bTrue\\b|\\bFalse\\b", 0.3)));
        m.put(Grammar.JAVASCRIPT.id(), List.of(
                new SignaturePattern("console\\.log\\s*\\(", 1.0, "console.log"),
                new SignaturePattern("\\bconst\\s+", 0.95, "const declaration"),
                new SignaturePattern("\\blet\\s+", 0.95),
                new SignaturePattern("\\bvar\\s+", 0.7),
                new SignaturePattern("\\bfunction\\s+\\w+\\s*\\(", 0.9),
                new SignaturePattern("=>", 0.95, "arrow function"),
                new SignaturePattern("\\basync\\s+", 0.8),
                new SignaturePattern("\\bawait\\s+", 0.8),
                new SignaturePattern("\\bimport\\s+", 0.6, "import statement"),
                new SignaturePattern("\\bexport\\s+", 0.8),
                new SignaturePattern("\\{.*\\}", 0.2),
                new SignaturePattern("this\\.", 0.7),
                new SignaturePattern("\\bnew\\s+", 0.6),
                new SignaturePattern("\\bfunction\\s*\\*", 0.8),
                new SignaturePattern("\\bclass\\s+", 0.7, "class definition"),
                new SignaturePattern("\\bthrow\\s+", 0.7),
                new SignaturePattern("\\bcatch\\s*\\(", 0.85),
                new SignaturePattern("\\bfinally\\s*\\{", 0.7),
                new SignaturePattern("\\btry\\s*\\{", 0.7),
                new SignaturePattern("\\.map\\s*\\(", 0.7),
                new SignaturePattern("\\.filter\\s*\\(", 0.7)));
        m.put(Grammar.JAVA.id(), List.of(
                new SignaturePattern("System\\.out\\.println\\s*\\(", 1.0, "println statement"),
                new SignaturePattern("\\bpublic\\s+static\\s+void\\s+main", 1.0, "main method"),
                new SignaturePattern("\\bpublic\\s+class\\s+", 0.95),
                new SignaturePattern("\\bprivate\\s+", 0.8),
                new SignaturePattern("\\bprotected\\s+", 0.8),
                new SignaturePattern("\\bnew\\s+\\w+\\s*\\(", 0.7),
                new SignaturePattern("\\bimport\\s+java", 0.95),
                new SignaturePattern("\\bint\\s+", 0.6),
                new SignaturePattern("\\bString\\s+", 0.6),
                new SignaturePattern("\\btry\\s*\\{", 0.7),
                new SignaturePattern("\\bcatch\\s*\\(", 0.85),
                new SignaturePattern("\\bthrows\\s+", 0.85),
                new SignaturePattern("\\bboolean\\s+", 0.7),
                new SignaturePattern("\\bvoid\\s+", 0.7),
                new SignaturePattern("\\bfor\\s*\\(", 0.5),
                new SignaturePattern("\\bwhile\\s*\\(", 0.3),
                new SignaturePattern("@Override", 0.9),
                new SignaturePattern("\\binterface\\s+", 0.8),
                new SignaturePattern("\\benum\\s+", 0.8)));
        return m;
    }
}
