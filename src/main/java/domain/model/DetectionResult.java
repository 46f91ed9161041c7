package domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Best-guess grammar for a snippet.
 */
public final class DetectionResult {

    public static final String UNKNOWN = "unknown";

    private final String language;
    private final double confidence;
    private final String reason;
    private final List<LanguageScore> alternatives;

    public DetectionResult(String language, double confidence, String reason, List<LanguageScore> alternatives) {
        this.language = (language == null || language.isBlank()) ? UNKNOWN : language;
        this.confidence = Math.max(0.0, Math.min(1.0, confidence));
        this.reason = reason == null ? "" : reason;
        this.alternatives = alternatives == null
                ? List.of()
                : Collections.unmodifiableList(new ArrayList<>(alternatives));
    }

    public static DetectionResult unknown(String reason) {
        return new DetectionResult(UNKNOWN, 0.0, reason, List.of());
    }

    public String getLanguage() {
        return language;
    }

    public boolean isUnknown() {
        return UNKNOWN.equals(language);
    }

    public double getConfidence() {
        return confidence;
    }

    public String getReason() {
        return reason;
    }

    /** Other candidates with a non-zero score, highest first. */
    public List<LanguageScore> getAlternatives() {
        return alternatives;
    }
}
