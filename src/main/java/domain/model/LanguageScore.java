package domain.model;

/**
 * A candidate grammar with its confidence.
 */
public final class LanguageScore {

    private final String language;
    private final double confidence;

    public LanguageScore(String language, double confidence) {
        this.language = language;
        this.confidence = confidence;
    }

    public String getLanguage() {
        return language;
    }

    public double getConfidence() {
        return confidence;
    }

    @Override
    public String toString() {
        return language + "=" + String.format(java.util.Locale.ROOT, "%.2f", confidence);
    }
}
