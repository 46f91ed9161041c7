package domain.model;

/**
 * Per-file conversion context used for warning attribution.
 *
 * <p>Immutable. The source language may be filled in only after detection,
 * see {@link #withSourceLanguage(String)}.</p>
 */
public final class ConversionContext {

    private static final ConversionContext EMPTY = new ConversionContext("", "", "");

    private final String sourceFile;
    private final String sourceLanguage;
    private final String targetLanguage;

    public ConversionContext(String sourceFile, String sourceLanguage, String targetLanguage) {
        this.sourceFile = safe(sourceFile);
        this.sourceLanguage = safe(sourceLanguage);
        this.targetLanguage = safe(targetLanguage);
    }

    public static ConversionContext empty() {
        return EMPTY;
    }

    private static String safe(String s) {
        return s == null ? "" : s;
    }

    public ConversionContext withSourceLanguage(String language) {
        return new ConversionContext(sourceFile, language, targetLanguage);
    }

    public String getSourceFile() {
        return sourceFile;
    }

    public String getSourceLanguage() {
        return sourceLanguage;
    }

    public String getTargetLanguage() {
        return targetLanguage;
    }
}
