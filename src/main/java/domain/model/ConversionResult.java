package domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable outcome of one convert call.
 */
public final class ConversionResult {

    private final String convertedCode;
    private final String sourceLanguage;
    private final String targetLanguage;
    private final double confidence;
    private final List<String> warnings;
    private final List<UnsupportedConstruct> unsupportedConstructs;
    private final int errorCount;
    private final int level;
    private final ConversionMetadata metadata;

    public ConversionResult(
            String convertedCode,
            String sourceLanguage,
            String targetLanguage,
            double confidence,
            List<String> warnings,
            List<UnsupportedConstruct> unsupportedConstructs,
            int level,
            ConversionMetadata metadata
    ) {
        this.convertedCode = convertedCode == null ? "" : convertedCode;
        this.sourceLanguage = sourceLanguage == null ? "" : sourceLanguage;
        this.targetLanguage = targetLanguage == null ? "" : targetLanguage;
        this.confidence = clamp(confidence);
        this.warnings = warnings == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(warnings));
        this.unsupportedConstructs = unsupportedConstructs == null
                ? List.of()
                : Collections.unmodifiableList(new ArrayList<>(unsupportedConstructs));
        this.errorCount = (int) this.unsupportedConstructs.stream().filter(UnsupportedConstruct::isError).count();
        this.level = level;
        this.metadata = metadata == null ? ConversionMetadata.empty() : metadata;
    }

    private static double clamp(double v) {
        if (Double.isNaN(v)) return 0.0;
        return Math.max(0.0, Math.min(1.0, v));
    }

    /** Copy with {@code warning} placed before the existing warnings. */
    public ConversionResult withLeadingWarning(String warning) {
        List<String> next = new ArrayList<>(warnings.size() + 1);
        next.add(warning);
        next.addAll(warnings);
        return new ConversionResult(convertedCode, sourceLanguage, targetLanguage, confidence,
                next, unsupportedConstructs, level, metadata);
    }

    public String getConvertedCode() {
        return convertedCode;
    }

    public String getSourceLanguage() {
        return sourceLanguage;
    }

    public String getTargetLanguage() {
        return targetLanguage;
    }

    public double getConfidence() {
        return confidence;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    public List<UnsupportedConstruct> getUnsupportedConstructs() {
        return unsupportedConstructs;
    }

    /** Number of error-severity unsupported constructs. */
    public int getErrorCount() {
        return errorCount;
    }

    /** Highest rule level reached (1..3); 0 only for degraded or undetected results. */
    public int getLevel() {
        return level;
    }

    public ConversionMetadata getMetadata() {
        return metadata;
    }
}
