package domain.model;

/**
 * One batch outcome row for reporting.
 *
 * <p>Kept as a simple value object (no behavior) so the CLI and the report
 * writers can share it.</p>
 */
public final class FileConversionResult {

    public static final String STATUS_OK = "OK";
    public static final String STATUS_LOW_CONFIDENCE = "LOW_CONFIDENCE";
    public static final String STATUS_SKIP = "SKIP";
    public static final String STATUS_FAIL = "FAIL";

    private final String status;
    private final String sourceFile;
    private final String sourceLanguage;
    private final String targetLanguage;
    /** True when the source language came from detection rather than the manifest. */
    private final boolean detected;
    private final double confidence;
    private final int level;
    private final int warningCount;
    private final int unsupportedCount;
    private final int errorCount;
    private final String outputFile;
    private final String message;

    public FileConversionResult(String status, String sourceFile, String sourceLanguage, String targetLanguage,
                                String message) {
        this(status, sourceFile, sourceLanguage, targetLanguage, false, 0.0, 0, 0, 0, 0, null, message);
    }

    public FileConversionResult(
            String status,
            String sourceFile,
            String sourceLanguage,
            String targetLanguage,
            boolean detected,
            double confidence,
            int level,
            int warningCount,
            int unsupportedCount,
            int errorCount,
            String outputFile,
            String message
    ) {
        this.status = nullToEmpty(status);
        this.sourceFile = nullToEmpty(sourceFile);
        this.sourceLanguage = nullToEmpty(sourceLanguage);
        this.targetLanguage = nullToEmpty(targetLanguage);
        this.detected = detected;
        this.confidence = confidence;
        this.level = level;
        this.warningCount = warningCount;
        this.unsupportedCount = unsupportedCount;
        this.errorCount = errorCount;
        this.outputFile = nullToEmpty(outputFile);
        this.message = nullToEmpty(message);
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    public String getStatus() {
        return status;
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

    public boolean isDetected() {
        return detected;
    }

    public double getConfidence() {
        return confidence;
    }

    public int getLevel() {
        return level;
    }

    public int getWarningCount() {
        return warningCount;
    }

    public int getUnsupportedCount() {
        return unsupportedCount;
    }

    public int getErrorCount() {
        return errorCount;
    }

    public String getOutputFile() {
        return outputFile;
    }

    public String getMessage() {
        return message;
    }
}
