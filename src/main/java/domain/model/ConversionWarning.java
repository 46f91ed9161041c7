package domain.model;

/**
 * A single batch-level warning, attributed to one source file.
 *
 * <p>Warnings are not fatal; they indicate a risk or missing information that
 * operators should review.</p>
 */
public final class ConversionWarning {

    private final WarningCode code;
    private final String sourceFile;
    private final String sourceLanguage;
    private final String targetLanguage;
    private final String message;
    private final String detail;

    public ConversionWarning(
            WarningCode code,
            String sourceFile,
            String sourceLanguage,
            String targetLanguage,
            String message,
            String detail
    ) {
        this.code = code == null ? WarningCode.TRANSFORM_ERROR : code;
        this.sourceFile = nullToEmpty(sourceFile);
        this.sourceLanguage = nullToEmpty(sourceLanguage);
        this.targetLanguage = nullToEmpty(targetLanguage);
        this.message = nullToEmpty(message);
        this.detail = nullToEmpty(detail);
    }

    public static ConversionWarning of(WarningCode code, ConversionContext ctx, String message) {
        return of(code, ctx, message, "");
    }

    public static ConversionWarning of(WarningCode code, ConversionContext ctx, String message, String detail) {
        ConversionContext c = ctx == null ? ConversionContext.empty() : ctx;
        return new ConversionWarning(code, c.getSourceFile(), c.getSourceLanguage(), c.getTargetLanguage(),
                message, detail);
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    public WarningCode getCode() {
        return code;
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

    public String getMessage() {
        return message;
    }

    public String getDetail() {
        return detail;
    }
}
