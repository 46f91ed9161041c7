package domain.model;

import java.nio.file.Path;

/**
 * One manifest row: a source file and the conversion requested for it.
 */
public class ConversionJob {

    private final String sourceFile;
    private final Path path;
    // optional; null means detect
    private final String sourceLanguage;
    private final String targetLanguage;
    // optional; null means the run-wide default
    private final Boolean strict;

    public ConversionJob(String sourceFile, Path path, String sourceLanguage, String targetLanguage, Boolean strict) {
        this.sourceFile = sourceFile;
        this.path = path;
        this.sourceLanguage = sourceLanguage;
        this.targetLanguage = targetLanguage;
        this.strict = strict;
    }

    /** Path as written in the manifest; used for reporting and output layout. */
    public String getSourceFile() {
        return sourceFile;
    }

    /** Absolute path resolved against the manifest directory. */
    public Path getPath() {
        return path;
    }

    public String getSourceLanguage() {
        return sourceLanguage;
    }

    public boolean needsDetection() {
        return sourceLanguage == null || sourceLanguage.isBlank();
    }

    public String getTargetLanguage() {
        return targetLanguage;
    }

    public boolean isStrict(boolean defaultStrict) {
        return strict == null ? defaultStrict : strict;
    }

    @Override
    public String toString() {
        return "ConversionJob{" +
                "sourceFile='" + sourceFile + '\'' +
                ", source='" + sourceLanguage + '\'' +
                ", target='" + targetLanguage + '\'' +
                ", strict=" + strict +
                '}';
    }
}
