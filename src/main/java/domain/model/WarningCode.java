package domain.model;

/**
 * Standard warning codes for batch conversion reporting.
 *
 * <p>Keep the set small and stable. Add codes only when the meaning is clear
 * and actionable for operators.</p>
 */
public enum WarningCode {

    /**
     * Source file is empty or blank and the row is skipped.
     */
    SOURCE_EMPTY,

    /**
     * Source file could not be read.
     */
    SOURCE_READ_FAILED,

    /**
     * Source language was not given and could not be detected.
     */
    LANGUAGE_NOT_DETECTED,

    /**
     * No pipeline is registered for the requested language pair.
     */
    UNSUPPORTED_PAIR,

    /**
     * The pipeline recorded a construct it could not convert.
     */
    UNSUPPORTED_CONSTRUCT,

    /**
     * Free-text warning produced by the pipeline.
     */
    CONVERSION_NOTE,

    /**
     * Strict mode was requested and error-severity constructs were found.
     */
    STRICT_MODE_VIOLATION,

    /**
     * Confidence is below the configured threshold.
     */
    LOW_CONFIDENCE,

    /**
     * Conversion failed with an exception.
     */
    TRANSFORM_ERROR,

    /**
     * Processing time exceeded the configured slow threshold.
     */
    SLOW_CONVERSION
}
