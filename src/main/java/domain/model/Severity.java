package domain.model;

public enum Severity {
    /** Converted, but the result should be reviewed. */
    WARNING,
    /** Left unconverted or converted through the generic fallback after a fault. */
    ERROR
}
