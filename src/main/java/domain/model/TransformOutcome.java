package domain.model;

/**
 * Result of one rule transform.
 */
public final class TransformOutcome {

    private final boolean success;
    private final String text;
    private final int level;
    private final String warning;

    private TransformOutcome(boolean success, String text, int level, String warning) {
        this.success = success;
        this.text = text;
        this.level = level;
        this.warning = warning;
    }

    public static TransformOutcome success(String text, int level) {
        return success(text, level, null);
    }

    public static TransformOutcome success(String text, int level, String warning) {
        if (level < 1 || level > 3) throw new IllegalArgumentException("level must be 1..3: " + level);
        return new TransformOutcome(true, text == null ? "" : text, level, warning);
    }

    public static TransformOutcome failure(String warning) {
        return new TransformOutcome(false, null, 0, warning);
    }

    public boolean isSuccess() {
        return success;
    }

    /** Converted line content without indentation; null on failure. */
    public String getText() {
        return text;
    }

    public int getLevel() {
        return level;
    }

    public String getWarning() {
        return warning;
    }
}
