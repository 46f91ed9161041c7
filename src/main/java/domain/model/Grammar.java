package domain.model;

import java.util.Locale;

/**
 * Grammars known to the converter and the language identifier.
 *
 * <p>{@link #JAVA} is only a detection candidate; no conversion pair is registered for it.</p>
 */
public enum Grammar {

    PYTHON("python", false, "#", 4, ".py"),
    JAVASCRIPT("javascript", true, "//", 2, ".js"),
    JAVA("java", true, "//", 4, ".java");

    private final String id;
    private final boolean braces;
    private final String commentPrefix;
    private final int indentUnit;
    private final String fileExtension;

    Grammar(String id, boolean braces, String commentPrefix, int indentUnit, String fileExtension) {
        this.id = id;
        this.braces = braces;
        this.commentPrefix = commentPrefix;
        this.indentUnit = indentUnit;
        this.fileExtension = fileExtension;
    }

    public String id() {
        return id;
    }

    /** True when blocks are delimited by braces rather than indentation. */
    public boolean usesBraces() {
        return braces;
    }

    public String commentPrefix() {
        return commentPrefix;
    }

    /** Spaces per nesting level when this grammar is the output. */
    public int indentUnit() {
        return indentUnit;
    }

    public String fileExtension() {
        return fileExtension;
    }

    public String indent(int depth) {
        return " ".repeat(Math.max(0, depth) * indentUnit);
    }

    /** Resolves an id case-insensitively; returns null when unknown. */
    public static Grammar fromId(String raw) {
        if (raw == null) return null;
        String t = raw.trim().toLowerCase(Locale.ROOT);
        for (Grammar g : values()) {
            if (g.id.equals(t)) return g;
        }
        return null;
    }

    @Override
    public String toString() {
        return id;
    }
}
