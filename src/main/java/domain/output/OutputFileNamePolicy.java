package domain.output;

import domain.model.Grammar;

import java.util.Locale;

/**
 * File naming policy for converted code.
 * <p>
 * {@code <source base name>.<target extension>}, e.g. {@code utils/strings.py} to {@code strings.js}.
 * Sub-directories of the source path are kept by the writer, not by this policy.
 */
public final class OutputFileNamePolicy {

    private static final int MAX_BASE_NAME = 180;

    private OutputFileNamePolicy() {
    }

    public static String build(String sourceFile, Grammar target) {
        String base = baseName(sourceFile);
        base = limit(safePart(base, "converted"), MAX_BASE_NAME);
        return base + (target == null ? ".txt" : target.fileExtension());
    }

    /** Last path element without its extension. */
    public static String baseName(String sourceFile) {
        String s = sourceFile == null ? "" : sourceFile.trim().replace('\\', '/');
        int slash = s.lastIndexOf('/');
        if (slash >= 0) s = s.substring(slash + 1);
        int dot = s.lastIndexOf('.');
        if (dot > 0) s = s.substring(0, dot);
        return s;
    }

    /** Parent directory of the source path using '/' separators; empty when there is none. */
    public static String relativeDir(String sourceFile) {
        String s = sourceFile == null ? "" : sourceFile.trim().replace('\\', '/');
        int slash = s.lastIndexOf('/');
        if (slash <= 0) return "";
        String dir = s.substring(0, slash);
        // absolute or parent-relative sources are flattened into the output root
        if (dir.startsWith("/") || dir.contains("..") || dir.contains(":")) return "";
        return dir;
    }

    private static String safePart(String raw, String fallback) {
        String s = (raw == null) ? "" : raw.trim();
        if (s.isEmpty()) s = fallback;
        s = s.replace('\n', '_')
                .replace('\r', '_');

        // Keep only filename-safe characters.
        s = s.replaceAll("[^a-zA-Z0-9._-]", "_");

        if (s.startsWith(".")) s = "_" + s.substring(1);

        // windows reserved names
        String u = s.toUpperCase(Locale.ROOT);
        if (u.equals("CON") || u.equals("PRN") || u.equals("AUX") || u.equals("NUL")
                || u.matches("COM[1-9]") || u.matches("LPT[1-9]")) {
            s = "_" + s;
        }
        return s;
    }

    private static String limit(String s, int max) {
        if (s.length() <= max) return s;
        return s.substring(0, max);
    }
}
