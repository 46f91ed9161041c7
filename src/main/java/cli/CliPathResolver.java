package cli;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Resolves CLI paths. Relative inputs are taken against {@code baseDir} ({@code --baseDir} or
 * {@code -DbaseDir}), falling back to the working directory.
 */
public final class CliPathResolver {

    public static final String PROP_BASE_DIR = "baseDir";

    private CliPathResolver() {}

    /** {@code --baseDir} wins over a {@code -DbaseDir} given to the JVM. */
    public static void applyBaseDirPropertyIfPresent(Map<String, String> argv) {
        String bd = argv == null ? null : trimToNull(argv.get(PROP_BASE_DIR));
        if (bd != null) System.setProperty(PROP_BASE_DIR, bd);
    }

    public static Path resolveBaseDir() {
        String bd = trimToNull(System.getProperty(PROP_BASE_DIR));
        Path p = bd == null ? Paths.get(".") : againstUserDir(bd);
        return p.toAbsolutePath().normalize();
    }

    /** @return null for a blank input */
    public static Path resolvePath(Path baseDir, String input) {
        String raw = trimToNull(input);
        if (raw == null) return null;
        Path p = Paths.get(raw);
        if (!p.isAbsolute()) p = baseDir != null ? baseDir.resolve(p) : againstUserDir(raw);
        return p.toAbsolutePath().normalize();
    }

    private static Path againstUserDir(String raw) {
        Path p = Paths.get(raw);
        return p.isAbsolute() ? p : Paths.get(System.getProperty("user.dir")).resolve(p);
    }

    /** Source files, manifests and mapping tables must be regular files. */
    public static void validateFileExists(Path p, String label) {
        if (p == null) throw new IllegalArgumentException(label + " is null");
        if (!Files.exists(p)) throw new IllegalArgumentException(label + " not found: " + p);
        if (Files.isDirectory(p)) throw new IllegalArgumentException(label + " is a directory: " + p);
    }

    /**
     * {@code --out} names a file when its last element has an extension and is not an existing
     * directory; otherwise it is an output directory.
     */
    public static boolean isFileTarget(Path out) {
        if (out == null || out.getFileName() == null) return false;
        if (Files.isDirectory(out)) return false;
        String name = out.getFileName().toString();
        return name.lastIndexOf('.') > 0;
    }

    public static void mkdirs(Path p) {
        if (p == null) return;
        try {
            Files.createDirectories(p);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to create directory: " + p, e);
        }
    }

    public static String trimToNull(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }
}
