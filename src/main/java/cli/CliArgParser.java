package cli;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * CLI argument parsing helpers.
 */
public final class CliArgParser {

    private CliArgParser() {
    }

    public static int parseInt(String s, int def) {
        if (s == null || s.isBlank()) return def;
        try {
            return Integer.parseInt(s.trim());
        } catch (NumberFormatException e) {
            return def;
        }
    }

    public static long parseLong(String s, long def) {
        if (s == null || s.isBlank()) return def;
        try {
            return Long.parseLong(s.trim());
        } catch (NumberFormatException e) {
            return def;
        }
    }

    public static double parseDouble(String s, double def) {
        if (s == null || s.isBlank()) return def;
        try {
            return Double.parseDouble(s.trim());
        } catch (NumberFormatException e) {
            return def;
        }
    }

    public static boolean parseBoolean(String s, boolean def) {
        if (s == null || s.isBlank()) return def;
        String v = s.trim()
                .toLowerCase(Locale.ROOT);
        return v.equals("true") || v.equals("1") || v.equals("y") || v.equals("yes");
    }

    /**
     * Presence-style flag.
     * <ul>
     *   <li>--strict       => true</li>
     *   <li>--strict=true  => true</li>
     *   <li>--strict=false => false</li>
     * </ul>
     */
    public static boolean flag(Map<String, String> argv, String key) {
        if (argv == null || key == null) return false;
        if (!argv.containsKey(key)) return false;
        String raw = argv.get(key);
        if (raw == null || raw.isBlank()) return true;
        return parseBoolean(raw, true);
    }

    /**
     * Tolerant mode parsing.
     * <ul>
     *   <li>convert / conv / c -> CONVERT (also the default)</li>
     *   <li>detect / identify / d -> DETECT</li>
     *   <li>batch / manifest / b -> BATCH</li>
     * </ul>
     */
    public static CliMode parseMode(String raw) {
        if (raw == null || raw.isBlank()) return CliMode.CONVERT;
        String v = raw.trim()
                .toLowerCase(Locale.ROOT);

        if (v.equals("detect") || v.equals("identify") || v.equals("d")) {
            return CliMode.DETECT;
        }
        if (v.equals("batch") || v.equals("manifest") || v.equals("b")) {
            return CliMode.BATCH;
        }
        if (v.equals("convert") || v.equals("conv") || v.equals("c")) {
            return CliMode.CONVERT;
        }

        // try enum name directly
        try {
            return CliMode.valueOf(v.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ignore) {
            return CliMode.CONVERT;
        }
    }

    public static Map<String, String> parseArgs(String[] args) {
        Map<String, String> m = new HashMap<>();
        if (args == null) return m;

        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            if (a == null) continue;
            a = a.trim();
            if (!a.startsWith("--")) continue;

            String k;
            String v;

            int eq = a.indexOf('=');
            if (eq > 2) {
                k = a.substring(2, eq)
                        .trim();
                v = a.substring(eq + 1)
                        .trim();
            } else {
                k = a.substring(2)
                        .trim();
                v = "";
                if (i + 1 < args.length && args[i + 1] != null && !args[i + 1].startsWith("--")) {
                    v = args[i + 1].trim();
                    i++;
                }
            }

            if (!k.isEmpty()) m.put(k, v);
        }

        return m;
    }
}
