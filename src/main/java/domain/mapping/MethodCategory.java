package domain.mapping;

import java.util.Locale;

public enum MethodCategory {
    TEXT,
    SEQUENCE,
    ASSOCIATIVE,
    FREE_FUNCTION;

    /** Tolerant parse for loader input ("string", "list", "dict", "builtin" accepted); defaults to TEXT. */
    public static MethodCategory parse(String raw) {
        if (raw == null || raw.isBlank()) return TEXT;
        String t = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        switch (t) {
            case "STRING":
                return TEXT;
            case "LIST":
            case "ARRAY":
                return SEQUENCE;
            case "DICT":
            case "MAP":
            case "OBJECT":
            case "ASSOCIATIVE_COLLECTION":
                return ASSOCIATIVE;
            case "BUILTIN":
            case "FUNCTION":
                return FREE_FUNCTION;
            default:
                for (MethodCategory c : values()) {
                    if (c.name().equals(t)) return c;
                }
                return TEXT;
        }
    }
}
