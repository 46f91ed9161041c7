package domain.mapping;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * What a mapping does in one direction: rename the member call, rewrite with custom patterns,
 * or report that the target grammar has no equivalent.
 */
public final class MethodTarget {

    public enum Kind { RENAME, CUSTOM, UNSUPPORTED }

    /** One regex rewrite; the replacement uses {@link Matcher#replaceAll(String)} syntax. */
    public static final class Rewrite {
        final Pattern pattern;
        final String replacement;

        Rewrite(String regex, String replacement) {
            this.pattern = Pattern.compile(regex);
            this.replacement = replacement;
        }
    }

    private final Kind kind;
    private final String name;
    private final List<Rewrite> rewrites;
    private final String note;

    private MethodTarget(Kind kind, String name, List<Rewrite> rewrites, String note) {
        this.kind = kind;
        this.name = name;
        this.rewrites = rewrites;
        this.note = note == null ? "" : note;
    }

    public static MethodTarget rename(String name) {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("rename target is blank");
        return new MethodTarget(Kind.RENAME, name.trim(), List.of(), null);
    }

    /**
     * @param regexAndReplacement alternating regex / replacement pairs, tried in order
     */
    public static MethodTarget custom(String... regexAndReplacement) {
        if (regexAndReplacement.length == 0 || regexAndReplacement.length % 2 != 0) {
            throw new IllegalArgumentException("custom target needs regex/replacement pairs");
        }
        List<Rewrite> list = new ArrayList<>();
        for (int i = 0; i < regexAndReplacement.length; i += 2) {
            list.add(new Rewrite(regexAndReplacement[i], regexAndReplacement[i + 1]));
        }
        return new MethodTarget(Kind.CUSTOM, null, Collections.unmodifiableList(list), null);
    }

    public static MethodTarget unsupported(String note) {
        return new MethodTarget(Kind.UNSUPPORTED, null, List.of(), note);
    }

    public Kind kind() {
        return kind;
    }

    public String name() {
        return name;
    }

    public String note() {
        return note;
    }

    /** Applies the first matching rewrite to every occurrence; returns the input when none matches. */
    String applyCustom(String line) {
        for (Rewrite r : rewrites) {
            Matcher m = r.pattern.matcher(line);
            if (m.find()) {
                return m.replaceAll(r.replacement);
            }
        }
        return line;
    }
}
