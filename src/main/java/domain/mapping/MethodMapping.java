package domain.mapping;

import java.util.regex.Pattern;

/**
 * One row of the cross-grammar method table.
 *
 * <p>Either name may be null when the member exists in one grammar only. A null target
 * means the row does not take part in that direction.</p>
 */
public final class MethodMapping {

    public final String pythonName;
    public final String javascriptName;
    public final MethodCategory category;

    private final MethodTarget toJavaScript;
    private final MethodTarget toPython;
    private final Pattern pythonCall;
    private final Pattern javascriptCall;

    public MethodMapping(String pythonName, String javascriptName, MethodCategory category,
                         MethodTarget toJavaScript, MethodTarget toPython) {
        this.pythonName = blankToNull(pythonName);
        this.javascriptName = blankToNull(javascriptName);
        this.category = category == null ? MethodCategory.TEXT : category;
        this.toJavaScript = toJavaScript;
        this.toPython = toPython;
        this.pythonCall = callPattern(this.pythonName, this.category);
        this.javascriptCall = callPattern(this.javascriptName, this.category);
    }

    /** Plain rename in both directions. */
    public static MethodMapping renamed(String pythonName, String javascriptName, MethodCategory category) {
        return new MethodMapping(pythonName, javascriptName, category,
                MethodTarget.rename(javascriptName), MethodTarget.rename(pythonName));
    }

    private static Pattern callPattern(String name, MethodCategory category) {
        if (name == null) return null;
        String quoted = Pattern.quote(name);
        if (category == MethodCategory.FREE_FUNCTION) {
            return Pattern.compile("(?<![\\w.])" + quoted + "(?=\\s*\\()");
        }
        return Pattern.compile("\\." + quoted + "(?=\\s*\\()");
    }

    private static String blankToNull(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }

    public String sourceName(MappingDirection direction) {
        return direction == MappingDirection.PYTHON_TO_JAVASCRIPT ? pythonName : javascriptName;
    }

    public MethodTarget target(MappingDirection direction) {
        return direction == MappingDirection.PYTHON_TO_JAVASCRIPT ? toJavaScript : toPython;
    }

    /** Pattern for {@code .name(} (or {@code name(} for free functions) in the direction's source grammar. */
    Pattern sourceCall(MappingDirection direction) {
        return direction == MappingDirection.PYTHON_TO_JAVASCRIPT ? pythonCall : javascriptCall;
    }

    @Override
    public String toString() {
        return "MethodMapping{" + pythonName + " <-> " + javascriptName + ", " + category + "}";
    }
}
