package domain.detect;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One weighted idiom of a grammar. Matching is multi-line and case-insensitive.
 */
public final class SignaturePattern {

    private static final int MAX_COUNTED_MATCHES = 3;
    private static final int MAX_FALLBACK_LENGTH = 30;

    private final String regex;
    private final Pattern pattern;
    private final double weight;
    private final String description;

    public SignaturePattern(String regex, double weight, String description) {
        this.regex = regex;
        this.pattern = Pattern.compile(regex, Pattern.MULTILINE | Pattern.CASE_INSENSITIVE);
        this.weight = weight;
        this.description = description;
    }

    public SignaturePattern(String regex, double weight) {
        this(regex, weight, null);
    }

    public String getRegex() {
        return regex;
    }

    public double getWeight() {
        return weight;
    }

    /** Non-overlapping match count. */
    public int count(String code) {
        Matcher m = pattern.matcher(code);
        int n = 0;
        while (m.find()) n++;
        return n;
    }

    public boolean foundIn(String code) {
        return pattern.matcher(code).find();
    }

    /** weight x min(matches, 3). */
    public double score(String code) {
        int n = count(code);
        return n == 0 ? 0.0 : weight * Math.min(n, MAX_COUNTED_MATCHES);
    }

    /** Human-readable name; falls back to the simplified regex. */
    public String readable() {
        if (description != null) return description;
        String s = regex.replace("\\b", "").replace("\\s+", " ").replace("\\s*", "");
        return s.length() > MAX_FALLBACK_LENGTH ? s.substring(0, MAX_FALLBACK_LENGTH) : s;
    }
}
