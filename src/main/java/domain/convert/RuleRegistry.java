package domain.convert;

import domain.model.ConstructKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered rule buckets per construct kind.
 *
 * <p>Bucket priority follows the first appearance of each kind in the rule list; inside a
 * bucket rules keep list order, so specific rules must be listed before general ones.</p>
 */
public final class RuleRegistry {

    private final Map<ConstructKind, List<ConversionRule>> buckets;

    public RuleRegistry(List<? extends ConversionRule> rules) {
        Map<ConstructKind, List<ConversionRule>> m = new LinkedHashMap<>();
        for (ConversionRule r : rules) {
            if (r.kind() == ConstructKind.STATEMENT) {
                throw new IllegalArgumentException("generic statements have no rules: " + r);
            }
            m.computeIfAbsent(r.kind(), k -> new ArrayList<>()).add(r);
        }
        Map<ConstructKind, List<ConversionRule>> frozen = new LinkedHashMap<>();
        m.forEach((k, v) -> frozen.put(k, Collections.unmodifiableList(v)));
        this.buckets = Collections.unmodifiableMap(frozen);
    }

    /** First kind whose bucket has a matching rule; {@link ConstructKind#STATEMENT} otherwise. */
    public ConstructKind classify(String content) {
        for (Map.Entry<ConstructKind, List<ConversionRule>> e : buckets.entrySet()) {
            for (ConversionRule r : e.getValue()) {
                if (r.matches(content)) return e.getKey();
            }
        }
        return ConstructKind.STATEMENT;
    }

    public boolean matchesKind(ConstructKind kind, String content) {
        for (ConversionRule r : bucket(kind)) {
            if (r.matches(content)) return true;
        }
        return false;
    }

    /** First rule of the kind's bucket that matches, or null. */
    public ConversionRule firstMatch(ConstructKind kind, String content) {
        for (ConversionRule r : bucket(kind)) {
            if (r.matches(content)) return r;
        }
        return null;
    }

    public List<ConversionRule> bucket(ConstructKind kind) {
        List<ConversionRule> b = buckets.get(kind);
        return b == null ? List.of() : b;
    }
}
