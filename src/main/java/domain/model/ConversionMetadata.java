package domain.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-call conversion statistics.
 */
public final class ConversionMetadata {

    private final int linesProcessed;
    private final int blocksOpened;
    private final int maxDepth;
    private final Map<ConstructKind, Integer> constructCounts;
    private final Map<String, String> extras;

    public ConversionMetadata(
            int linesProcessed,
            int blocksOpened,
            int maxDepth,
            Map<ConstructKind, Integer> constructCounts,
            Map<String, String> extras
    ) {
        this.linesProcessed = linesProcessed;
        this.blocksOpened = blocksOpened;
        this.maxDepth = maxDepth;
        EnumMap<ConstructKind, Integer> counts = new EnumMap<>(ConstructKind.class);
        if (constructCounts != null) counts.putAll(constructCounts);
        counts.remove(ConstructKind.STATEMENT);
        this.constructCounts = Collections.unmodifiableMap(counts);
        this.extras = extras == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(extras));
    }

    public static ConversionMetadata empty() {
        return new ConversionMetadata(0, 0, 0, null, null);
    }

    public static ConversionMetadata ofLines(int linesProcessed) {
        return new ConversionMetadata(linesProcessed, 0, 0, null, null);
    }

    public int getLinesProcessed() {
        return linesProcessed;
    }

    public int getBlocksOpened() {
        return blocksOpened;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    /** Counts per construct kind; generic statements are never included. */
    public Map<ConstructKind, Integer> getConstructCounts() {
        return constructCounts;
    }

    public int count(ConstructKind kind) {
        Integer n = constructCounts.get(kind);
        return n == null ? 0 : n;
    }

    public Map<String, String> getExtras() {
        return extras;
    }

    public ConversionMetadata withExtra(String key, String value) {
        Map<String, String> next = new LinkedHashMap<>(extras);
        next.put(key, value);
        return new ConversionMetadata(linesProcessed, blocksOpened, maxDepth, constructCounts, next);
    }
}
