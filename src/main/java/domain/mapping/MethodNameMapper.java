package domain.mapping;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Immutable cross-grammar method table.
 *
 * <p>Built once and shared by every pipeline; safe for concurrent use. Rows are applied in
 * table order, so an earlier row wins when two rows share a source name.</p>
 */
public final class MethodNameMapper {

    private final List<MethodMapping> mappings;

    public MethodNameMapper(List<MethodMapping> mappings) {
        this.mappings = Collections.unmodifiableList(new ArrayList<>(mappings == null ? List.of() : mappings));
    }

    public static MethodNameMapper builtIn() {
        return new MethodNameMapper(MethodMappingTable.builtIn());
    }

    /** Extra rows first so they take precedence over the built-in table. */
    public static MethodNameMapper withExtras(List<MethodMapping> extras) {
        List<MethodMapping> all = new ArrayList<>();
        if (extras != null) all.addAll(extras);
        all.addAll(MethodMappingTable.builtIn());
        return new MethodNameMapper(all);
    }

    public int size() {
        return mappings.size();
    }

    public List<MethodMapping> mappings() {
        return mappings;
    }

    /** First row whose source name in {@code direction} equals {@code name}, or null. */
    public MethodMapping lookup(String name, MappingDirection direction) {
        if (name == null || direction == null) return null;
        for (MethodMapping m : mappings) {
            if (name.equals(m.sourceName(direction)) && m.target(direction) != null) return m;
        }
        return null;
    }

    /**
     * Rewrites every known call in {@code line}. Custom rewrites run before plain renames of the
     * same row. Rows unsupported in this direction leave the text as is and are reported as gaps.
     */
    public MethodRenameResult convert(String line, MappingDirection direction) {
        if (line == null || line.isEmpty() || direction == null) {
            return new MethodRenameResult(line == null ? "" : line, false, List.of());
        }
        String text = line;
        List<MethodMapping> gaps = new ArrayList<>();
        for (MethodMapping m : mappings) {
            MethodTarget target = m.target(direction);
            if (target == null) continue;

            switch (target.kind()) {
                case CUSTOM:
                    text = target.applyCustom(text);
                    break;
                case RENAME: {
                    Pattern call = m.sourceCall(direction);
                    if (call == null) break;
                    Matcher matcher = call.matcher(text);
                    if (matcher.find()) {
                        String replacement = m.category == MethodCategory.FREE_FUNCTION
                                ? target.name()
                                : "." + target.name();
                        text = matcher.replaceAll(Matcher.quoteReplacement(replacement));
                    }
                    break;
                }
                case UNSUPPORTED: {
                    Pattern call = m.sourceCall(direction);
                    if (call != null && call.matcher(text).find() && !gaps.contains(m)) {
                        gaps.add(m);
                    }
                    break;
                }
                default:
                    break;
            }
        }
        return new MethodRenameResult(text, !text.equals(line), gaps);
    }
}
