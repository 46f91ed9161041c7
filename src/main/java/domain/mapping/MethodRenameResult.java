package domain.mapping;

import java.util.List;

/**
 * Outcome of {@link MethodNameMapper#convert(String, MappingDirection)}.
 */
public final class MethodRenameResult {

    private final String text;
    private final boolean changed;
    private final List<MethodMapping> gaps;

    MethodRenameResult(String text, boolean changed, List<MethodMapping> gaps) {
        this.text = text;
        this.changed = changed;
        this.gaps = List.copyOf(gaps);
    }

    public String getText() {
        return text;
    }

    public boolean isChanged() {
        return changed;
    }

    /** Calls found in the line whose mapping is unsupported in this direction. */
    public List<MethodMapping> getGaps() {
        return gaps;
    }
}
