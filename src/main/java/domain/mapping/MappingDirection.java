package domain.mapping;

import domain.model.Grammar;

public enum MappingDirection {

    PYTHON_TO_JAVASCRIPT(Grammar.PYTHON, Grammar.JAVASCRIPT),
    JAVASCRIPT_TO_PYTHON(Grammar.JAVASCRIPT, Grammar.PYTHON);

    private final Grammar source;
    private final Grammar target;

    MappingDirection(Grammar source, Grammar target) {
        this.source = source;
        this.target = target;
    }

    public Grammar source() {
        return source;
    }

    public Grammar target() {
        return target;
    }

    /** Direction for a grammar pair, or null when the mapper has no table for it. */
    public static MappingDirection of(Grammar source, Grammar target) {
        for (MappingDirection d : values()) {
            if (d.source == source && d.target == target) return d;
        }
        return null;
    }
}
