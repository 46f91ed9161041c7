package domain.convert;

import domain.mapping.MappingDirection;
import domain.mapping.MethodMapping;
import domain.mapping.MethodNameMapper;
import domain.mapping.MethodRenameResult;
import domain.model.ConstructKind;
import domain.model.Severity;

/**
 * Per-call state handed to rules: block state, diagnostics and the shared method table.
 */
public final class RuleContext {

    private final BlockState blocks;
    private final DiagnosticsCollector diagnostics;
    private final MethodNameMapper methods;
    private final MappingDirection direction;

    public RuleContext(BlockState blocks, DiagnosticsCollector diagnostics, MethodNameMapper methods,
                       MappingDirection direction) {
        this.blocks = blocks;
        this.diagnostics = diagnostics;
        this.methods = methods;
        this.direction = direction;
    }

    public BlockState blocks() {
        return blocks;
    }

    public DiagnosticsCollector diagnostics() {
        return diagnostics;
    }

    /**
     * Runs the method table over {@code text}. Calls with no equivalent in the target grammar
     * are left as is and reported as warning-severity unsupported constructs.
     */
    public String mapMethods(String text, int lineNumber) {
        if (methods == null || direction == null || text == null || text.isEmpty()) return text;
        MethodRenameResult r = methods.convert(text, direction);
        for (MethodMapping gap : r.getGaps()) {
            String name = gap.sourceName(direction);
            String note = gap.target(direction).note();
            diagnostics.warn(lineNumber, "'" + name + "' has no " + direction.target().id() + " equivalent"
                    + (note.isEmpty() ? "" : " - " + note));
            diagnostics.unsupported(lineNumber, ConstructKind.METHOD_CALL, Severity.WARNING,
                    name + (note.isEmpty() ? "" : ": " + note));
        }
        return r.getText();
    }
}
