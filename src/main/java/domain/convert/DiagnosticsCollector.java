package domain.convert;

import domain.model.ConstructKind;
import domain.model.Severity;
import domain.model.UnsupportedConstruct;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Append-only collector of warnings and unsupported-construct records for one conversion call.
 *
 * <p>Identical warning strings are kept once, in first-seen order. Unsupported records are
 * never de-duplicated because each one is tied to a line.</p>
 */
public final class DiagnosticsCollector {

    private final Set<String> warnings = new LinkedHashSet<>();
    private final List<UnsupportedConstruct> unsupported = new ArrayList<>();

    public void warn(String message) {
        if (message == null || message.isBlank()) return;
        warnings.add(message);
    }

    public void warn(int line, String message) {
        if (message == null || message.isBlank()) return;
        warn("Line " + line + ": " + message);
    }

    public void unsupported(int line, ConstructKind kind, Severity severity, String detail) {
        unsupported.add(new UnsupportedConstruct(line, kind, severity, detail));
    }

    /**
     * A rule faulted while transforming one line: error-severity record plus a warning.
     */
    public void ruleFault(int line, ConstructKind kind, String fault) {
        String text = (fault == null || fault.isBlank()) ? "unexpected failure" : fault;
        warn("Line " + line + ": '" + kind.label() + "' - " + text);
        unsupported(line, kind, Severity.ERROR, text);
    }

    public List<String> warnings() {
        return List.copyOf(warnings);
    }

    public List<UnsupportedConstruct> unsupportedConstructs() {
        return List.copyOf(unsupported);
    }

    public int unsupportedCount() {
        return unsupported.size();
    }

    public int errorCount() {
        int n = 0;
        for (UnsupportedConstruct u : unsupported) {
            if (u.isError()) n++;
        }
        return n;
    }

    public boolean isEmpty() {
        return warnings.isEmpty() && unsupported.isEmpty();
    }
}
