package domain.model;

/**
 * Structured record of a construct that could not be (fully) converted.
 */
public final class UnsupportedConstruct {

    private final int line;
    private final ConstructKind kind;
    private final Severity severity;
    private final String detail;

    public UnsupportedConstruct(int line, ConstructKind kind, Severity severity, String detail) {
        this.line = line;
        this.kind = kind == null ? ConstructKind.STATEMENT : kind;
        this.severity = severity == null ? Severity.ERROR : severity;
        this.detail = detail == null ? "" : detail;
    }

    public int getLine() {
        return line;
    }

    public ConstructKind getKind() {
        return kind;
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getDetail() {
        return detail;
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    @Override
    public String toString() {
        return "line " + line + " [" + severity + "] " + kind.label() + (detail.isEmpty() ? "" : ": " + detail);
    }
}
