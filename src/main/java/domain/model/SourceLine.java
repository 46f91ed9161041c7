package domain.model;

/**
 * One classified line of source text. Immutable.
 */
public final class SourceLine {

    private final String raw;
    private final int lineNumber;
    private final int leadingWidth;
    private final int depth;
    private final ConstructKind kind;
    private final String content;
    private final String trailingComment;
    private final boolean opensBlock;
    private final int blockDepth;

    public SourceLine(
            String raw,
            int lineNumber,
            int leadingWidth,
            int depth,
            ConstructKind kind,
            String content,
            String trailingComment,
            boolean opensBlock,
            int blockDepth
    ) {
        if (lineNumber < 1) throw new IllegalArgumentException("lineNumber must be >= 1: " + lineNumber);
        this.raw = raw == null ? "" : raw;
        this.lineNumber = lineNumber;
        this.leadingWidth = Math.max(0, leadingWidth);
        this.depth = Math.max(0, depth);
        this.kind = kind == null ? ConstructKind.STATEMENT : kind;
        this.content = content == null ? "" : content;
        this.trailingComment = trailingComment;
        this.opensBlock = opensBlock;
        this.blockDepth = Math.max(0, blockDepth);
    }

    public String getRaw() {
        return raw;
    }

    public int getLineNumber() {
        return lineNumber;
    }

    public int getLeadingWidth() {
        return leadingWidth;
    }

    /** Indentation depth in source-grammar units. */
    public int getDepth() {
        return depth;
    }

    public ConstructKind getKind() {
        return kind;
    }

    /** Trimmed code, without leading closing braces or a trailing comment. */
    public String getContent() {
        return content;
    }

    /** Comment text after the comment prefix, or null. */
    public String getTrailingComment() {
        return trailingComment;
    }

    public boolean opensBlock() {
        return opensBlock;
    }

    /** Open blocks on the BlockState stack when the line was classified. */
    public int getBlockDepth() {
        return blockDepth;
    }

    public boolean isBlank() {
        return content.isEmpty() && trailingComment == null;
    }

    @Override
    public String toString() {
        return "SourceLine{" + lineNumber + ", " + kind.label() + ", depth=" + depth + ", '" + content + "'}";
    }
}
